package de.mirkosertic.kbindexer;

import de.mirkosertic.kbindexer.config.ApplicationConfig;
import de.mirkosertic.kbindexer.config.BuildInfo;
import de.mirkosertic.kbindexer.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point. The only optional argument is the path of a configuration file.
 */
public class KnowledgebaseIndexerApplication {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgebaseIndexerApplication.class);

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean fileOnly = LoggingConfigurator.isFileOnlyRequested();
            LoggingConfigurator.configure(fileOnly);

            final Path explicitConfig = args.length > 0 ? Paths.get(args[0]) : null;
            final ApplicationConfig config = ApplicationConfig.load(explicitConfig);

            logger.info("Knowledgebase indexer {}", BuildInfo.current());
            logger.info("Include directories: {}", config.getIncludeDirectories());
            logger.info("Keyword files: {}", config.getKeywordFiles());

            new KnowledgebaseIndexer(config).run();

        } catch (final Exception e) {
            System.err.println("Indexing failed: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
