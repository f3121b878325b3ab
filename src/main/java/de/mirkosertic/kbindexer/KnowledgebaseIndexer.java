package de.mirkosertic.kbindexer;

import de.mirkosertic.kbindexer.adapter.FormatAdapter;
import de.mirkosertic.kbindexer.adapter.FormatAdapterRegistry;
import de.mirkosertic.kbindexer.config.ApplicationConfig;
import de.mirkosertic.kbindexer.config.BuildInfo;
import de.mirkosertic.kbindexer.crawler.DocumentDiscoveryService;
import de.mirkosertic.kbindexer.indexing.DocumentTreeLoader;
import de.mirkosertic.kbindexer.indexing.IndexingExecutorService;
import de.mirkosertic.kbindexer.indexing.IndexingStatistics;
import de.mirkosertic.kbindexer.indexing.IndexingStatisticsTracker;
import de.mirkosertic.kbindexer.indexing.KeywordIndexEntry;
import de.mirkosertic.kbindexer.indexing.KeywordIndexService;
import de.mirkosertic.kbindexer.keywords.KeywordFileParser;
import de.mirkosertic.kbindexer.keywords.KeywordFiles;
import de.mirkosertic.kbindexer.report.KeywordIndexReport;
import de.mirkosertic.kbindexer.report.KeywordIndexReportWriter;
import de.mirkosertic.kbindexer.search.HierarchicalSearchEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One indexing run: discover documents, parse them, run every keyword query and write the report.
 */
public class KnowledgebaseIndexer {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgebaseIndexer.class);

    private final ApplicationConfig config;
    private final DocumentDiscoveryService discoveryService;
    private final FormatAdapterRegistry adapterRegistry;
    private final HierarchicalSearchEngine searchEngine;
    private final IndexingStatisticsTracker statisticsTracker;
    private final KeywordFileParser keywordFileParser;
    private final KeywordIndexReportWriter reportWriter;

    public KnowledgebaseIndexer(final ApplicationConfig config) {
        this.config = config;
        this.discoveryService = new DocumentDiscoveryService(config);
        this.adapterRegistry = FormatAdapterRegistry.fromConfig(config).withTreeCache(config.getTreeCacheSize());
        this.searchEngine = new HierarchicalSearchEngine();
        this.searchEngine.setDebug(config.isDebug());
        this.statisticsTracker = new IndexingStatisticsTracker();
        this.keywordFileParser = new KeywordFileParser();
        this.reportWriter = new KeywordIndexReportWriter(BuildInfo.current().getVersion());
    }

    /**
     * Runs the whole pipeline and writes the report to the configured output file.
     */
    public KeywordIndexReport run() throws IOException {
        statisticsTracker.reset();

        final List<Path> files = discoveryService.discover();
        statisticsTracker.setFilesFound(files.size());

        final Map<Path, FormatAdapter> adapters = adapterRegistry.adaptersFor(files);
        statisticsTracker.setFilesWithAdapter(adapters.size());

        try (final IndexingExecutorService executor = new IndexingExecutorService(config.getThreadPoolSize())) {
            new DocumentTreeLoader(executor, statisticsTracker).loadAll(adapters);
        }

        final List<Path> keywordFilePaths = config.getKeywordFiles().stream()
                .map(Paths::get)
                .toList();
        final KeywordFiles keywordFiles = KeywordFiles.load(keywordFilePaths, keywordFileParser);
        if (keywordFiles.entries().isEmpty()) {
            logger.warn("No keyword entries loaded from {}", config.getKeywordFiles());
        }

        final List<Path> searchableFiles = new ArrayList<>(adapters.keySet());
        final List<KeywordIndexEntry> index = new KeywordIndexService(searchEngine, statisticsTracker)
                .buildIndex(keywordFiles.entries(), searchableFiles, adapters);

        final IndexingStatistics statistics = statisticsTracker.snapshot();
        final Path outputFile = Paths.get(config.getOutputFile()).toAbsolutePath().normalize();
        final Path reportDirectory = outputFile.getParent() != null ? outputFile.getParent() : outputFile;
        final KeywordIndexReport report = reportWriter.createReport(
                index, searchableFiles, adapters, keywordFiles.warnings(), statistics, reportDirectory);
        reportWriter.write(report, outputFile);

        adapterRegistry.clearCaches();
        logStatistics(statistics);
        return report;
    }

    public IndexingStatistics getStatistics() {
        return statisticsTracker.snapshot();
    }

    private static void logStatistics(final IndexingStatistics statistics) {
        logger.info("Files found: {}, with adapter: {}, parsed: {}, failed: {}, nodes: {}",
                statistics.filesFound(),
                statistics.filesWithAdapter(),
                statistics.filesParsed(),
                statistics.filesFailed(),
                statistics.nodesLoaded());
        logger.info("Queries run: {}, failed: {}, results: {}",
                statistics.queriesRun(),
                statistics.queriesFailed(),
                statistics.resultsFound());
        logger.info("Indexing took {} ms ({} files/sec)",
                statistics.elapsedTimeMs(),
                String.format("%.1f", statistics.filesPerSecond()));
    }
}
