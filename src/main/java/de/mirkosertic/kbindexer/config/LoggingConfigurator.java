package de.mirkosertic.kbindexer.config;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Chooses between console logging (logback.xml, picked up automatically) and file-only logging
 * (logback-file.xml) for runs whose stdout is consumed by another tool.
 */
public final class LoggingConfigurator {

    public static final String PROP_LOGGING = "kbi.logging";

    private static final String FILE_CONFIG = "logback-file.xml";

    private LoggingConfigurator() {
    }

    /**
     * True if the {@code kbi.logging} system property asks for file-only logging.
     */
    public static boolean isFileOnlyRequested() {
        return "file".equalsIgnoreCase(System.getProperty(PROP_LOGGING));
    }

    /**
     * Must be called before anything else logs.
     *
     * @param fileOnly true to log into ~/.kbindexer/log instead of the console
     */
    public static void configure(final boolean fileOnly) {
        if (fileOnly) {
            ensureLogDirectoryExists(ApplicationConfig.getConfigDirectory().resolve("log"));
            loadConfiguration(FILE_CONFIG);
        }
    }

    private static void ensureLogDirectoryExists(final Path logDir) {
        try {
            Files.createDirectories(logDir);
        } catch (final IOException e) {
            System.err.println("Warning: Could not create log directory " + logDir + ": " + e.getMessage());
        }
    }

    private static void loadConfiguration(final String configFile) {
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        try (InputStream configStream = LoggingConfigurator.class.getClassLoader().getResourceAsStream(configFile)) {
            if (configStream == null) {
                System.err.println("Warning: Could not find " + configFile + " on classpath, keeping console logging");
                return;
            }
            context.reset();
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            configurator.doConfigure(configStream);
        } catch (final JoranException | IOException e) {
            System.err.println("Warning: Error loading logback configuration " + configFile + ": " + e.getMessage());
        }
    }
}
