package de.mirkosertic.kbindexer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time from the Maven-filtered build-info.properties.
 * Unfiltered placeholders (IDE runs) are reported as "dev" and "unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String BUILD_INFO_FILE = "build-info.properties";

    private static final BuildInfo CURRENT = load(BUILD_INFO_FILE);

    private final String version;
    private final String buildTimestamp;

    BuildInfo(final String version, final String buildTimestamp) {
        this.version = version;
        this.buildTimestamp = buildTimestamp;
    }

    public static BuildInfo current() {
        return CURRENT;
    }

    static BuildInfo load(final String resource) {
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.debug("{} not found, running from IDE", resource);
                return new BuildInfo("dev", "unknown");
            }
            final Properties props = new Properties();
            props.load(input);
            return new BuildInfo(
                    filteredOr(props.getProperty("build.version"), "dev"),
                    filteredOr(props.getProperty("build.timestamp"), "unknown"));
        } catch (final IOException e) {
            logger.warn("Failed to load {}, using defaults", resource, e);
            return new BuildInfo("dev", "unknown");
        }
    }

    private static String filteredOr(final String value, final String fallback) {
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value.trim();
    }

    public String getVersion() {
        return version;
    }

    public String getBuildTimestamp() {
        return buildTimestamp;
    }

    @Override
    public String toString() {
        return version + " (" + buildTimestamp + ")";
    }
}
