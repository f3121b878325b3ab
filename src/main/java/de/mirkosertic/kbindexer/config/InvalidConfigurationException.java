package de.mirkosertic.kbindexer.config;

/**
 * Configuration file content or an override value is not acceptable.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(final String message) {
        super(message);
    }

    public InvalidConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
