package de.mirkosertic.kbindexer.adapter;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A document could be read but not turned into a tree: malformed XML, unexpected root element.
 */
public class DocumentParseException extends IOException {

    private final Path file;

    public DocumentParseException(final Path file, final String message) {
        super(message + ": " + file);
        this.file = file;
    }

    public DocumentParseException(final Path file, final String message, final Throwable cause) {
        super(message + ": " + file, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
