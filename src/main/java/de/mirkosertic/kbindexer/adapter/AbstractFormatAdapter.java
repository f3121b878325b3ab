package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.config.FileTypeConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Extension handling shared by the file based adapters.
 */
public abstract class AbstractFormatAdapter implements FormatAdapter {

    private final FileTypeConfig fileType;

    protected AbstractFormatAdapter(final FileTypeConfig fileType) {
        this.fileType = fileType;
    }

    @Override
    public String name() {
        return fileType.name();
    }

    public FileTypeConfig getFileType() {
        return fileType;
    }

    protected boolean hasSupportedExtension(final Path file) {
        final Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        final String name = fileName.toString().toLowerCase(Locale.ROOT);
        return fileType.extensions().stream()
                .anyMatch(extension -> name.endsWith(extension.toLowerCase(Locale.ROOT)));
    }

    protected boolean isReadableFile(final Path file) {
        return Files.isRegularFile(file) && Files.isReadable(file);
    }
}
