package de.mirkosertic.kbindexer.config;

import java.util.List;

/**
 * One entry of the {@code file-types} section: which adapter handles which extensions.
 *
 * @param name       key of the entry, e.g. {@code markdown}
 * @param handler    adapter name, e.g. {@code markdown} or {@code freeplane}
 * @param extensions extensions including the leading dot
 */
public record FileTypeConfig(String name, String handler, List<String> extensions) {

    public FileTypeConfig {
        extensions = List.copyOf(extensions);
    }
}
