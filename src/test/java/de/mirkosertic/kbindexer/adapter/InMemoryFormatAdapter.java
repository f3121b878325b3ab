package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.model.NodeKind;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Adapter over prebuilt trees that counts how it is called.
 */
public class InMemoryFormatAdapter implements FormatAdapter {

    private final Map<Path, List<DocumentNode>> documents = new LinkedHashMap<>();
    private final Set<Path> failing = new HashSet<>();
    private final AtomicInteger rootNodesCalls = new AtomicInteger();
    private final List<String> searchedPatterns = Collections.synchronizedList(new ArrayList<>());

    public static DocumentNode node(final String id, final String text, final String content) {
        return new DocumentNode(id, content, text, null, NodeKind.GENERIC, Map.of());
    }

    public static DocumentNode tree(final DocumentNode parent, final DocumentNode... children) {
        for (final DocumentNode child : children) {
            parent.addChild(child);
        }
        return parent;
    }

    public InMemoryFormatAdapter add(final Path file, final DocumentNode... roots) {
        documents.put(file, List.of(roots));
        return this;
    }

    public InMemoryFormatAdapter failOn(final Path file) {
        failing.add(file);
        return this;
    }

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public boolean canHandle(final Path file) {
        return documents.containsKey(file) || failing.contains(file);
    }

    @Override
    public List<DocumentNode> rootNodes(final Path file) throws IOException {
        rootNodesCalls.incrementAndGet();
        if (failing.contains(file)) {
            throw new IOException("Cannot read " + file);
        }
        return documents.getOrDefault(file, List.of());
    }

    @Override
    public String nodeContent(final DocumentNode node) {
        return node.getContent();
    }

    @Override
    public List<DocumentNode> subtreeSearch(final DocumentNode node, final Pattern pattern, final boolean includeDescendants) {
        searchedPatterns.add(pattern.pattern());
        return FormatAdapter.super.subtreeSearch(node, pattern, includeDescendants);
    }

    public int getRootNodesCalls() {
        return rootNodesCalls.get();
    }

    public List<String> getSearchedPatterns() {
        return List.copyOf(searchedPatterns);
    }
}
