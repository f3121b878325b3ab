package de.mirkosertic.kbindexer.search;

import de.mirkosertic.kbindexer.adapter.FormatAdapter;
import de.mirkosertic.kbindexer.model.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Hierarchical context-sensitive search: narrows matches through the document tree one keyword
 * at a time.
 *
 * <ol>
 *   <li>The anchor term (first) collects every matching node of every tree.</li>
 *   <li>Each refinement term (middle) narrows every candidate to at most one node of its own
 *   subtree: the candidate itself if it matches, else the first matching descendant in document
 *   order.</li>
 *   <li>The terminal term (last) collects every matching node of each candidate's subtree.</li>
 * </ol>
 *
 * <p>After every step candidates of a file that converge on the same node are merged, keeping the
 * first. As soon as a step leaves no candidate in any file the query ends without evaluating the
 * remaining terms.</p>
 *
 * <p>Queries hold no state between calls. The engine never mutates trees, so one instance can
 * serve several threads.</p>
 */
public class HierarchicalSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(HierarchicalSearchEngine.class);

    private record Candidate(DocumentNode node, List<String> searchPath) {
    }

    private volatile boolean debug;

    public void setDebug(final boolean debug) {
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Runs one keyword sequence over the given files.
     *
     * @param files           files in the order results should be reported
     * @param keywordSequence terms in raw (regular expression) mode, anchor term first
     * @param adapters        adapter per file; files without an adapter are ignored
     * @return results per file in the order of {@code files}; files without results are absent
     * @throws InvalidKeywordPatternException if any term does not compile, before any file is touched
     */
    public Map<Path, List<SearchResult>> searchSequence(final List<Path> files,
                                                        final List<String> keywordSequence,
                                                        final Map<Path, ? extends FormatAdapter> adapters) {
        if (keywordSequence.isEmpty()) {
            return Map.of();
        }

        final List<Pattern> patterns = new ArrayList<>(keywordSequence.size());
        for (final String term : keywordSequence) {
            patterns.add(KeywordPatterns.raw(term));
        }

        trace("Searching sequence {} in {} files", keywordSequence, files.size());

        Map<Path, List<Candidate>> candidates = collectAnchorMatches(files, keywordSequence.get(0), patterns.get(0), adapters);

        for (int k = 1; k < keywordSequence.size() && !candidates.isEmpty(); k++) {
            final boolean isLast = k == keywordSequence.size() - 1;
            trace("Processing keyword {}: '{}' (last: {})", k + 1, keywordSequence.get(k), isLast);
            candidates = refine(candidates, keywordSequence.get(k), patterns.get(k), isLast, adapters);
        }

        if (candidates.isEmpty()) {
            trace("No matches for sequence {}", keywordSequence);
        }
        return toResults(candidates, adapters);
    }

    public Map<Path, List<SearchResult>> searchSingleKeyword(final List<Path> files,
                                                             final String keyword,
                                                             final Map<Path, ? extends FormatAdapter> adapters) {
        return searchSequence(files, List.of(keyword), adapters);
    }

    /**
     * Runs several sequences; the result is keyed by the colon joined sequence and only holds
     * sequences that found something.
     *
     * @throws InvalidKeywordPatternException on the first sequence with a malformed term
     */
    public Map<String, Map<Path, List<SearchResult>>> searchMultipleSequences(final List<Path> files,
                                                                              final List<List<String>> keywordSequences,
                                                                              final Map<Path, ? extends FormatAdapter> adapters) {
        final Map<String, Map<Path, List<SearchResult>>> allResults = new LinkedHashMap<>();
        for (final List<String> sequence : keywordSequences) {
            final Map<Path, List<SearchResult>> results = searchSequence(files, sequence, adapters);
            if (!results.isEmpty()) {
                allResults.put(KeywordSequences.join(sequence), results);
            }
        }
        return allResults;
    }

    private Map<Path, List<Candidate>> collectAnchorMatches(final List<Path> files,
                                                           final String term,
                                                           final Pattern pattern,
                                                           final Map<Path, ? extends FormatAdapter> adapters) {
        final Map<Path, List<Candidate>> candidates = new LinkedHashMap<>();
        final List<String> searchPath = List.of(term);

        for (final Path file : files) {
            final FormatAdapter adapter = adapters.get(file);
            if (adapter == null || candidates.containsKey(file)) {
                continue;
            }
            try {
                final CandidateCollector collector = new CandidateCollector();
                for (final DocumentNode root : adapter.rootNodes(file)) {
                    for (final DocumentNode match : adapter.subtreeSearch(root, pattern, true)) {
                        collector.add(match, searchPath);
                    }
                }
                if (!collector.isEmpty()) {
                    candidates.put(file, collector.candidates());
                    trace("  Found {} matches for '{}' in {}", collector.candidates().size(), term, file);
                }
            } catch (final IOException | RuntimeException e) {
                logger.warn("Skipping {} while searching '{}': {}", file, term, e.getMessage());
                logger.debug("Search failure details for {}", file, e);
            }
        }
        return candidates;
    }

    private Map<Path, List<Candidate>> refine(final Map<Path, List<Candidate>> current,
                                              final String term,
                                              final Pattern pattern,
                                              final boolean isLast,
                                              final Map<Path, ? extends FormatAdapter> adapters) {
        final Map<Path, List<Candidate>> refined = new LinkedHashMap<>();

        for (final Map.Entry<Path, List<Candidate>> entry : current.entrySet()) {
            final Path file = entry.getKey();
            final FormatAdapter adapter = adapters.get(file);
            try {
                final CandidateCollector collector = new CandidateCollector();
                for (final Candidate candidate : entry.getValue()) {
                    final List<String> searchPath = append(candidate.searchPath(), term);
                    for (final DocumentNode match : adapter.subtreeSearch(candidate.node(), pattern, isLast)) {
                        collector.add(match, searchPath);
                    }
                }
                if (!collector.isEmpty()) {
                    refined.put(file, collector.candidates());
                    trace("  Refined to {} matches for '{}' in {}", collector.candidates().size(), term, file);
                }
            } catch (final RuntimeException e) {
                logger.warn("Skipping {} while refining with '{}': {}", file, term, e.getMessage());
                logger.debug("Search failure details for {}", file, e);
            }
        }
        return refined;
    }

    private static Map<Path, List<SearchResult>> toResults(final Map<Path, List<Candidate>> candidates,
                                                          final Map<Path, ? extends FormatAdapter> adapters) {
        final Map<Path, List<SearchResult>> results = new LinkedHashMap<>();
        for (final Map.Entry<Path, List<Candidate>> entry : candidates.entrySet()) {
            final FormatAdapter adapter = adapters.get(entry.getKey());
            final List<SearchResult> fileResults = new ArrayList<>(entry.getValue().size());
            for (final Candidate candidate : entry.getValue()) {
                fileResults.add(new SearchResult(
                        entry.getKey(),
                        candidate.node(),
                        adapter.nodeContent(candidate.node()),
                        candidate.searchPath()));
            }
            results.put(entry.getKey(), List.copyOf(fileResults));
        }
        return results;
    }

    private static List<String> append(final List<String> searchPath, final String term) {
        final List<String> extended = new ArrayList<>(searchPath.size() + 1);
        extended.addAll(searchPath);
        extended.add(term);
        return List.copyOf(extended);
    }

    private void trace(final String format, final Object... arguments) {
        if (debug) {
            logger.info(format, arguments);
        } else {
            logger.debug(format, arguments);
        }
    }

    /**
     * Candidates of one file in arrival order, each node at most once.
     */
    private static final class CandidateCollector {

        private final List<Candidate> candidates = new ArrayList<>();
        private final Set<DocumentNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());

        void add(final DocumentNode node, final List<String> searchPath) {
            if (seen.add(node)) {
                candidates.add(new Candidate(node, searchPath));
            }
        }

        boolean isEmpty() {
            return candidates.isEmpty();
        }

        List<Candidate> candidates() {
            return candidates;
        }
    }
}
