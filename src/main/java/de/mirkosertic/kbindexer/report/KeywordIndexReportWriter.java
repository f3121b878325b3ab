package de.mirkosertic.kbindexer.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import de.mirkosertic.kbindexer.adapter.FormatAdapter;
import de.mirkosertic.kbindexer.indexing.IndexingStatistics;
import de.mirkosertic.kbindexer.indexing.KeywordIndexEntry;
import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.search.SearchResult;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a keyword index into a {@link KeywordIndexReport} and writes it as indented JSON.
 */
public class KeywordIndexReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(KeywordIndexReportWriter.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String version;

    public KeywordIndexReportWriter(final String version) {
        this(version, Clock.systemUTC());
    }

    KeywordIndexReportWriter(final String version, final Clock clock) {
        this.version = version;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @param baseDirectory directory the result links are made relative to, usually the report's own directory
     */
    public KeywordIndexReport createReport(final List<KeywordIndexEntry> index,
                                           final List<Path> files,
                                           final Map<Path, ? extends FormatAdapter> adapters,
                                           final List<String> warnings,
                                           final IndexingStatistics statistics,
                                           final Path baseDirectory) {
        final Path base = baseDirectory.toAbsolutePath().normalize();
        final List<ReportEntry> entries = new ArrayList<>(index.size());
        for (final KeywordIndexEntry entry : index) {
            entries.add(toReportEntry(entry, adapters, base));
        }
        return new KeywordIndexReport(
                clock.instant(),
                version,
                files.stream().map(file -> relativeLink(base, file)).toList(),
                List.copyOf(warnings),
                RunSummary.of(statistics),
                entries
        );
    }

    public String toJson(final KeywordIndexReport report) throws IOException {
        return objectMapper.writeValueAsString(report);
    }

    public void write(final KeywordIndexReport report, final Path outputFile) throws IOException {
        final Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writeValue(outputFile.toFile(), report);
        logger.info("Keyword index written to {}", outputFile.toAbsolutePath());
    }

    private ReportEntry toReportEntry(final KeywordIndexEntry entry,
                                      final Map<Path, ? extends FormatAdapter> adapters,
                                      final Path base) {
        final List<ReportResult> results = new ArrayList<>();
        for (final Map.Entry<Path, List<SearchResult>> fileResults : entry.results().entrySet()) {
            final FormatAdapter adapter = adapters.get(fileResults.getKey());
            for (final SearchResult result : fileResults.getValue()) {
                results.add(toReportResult(result, adapter, base));
            }
        }

        final List<ReportEntry> children = new ArrayList<>(entry.children().size());
        for (final KeywordIndexEntry child : entry.children()) {
            children.add(toReportEntry(child, adapters, base));
        }

        return new ReportEntry(
                entry.label(),
                entry.displayName(),
                entry.searchSequence(),
                entry.error(),
                entry.totalResultCount(),
                results,
                children
        );
    }

    private static ReportResult toReportResult(final SearchResult result,
                                               final @Nullable FormatAdapter adapter,
                                               final Path base) {
        final DocumentNode node = result.node();
        final String file = relativeLink(base, result.file());
        final String fragment = adapter != null ? adapter.linkFragment(node) : null;
        return new ReportResult(
                file,
                node.getId(),
                node.getText(),
                node.getKind().name(),
                node.pathLabels(),
                result.searchPath(),
                result.matchedContent(),
                fragment == null || fragment.isEmpty() ? file : file + "#" + fragment
        );
    }

    static String relativeLink(final Path base, final Path file) {
        final Path absolute = file.toAbsolutePath().normalize();
        Path link;
        try {
            link = base.relativize(absolute);
        } catch (final IllegalArgumentException e) {
            // different roots, e.g. another drive
            link = absolute;
        }
        return link.toString().replace('\\', '/');
    }
}
