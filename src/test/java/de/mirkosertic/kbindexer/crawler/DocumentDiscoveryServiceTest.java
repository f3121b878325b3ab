package de.mirkosertic.kbindexer.crawler;

import de.mirkosertic.kbindexer.config.ApplicationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DocumentDiscoveryService Tests")
class DocumentDiscoveryServiceTest {

    @TempDir
    Path tempDir;

    private Path map;
    private Path notes;
    private Path nested;

    @BeforeEach
    void setUp() throws IOException {
        map = Files.writeString(tempDir.resolve("b-ideas.mm"), "<map/>");
        notes = Files.writeString(tempDir.resolve("a-notes.MD"), "# Notes");
        Files.createDirectories(tempDir.resolve("sub/.git"));
        Files.createDirectories(tempDir.resolve("sub/deeper"));
        nested = Files.writeString(tempDir.resolve("sub/deeper/c.markdown"), "# C");
        Files.writeString(tempDir.resolve("sub/.git/HEAD.md"), "# ignored");
        Files.writeString(tempDir.resolve("plain.txt"), "ignored");
    }

    private DocumentDiscoveryService service(final List<String> includes) {
        return new DocumentDiscoveryService(includes, List.of(".mm", ".md", ".markdown"), List.of("**/.git/**"));
    }

    @Test
    @DisplayName("Walks directories, keeps configured extensions and drops excluded paths")
    void discoversFiles() {
        final List<Path> files = service(List.of(tempDir.toString())).discover();

        assertThat(files).containsExactly(
                notes.toAbsolutePath().normalize(),
                map.toAbsolutePath().normalize(),
                nested.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("File entries are included directly and duplicates collapse")
    void fileEntriesAndDuplicates() {
        final List<Path> files = service(List.of(
                map.toString(),
                tempDir.resolve("sub").toString(),
                tempDir.resolve("sub/../sub").toString())).discover();

        assertThat(files).containsExactly(
                map.toAbsolutePath().normalize(),
                nested.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Missing include directories are skipped")
    void missingDirectory() {
        final List<Path> files = service(List.of(tempDir.resolve("missing").toString(), map.toString())).discover();

        assertThat(files).containsExactly(map.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Extensions come from the configured file types")
    void usesConfiguredFileTypes() {
        final ApplicationConfig config = ApplicationConfig.fromYaml("""
                kbi:
                  directories:
                    include: ["%s"]
                  file-types:
                    markdown:
                      extensions: [".markdown"]
                """.formatted(tempDir.toString().replace("\\", "/")));

        assertThat(new DocumentDiscoveryService(config).discover()).containsExactly(
                map.toAbsolutePath().normalize(),
                nested.toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("Pattern matcher checks excludes against the absolute path and extensions case-insensitively")
    void patternMatcher() {
        final FilePatternMatcher matcher = new FilePatternMatcher(List.of(".MD"), List.of("**/drafts/**"));

        assertThat(matcher.shouldInclude(tempDir.resolve("readme.md"))).isTrue();
        assertThat(matcher.shouldInclude(tempDir.resolve("drafts/readme.md"))).isFalse();
        assertThat(matcher.shouldInclude(tempDir.resolve("readme.txt"))).isFalse();
    }
}
