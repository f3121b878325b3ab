package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.config.FileTypeConfig;
import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.model.NodeKind;
import de.mirkosertic.kbindexer.model.NodeMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FreeplaneAdapter Tests")
class FreeplaneAdapterTest {

    private static final String MIND_MAP = """
            <map version="freeplane 1.9.13">
            <node TEXT="Programming" ID="ID_root" CREATED="1700000000000" MODIFIED="1700000001000">
              <node TEXT="Functions" ID="ID_functions">
                <richcontent TYPE="NOTE"><html><head/><body><p>Functions are reusable</p><p>blocks of code</p></body></html></richcontent>
                <attribute NAME="status" VALUE="draft"/>
                <node TEXT="Async &amp; Await" ID="ID_async">
                  <node TEXT="Example" ID="ID_example">
                    <richcontent TYPE="NOTE"><html><body><p>async definition</p></body></html></richcontent>
                  </node>
                </node>
              </node>
              <node ID="ID_rich">
                <richcontent TYPE="NODE"><html><body><p>Rich <b>node</b> text</p></body></html></richcontent>
              </node>
              <node TEXT="No id here"/>
            </node>
            </map>
            """;

    @TempDir
    Path tempDir;

    private FreeplaneAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new FreeplaneAdapter(new FileTypeConfig("freeplane", "freeplane", List.of(".mm")));
    }

    private Path write(final String name, final String content) throws IOException {
        final Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("canHandle")
    class CanHandle {

        @Test
        @DisplayName("Accepts a .mm file with a map root element")
        void acceptsMindMap() throws IOException {
            assertThat(adapter.canHandle(write("ideas.mm", MIND_MAP))).isTrue();
            assertThat(adapter.canHandle(write("UPPER.MM", MIND_MAP))).isTrue();
        }

        @Test
        @DisplayName("Rejects other extensions, other root elements and missing files")
        void rejectsOthers() throws IOException {
            assertThat(adapter.canHandle(write("ideas.xml", MIND_MAP))).isFalse();
            assertThat(adapter.canHandle(write("other.mm", "<html><body/></html>"))).isFalse();
            assertThat(adapter.canHandle(write("garbage.mm", "not xml at all"))).isFalse();
            assertThat(adapter.canHandle(tempDir.resolve("missing.mm"))).isFalse();
        }
    }

    @Nested
    @DisplayName("rootNodes")
    class RootNodes {

        @Test
        @DisplayName("First node becomes the single root with children in document order")
        void buildsTree() throws IOException {
            final Path file = write("ideas.mm", MIND_MAP);

            final List<DocumentNode> roots = adapter.rootNodes(file);

            assertThat(roots).hasSize(1);
            final DocumentNode root = roots.get(0);
            assertThat(root.getId()).isEqualTo("ID_root");
            assertThat(root.getText()).isEqualTo("Programming");
            assertThat(root.getKind()).isEqualTo(NodeKind.MINDMAP_NODE);
            assertThat(root.getFileOwner()).isEqualTo(file);
            assertThat(root.getChildren()).extracting(DocumentNode::getId)
                    .containsExactly("ID_functions", "ID_rich", "ID_GENERATED_1");
            assertThat(root.metadata(NodeMetadata.CREATED)).isEqualTo("1700000000000");
        }

        @Test
        @DisplayName("Content joins text, rich content and note of the node itself only")
        void contentUsesOwnRichContent() throws IOException {
            final DocumentNode root = adapter.rootNodes(write("ideas.mm", MIND_MAP)).get(0);
            final DocumentNode functions = root.getChildren().get(0);
            final DocumentNode async = functions.getChildren().get(0);

            assertThat(functions.getContent()).isEqualTo("Functions Functions are reusable blocks of code");
            assertThat(functions.metadata(NodeMetadata.NOTE)).isEqualTo("Functions are reusable blocks of code");
            assertThat(functions.metadata(NodeMetadata.ATTRIBUTES)).isEqualTo(Map.of("status", "draft"));
            assertThat(async.getText()).isEqualTo("Async & Await");
            assertThat(async.getContent()).isEqualTo("Async & Await");
            assertThat(root.getContent()).isEqualTo("Programming");
        }

        @Test
        @DisplayName("Rich node content stands in for a missing TEXT attribute")
        void richNodeContent() throws IOException {
            final DocumentNode rich = adapter.rootNodes(write("ideas.mm", MIND_MAP)).get(0).getChildren().get(1);

            assertThat(rich.getContent()).isEqualTo("Rich node text");
            assertThat(rich.getText()).isEqualTo("Rich node text");
            assertThat(adapter.nodeContent(rich)).isEqualTo("Rich node text");
        }

        @Test
        @DisplayName("Map without nodes has no roots")
        void emptyMap() throws IOException {
            assertThat(adapter.rootNodes(write("empty.mm", "<map version=\"1.0\"/>"))).isEmpty();
        }

        @Test
        @DisplayName("Malformed XML raises DocumentParseException")
        void malformedXml() throws IOException {
            final Path file = write("broken.mm", "<map><node TEXT=\"open\"></map>");

            assertThatThrownBy(() -> adapter.rootNodes(file))
                    .isInstanceOf(DocumentParseException.class)
                    .satisfies(e -> assertThat(((DocumentParseException) e).getFile()).isEqualTo(file));
        }

        @Test
        @DisplayName("Wrong root element raises DocumentParseException")
        void wrongRoot() throws IOException {
            final Path file = write("page.mm", "<html><node TEXT=\"x\"/></html>");

            assertThatThrownBy(() -> adapter.rootNodes(file))
                    .isInstanceOf(DocumentParseException.class)
                    .hasMessageContaining("<html>");
        }

        @Test
        @DisplayName("DOCTYPE declarations are rejected")
        void doctypeRejected() throws IOException {
            final Path file = write("xxe.mm", """
                    <?xml version="1.0"?>
                    <!DOCTYPE map [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                    <map><node TEXT="&xxe;"/></map>
                    """);

            assertThatThrownBy(() -> adapter.rootNodes(file)).isInstanceOf(DocumentParseException.class);
        }

        @Test
        @DisplayName("Missing file raises IOException")
        void missingFile() {
            assertThatThrownBy(() -> adapter.rootNodes(tempDir.resolve("missing.mm")))
                    .isInstanceOf(IOException.class);
        }
    }

    @Test
    @DisplayName("Link fragment is the node id")
    void linkFragment() throws IOException {
        final DocumentNode root = adapter.rootNodes(write("ideas.mm", MIND_MAP)).get(0);

        assertThat(adapter.linkFragment(root)).isEqualTo("ID_root");
        assertThat(adapter.name()).isEqualTo("freeplane");
    }
}
