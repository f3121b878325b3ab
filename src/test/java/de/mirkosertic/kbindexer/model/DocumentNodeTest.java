package de.mirkosertic.kbindexer.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DocumentNode Tests")
class DocumentNodeTest {

    @Test
    @DisplayName("Text defaults to content when not given")
    void textDefaultsToContent() {
        final DocumentNode node = new DocumentNode("n1", "some content");

        assertThat(node.getText()).isEqualTo("some content");
        assertThat(node.getKind()).isEqualTo(NodeKind.GENERIC);
        assertThat(node.getFileOwner()).isNull();
        assertThat(node.getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("Children keep insertion order and point back to their parent")
    void childrenKeepOrderAndParentLink() {
        final DocumentNode root = new DocumentNode("root", "Root");
        final DocumentNode first = new DocumentNode("a", "A");
        final DocumentNode second = new DocumentNode("b", "B");

        root.addChild(first);
        root.addChild(second);

        assertThat(root.getChildren()).containsExactly(first, second);
        assertThat(first.getParent()).isSameAs(root);
        assertThat(root.getParent()).isNull();
    }

    @Test
    @DisplayName("A node cannot get a second parent")
    void secondParentIsRejected() {
        final DocumentNode parent1 = new DocumentNode("p1", "P1");
        final DocumentNode parent2 = new DocumentNode("p2", "P2");
        final DocumentNode child = new DocumentNode("c", "C");
        parent1.addChild(child);

        assertThatThrownBy(() -> parent2.addChild(child))
                .isInstanceOf(IllegalStateException.class);
        assertThat(parent2.getChildren()).isEmpty();
    }

    @Test
    @DisplayName("Adding an ancestor as child is rejected")
    void cycleIsRejected() {
        final DocumentNode root = new DocumentNode("root", "Root");
        final DocumentNode child = new DocumentNode("c", "C");
        root.addChild(child);

        assertThatThrownBy(() -> child.addChild(root))
                .isInstanceOf(IllegalArgumentException.class);

        final DocumentNode lonely = new DocumentNode("self", "Self");
        assertThatThrownBy(() -> lonely.addChild(lonely))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Descendants are returned in pre-order")
    void descendantsInPreOrder() {
        final DocumentNode root = new DocumentNode("root", "Root");
        final DocumentNode a = new DocumentNode("a", "A");
        final DocumentNode a1 = new DocumentNode("a1", "A1");
        final DocumentNode b = new DocumentNode("b", "B");
        root.addChild(a);
        a.addChild(a1);
        root.addChild(b);

        assertThat(root.descendants()).containsExactly(a, a1, b);
        assertThat(a1.descendants()).isEmpty();
    }

    @Test
    @DisplayName("Path labels run from the root to the node")
    void pathLabels() {
        final DocumentNode root = new DocumentNode("root", "Guide");
        final DocumentNode section = new DocumentNode("s", "Functions and more", "Functions", null, NodeKind.HEADING, Map.of());
        root.addChild(section);

        assertThat(section.pathLabels()).containsExactly("Guide", "Functions");
    }

    @Test
    @DisplayName("Path labels keep an empty text instead of substituting the id")
    void pathLabelsWithEmptyText() {
        final DocumentNode root = new DocumentNode("root", "Guide");
        final DocumentNode untitled = new DocumentNode("ID_42", "", "", null, NodeKind.MINDMAP_NODE, Map.of());
        root.addChild(untitled);

        assertThat(untitled.pathLabels()).containsExactly("Guide", "");
    }

    @Test
    @DisplayName("Metadata is copied and exposed read-only")
    void metadataIsImmutable() {
        final Path file = Path.of("notes.md");
        final DocumentNode node = new DocumentNode("h", "Heading", null, file, NodeKind.HEADING,
                Map.of(NodeMetadata.HEADING_LEVEL, 2));

        assertThat(node.metadata(NodeMetadata.HEADING_LEVEL)).isEqualTo(2);
        assertThat(node.metadata("missing")).isNull();
        assertThat(node.getFileOwner()).isEqualTo(file);
        assertThatThrownBy(() -> node.getMetadata().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Kind filter keeps child order")
    void childrenOfKind() {
        final DocumentNode heading = new DocumentNode("h", "H", null, null, NodeKind.HEADING, Map.of());
        final DocumentNode item1 = new DocumentNode("i1", "I1", null, null, NodeKind.LIST_ITEM, Map.of());
        final DocumentNode sub = new DocumentNode("h2", "H2", null, null, NodeKind.HEADING, Map.of());
        final DocumentNode item2 = new DocumentNode("i2", "I2", null, null, NodeKind.LIST_ITEM, Map.of());
        heading.addChild(item1);
        heading.addChild(sub);
        heading.addChild(item2);

        assertThat(heading.childrenOfKind(NodeKind.LIST_ITEM)).containsExactly(item1, item2);
    }

    @Test
    @DisplayName("Equality is identity")
    void equalityIsIdentity() {
        assertThat(new DocumentNode("same", "x")).isNotEqualTo(new DocumentNode("same", "x"));
    }
}
