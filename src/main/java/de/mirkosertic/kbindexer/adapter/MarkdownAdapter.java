package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.config.FileTypeConfig;
import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.model.NodeKind;
import de.mirkosertic.kbindexer.model.NodeMetadata;
import de.mirkosertic.kbindexer.util.TextCleaner;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.node.Block;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads Markdown files into a composite hierarchy of headings and list items.
 *
 * <p>Block structure comes from the CommonMark parser, so fenced and indented code, front matter
 * and lazy paragraph continuation follow the CommonMark rules. Headings nest by level. A heading's
 * content is its own text plus the prose blocks up to the next heading of any level, so
 * sub-sections do not leak into their parent. List items are nodes of their own, nested as the
 * lists are nested, below the current heading. Nodes are attached in source order.</p>
 */
public class MarkdownAdapter extends AbstractFormatAdapter {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownAdapter.class);

    private static final Parser PARSER = Parser.builder()
            .extensions(List.of(YamlFrontMatterExtension.create()))
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();

    private static final Pattern ANCHOR_INVALID = Pattern.compile("[^\\w\\-]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern ANCHOR_DASHES = Pattern.compile("-+");

    private record Frame(DocumentNode node, int level) {
    }

    public MarkdownAdapter(final FileTypeConfig fileType) {
        super(fileType);
    }

    @Override
    public boolean canHandle(final Path file) {
        return hasSupportedExtension(file) && isReadableFile(file);
    }

    @Override
    public List<DocumentNode> rootNodes(final Path file) throws IOException {
        final String content = Files.readString(file, StandardCharsets.UTF_8);
        final List<DocumentNode> roots = buildHierarchy(PARSER.parse(content), file);
        logger.debug("Parsed Markdown file {} into {} root nodes", file, roots.size());
        return roots;
    }

    private List<DocumentNode> buildHierarchy(final Node document, final Path file) {
        final List<DocumentNode> roots = new ArrayList<>();
        final Deque<Frame> headings = new ArrayDeque<>();

        for (Node block = document.getFirstChild(); block != null; block = block.getNext()) {
            if (block instanceof Heading heading) {
                while (!headings.isEmpty() && headings.peek().level() >= heading.getLevel()) {
                    headings.pop();
                }
                final String text = TextCleaner.clean(inlineText(heading));
                final int lineNumber = lineNumber(heading);
                final DocumentNode node = new DocumentNode(
                        nodeId(lineNumber),
                        sectionContent(heading, text),
                        text,
                        file,
                        NodeKind.HEADING,
                        Map.of(NodeMetadata.HEADING_LEVEL, heading.getLevel(), NodeMetadata.LINE_NUMBER, lineNumber));
                attach(node, headings.peek() != null ? headings.peek().node() : null, roots);
                headings.push(new Frame(node, heading.getLevel()));

            } else if (block instanceof ListBlock list) {
                addListItems(list, 0, headings.peek() != null ? headings.peek().node() : null, roots, file);
            }
        }
        return roots;
    }

    private void addListItems(final ListBlock list,
                              final int depth,
                              final @Nullable DocumentNode parent,
                              final List<DocumentNode> roots,
                              final Path file) {
        for (Node child = list.getFirstChild(); child != null; child = child.getNext()) {
            if (!(child instanceof ListItem item)) {
                continue;
            }
            final String text = itemText(item);
            DocumentNode itemParent = parent;
            if (!text.isEmpty()) {
                final int lineNumber = lineNumber(item);
                final DocumentNode node = new DocumentNode(
                        nodeId(lineNumber),
                        itemContent(item),
                        text,
                        file,
                        NodeKind.LIST_ITEM,
                        Map.of(NodeMetadata.LIST_LEVEL, depth, NodeMetadata.LINE_NUMBER, lineNumber));
                attach(node, parent, roots);
                itemParent = node;
            }
            // an item without text hands its sub-list to its own parent
            for (Node inner = item.getFirstChild(); inner != null; inner = inner.getNext()) {
                if (inner instanceof ListBlock nested) {
                    addListItems(nested, itemParent == parent ? depth : depth + 1, itemParent, roots, file);
                }
            }
        }
    }

    private static void attach(final DocumentNode node, final @Nullable DocumentNode parent, final List<DocumentNode> roots) {
        if (parent == null) {
            roots.add(node);
        } else {
            parent.addChild(node);
        }
    }

    /**
     * Heading text followed by the prose blocks that belong to this heading directly. Lists are
     * nodes of their own and the next heading, whatever its level, ends the section.
     */
    private static String sectionContent(final Heading heading, final String headingText) {
        final StringBuilder content = new StringBuilder(headingText);
        for (Node block = heading.getNext(); block != null && !(block instanceof Heading); block = block.getNext()) {
            appendProse(content, block);
        }
        return content.toString();
    }

    /**
     * The first paragraph of the item.
     */
    private static String itemText(final ListItem item) {
        for (Node inner = item.getFirstChild(); inner != null; inner = inner.getNext()) {
            if (inner instanceof Paragraph) {
                return TextCleaner.clean(inlineText(inner));
            }
        }
        return "";
    }

    private static String itemContent(final ListItem item) {
        final StringBuilder content = new StringBuilder();
        for (Node inner = item.getFirstChild(); inner != null; inner = inner.getNext()) {
            appendProse(content, inner);
        }
        return content.toString().trim();
    }

    private static void appendProse(final StringBuilder content, final Node block) {
        final String text;
        if (block instanceof Paragraph || block instanceof BlockQuote) {
            text = inlineText(block);
        } else if (block instanceof FencedCodeBlock fenced) {
            text = fenced.getLiteral();
        } else if (block instanceof IndentedCodeBlock indented) {
            text = indented.getLiteral();
        } else if (block instanceof HtmlBlock html) {
            text = html.getLiteral();
        } else {
            return;
        }
        final String cleaned = TextCleaner.clean(text);
        if (!cleaned.isEmpty()) {
            content.append(' ').append(cleaned);
        }
    }

    private static String inlineText(final Node node) {
        final StringBuilder text = new StringBuilder();
        collectText(node, text);
        return text.toString();
    }

    private static void collectText(final Node node, final StringBuilder text) {
        if (node instanceof Text literal) {
            text.append(literal.getLiteral());
        } else if (node instanceof Code code) {
            text.append(code.getLiteral());
        } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
            text.append(' ');
        } else {
            for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                collectText(child, text);
                if (child instanceof Block) {
                    text.append(' ');
                }
            }
        }
    }

    private static int lineNumber(final Node node) {
        final List<SourceSpan> spans = node.getSourceSpans();
        return spans.isEmpty() ? 0 : spans.get(0).getLineIndex() + 1;
    }

    private static String nodeId(final int lineNumber) {
        return "md-L" + lineNumber;
    }

    @Override
    public String nodeContent(final DocumentNode node) {
        if (node.getKind() == NodeKind.LIST_ITEM) {
            return node.getText();
        }
        return node.getContent();
    }

    @Override
    public @Nullable String linkFragment(final DocumentNode node) {
        if (node.getKind() != NodeKind.HEADING) {
            return null;
        }
        final String anchor = anchorFor(node.getText());
        return anchor.isEmpty() ? null : anchor;
    }

    /**
     * GitHub style heading anchor: "ARM Interrupt Handling" becomes "arm-interrupt-handling".
     */
    public static String anchorFor(final String headingText) {
        if (headingText == null || headingText.isEmpty()) {
            return "";
        }
        String anchor = ANCHOR_INVALID.matcher(headingText.toLowerCase(Locale.ROOT)).replaceAll("-");
        anchor = ANCHOR_DASHES.matcher(anchor).replaceAll("-");
        int start = 0;
        int end = anchor.length();
        while (start < end && anchor.charAt(start) == '-') {
            start++;
        }
        while (end > start && anchor.charAt(end - 1) == '-') {
            end--;
        }
        return anchor.substring(start, end);
    }
}
