package de.mirkosertic.kbindexer.adapter;

import de.mirkosertic.kbindexer.config.FileTypeConfig;
import de.mirkosertic.kbindexer.model.DocumentNode;
import de.mirkosertic.kbindexer.model.NodeKind;
import de.mirkosertic.kbindexer.model.NodeMetadata;
import de.mirkosertic.kbindexer.util.TextCleaner;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reads Freeplane mind maps ({@code .mm}). The first {@code node} element below {@code map} becomes
 * the single root; nested {@code node} elements become children in document order.
 *
 * <p>Searchable content is the node's {@code TEXT} plus its rich node content and its note, both
 * taken from the HTML body of the node's own {@code richcontent} elements.</p>
 */
public class FreeplaneAdapter extends AbstractFormatAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FreeplaneAdapter.class);

    private static final String MAP_ELEMENT = "map";
    private static final String NODE_ELEMENT = "node";
    private static final String RICHCONTENT_ELEMENT = "richcontent";
    private static final String ATTRIBUTE_ELEMENT = "attribute";
    private static final String BODY_ELEMENT = "body";
    private static final String TYPE_NODE = "NODE";
    private static final String TYPE_NOTE = "NOTE";

    private final DocumentBuilderFactory documentBuilderFactory;
    private final XMLInputFactory xmlInputFactory;

    public FreeplaneAdapter(final FileTypeConfig fileType) {
        super(fileType);
        this.documentBuilderFactory = createDocumentBuilderFactory();
        this.xmlInputFactory = XMLInputFactory.newFactory();
        this.xmlInputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        this.xmlInputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
    }

    private static DocumentBuilderFactory createDocumentBuilderFactory() {
        final DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (final ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        factory.setExpandEntityReferences(false);
        factory.setNamespaceAware(false);
        return factory;
    }

    @Override
    public boolean canHandle(final Path file) {
        return hasSupportedExtension(file) && isReadableFile(file) && hasMapRootElement(file);
    }

    private boolean hasMapRootElement(final Path file) {
        try (final InputStream stream = Files.newInputStream(file)) {
            final XMLStreamReader reader = xmlInputFactory.createXMLStreamReader(stream);
            try {
                while (reader.hasNext()) {
                    if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                        return MAP_ELEMENT.equals(reader.getLocalName());
                    }
                }
                return false;
            } finally {
                reader.close();
            }
        } catch (final IOException | XMLStreamException e) {
            logger.debug("Not a Freeplane map: {} ({})", file, e.getMessage());
            return false;
        }
    }

    // DocumentBuilderFactory is not thread safe, trees are loaded in parallel
    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        synchronized (documentBuilderFactory) {
            return documentBuilderFactory.newDocumentBuilder();
        }
    }

    @Override
    public List<DocumentNode> rootNodes(final Path file) throws IOException {
        final Document document;
        try (final InputStream stream = Files.newInputStream(file)) {
            final DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler(file));
            document = builder.parse(stream);
        } catch (final SAXException e) {
            throw new DocumentParseException(file, "Malformed mind map XML", e);
        } catch (final ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML parser", e);
        }

        final Element mapElement = document.getDocumentElement();
        if (!MAP_ELEMENT.equals(mapElement.getTagName())) {
            throw new DocumentParseException(file, "Expected <map> root element but found <" + mapElement.getTagName() + ">");
        }

        final NodeList nodeElements = mapElement.getElementsByTagName(NODE_ELEMENT);
        if (nodeElements.getLength() == 0) {
            logger.debug("Mind map has no nodes: {}", file);
            return List.of();
        }

        final AtomicInteger generatedIds = new AtomicInteger();
        final DocumentNode root = toDocumentNode((Element) nodeElements.item(0), file, generatedIds);
        logger.debug("Parsed mind map {} with {} nodes", file, root.descendants().size() + 1);
        return List.of(root);
    }

    private DocumentNode toDocumentNode(final Element element, final Path file, final AtomicInteger generatedIds) {
        final String id = element.hasAttribute("ID")
                ? element.getAttribute("ID")
                : "ID_GENERATED_" + generatedIds.incrementAndGet();
        final String text = TextCleaner.clean(element.getAttribute("TEXT"));

        String richContent = "";
        String note = "";
        final Map<String, String> attributes = new LinkedHashMap<>();
        final List<Element> childNodeElements = new ArrayList<>();

        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (!(child instanceof Element childElement)) {
                continue;
            }
            switch (childElement.getTagName()) {
                case NODE_ELEMENT -> childNodeElements.add(childElement);
                case RICHCONTENT_ELEMENT -> {
                    final String type = childElement.getAttribute("TYPE");
                    if (TYPE_NODE.equalsIgnoreCase(type)) {
                        richContent = extractBodyText(childElement);
                    } else if (TYPE_NOTE.equalsIgnoreCase(type)) {
                        note = extractBodyText(childElement);
                    }
                }
                case ATTRIBUTE_ELEMENT -> attributes.put(childElement.getAttribute("NAME"), childElement.getAttribute("VALUE"));
                default -> {
                    // icons, fonts, edges and hooks carry no searchable text
                }
            }
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(NodeMetadata.RICH_CONTENT, richContent);
        metadata.put(NodeMetadata.NOTE, note);
        metadata.put(NodeMetadata.CREATED, element.getAttribute("CREATED"));
        metadata.put(NodeMetadata.MODIFIED, element.getAttribute("MODIFIED"));
        if (!attributes.isEmpty()) {
            metadata.put(NodeMetadata.ATTRIBUTES, Map.copyOf(attributes));
        }

        final DocumentNode node = new DocumentNode(
                id,
                TextCleaner.join(text, richContent, note),
                text,
                file,
                NodeKind.MINDMAP_NODE,
                metadata);

        for (final Element childElement : childNodeElements) {
            node.addChild(toDocumentNode(childElement, file, generatedIds));
        }
        return node;
    }

    private static String extractBodyText(final Element richContent) {
        final Element body = findFirstElement(richContent, BODY_ELEMENT);
        return TextCleaner.clean(body == null ? richContent.getTextContent() : collectText(body));
    }

    private static @Nullable Element findFirstElement(final Element parent, final String tagName) {
        final NodeList candidates = parent.getElementsByTagName(tagName);
        return candidates.getLength() == 0 ? null : (Element) candidates.item(0);
    }

    // Block elements are separated by a space so "<p>one</p><p>two</p>" does not become "onetwo"
    private static String collectText(final Node node) {
        final StringBuilder text = new StringBuilder();
        for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                text.append(' ').append(collectText(child)).append(' ');
            }
        }
        return text.toString();
    }

    @Override
    public String nodeContent(final DocumentNode node) {
        return node.getContent();
    }

    @Override
    public String linkFragment(final DocumentNode node) {
        return node.getId();
    }

    /**
     * Keeps the XML parser from printing to stderr; errors surface as exceptions instead.
     */
    private record RethrowingErrorHandler(Path file) implements ErrorHandler {

        @Override
        public void warning(final SAXParseException exception) {
            logger.debug("XML warning in {} at line {}: {}", file, exception.getLineNumber(), exception.getMessage());
        }

        @Override
        public void error(final SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(final SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
