package io.quantum.core.parser;

import io.quantum.core.error.SourceParseException;
import io.quantum.core.model.SourceLocation;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * Reads component markup into a {@link RawNode.RawElement} tree with SAX.
 *
 * <p>The reader is namespace-unaware: {@code q:set} arrives as the literal name {@code q:set}, and
 * {@code xmlns} declarations are dropped from attribute maps. Document type declarations are
 * rejected, so neither internal entity expansion nor external entities can be triggered by a
 * source file. Whitespace-only text between elements is dropped; all other text is kept in
 * document order.
 */
final class XmlReader {

    static final String QUANTUM_PREFIX = "q:";

    private XmlReader() {}

    /**
     * Parses a whole document.
     *
     * @throws SourceParseException on malformed markup or a DOCTYPE
     */
    static RawNode.RawElement read(String text, String sourceName) {
        TreeBuilder builder = new TreeBuilder(sourceName);
        try {
            SAXParser parser = newFactory().newSAXParser();
            parser.parse(new InputSource(new StringReader(text)), builder);
        } catch (SAXParseException e) {
            throw new SourceParseException(
                    "Malformed markup: " + e.getMessage(),
                    e,
                    sourceName,
                    SourceLocation.of(sourceName, e.getLineNumber(), e.getColumnNumber()));
        } catch (SAXException | ParserConfigurationException | IOException e) {
            throw new SourceParseException(
                    "Failed to read source: " + e.getMessage(), e, sourceName, SourceLocation.of(sourceName, 0, 0));
        }
        if (builder.root == null) {
            throw new SourceParseException("Empty document", sourceName, SourceLocation.of(sourceName, 0, 0));
        }
        return builder.root;
    }

    /** SAX factories are not thread-safe, so each read configures its own. */
    private static SAXParserFactory newFactory() throws ParserConfigurationException, SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory;
    }

    private static final class TreeBuilder extends DefaultHandler {

        private final String sourceName;
        private final Deque<Pending> open = new ArrayDeque<>();
        private final StringBuilder text = new StringBuilder();
        private SourceLocation textStart;
        private Locator locator;
        private RawNode.RawElement root;

        TreeBuilder(String sourceName) {
            this.sourceName = sourceName;
        }

        @Override
        public void setDocumentLocator(Locator locator) {
            this.locator = locator;
        }

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            flushText();
            Map<String, String> attrs = new LinkedHashMap<>();
            for (int i = 0; i < attributes.getLength(); i++) {
                String name = attributes.getQName(i);
                if (!name.equals("xmlns") && !name.startsWith("xmlns:")) {
                    attrs.put(name, attributes.getValue(i));
                }
            }
            open.push(new Pending(qName, attrs, here()));
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            flushText();
            Pending pending = open.pop();
            RawNode.RawElement element =
                    new RawNode.RawElement(pending.name, pending.attributes, pending.children, pending.location);
            if (open.isEmpty()) {
                root = element;
            } else {
                open.peek().children.add(element);
            }
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (text.length() == 0) {
                textStart = here();
            }
            text.append(ch, start, length);
        }

        @Override
        public void ignorableWhitespace(char[] ch, int start, int length) {
            characters(ch, start, length);
        }

        private void flushText() {
            if (text.length() == 0) {
                return;
            }
            String value = text.toString();
            text.setLength(0);
            if (!value.isBlank() && !open.isEmpty()) {
                open.peek().children.add(new RawNode.RawText(value, textStart));
            }
        }

        private SourceLocation here() {
            return locator != null
                    ? SourceLocation.of(sourceName, locator.getLineNumber(), locator.getColumnNumber())
                    : SourceLocation.of(sourceName, 0, 0);
        }
    }

    private static final class Pending {
        final String name;
        final Map<String, String> attributes;
        final List<RawNode> children = new ArrayList<>();
        final SourceLocation location;

        Pending(String name, Map<String, String> attributes, SourceLocation location) {
            this.name = name;
            this.attributes = attributes;
            this.location = location;
        }
    }
}
