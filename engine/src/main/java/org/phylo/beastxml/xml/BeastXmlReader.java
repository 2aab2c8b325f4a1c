package org.phylo.beastxml.xml;

import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.XMLReader;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Parses BEAST XML into {@link Element} trees.
 *
 * Comments and whitespace-only text are dropped; remaining text is trimmed.
 * Every call builds a fresh tree, nothing is cached between calls.
 */
public final class BeastXmlReader {

    private BeastXmlReader() {
        // Static utility class
    }

    public static BeastDocument parse(String name, String xml) {
        return parse(name, new InputSource(new StringReader(xml)));
    }

    public static BeastDocument parse(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(path.toString(), new InputSource(reader));
        }
    }

    /**
     * Parses from a stream, which is closed afterwards.
     */
    public static BeastDocument parse(String name, InputStream in) throws IOException {
        try (in) {
            return parse(name, new InputSource(in));
        }
    }

    private static BeastDocument parse(String name, InputSource source) {
        TreeHandler handler = new TreeHandler();
        try {
            SAXParserFactory factory = SAXParserFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            XMLReader reader = factory.newSAXParser().getXMLReader();
            reader.setContentHandler(handler);
            reader.setErrorHandler(handler);
            reader.parse(source);
        } catch (SAXParseException e) {
            throw new XmlParseException("Malformed XML in " + name + ": " + e.getMessage(),
                    e.getLineNumber(), e.getColumnNumber(), e);
        } catch (SAXException | ParserConfigurationException | IOException e) {
            throw new XmlParseException("Error parsing XML from " + name, e);
        }
        if (handler.root == null) {
            throw new XmlParseException("No root element in " + name, null);
        }
        return new BeastDocument(name, handler.root);
    }

    private static final class TreeHandler extends DefaultHandler {
        private final Deque<Element> open = new ArrayDeque<>();
        private final Deque<StringBuilder> text = new ArrayDeque<>();
        private Element root;

        @Override
        public void startElement(String uri, String localName, String qName, Attributes attributes) {
            Element element = new Element(qName);
            for (int i = 0; i < attributes.getLength(); i++) {
                element.setAttribute(attributes.getQName(i), attributes.getValue(i));
            }
            if (open.isEmpty()) {
                root = element;
            } else {
                open.peek().append(element);
            }
            open.push(element);
            text.push(new StringBuilder());
        }

        @Override
        public void characters(char[] ch, int start, int length) {
            if (!text.isEmpty()) {
                text.peek().append(ch, start, length);
            }
        }

        @Override
        public void endElement(String uri, String localName, String qName) {
            Element element = open.pop();
            String content = text.pop().toString().strip();
            if (!content.isEmpty()) {
                element.setText(content);
            }
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
