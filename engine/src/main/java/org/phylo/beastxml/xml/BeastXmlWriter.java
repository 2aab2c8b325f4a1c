package org.phylo.beastxml.xml;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes documents in the layout BEAST itself writes.
 *
 * Output depends only on the tree: attribute order is the stored order, one
 * element per line, tab indentation. Text of an element that also has
 * children is written after them, which is how {@code <sequence>} blocks
 * carry their residues.
 */
public final class BeastXmlWriter {

    public static final String HEADER = "<?xml version=\"1.0\" standalone=\"yes\"?>";

    private BeastXmlWriter() {
        // Static utility class
    }

    public static String toXml(BeastDocument document) {
        StringBuilder sb = new StringBuilder(HEADER).append('\n');
        writeElement(sb, document.root(), 0);
        return sb.toString();
    }

    public static void write(BeastDocument document, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toXml(document));
        }
    }

    private static void writeElement(StringBuilder sb, Element element, int depth) {
        indent(sb, depth);
        sb.append('<').append(element.tag());
        element.attributes().forEach((name, value) ->
                sb.append(' ').append(name).append("=\"").append(escape(value, true)).append('"'));

        if (element.childCount() == 0 && element.text() == null) {
            sb.append("/>\n");
            return;
        }
        if (element.childCount() == 0) {
            sb.append('>').append(escape(element.text(), false));
            sb.append("</").append(element.tag()).append(">\n");
            return;
        }

        sb.append(">\n");
        for (Element child : element.children()) {
            writeElement(sb, child, depth + 1);
        }
        if (element.text() != null) {
            indent(sb, depth + 1);
            sb.append(escape(element.text(), false)).append('\n');
        }
        indent(sb, depth);
        sb.append("</").append(element.tag()).append(">\n");
    }

    private static void indent(StringBuilder sb, int depth) {
        sb.append("\t".repeat(depth));
    }

    private static String escape(String value, boolean attribute) {
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append(attribute ? "&quot;" : "\"");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
