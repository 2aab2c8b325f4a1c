package org.phylo.beastxml.xml;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Exception thrown when a template or document is not well-formed XML.
 * Includes optional source location information.
 */
public class XmlParseException extends BeastAssemblyException {

    private final int line;
    private final int column;

    public XmlParseException(String message, Throwable cause) {
        super(message, cause);
        this.line = -1;
        this.column = -1;
    }

    public XmlParseException(String message, int line, int column, Throwable cause) {
        super("line " + line + ":" + column + " " + message, cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean hasLocation() {
        return line >= 0 && column >= 0;
    }
}
