package org.phylo.beastxml.iqtree;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when an IQ-TREE scheme file cannot be read.
 */
public class IqTreeParseException extends BeastAssemblyException {

    private final int line;
    private final int column;

    public IqTreeParseException(String message, int line, int column) {
        this(message, line, column, null);
    }

    public IqTreeParseException(String message, int line, int column, Throwable cause) {
        super(message + " (line " + line + ", column " + column + ")", cause);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
