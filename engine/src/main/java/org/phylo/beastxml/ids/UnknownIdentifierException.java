package org.phylo.beastxml.ids;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when looking up an identifier that was never registered.
 */
public class UnknownIdentifierException extends BeastAssemblyException {

    private final String identifier;

    public UnknownIdentifierException(String identifier) {
        super("Unknown identifier: '" + identifier + "'");
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
