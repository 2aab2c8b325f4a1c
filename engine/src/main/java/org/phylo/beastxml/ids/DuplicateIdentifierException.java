package org.phylo.beastxml.ids;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when two non-equivalent elements declare the same identifier.
 */
public class DuplicateIdentifierException extends BeastAssemblyException {

    private final String identifier;

    public DuplicateIdentifierException(String identifier, String existingPath, String duplicatePath) {
        super("Identifier '" + identifier + "' declared at " + duplicatePath
                + " is already declared at " + existingPath);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
