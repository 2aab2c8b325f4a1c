package org.phylo.beastxml.edit;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when a document lacks the blocks an edit needs, or the edit's input
 * does not fit what the document already holds.
 */
public class EditException extends BeastAssemblyException {

    public EditException(String message) {
        super(message);
    }
}
