package org.phylo.beastxml.bind;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when a binding context does not fit the document it is bound to.
 */
public class BindingException extends BeastAssemblyException {

    public BindingException(String message) {
        super(message);
    }

    public BindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
