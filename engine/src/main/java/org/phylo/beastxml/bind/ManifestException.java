package org.phylo.beastxml.bind;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown for a malformed binding-context manifest.
 */
public class ManifestException extends BeastAssemblyException {

    public ManifestException(String message) {
        super(message);
    }

    public ManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}
