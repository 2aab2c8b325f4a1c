package org.phylo.beastxml.merge;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when a fragment's block cannot be lined up with the target: wrong root,
 * different BEAST version, or a container whose id belongs to an element of
 * another tag or location.
 */
public class StructuralMismatchException extends BeastAssemblyException {

    private final String path;

    public StructuralMismatchException(String message, String path) {
        super(message + (path == null ? "" : " at " + path));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
