package org.phylo.beastxml.ids;

import org.phylo.beastxml.BeastAssemblyException;

/**
 * Thrown when an {@code idref} does not resolve to a declared {@code id}.
 */
public class DanglingReferenceException extends BeastAssemblyException {

    private final String identifier;
    private final String path;
    private final String fragment;

    public DanglingReferenceException(String identifier, String path) {
        this(identifier, path, null);
    }

    public DanglingReferenceException(String identifier, String path, String fragment) {
        super("Unresolved idref '" + identifier + "' at " + path
                + (fragment == null ? "" : " (introduced by fragment '" + fragment + "')"));
        this.identifier = identifier;
        this.path = path;
        this.fragment = fragment;
    }

    public String getIdentifier() {
        return identifier;
    }

    public String getPath() {
        return path;
    }

    /**
     * @return Name of the fragment whose merge introduced the reference, or null
     */
    public String getFragment() {
        return fragment;
    }
}
