package org.phylo.beastxml.merge;

/**
 * Tie-break when a fragment declares an identifier that the target already
 * declares on a non-equivalent element.
 */
public enum CollisionPolicy {
    /** The target keeps the name; the fragment's element gets a suffixed one. */
    RENAME_INCOMING,
    /** The fragment keeps the name; the target's element gets a suffixed one. */
    RENAME_EXISTING,
    /** Abort the merge with a DuplicateIdentifierException. */
    FAIL
}
