package org.phylo.beastxml.bind;

public enum TraitKind {
    /** States become a generalDataType with attribute patterns. */
    DISCRETE,
    /** Values are attached to taxa only. */
    CONTINUOUS
}
