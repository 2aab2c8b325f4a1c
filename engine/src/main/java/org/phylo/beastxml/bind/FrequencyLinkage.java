package org.phylo.beastxml.bind;

/**
 * Whether partitions share one base-frequency parameter.
 */
public enum FrequencyLinkage {
    /** Every partition gets its own {@code <partition>.frequencies}. */
    PER_PARTITION,
    /** All partitions refer to a single {@code frequencies} parameter. */
    SHARED
}
