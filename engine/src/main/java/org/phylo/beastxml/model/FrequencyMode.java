package org.phylo.beastxml.model;

/**
 * How base frequencies are treated by a nucleotide substitution model.
 */
public enum FrequencyMode {
    /** Uniform starting value, sampled during the run (delta-exchange + Dirichlet prior). */
    ESTIMATED,
    /** Taken from the alignment at start-up and then fixed. */
    EMPIRICAL,
    /** Fixed at 0.25 each. */
    EQUAL;

    public String label() {
        return name().toLowerCase();
    }
}
