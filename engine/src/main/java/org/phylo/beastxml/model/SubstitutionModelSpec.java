package org.phylo.beastxml.model;

import java.util.Objects;

/**
 * A fully specified nucleotide substitution model.
 *
 * @param family              Rate-matrix family
 * @param frequencies         Base-frequency treatment
 * @param gammaCategories     Number of discrete gamma categories, or null for no rate heterogeneity
 * @param proportionInvariant Whether a proportion of invariant sites is estimated
 */
public record SubstitutionModelSpec(
        SubstitutionModelFamily family,
        FrequencyMode frequencies,
        Integer gammaCategories,
        boolean proportionInvariant) {

    public SubstitutionModelSpec {
        Objects.requireNonNull(family, "Model family cannot be null");
        Objects.requireNonNull(frequencies, "Frequency mode cannot be null");
        if (gammaCategories != null && gammaCategories < 1) {
            throw new IllegalArgumentException("Gamma categories must be at least 1, got " + gammaCategories);
        }
    }

    public static SubstitutionModelSpec of(SubstitutionModelFamily family) {
        return new SubstitutionModelSpec(family, FrequencyMode.ESTIMATED, null, false);
    }

    public SubstitutionModelSpec withFrequencies(FrequencyMode mode) {
        return new SubstitutionModelSpec(family, mode, gammaCategories, proportionInvariant);
    }

    public SubstitutionModelSpec withGamma(Integer categories) {
        return new SubstitutionModelSpec(family, frequencies, categories, proportionInvariant);
    }

    public SubstitutionModelSpec withProportionInvariant(boolean invariant) {
        return new SubstitutionModelSpec(family, frequencies, gammaCategories, invariant);
    }

    public boolean hasGamma() {
        return gammaCategories != null;
    }

    /**
     * e.g. {@code GTR+G4+I (estimated frequencies)}
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(family.name());
        if (hasGamma()) {
            sb.append("+G").append(gammaCategories);
        }
        if (proportionInvariant) {
            sb.append("+I");
        }
        return sb.append(" (").append(frequencies.label()).append(" frequencies)").toString();
    }
}
