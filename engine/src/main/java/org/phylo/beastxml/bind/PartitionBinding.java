package org.phylo.beastxml.bind;

import java.util.Objects;

/**
 * One partition of the dataset.
 *
 * @param name     Partition name; also the alignment id and the identifier prefix
 * @param length   Number of alignment columns
 * @param dataType BEAST data type, e.g. {@code nucleotide}
 * @param model    Model name such as {@code HKY+G4}, or null when none was chosen
 */
public record PartitionBinding(String name, int length, String dataType, String model) {

    public static final String NUCLEOTIDE = "nucleotide";

    public PartitionBinding {
        Objects.requireNonNull(name, "Partition name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Partition name cannot be blank");
        }
        if (length < 1) {
            throw new IllegalArgumentException("Partition '" + name + "' must have at least one column");
        }
        dataType = dataType == null ? NUCLEOTIDE : dataType;
    }
}
