package org.phylo.beastxml.edit;

import java.util.Objects;

/**
 * Settings for taxa and sequences added by {@link TaxonEditor}.
 *
 * @param taxaId    Id of the {@code <taxa>} block
 * @param missing   Missing-data characters of new alignments
 * @param dataType  Data type of new alignments
 * @param direction Date direction, {@code forwards} or {@code backwards}
 * @param units     Date units
 */
public record TaxonOptions(String taxaId, String missing, String dataType, String direction, String units) {

    public TaxonOptions {
        Objects.requireNonNull(taxaId, "Taxa id cannot be null");
        Objects.requireNonNull(missing, "Missing characters cannot be null");
        Objects.requireNonNull(dataType, "Data type cannot be null");
        Objects.requireNonNull(direction, "Date direction cannot be null");
        Objects.requireNonNull(units, "Date units cannot be null");
    }

    public static TaxonOptions defaults() {
        return new TaxonOptions("taxa", "-", "nucleotide", "forwards", "years");
    }

    public TaxonOptions withDataType(String type) {
        return new TaxonOptions(taxaId, missing, type, direction, units);
    }
}
