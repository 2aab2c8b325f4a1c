package org.phylo.beastxml.bind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One sampled taxon.
 *
 * @param id         Taxon id
 * @param date       Sampling date in decimal years, or null if undated
 * @param sequences  Partition name to aligned sequence; partitions left out are padded
 * @param attributes Trait name to value
 */
public record TaxonBinding(String id, Double date, Map<String, String> sequences, Map<String, String> attributes) {

    public TaxonBinding {
        Objects.requireNonNull(id, "Taxon id cannot be null");
        sequences = sequences == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sequences));
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
