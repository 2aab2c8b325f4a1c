package org.phylo.beastxml.bind;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only description of the dataset a document is bound to.
 */
public record BindingContext(List<PartitionBinding> partitions, List<TaxonBinding> taxa, List<TraitBinding> traits) {

    public BindingContext {
        partitions = List.copyOf(partitions);
        taxa = List.copyOf(taxa);
        traits = traits == null ? List.of() : List.copyOf(traits);
        requireUnique(partitions.stream().map(PartitionBinding::name).toList(), "partition");
        requireUnique(taxa.stream().map(TaxonBinding::id).toList(), "taxon");
        requireUnique(traits.stream().map(TraitBinding::name).toList(), "trait");
    }

    public Optional<PartitionBinding> partition(String name) {
        return partitions.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * @return Total number of columns over all partitions
     */
    public int totalLength() {
        return partitions.stream().mapToInt(PartitionBinding::length).sum();
    }

    private static void requireUnique(List<String> names, String what) {
        Set<String> seen = new HashSet<>();
        for (String name : names) {
            if (!seen.add(name)) {
                throw new IllegalArgumentException("Duplicate " + what + " '" + name + "'");
            }
        }
    }
}
