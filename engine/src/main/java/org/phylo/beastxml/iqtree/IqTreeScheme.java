package org.phylo.beastxml.iqtree;

import org.phylo.beastxml.model.SubstitutionModelSpec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A partitioning scheme chosen by IQ-TREE.
 *
 * @param models     Partition name to model, in charpartition order
 * @param modelNames Partition name to the model string as IQ-TREE wrote it
 * @param columns    Partition name to 1-based alignment columns, in charset order
 */
public record IqTreeScheme(
        Map<String, SubstitutionModelSpec> models,
        Map<String, String> modelNames,
        Map<String, List<Integer>> columns) {

    public IqTreeScheme {
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        modelNames = Collections.unmodifiableMap(new LinkedHashMap<>(modelNames));
        Map<String, List<Integer>> copy = new LinkedHashMap<>();
        columns.forEach((name, indices) -> copy.put(name, List.copyOf(indices)));
        columns = Collections.unmodifiableMap(copy);
    }

    /**
     * @return Names of partitions that have a model assigned
     */
    public Set<String> partitionNames() {
        return models.keySet();
    }

    public SubstitutionModelSpec model(String partition) {
        SubstitutionModelSpec spec = models.get(partition);
        if (spec == null) {
            throw new IllegalArgumentException("No model assigned to partition '" + partition + "'");
        }
        return spec;
    }

    public List<Integer> columns(String partition) {
        List<Integer> indices = columns.get(partition);
        if (indices == null) {
            throw new IllegalArgumentException("No charset for partition '" + partition + "'");
        }
        return indices;
    }
}
