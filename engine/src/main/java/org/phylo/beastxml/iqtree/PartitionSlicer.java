package org.phylo.beastxml.iqtree;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cuts partition columns out of full-length sequences.
 */
public final class PartitionSlicer {

    private PartitionSlicer() {
        // Static utility class
    }

    /**
     * @param sequence Full aligned sequence
     * @param columns  1-based column indices, in output order
     * @throws IllegalArgumentException if a column lies outside the sequence
     */
    public static String slice(String sequence, List<Integer> columns) {
        StringBuilder sb = new StringBuilder(columns.size());
        for (int column : columns) {
            if (column < 1 || column > sequence.length()) {
                throw new IllegalArgumentException("Column " + column + " outside sequence of length "
                        + sequence.length());
            }
            sb.append(sequence.charAt(column - 1));
        }
        return sb.toString();
    }

    /**
     * Slices every sequence of an alignment, keeping taxon order.
     */
    public static Map<String, String> slice(Map<String, String> sequences, List<Integer> columns) {
        Map<String, String> result = new LinkedHashMap<>();
        sequences.forEach((taxon, sequence) -> result.put(taxon, slice(sequence, columns)));
        return result;
    }
}
