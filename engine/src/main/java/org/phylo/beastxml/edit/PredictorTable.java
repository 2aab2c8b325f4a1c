package org.phylo.beastxml.edit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A CSV table of predictor values: a header row, then one row per state whose
 * first cell names the state.
 *
 * <pre>
 * state,population
 * UK,67.0
 * FR,68.1
 * </pre>
 *
 * A table with one value column is a scalar predictor; a table whose value
 * columns are named by states is a matrix predictor.
 */
public record PredictorTable(List<String> columns, List<String> rows, double[][] values) {

    public PredictorTable {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        if (values.length != rows.size()) {
            throw new IllegalArgumentException("Expected " + rows.size() + " rows of values, got " + values.length);
        }
    }

    /**
     * @throws IllegalArgumentException on ragged rows or non-numeric values
     */
    public static PredictorTable parse(String csv) {
        List<String> lines = new ArrayList<>();
        for (String line : csv.split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        if (lines.size() < 2) {
            throw new IllegalArgumentException("Predictor table needs a header and at least one row");
        }
        List<String> header = cells(lines.get(0));
        List<String> columns = header.subList(1, header.size());
        List<String> rows = new ArrayList<>();
        double[][] values = new double[lines.size() - 1][];
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = cells(lines.get(i));
            if (cells.size() != header.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + cells.size() + " cells, expected "
                        + header.size());
            }
            rows.add(cells.get(0));
            values[i - 1] = new double[columns.size()];
            for (int j = 0; j < columns.size(); j++) {
                try {
                    values[i - 1][j] = Double.parseDouble(cells.get(j + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Row " + i + ", column '" + columns.get(j)
                            + "' is not a number: " + cells.get(j + 1), e);
                }
            }
        }
        return new PredictorTable(columns, rows, values);
    }

    public boolean isScalar() {
        return columns.size() == 1;
    }

    public boolean isMatrix() {
        return columns.size() == rows.size() && columns.containsAll(rows);
    }

    public double value(String row, String column) {
        int i = rows.indexOf(row);
        int j = columns.indexOf(column);
        if (i < 0 || j < 0) {
            throw new IllegalArgumentException("No value for (" + row + ", " + column + ")");
        }
        return values[i][j];
    }

    private static List<String> cells(String line) {
        List<String> cells = new ArrayList<>();
        for (String cell : Arrays.asList(line.split(",", -1))) {
            String trimmed = cell.trim();
            if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
            cells.add(trimmed);
        }
        return cells;
    }
}
