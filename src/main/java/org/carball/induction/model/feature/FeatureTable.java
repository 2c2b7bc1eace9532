package org.carball.induction.model.feature;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Row-major feature matrix keyed by train identifier. Rows follow the input
 * dataset order; columns follow {@link #columns()}.
 */
public record FeatureTable(List<String> columns, List<String> trainIds, double[][] values) {

    public FeatureTable {
        columns = List.copyOf(columns);
        trainIds = List.copyOf(trainIds);
        if (values.length != trainIds.size()) {
            throw new IllegalArgumentException("Expected " + trainIds.size() + " rows but got " + values.length);
        }
        for (double[] row : values) {
            if (row.length != columns.size()) {
                throw new IllegalArgumentException("Row width " + row.length + " does not match " + columns.size() + " columns");
            }
        }
    }

    public int rowCount() {
        return trainIds.size();
    }

    public int columnCount() {
        return columns.size();
    }

    public double[] row(int index) {
        return Arrays.copyOf(values[index], values[index].length);
    }

    public double[] column(String name) {
        int index = columns.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown feature column: " + name);
        }
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i][index];
        }
        return out;
    }

    public double value(String trainId, String column) {
        int row = trainIds.indexOf(trainId);
        if (row < 0) {
            throw new IllegalArgumentException("Unknown train: " + trainId);
        }
        return column(column)[row];
    }

    /**
     * Reorders to {@code target}. Columns absent here are zero-filled, columns
     * absent from {@code target} are dropped.
     */
    public FeatureTable alignTo(List<String> target) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            positions.put(columns.get(i), i);
        }
        double[][] aligned = new double[values.length][target.size()];
        for (int c = 0; c < target.size(); c++) {
            Integer source = positions.get(target.get(c));
            if (source == null) {
                continue;
            }
            for (int r = 0; r < values.length; r++) {
                aligned[r][c] = values[r][source];
            }
        }
        return new FeatureTable(new ArrayList<>(target), trainIds, aligned);
    }
}
