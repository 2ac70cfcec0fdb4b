package com.bricks.sorter.cluster;

import com.bricks.sorter.model.EnrichedRecord;

import java.util.List;

/**
 * Binary category-membership matrix of one working set.
 * <p>
 * Row {@code i} belongs to {@code records().get(i)}; column {@code j} is the
 * category {@code columns().get(j)}. The root term has no column, its
 * presence is tracked per row by {@link #carriesRoot(int)}.
 */
public final class FeatureMatrix {

    private final String rootTerm;

    private final List<String> columns;

    private final List<EnrichedRecord> records;

    private final boolean[][] values;

    private final boolean[] carriesRoot;

    FeatureMatrix(final String rootTerm,
                  final List<String> columns,
                  final List<EnrichedRecord> records,
                  final boolean[][] values,
                  final boolean[] carriesRoot) {
        this.rootTerm = rootTerm;
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
        this.values = values;
        this.carriesRoot = carriesRoot;
    }

    public String rootTerm() {
        return rootTerm;
    }

    public List<String> columns() {
        return columns;
    }

    public List<EnrichedRecord> records() {
        return records;
    }

    public int rows() {
        return records.size();
    }

    public boolean value(final int row, final int column) {
        return values[row][column];
    }

    public boolean carriesRoot(final int row) {
        return carriesRoot[row];
    }

    /**
     * @return one 0/1 vector per row
     */
    public double[][] points() {
        double[][] points = new double[values.length][columns.size()];
        for (int i = 0; i < values.length; i++) {
            for (int j = 0; j < columns.size(); j++) {
                points[i][j] = values[i][j] ? 1.0 : 0.0;
            }
        }
        return points;
    }

    /**
     * @return quantity of every row
     */
    public double[] weights() {
        return records.stream().mapToDouble(EnrichedRecord::quantity).toArray();
    }
}
