package com.streamdetect.core.buffer;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Column-major matrix of named feature columns, all of the same length.
 *
 * @since 1.0.0
 */
public final class FeatureMatrix {

    private final List<String> names;
    private final List<double[]> columns;
    private final int rows;

    FeatureMatrix(int rows) {
        this.names = new ArrayList<>();
        this.columns = new ArrayList<>();
        this.rows = rows;
    }

    /**
     * Build a matrix from row-major data.
     *
     * @param names column names, one per column of every row
     * @param data  rows, each of length {@code names.size()}
     * @return the matrix
     */
    public static FeatureMatrix fromRows(List<String> names, double[][] data) {
        Objects.requireNonNull(names, "Column names must not be null");
        Objects.requireNonNull(data, "Rows must not be null");
        FeatureMatrix matrix = new FeatureMatrix(data.length);
        for (int c = 0; c < names.size(); c++) {
            double[] column = new double[data.length];
            for (int r = 0; r < data.length; r++) {
                if (data[r].length != names.size()) {
                    throw new IllegalArgumentException("Row " + r + " has " + data[r].length
                            + " values, expected " + names.size());
                }
                column[r] = data[r][c];
            }
            matrix.addColumn(names.get(c), column);
        }
        return matrix;
    }

    void addColumn(String name, double[] values) {
        if (values.length != rows) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.length
                    + " values, expected " + rows);
        }
        names.add(name);
        columns.add(values);
    }

    public int rowCount() {
        return rows;
    }

    public int columnCount() {
        return columns.size();
    }

    public List<String> columnNames() {
        return List.copyOf(names);
    }

    /**
     * @param name column name
     * @return a copy of the column's values
     * @throws IllegalArgumentException if there is no such column
     */
    public double[] column(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return columns.get(index).clone();
    }

    double[] columnAt(int index) {
        return columns.get(index);
    }

    public double[] row(int index) {
        if (index < 0 || index >= rows) {
            throw new IndexOutOfBoundsException("Row " + index + " outside [0, " + rows + ")");
        }
        double[] row = new double[columns.size()];
        for (int c = 0; c < row.length; c++) {
            row[c] = columns.get(c)[index];
        }
        return row;
    }

    /**
     * @return the newest row, or an empty array for an empty matrix
     */
    public double[] lastRow() {
        return rows == 0 ? new double[0] : row(rows - 1);
    }

    /**
     * @return row-major copy of all values
     */
    public double[][] toRows() {
        double[][] data = new double[rows][];
        for (int r = 0; r < rows; r++) {
            data[r] = row(r);
        }
        return data;
    }

    @Override
    public String toString() {
        return "FeatureMatrix{rows=" + rows + ", columns=" + names + '}';
    }
}
