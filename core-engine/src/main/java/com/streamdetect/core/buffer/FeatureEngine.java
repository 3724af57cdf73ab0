package com.streamdetect.core.buffer;

import org.apache.commons.math3.stat.StatUtils;

import java.util.List;
import java.util.Objects;

/**
 * Derives rolling-statistic and lag columns from encoded rows.
 *
 * <p>
 * Derived columns are computed for numeric columns only and in this order:
 * base columns, then for each window and each statistic and each numeric
 * column {@code <field>_rolling_<stat>_<w>}, then for each period and each
 * numeric column {@code <field>_lag_<p>}.
 * </p>
 *
 * <h3>Edge values</h3>
 * <ul>
 * <li>A window reaching before the first row uses the rows that exist.</li>
 * <li>A statistic that is undefined (standard deviation of one value) is
 * {@code 0.0}.</li>
 * <li>A lag reaching before the first row is {@code 0.0}.</li>
 * </ul>
 * <p>
 * No derived value is ever {@code NaN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureEngine {

    private FeatureEngine() {
        // utility class
    }

    /**
     * Build the full feature matrix for a sequence of encoded rows.
     *
     * @param names          base column names
     * @param rows           encoded rows, oldest first
     * @param numericColumns indices of the base columns to derive from
     * @param spec           derived columns to add
     * @return base plus derived columns
     */
    public static FeatureMatrix compute(List<String> names, double[][] rows, int[] numericColumns,
            FeatureSpec spec) {
        Objects.requireNonNull(spec, "FeatureSpec must not be null");
        FeatureMatrix matrix = FeatureMatrix.fromRows(names, rows);
        appendRolling(matrix, matrix, numericColumns, spec.getRollingWindows(), spec.getRollingStats());
        appendLags(matrix, matrix, numericColumns, spec.getLagPeriods());
        return matrix;
    }

    /**
     * Only the rolling-statistic columns.
     */
    public static FeatureMatrix rolling(List<String> names, double[][] rows, int[] numericColumns,
            List<Integer> windows, List<RollingStat> stats) {
        FeatureMatrix base = FeatureMatrix.fromRows(names, rows);
        FeatureMatrix derived = new FeatureMatrix(rows.length);
        appendRolling(base, derived, numericColumns, windows, stats);
        return derived;
    }

    /**
     * Only the lag columns.
     */
    public static FeatureMatrix lags(List<String> names, double[][] rows, int[] numericColumns,
            List<Integer> periods) {
        FeatureMatrix base = FeatureMatrix.fromRows(names, rows);
        FeatureMatrix derived = new FeatureMatrix(rows.length);
        appendLags(base, derived, numericColumns, periods);
        return derived;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static void appendRolling(FeatureMatrix source, FeatureMatrix target, int[] numericColumns,
            List<Integer> windows, List<RollingStat> stats) {
        List<String> names = source.columnNames();
        for (int window : windows) {
            for (RollingStat stat : stats) {
                for (int column : numericColumns) {
                    target.addColumn(names.get(column) + "_rolling_" + stat.value() + "_" + window,
                            rollingColumn(source.columnAt(column), window, stat));
                }
            }
        }
    }

    private static void appendLags(FeatureMatrix source, FeatureMatrix target, int[] numericColumns,
            List<Integer> periods) {
        List<String> names = source.columnNames();
        for (int period : periods) {
            for (int column : numericColumns) {
                target.addColumn(names.get(column) + "_lag_" + period,
                        lagColumn(source.columnAt(column), period));
            }
        }
    }

    static double[] rollingColumn(double[] values, int window, RollingStat stat) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int begin = Math.max(0, i - window + 1);
            int length = i - begin + 1;
            double value = switch (stat) {
                case MEAN -> StatUtils.mean(values, begin, length);
                case STD -> length < 2 ? 0.0 : Math.sqrt(StatUtils.variance(values, begin, length));
                case MIN -> StatUtils.min(values, begin, length);
                case MAX -> StatUtils.max(values, begin, length);
            };
            out[i] = Double.isFinite(value) ? value : 0.0;
        }
        return out;
    }

    static double[] lagColumn(double[] values, int period) {
        double[] out = new double[values.length];
        for (int i = period; i < values.length; i++) {
            out[i] = values[i - period];
        }
        return out;
    }
}
