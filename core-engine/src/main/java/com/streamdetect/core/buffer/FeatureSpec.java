package com.streamdetect.core.buffer;

import java.util.List;
import java.util.Objects;

/**
 * Which derived columns to add on top of the encoded record: rolling
 * statistics per window and lagged values per period.
 *
 * @since 1.0.0
 */
public final class FeatureSpec {

    private static final FeatureSpec NONE = new FeatureSpec(List.of(), List.of(), List.of());

    private final List<Integer> rollingWindows;
    private final List<RollingStat> rollingStats;
    private final List<Integer> lagPeriods;

    public FeatureSpec(List<Integer> rollingWindows, List<RollingStat> rollingStats,
            List<Integer> lagPeriods) {
        this.rollingWindows = List.copyOf(Objects.requireNonNull(rollingWindows, "rollingWindows"));
        this.rollingStats = List.copyOf(Objects.requireNonNull(rollingStats, "rollingStats"));
        this.lagPeriods = List.copyOf(Objects.requireNonNull(lagPeriods, "lagPeriods"));
        for (int window : this.rollingWindows) {
            if (window < 1) {
                throw new IllegalArgumentException("Rolling window must be >= 1, got: " + window);
            }
        }
        for (int period : this.lagPeriods) {
            if (period < 1) {
                throw new IllegalArgumentException("Lag period must be >= 1, got: " + period);
            }
        }
    }

    /**
     * @return a spec that adds no derived columns
     */
    public static FeatureSpec none() {
        return NONE;
    }

    public List<Integer> getRollingWindows() {
        return rollingWindows;
    }

    public List<RollingStat> getRollingStats() {
        return rollingStats;
    }

    public List<Integer> getLagPeriods() {
        return lagPeriods;
    }

    /**
     * @return {@code true} if no rolling or lag columns are produced
     */
    public boolean isEmpty() {
        return (rollingWindows.isEmpty() || rollingStats.isEmpty()) && lagPeriods.isEmpty();
    }

    /**
     * Number of most recent records needed to compute the derived columns of
     * the newest record exactly as they were computed during training.
     *
     * @return at least 1
     */
    public int historyRequired() {
        int required = 1;
        if (!rollingStats.isEmpty()) {
            for (int window : rollingWindows) {
                required = Math.max(required, window);
            }
        }
        for (int period : lagPeriods) {
            required = Math.max(required, period + 1);
        }
        return required;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureSpec that))
            return false;
        return rollingWindows.equals(that.rollingWindows)
                && rollingStats.equals(that.rollingStats)
                && lagPeriods.equals(that.lagPeriods);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rollingWindows, rollingStats, lagPeriods);
    }

    @Override
    public String toString() {
        return "FeatureSpec{rollingWindows=" + rollingWindows
                + ", rollingStats=" + rollingStats
                + ", lagPeriods=" + lagPeriods + '}';
    }
}
