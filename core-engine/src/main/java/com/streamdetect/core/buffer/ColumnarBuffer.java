package com.streamdetect.core.buffer;

import com.streamdetect.core.encoding.FeatureEncoder;
import com.streamdetect.core.model.Record;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Bounded, ordered history of records for one detector.
 *
 * <p>
 * Appends go to the tail; once the length exceeds {@code windowSize} records
 * are dropped from the head until it equals {@code windowSize} again. Every
 * public method is synchronized, so no caller ever observes more than
 * {@code windowSize} records and {@link #all()} / {@link #tail(int)} return
 * consistent point-in-time copies.
 * </p>
 *
 * <p>
 * Records are stored as ingested. Feature methods take the encoder to use,
 * which keeps the buffer independent of model retraining.
 * </p>
 *
 * @since 1.0.0
 */
public class ColumnarBuffer {

    private final int windowSize;
    private final Deque<Record> records = new ArrayDeque<>();
    private final Set<String> fieldNames = new LinkedHashSet<>();
    private long appendedTotal;

    /**
     * @param windowSize maximum number of records retained; must be >= 1
     */
    public ColumnarBuffer(int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got: " + windowSize);
        }
        this.windowSize = windowSize;
    }

    // ---------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------

    public synchronized void append(Record record) {
        Objects.requireNonNull(record, "Record must not be null");
        records.addLast(record);
        fieldNames.addAll(record.fieldNames());
        appendedTotal++;
        while (records.size() > windowSize) {
            records.pollFirst();
        }
    }

    public synchronized void appendBatch(List<Record> batch) {
        Objects.requireNonNull(batch, "Batch must not be null");
        for (Record record : batch) {
            append(record);
        }
    }

    public synchronized void clear() {
        records.clear();
        fieldNames.clear();
        appendedTotal = 0;
    }

    // ---------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------

    /**
     * @return copy of every retained record, oldest first
     */
    public synchronized List<Record> all() {
        return List.copyOf(records);
    }

    /**
     * @param n number of most recent records wanted; must be >= 0
     * @return copy of at most {@code n} newest records, oldest first
     */
    public synchronized List<Record> tail(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got: " + n);
        }
        int count = Math.min(n, records.size());
        List<Record> newest = new ArrayList<>(count);
        Iterator<Record> descending = records.descendingIterator();
        for (int i = 0; i < count; i++) {
            newest.add(descending.next());
        }
        List<Record> ordered = new ArrayList<>(count);
        for (int i = newest.size() - 1; i >= 0; i--) {
            ordered.add(newest.get(i));
        }
        return ordered;
    }

    public synchronized int size() {
        return records.size();
    }

    public int windowSize() {
        return windowSize;
    }

    public synchronized BufferStats stats() {
        return new BufferStats(records.size(), windowSize, appendedTotal, new ArrayList<>(fieldNames));
    }

    // ---------------------------------------------------------------
    // Features
    // ---------------------------------------------------------------

    /**
     * Rolling statistics over the retained records.
     *
     * @param encoder encoder used to turn records into vectors
     * @param windows window lengths
     * @param stats   statistics to compute
     * @return one derived column per window, statistic and numeric field
     */
    public FeatureMatrix rollingFeatures(FeatureEncoder encoder, List<Integer> windows,
            List<RollingStat> stats) {
        double[][] rows = encoder.transformAll(all());
        return FeatureEngine.rolling(encoder.featureNames(), rows, encoder.numericColumns(),
                windows, stats);
    }

    /**
     * Lagged values over the retained records.
     *
     * @param encoder encoder used to turn records into vectors
     * @param periods lag periods
     * @return one derived column per period and numeric field
     */
    public FeatureMatrix lagFeatures(FeatureEncoder encoder, List<Integer> periods) {
        double[][] rows = encoder.transformAll(all());
        return FeatureEngine.lags(encoder.featureNames(), rows, encoder.numericColumns(), periods);
    }

    /**
     * Base columns plus every derived column of {@code spec}.
     */
    public FeatureMatrix features(FeatureEncoder encoder, FeatureSpec spec) {
        return features(encoder, spec, all());
    }

    /**
     * Feature matrix of an arbitrary record sequence, such as a snapshot taken
     * earlier from a buffer.
     */
    public static FeatureMatrix features(FeatureEncoder encoder, FeatureSpec spec, List<Record> records) {
        double[][] rows = encoder.transformAll(records);
        return FeatureEngine.compute(encoder.featureNames(), rows, encoder.numericColumns(), spec);
    }

    @Override
    public synchronized String toString() {
        return "ColumnarBuffer{size=" + records.size() + ", windowSize=" + windowSize + '}';
    }
}
