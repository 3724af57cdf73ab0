package com.streamdetect.core.buffer;

import java.util.List;

/**
 * Point-in-time description of a {@link ColumnarBuffer}.
 */
public final class BufferStats {

    private final int size;
    private final int windowSize;
    private final long appendedTotal;
    private final List<String> fieldNames;

    BufferStats(int size, int windowSize, long appendedTotal, List<String> fieldNames) {
        this.size = size;
        this.windowSize = windowSize;
        this.appendedTotal = appendedTotal;
        this.fieldNames = List.copyOf(fieldNames);
    }

    public int getSize() {
        return size;
    }

    public int getWindowSize() {
        return windowSize;
    }

    /**
     * @return records appended since creation or the last clear, including
     *         those already dropped from the head
     */
    public long getAppendedTotal() {
        return appendedTotal;
    }

    public List<String> getFieldNames() {
        return fieldNames;
    }

    @Override
    public String toString() {
        return "BufferStats{size=" + size + ", windowSize=" + windowSize
                + ", appendedTotal=" + appendedTotal + ", fieldNames=" + fieldNames + '}';
    }
}
