package com.streamdetect.service;

import com.streamdetect.core.model.Record;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The {@code data} of one request: the records that parsed, in order, and the
 * batch positions of the elements that did not, with the reason.
 */
public final class ParsedData {

    private final List<Record> records;
    private final Map<Integer, String> rejected;

    ParsedData(List<Record> records, Map<Integer, String> rejected) {
        this.records = Collections.unmodifiableList(records);
        this.rejected = Collections.unmodifiableMap(rejected);
    }

    public List<Record> getRecords() {
        return records;
    }

    public Map<Integer, String> getRejected() {
        return rejected;
    }

    public int size() {
        return records.size() + rejected.size();
    }

    @Override
    public String toString() {
        return "ParsedData{records=" + records.size() + ", rejected=" + rejected.keySet() + '}';
    }
}
