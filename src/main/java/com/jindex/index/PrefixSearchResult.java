package com.jindex.index;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Records matched by a prefix search together with the cost of finding them.
 */
public class PrefixSearchResult {
    private final List<Map<String, Object>> records;
    private final SearchMetrics metrics;

    public PrefixSearchResult(List<Map<String, Object>> records, SearchMetrics metrics) {
        this.records = Collections.unmodifiableList(records);
        this.metrics = metrics;
    }

    public static PrefixSearchResult empty(long memoryBytes) {
        return new PrefixSearchResult(List.of(), new SearchMetrics(0, 0.0, memoryBytes, 0));
    }

    public List<Map<String, Object>> getRecords() {
        return records;
    }

    public SearchMetrics getMetrics() {
        return metrics;
    }

    public int size() {
        return records.size();
    }
}
