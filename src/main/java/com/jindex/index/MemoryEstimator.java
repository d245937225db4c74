package com.jindex.index;

import java.util.Map;

/**
 * Rough heap-size estimates used by the memory counters. These are
 * comparable between structures, not exact.
 */
public final class MemoryEstimator {
    public static final long OBJECT_HEADER = 16;
    public static final long TRIE_NODE = 64;
    public static final long TST_NODE = 56;
    public static final long ARRAY_ENTRY = 48;

    private MemoryEstimator() {
    }

    public static long estimate(Map<String, Object> record) {
        long bytes = 48;
        for (Map.Entry<String, Object> entry : record.entrySet()) {
            bytes += 32 + estimate(entry.getKey()) + estimateValue(entry.getValue());
        }
        return bytes;
    }

    public static long estimate(String text) {
        return text == null ? 0 : 40 + text.length() * 2L;
    }

    private static long estimateValue(Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof String) {
            return estimate((String) value);
        }
        if (value instanceof Number || value instanceof Boolean) {
            return OBJECT_HEADER + 8;
        }
        return estimate(value.toString());
    }
}
