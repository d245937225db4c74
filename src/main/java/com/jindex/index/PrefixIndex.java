package com.jindex.index;

import java.util.Map;

/**
 * Prefix index over a normalized name key. Implementations keep a running
 * comparison total and a memory estimate for benchmarking callers.
 */
public interface PrefixIndex extends ScannableIndex {

    int DEFAULT_MAX_RESULTS = 10;

    /**
     * @param key Name key; lower-cased and trimmed before use
     * @param record Record stored under it
     * @throws InvalidKeyException If the key is blank
     * @throws IllegalStateException If the index is frozen
     */
    void insert(String key, Map<String, Object> record);

    default PrefixSearchResult searchPrefix(String prefix) {
        return searchPrefix(prefix, DEFAULT_MAX_RESULTS);
    }

    /**
     * Finds records whose normalized key starts with the normalized prefix.
     * A blank prefix matches nothing.
     *
     * @param prefix The prefix
     * @param maxResults Upper bound on returned records, at least 1
     */
    PrefixSearchResult searchPrefix(String prefix, int maxResults);

    long getTotalComparisons();

    void resetComparisons();

    long getMemoryUsage();
}
