package com.jindex.index;

import com.jindex.filter.FilterCriteria;
import com.jindex.filter.FilterEngine;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Query contract of the structures keyed by the numeric rating.
 */
public interface RatingIndex extends ScannableIndex {

    /**
     * Adds a record. Records sharing a key are all kept.
     *
     * @param key The rating
     * @param record The record stored under it
     * @throws InvalidKeyException If the rating is NaN or infinite
     * @throws IllegalStateException If the index is frozen
     */
    void insert(double key, Map<String, Object> record);

    default void insert(Record record) {
        insert(record.getRating(), record.getValue());
    }

    default void insertAll(Collection<Record> records) {
        for (Record record : records) {
            insert(record);
        }
    }

    /**
     * @return Every record whose key equals {@code key}, possibly none
     */
    default List<Map<String, Object>> search(double key) {
        return search(key, ComparisonCounter.NOOP);
    }

    List<Map<String, Object>> search(double key, ComparisonCounter counter);

    /**
     * @return Every record with key in {@code [min, max]}; empty when {@code min > max}
     */
    default List<Map<String, Object>> getRange(double min, double max) {
        return getRange(min, max, ComparisonCounter.NOOP);
    }

    List<Map<String, Object>> getRange(double min, double max, ComparisonCounter counter);

    /**
     * @return The {@code k} records with the greatest keys, highest first
     */
    List<Map<String, Object>> getTopK(int k);

    /**
     * Range filter with open bounds: a null bound means unbounded.
     */
    default List<Map<String, Object>> filterByRating(Double min, Double max) {
        return FilterEngine.filterByRating(this, min, max);
    }

    /**
     * Applies the rating bounds first, then every field predicate in turn.
     */
    default List<Map<String, Object>> filterMultiCriteria(FilterCriteria criteria) {
        return FilterEngine.filterMultiCriteria(this, criteria);
    }
}
