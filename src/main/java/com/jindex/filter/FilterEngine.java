package com.jindex.filter;

import com.jindex.index.RatingIndex;
import com.jindex.index.ScannableIndex;
import com.jindex.index.StructureNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Filtering layered on the index primitives. Rating bounds go through the
 * structure's own range query; every other field is a linear scan because it
 * is not indexed.
 */
public final class FilterEngine {

    private FilterEngine() {
    }

    public static List<Map<String, Object>> filterByRating(RatingIndex index, Double min, Double max) {
        double low = min == null ? Double.NEGATIVE_INFINITY : min;
        double high = max == null ? Double.POSITIVE_INFINITY : max;
        return index.getRange(low, high);
    }

    public static List<Map<String, Object>> filterByField(ScannableIndex index, String field, FieldPredicate predicate) {
        requireField(index, field);
        List<Map<String, Object>> results = new ArrayList<>();
        index.forEachRecord(record -> {
            if (matches(record, field, predicate)) {
                results.add(record);
            }
        });
        return results;
    }

    public static List<Map<String, Object>> filterMultiCriteria(RatingIndex index, FilterCriteria criteria) {
        for (String field : criteria.getFieldPredicates().keySet()) {
            requireField(index, field);
        }

        List<Map<String, Object>> candidates = criteria.hasRatingFilter()
            ? filterByRating(index, criteria.getMinRating(), criteria.getMaxRating())
            : index.getAllRecords();

        for (Map.Entry<String, FieldPredicate> entry : criteria.getFieldPredicates().entrySet()) {
            candidates = refine(candidates, entry.getKey(), entry.getValue());
            if (candidates.isEmpty()) {
                break;
            }
        }
        return candidates;
    }

    /**
     * Keeps the records of {@code candidates} matching one more predicate.
     */
    public static List<Map<String, Object>> refine(List<Map<String, Object>> candidates, String field,
                                                   FieldPredicate predicate) {
        List<Map<String, Object>> kept = new ArrayList<>();
        for (Map<String, Object> record : candidates) {
            if (matches(record, field, predicate)) {
                kept.add(record);
            }
        }
        return kept;
    }

    private static boolean matches(Map<String, Object> record, String field, FieldPredicate predicate) {
        return record.containsKey(field) && predicate.test(record.get(field));
    }

    /**
     * Field names are known only from stored records, so an empty structure
     * accepts any field.
     */
    private static void requireField(ScannableIndex index, String field) {
        if (index.getSize() > 0 && !index.fieldNames().contains(field)) {
            throw new StructureNotFoundException(
                "Field '" + field + "' is not present in " + index.type() + " index");
        }
    }
}
