package com.jindex.filter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunction of an optional rating range and any number of field
 * predicates. Field predicates are applied in the order they were added.
 */
public class FilterCriteria {
    private final boolean ratingFilter;
    private final Double minRating;
    private final Double maxRating;
    private final Map<String, FieldPredicate> fieldPredicates;

    private FilterCriteria(Builder builder) {
        this.ratingFilter = builder.ratingFilter;
        this.minRating = builder.minRating;
        this.maxRating = builder.maxRating;
        this.fieldPredicates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldPredicates));
    }

    public boolean hasRatingFilter() {
        return ratingFilter;
    }

    public Double getMinRating() {
        return minRating;
    }

    public Double getMaxRating() {
        return maxRating;
    }

    public Map<String, FieldPredicate> getFieldPredicates() {
        return fieldPredicates;
    }

    public static class Builder {
        private boolean ratingFilter;
        private Double minRating;
        private Double maxRating;
        private final Map<String, FieldPredicate> fieldPredicates = new LinkedHashMap<>();

        /**
         * @param min Lower bound, or null for none
         * @param max Upper bound, or null for none
         */
        public Builder setRating(Double min, Double max) {
            this.ratingFilter = true;
            this.minRating = min;
            this.maxRating = max;
            return this;
        }

        public Builder addField(String field, FieldPredicate predicate) {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(predicate, "predicate");
            if (fieldPredicates.putIfAbsent(field, predicate) != null) {
                throw new IllegalArgumentException("Field already filtered: " + field);
            }
            return this;
        }

        public FilterCriteria build() {
            return new FilterCriteria(this);
        }
    }
}
