package com.jindex.index;

import java.util.Map;
import java.util.Objects;

/**
 * A row handed to the indexes by the loader: the rating key it is ordered by
 * and the full attribute map stored alongside it.
 */
public class Record {
    private final double rating;
    private final Map<String, Object> value;

    public Record(double rating, Map<String, Object> value) {
        this.rating = Keys.checkRating(rating);
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Builds a record whose key is read from one of its own fields.
     *
     * @param value The attribute map
     * @param ratingField Name of the field holding the rating
     * @return The record keyed by the parsed rating
     * @throws InvalidKeyException If the field is missing or not numeric
     */
    public static Record of(Map<String, Object> value, String ratingField) {
        return new Record(Keys.rating(value.get(ratingField)), value);
    }

    public double getRating() {
        return rating;
    }

    public Map<String, Object> getValue() {
        return value;
    }

    @Override
    public String toString() {
        return "Record{rating=" + rating + ", value=" + value + '}';
    }
}
