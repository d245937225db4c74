package com.jindex.trie;

import java.util.Map;

/**
 * A record together with the exact rating it was inserted under. Several
 * ratings can share one digit path once rounded to a single decimal.
 */
final class RatedEntry {
    final double rating;
    final Map<String, Object> record;

    RatedEntry(double rating, Map<String, Object> record) {
        this.rating = rating;
        this.record = record;
    }
}
