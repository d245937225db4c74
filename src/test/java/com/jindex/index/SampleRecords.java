package com.jindex.index;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Review-like records shared by the index tests.
 */
public final class SampleRecords {
    private static final String[] COUNTRIES = {"US", "UK", "DE"};
    private static final String[] NAMES = {"Delta", "Delta Air", "Emirates", "Qatar", "Lufthansa", "KLM",
        "United", "American", "Alaska", "Air France", "Air Canada", "Turkish"};

    private SampleRecords() {
    }

    public static Map<String, Object> record(int id, String name, double rating) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("id", id);
        value.put("name", name);
        value.put("rating", rating);
        value.put("country", COUNTRIES[id % COUNTRIES.length]);
        value.put("reviews", id * 10);
        value.put("recommended", id % 2 == 0);
        return value;
    }

    /**
     * Records with the given ratings, in order, with distinct ids.
     */
    public static List<Record> withRatings(double... ratings) {
        List<Record> records = new ArrayList<>();
        for (int i = 0; i < ratings.length; i++) {
            records.add(new Record(ratings[i], record(i, NAMES[i % NAMES.length] + " " + i, ratings[i])));
        }
        return records;
    }

    /**
     * Random one-decimal ratings between 0.0 and 10.0.
     */
    public static List<Record> random(int count, long seed) {
        Random random = new Random(seed);
        double[] ratings = new double[count];
        for (int i = 0; i < count; i++) {
            ratings[i] = random.nextInt(101) / 10.0;
        }
        return withRatings(ratings);
    }

    public static List<Double> ratings(List<Map<String, Object>> records) {
        List<Double> ratings = new ArrayList<>();
        for (Map<String, Object> record : records) {
            ratings.add((Double) record.get("rating"));
        }
        return ratings;
    }

    public static List<Integer> ids(List<Map<String, Object>> records) {
        List<Integer> ids = new ArrayList<>();
        for (Map<String, Object> record : records) {
            ids.add((Integer) record.get("id"));
        }
        return ids;
    }
}
