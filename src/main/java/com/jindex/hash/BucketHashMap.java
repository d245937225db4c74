package com.jindex.hash;

import com.jindex.index.AbstractIndex;
import com.jindex.index.ComparisonCounter;
import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.index.MemoryEstimator;
import com.jindex.index.RatingIndex;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Hash index over the rating with separate chaining. Each bucket holds one
 * entry per distinct key and every record with that key lives in the
 * entry's list. Capacity doubles, with a full rehash, as soon as the number
 * of distinct keys exceeds {@code capacity * loadFactor}.
 *
 * <p>Range and top-K queries have no ordering to exploit and scan every bucket.
 */
public class BucketHashMap extends AbstractIndex implements RatingIndex {
    private static final Logger logger = LoggerFactory.getLogger(BucketHashMap.class);

    public static final int DEFAULT_INITIAL_CAPACITY = 16;
    public static final double DEFAULT_LOAD_FACTOR = 0.75;

    private List<List<BucketEntry>> buckets;
    private final double loadFactor;
    private int keyCount;
    private int resizeCount;
    private final AtomicLong comparisons = new AtomicLong();
    private long memoryUsage;

    static final class BucketEntry {
        final double key;
        final List<Map<String, Object>> records = new ArrayList<>();

        BucketEntry(double key) {
            this.key = key;
        }
    }

    public BucketHashMap() {
        this(DEFAULT_INITIAL_CAPACITY, DEFAULT_LOAD_FACTOR);
    }

    public BucketHashMap(int initialCapacity, double loadFactor) {
        if (initialCapacity < 1) {
            throw new IllegalArgumentException("Initial capacity must be positive: " + initialCapacity);
        }
        if (!(loadFactor > 0) || Double.isInfinite(loadFactor)) {
            throw new IllegalArgumentException("Load factor must be positive: " + loadFactor);
        }
        this.loadFactor = loadFactor;
        this.buckets = emptyBuckets(initialCapacity);
    }

    private static List<List<BucketEntry>> emptyBuckets(int capacity) {
        List<List<BucketEntry>> fresh = new ArrayList<>(capacity);
        for (int i = 0; i < capacity; i++) {
            fresh.add(new ArrayList<>());
        }
        return fresh;
    }

    /**
     * Bucket of a key. The rating is scaled to tenths and rounded so that
     * keys such as 4.5 and 4.500000001 that render the same land together.
     */
    static int bucketOf(double key, int capacity) {
        return (int) Math.floorMod(Math.round(key * 10), (long) capacity);
    }

    @Override
    public IndexType type() {
        return IndexType.HASH_MAP;
    }

    @Override
    public void insert(double key, Map<String, Object> record) {
        Keys.checkRating(key);
        Map<String, Object> stored = admit(record);
        List<BucketEntry> bucket = buckets.get(bucketOf(key, buckets.size()));
        BucketEntry target = null;
        long steps = 0;
        for (BucketEntry entry : bucket) {
            steps++;
            if (entry.key == key) {
                target = entry;
                break;
            }
        }
        comparisons.addAndGet(steps);
        if (target == null) {
            target = new BucketEntry(key);
            bucket.add(target);
            keyCount++;
            memoryUsage += MemoryEstimator.ARRAY_ENTRY;
        }
        target.records.add(stored);
        size++;
        memoryUsage += MemoryEstimator.estimate(stored);
        if (keyCount > buckets.size() * loadFactor) {
            resize();
        }
    }

    private void resize() {
        int oldCapacity = buckets.size();
        List<List<BucketEntry>> rehashed = emptyBuckets(oldCapacity * 2);
        for (List<BucketEntry> bucket : buckets) {
            for (BucketEntry entry : bucket) {
                rehashed.get(bucketOf(entry.key, rehashed.size())).add(entry);
            }
        }
        buckets = rehashed;
        resizeCount++;
        logger.debug("Resized hash map from {} to {} buckets at {} keys", oldCapacity, rehashed.size(), keyCount);
    }

    /**
     * Looks in the key's bucket only.
     */
    @Override
    public List<Map<String, Object>> search(double key, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        if (Double.isNaN(key) || Double.isInfinite(key)) {
            return results;
        }
        ComparisonCounter.Tally tally = ComparisonCounter.tally();
        for (BucketEntry entry : buckets.get(bucketOf(key, buckets.size()))) {
            tally.increment();
            if (entry.key == key) {
                results.addAll(entry.records);
                break;
            }
        }
        counter.add((int) tally.getCount());
        comparisons.addAndGet(tally.getCount());
        return results;
    }

    @Override
    public List<Map<String, Object>> getRange(double min, double max, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        long steps = 0;
        for (List<BucketEntry> bucket : buckets) {
            for (BucketEntry entry : bucket) {
                steps++;
                if (min <= entry.key && entry.key <= max) {
                    results.addAll(entry.records);
                    steps += entry.records.size();
                }
            }
        }
        counter.add((int) Math.min(steps, Integer.MAX_VALUE));
        comparisons.addAndGet(steps);
        return results;
    }

    @Override
    public List<Map<String, Object>> getTopK(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        List<BucketEntry> entries = new ArrayList<>(keyCount);
        for (List<BucketEntry> bucket : buckets) {
            entries.addAll(bucket);
        }
        entries.sort(Comparator.comparingDouble((BucketEntry e) -> e.key).reversed());
        List<Map<String, Object>> top = new ArrayList<>(Math.min(k, size));
        for (BucketEntry entry : entries) {
            for (Map<String, Object> record : entry.records) {
                if (top.size() == k) {
                    return top;
                }
                top.add(record);
            }
        }
        return top;
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        for (List<BucketEntry> bucket : buckets) {
            for (BucketEntry entry : bucket) {
                entry.records.forEach(action);
            }
        }
    }

    @Override
    public int getHeight() {
        return 0;
    }

    public int getCapacity() {
        return buckets.size();
    }

    public double getLoadFactor() {
        return loadFactor;
    }

    /**
     * @return Number of distinct keys
     */
    public int getKeyCount() {
        return keyCount;
    }

    public int getResizeCount() {
        return resizeCount;
    }

    public long getTotalComparisons() {
        return comparisons.get();
    }

    public void resetComparisons() {
        comparisons.set(0);
    }

    public long getMemoryUsage() {
        return memoryUsage;
    }

    @Override
    public void writeTo(NodeOutput out) throws IOException {
        out.writeInt(buckets.size());
        out.writeDouble(loadFactor);
        out.writeInt(resizeCount);
        out.writeInt(size);
        out.writeLong(memoryUsage);
        for (List<BucketEntry> bucket : buckets) {
            out.writeInt(bucket.size());
            for (BucketEntry entry : bucket) {
                out.enterNode(1);
                out.writeDouble(entry.key);
                out.writeInt(entry.records.size());
                for (Map<String, Object> record : entry.records) {
                    out.writeRecord(record);
                }
            }
        }
    }

    public static BucketHashMap readFrom(NodeInput in) throws IOException {
        int capacity = in.readInt();
        double loadFactor = in.readDouble();
        if (capacity < 1 || !(loadFactor > 0) || Double.isInfinite(loadFactor)) {
            throw new PersistenceCorruptException(
                "Invalid hash map geometry: capacity=" + capacity + ", loadFactor=" + loadFactor);
        }
        // every bucket carries at least its entry count
        if (capacity > in.remaining() / Integer.BYTES) {
            throw new PersistenceCorruptException("Hash map capacity " + capacity + " exceeds payload");
        }
        BucketHashMap map = new BucketHashMap(capacity, loadFactor);
        map.resizeCount = in.readInt();
        int expected = in.readInt();
        map.memoryUsage = in.readLong();
        for (int b = 0; b < capacity; b++) {
            int entries = in.readCount("bucket entry");
            for (int i = 0; i < entries; i++) {
                in.enterNode(1);
                BucketEntry entry = new BucketEntry(in.readDouble());
                if (bucketOf(entry.key, capacity) != b) {
                    throw new PersistenceCorruptException("Key " + entry.key + " stored in wrong bucket " + b);
                }
                int records = in.readCount("record");
                for (int r = 0; r < records; r++) {
                    entry.records.add(map.restore(in.readRecord()));
                }
                map.buckets.get(b).add(entry);
                map.keyCount++;
                map.size += records;
            }
        }
        if (map.size != expected) {
            throw new PersistenceCorruptException("Expected " + expected + " records but restored " + map.size);
        }
        return map;
    }
}
