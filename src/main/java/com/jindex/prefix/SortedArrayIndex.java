package com.jindex.prefix;

import com.jindex.index.AbstractIndex;
import com.jindex.index.ComparisonCounter;
import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.index.MemoryEstimator;
import com.jindex.index.PrefixIndex;
import com.jindex.index.PrefixSearchResult;
import com.jindex.index.SearchMetrics;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Names kept in one array sorted by normalized key. Inserts binary-search
 * their position and shift the tail; prefix lookups binary-search the first
 * candidate and scan forward until the prefix stops matching.
 */
public class SortedArrayIndex extends AbstractIndex implements PrefixIndex {
    private final List<Entry> entries = new ArrayList<>();
    private final AtomicLong comparisons = new AtomicLong();
    private long memoryUsage;

    private static final class Entry {
        final String normalizedKey;
        final String displayKey;
        final Map<String, Object> record;

        Entry(String normalizedKey, String displayKey, Map<String, Object> record) {
            this.normalizedKey = normalizedKey;
            this.displayKey = displayKey;
            this.record = record;
        }
    }

    @Override
    public IndexType type() {
        return IndexType.SORTED_ARRAY;
    }

    @Override
    public void insert(String key, Map<String, Object> record) {
        String normalized = Keys.requireName(key);
        Map<String, Object> stored = admit(record);
        ComparisonCounter.Tally tally = ComparisonCounter.tally();
        int position = lowerBound(normalized, tally);
        comparisons.addAndGet(tally.getCount());
        entries.add(position, new Entry(normalized, key.trim(), stored));
        size++;
        memoryUsage += MemoryEstimator.ARRAY_ENTRY + MemoryEstimator.estimate(key) + MemoryEstimator.estimate(stored);
    }

    /**
     * First position whose key is not less than {@code key}.
     */
    private int lowerBound(String key, ComparisonCounter counter) {
        int low = 0;
        int high = entries.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            counter.increment();
            if (entries.get(mid).normalizedKey.compareTo(key) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    @Override
    public PrefixSearchResult searchPrefix(String prefix, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        long start = System.nanoTime();
        String normalized = Keys.normalize(prefix);
        if (normalized.isEmpty() || entries.isEmpty()) {
            return PrefixSearchResult.empty(memoryUsage);
        }
        ComparisonCounter.Tally tally = ComparisonCounter.tally();
        int position = lowerBound(normalized, tally);

        List<Map<String, Object>> results = new ArrayList<>();
        for (int i = position; i < entries.size() && results.size() < maxResults; i++) {
            tally.increment();
            Entry entry = entries.get(i);
            if (!entry.normalizedKey.startsWith(normalized)) {
                break;
            }
            results.add(entry.record);
        }
        comparisons.addAndGet(tally.getCount());
        return new PrefixSearchResult(results,
            SearchMetrics.since(start, tally.getCount(), memoryUsage, results.size()));
    }

    /**
     * Keys as inserted, trimmed but not case-folded, in sorted order.
     */
    public List<String> displayKeys() {
        List<String> keys = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            keys.add(entry.displayKey);
        }
        return keys;
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        for (Entry entry : entries) {
            action.accept(entry.record);
        }
    }

    @Override
    public int getHeight() {
        return 0;
    }

    @Override
    public long getTotalComparisons() {
        return comparisons.get();
    }

    @Override
    public void resetComparisons() {
        comparisons.set(0);
    }

    @Override
    public long getMemoryUsage() {
        return memoryUsage;
    }

    @Override
    public void writeTo(NodeOutput out) throws IOException {
        out.writeInt(entries.size());
        out.writeLong(memoryUsage);
        for (Entry entry : entries) {
            out.enterNode(1);
            out.writeString(entry.normalizedKey);
            out.writeString(entry.displayKey);
            out.writeRecord(entry.record);
        }
    }

    public static SortedArrayIndex readFrom(NodeInput in) throws IOException {
        SortedArrayIndex index = new SortedArrayIndex();
        int count = in.readCount("entry");
        index.memoryUsage = in.readLong();
        String previous = null;
        for (int i = 0; i < count; i++) {
            in.enterNode(1);
            String normalized = in.readString();
            if (previous != null && previous.compareTo(normalized) > 0) {
                throw new PersistenceCorruptException("Entries out of order at position " + i);
            }
            String display = in.readString();
            index.entries.add(new Entry(normalized, display, index.restore(in.readRecord())));
            previous = normalized;
        }
        index.size = count;
        return index;
    }
}
