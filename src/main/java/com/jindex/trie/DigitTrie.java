package com.jindex.trie;

import com.jindex.index.AbstractIndex;
import com.jindex.index.ComparisonCounter;
import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.index.MemoryEstimator;
import com.jindex.index.PrefixSearchResult;
import com.jindex.index.RatingIndex;
import com.jindex.index.SearchMetrics;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Trie over the digits of the rating rendered with one decimal and no point
 * (4.5 is stored under "45"). Exact lookups walk one path; a digit prefix
 * such as "4" collects every rating from 4.0 to 4.9.
 *
 * <p>Range and top-K queries have no structural help here and scan every
 * entry.
 */
public class DigitTrie extends AbstractIndex implements RatingIndex {
    private TrieNode<RatedEntry> root = new TrieNode<>();
    private final AtomicLong comparisons = new AtomicLong();
    private long memoryUsage;

    @Override
    public IndexType type() {
        return IndexType.DIGIT_TRIE;
    }

    @Override
    public void insert(double key, Map<String, Object> record) {
        String digits = Keys.ratingDigits(key);
        Map<String, Object> stored = admit(record);
        TrieNode<RatedEntry> node = root;
        for (int i = 0; i < digits.length(); i++) {
            char digit = digits.charAt(i);
            TrieNode<RatedEntry> child = node.children.get(digit);
            if (child == null) {
                child = new TrieNode<>();
                node.children.put(digit, child);
                memoryUsage += MemoryEstimator.TRIE_NODE;
            }
            node = child;
        }
        node.end = true;
        node.entries.add(new RatedEntry(key, stored));
        size++;
        comparisons.addAndGet(digits.length());
        memoryUsage += MemoryEstimator.estimate(stored);
    }

    @Override
    public List<Map<String, Object>> search(double key, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        TrieNode<RatedEntry> node = walk(Keys.ratingDigits(key), counter);
        if (node != null && node.end) {
            for (RatedEntry entry : node.entries) {
                counter.increment();
                if (entry.rating == key) {
                    results.add(entry.record);
                }
            }
        }
        return results;
    }

    /**
     * Collects records whose digit string starts with {@code digitPrefix}.
     * A blank prefix matches nothing.
     */
    public PrefixSearchResult searchPrefix(String digitPrefix, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        long start = System.nanoTime();
        String prefix = digitPrefix == null ? "" : digitPrefix.trim();
        if (prefix.isEmpty()) {
            return PrefixSearchResult.empty(memoryUsage);
        }
        ComparisonCounter.Tally tally = ComparisonCounter.tally();
        List<Map<String, Object>> results = new ArrayList<>();
        TrieNode<RatedEntry> node = walk(prefix, tally);
        if (node != null) {
            TrieNode.collect(node, maxResults, tally, entry -> results.add(entry.record));
        }
        comparisons.addAndGet(tally.getCount());
        return new PrefixSearchResult(results,
            SearchMetrics.since(start, tally.getCount(), memoryUsage, results.size()));
    }

    private TrieNode<RatedEntry> walk(String digits, ComparisonCounter counter) {
        TrieNode<RatedEntry> node = root;
        for (int i = 0; i < digits.length() && node != null; i++) {
            counter.increment();
            node = node.children.get(digits.charAt(i));
        }
        return node;
    }

    @Override
    public List<Map<String, Object>> getRange(double min, double max, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        forEachEntry(entry -> {
            counter.increment();
            if (min <= entry.rating && entry.rating <= max) {
                results.add(entry.record);
            }
        });
        return results;
    }

    @Override
    public List<Map<String, Object>> getTopK(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        List<RatedEntry> entries = new ArrayList<>(size);
        forEachEntry(entries::add);
        entries.sort(Comparator.comparingDouble((RatedEntry e) -> e.rating).reversed());
        List<Map<String, Object>> top = new ArrayList<>(Math.min(k, entries.size()));
        for (int i = 0; i < k && i < entries.size(); i++) {
            top.add(entries.get(i).record);
        }
        return top;
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        forEachEntry(entry -> action.accept(entry.record));
    }

    private void forEachEntry(Consumer<RatedEntry> action) {
        TrieNode.collect(root, Integer.MAX_VALUE, ComparisonCounter.NOOP, action);
    }

    @Override
    public int getHeight() {
        return TrieNode.height(root);
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
        out.writeInt(size);
        out.writeLong(memoryUsage);
        TrieNode.write(root, out, (sink, entry) -> {
            sink.writeDouble(entry.rating);
            sink.writeRecord(entry.record);
        });
    }

    public static DigitTrie readFrom(NodeInput in) throws IOException {
        DigitTrie trie = new DigitTrie();
        int expected = in.readInt();
        trie.memoryUsage = in.readLong();
        trie.root = TrieNode.read(in, source -> {
            double rating = source.readDouble();
            trie.size++;
            return new RatedEntry(rating, trie.restore(source.readRecord()));
        });
        if (trie.size != expected) {
            throw new PersistenceCorruptException("Expected " + expected + " entries but restored " + trie.size);
        }
        return trie;
    }
}
