package com.jindex.trie;

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
 * Character trie over normalized names, for autocomplete-style prefix
 * lookups.
 */
public class CharacterTrie extends AbstractIndex implements PrefixIndex {
    private TrieNode<Map<String, Object>> root = new TrieNode<>();
    private final AtomicLong comparisons = new AtomicLong();
    private long memoryUsage;

    @Override
    public IndexType type() {
        return IndexType.CHARACTER_TRIE;
    }

    @Override
    public void insert(String key, Map<String, Object> record) {
        String normalized = Keys.requireName(key);
        Map<String, Object> stored = admit(record);
        TrieNode<Map<String, Object>> node = root;
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            TrieNode<Map<String, Object>> child = node.children.get(c);
            if (child == null) {
                child = new TrieNode<>();
                node.children.put(c, child);
                memoryUsage += MemoryEstimator.TRIE_NODE;
            }
            node = child;
        }
        node.end = true;
        node.entries.add(stored);
        size++;
        comparisons.addAndGet(normalized.length());
        memoryUsage += MemoryEstimator.estimate(stored);
    }

    @Override
    public PrefixSearchResult searchPrefix(String prefix, int maxResults) {
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be positive: " + maxResults);
        }
        long start = System.nanoTime();
        String normalized = Keys.normalize(prefix);
        if (normalized.isEmpty()) {
            return PrefixSearchResult.empty(memoryUsage);
        }
        ComparisonCounter.Tally tally = ComparisonCounter.tally();
        List<Map<String, Object>> results = new ArrayList<>();
        TrieNode<Map<String, Object>> node = root;
        for (int i = 0; i < normalized.length() && node != null; i++) {
            tally.increment();
            node = node.children.get(normalized.charAt(i));
        }
        if (node != null) {
            TrieNode.collect(node, maxResults, tally, results::add);
        }
        comparisons.addAndGet(tally.getCount());
        return new PrefixSearchResult(results,
            SearchMetrics.since(start, tally.getCount(), memoryUsage, results.size()));
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        TrieNode.collect(root, Integer.MAX_VALUE, ComparisonCounter.NOOP, action);
    }

    @Override
    public int getHeight() {
        return TrieNode.height(root);
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
        out.writeInt(size);
        out.writeLong(memoryUsage);
        TrieNode.write(root, out, NodeOutput::writeRecord);
    }

    public static CharacterTrie readFrom(NodeInput in) throws IOException {
        CharacterTrie trie = new CharacterTrie();
        int expected = in.readInt();
        trie.memoryUsage = in.readLong();
        trie.root = TrieNode.read(in, source -> {
            trie.size++;
            return trie.restore(source.readRecord());
        });
        if (trie.size != expected) {
            throw new PersistenceCorruptException("Expected " + expected + " entries but restored " + trie.size);
        }
        return trie;
    }
}
