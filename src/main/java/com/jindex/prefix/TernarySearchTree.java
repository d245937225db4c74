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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Ternary search tree over normalized names. Each node compares one
 * character: {@code less}/{@code greater} hold other characters at the same
 * position, {@code equal} continues with the next position.
 */
public class TernarySearchTree extends AbstractIndex implements PrefixIndex {
    private static final int LESS = 0;
    private static final int EQUAL = 1;
    private static final int GREATER = 2;

    private Node root;
    private final AtomicLong comparisons = new AtomicLong();
    private long memoryUsage;

    static final class Node {
        final char c;
        Node less;
        Node equal;
        Node greater;
        final List<Map<String, Object>> records = new ArrayList<>();
        boolean end;

        Node(char c) {
            this.c = c;
        }

        Node child(int branch) {
            return branch == LESS ? less : branch == EQUAL ? equal : greater;
        }

        void setChild(int branch, Node node) {
            if (branch == LESS) {
                less = node;
            } else if (branch == EQUAL) {
                equal = node;
            } else {
                greater = node;
            }
        }
    }

    @Override
    public IndexType type() {
        return IndexType.TERNARY_SEARCH_TREE;
    }

    @Override
    public void insert(String key, Map<String, Object> record) {
        String normalized = Keys.requireName(key);
        Map<String, Object> stored = admit(record);
        if (root == null) {
            root = newNode(normalized.charAt(0));
        }
        Node node = root;
        int index = 0;
        long steps = 0;
        while (true) {
            char c = normalized.charAt(index);
            steps++;
            if (c < node.c) {
                if (node.less == null) {
                    node.less = newNode(c);
                }
                node = node.less;
            } else if (c > node.c) {
                if (node.greater == null) {
                    node.greater = newNode(c);
                }
                node = node.greater;
            } else if (index < normalized.length() - 1) {
                index++;
                if (node.equal == null) {
                    node.equal = newNode(normalized.charAt(index));
                }
                node = node.equal;
            } else {
                node.end = true;
                node.records.add(stored);
                break;
            }
        }
        size++;
        comparisons.addAndGet(steps);
        memoryUsage += MemoryEstimator.estimate(stored);
    }

    private Node newNode(char c) {
        memoryUsage += MemoryEstimator.TST_NODE;
        return new Node(c);
    }

    /**
     * Locates the node holding the last prefix character, takes its own
     * records, then everything under its {@code equal} child. Inside that
     * subtree all three branches are continuations of the prefix; the
     * {@code less}/{@code greater} branches of the prefix node itself are not.
     */
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
        Node node = findPrefixNode(normalized, tally);
        if (node != null) {
            tally.increment();
            if (node.end) {
                take(node, results, maxResults, tally);
            }
            if (node.equal != null) {
                collectAll(node.equal, results, maxResults, tally);
            }
        }
        comparisons.addAndGet(tally.getCount());
        return new PrefixSearchResult(results,
            SearchMetrics.since(start, tally.getCount(), memoryUsage, results.size()));
    }

    private Node findPrefixNode(String prefix, ComparisonCounter counter) {
        Node node = root;
        int index = 0;
        while (node != null) {
            char c = prefix.charAt(index);
            counter.increment();
            if (c < node.c) {
                node = node.less;
            } else if (c > node.c) {
                node = node.greater;
            } else if (index == prefix.length() - 1) {
                return node;
            } else {
                node = node.equal;
                index++;
            }
        }
        return null;
    }

    private static void collectAll(Node start, List<Map<String, Object>> results, int limit,
                                   ComparisonCounter counter) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(start);
        while (!stack.isEmpty() && results.size() < limit) {
            Node node = stack.pop();
            counter.increment();
            if (node.end) {
                take(node, results, limit, counter);
            }
            pushIfPresent(stack, node.greater);
            pushIfPresent(stack, node.equal);
            pushIfPresent(stack, node.less);
        }
    }

    private static void take(Node node, List<Map<String, Object>> results, int limit, ComparisonCounter counter) {
        for (Map<String, Object> record : node.records) {
            if (results.size() >= limit) {
                return;
            }
            results.add(record);
            counter.increment();
        }
    }

    private static void pushIfPresent(Deque<Node> stack, Node node) {
        if (node != null) {
            stack.push(node);
        }
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        if (root == null) {
            return;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            node.records.forEach(action);
            pushIfPresent(stack, node.greater);
            pushIfPresent(stack, node.equal);
            pushIfPresent(stack, node.less);
        }
    }

    /**
     * Longest path counting all three branch kinds; 0 when empty.
     */
    @Override
    public int getHeight() {
        if (root == null) {
            return 0;
        }
        int height = 0;
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            height = Math.max(height, depth);
            for (int branch = LESS; branch <= GREATER; branch++) {
                Node child = node.child(branch);
                if (child != null) {
                    nodes.push(child);
                    depths.push(depth + 1);
                }
            }
        }
        return height;
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

    /**
     * Pre-order over less, equal, greater. Each node writes its character,
     * end flag, records and a presence bitmask for its three children.
     */
    @Override
    public void writeTo(NodeOutput out) throws IOException {
        out.writeInt(size);
        out.writeLong(memoryUsage);
        out.writeBoolean(root != null);
        if (root == null) {
            return;
        }
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(1);
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int depth = depths.pop();
            out.enterNode(depth);
            out.writeChar(node.c);
            out.writeBoolean(node.end);
            out.writeInt(node.records.size());
            for (Map<String, Object> record : node.records) {
                out.writeRecord(record);
            }
            int mask = 0;
            for (int branch = LESS; branch <= GREATER; branch++) {
                if (node.child(branch) != null) {
                    mask |= 1 << branch;
                }
            }
            out.writeByte(mask);
            for (int branch = GREATER; branch >= LESS; branch--) {
                Node child = node.child(branch);
                if (child != null) {
                    nodes.push(child);
                    depths.push(depth + 1);
                }
            }
        }
    }

    public static TernarySearchTree readFrom(NodeInput in) throws IOException {
        TernarySearchTree tree = new TernarySearchTree();
        int expected = in.readInt();
        tree.memoryUsage = in.readLong();
        if (in.readBoolean()) {
            Deque<Node> parents = new ArrayDeque<>();
            Deque<Integer> branches = new ArrayDeque<>();
            Deque<Integer> depths = new ArrayDeque<>();
            tree.root = tree.readNode(in, 1, parents, branches, depths);
            while (!parents.isEmpty()) {
                Node parent = parents.pop();
                int branch = branches.pop();
                int depth = depths.pop();
                parent.setChild(branch, tree.readNode(in, depth, parents, branches, depths));
            }
        }
        if (tree.size != expected) {
            throw new PersistenceCorruptException("Expected " + expected + " records but restored " + tree.size);
        }
        return tree;
    }

    /**
     * Reads one node and schedules its children, less first.
     */
    private Node readNode(NodeInput in, int depth, Deque<Node> parents, Deque<Integer> branches,
                          Deque<Integer> depths) throws IOException {
        in.enterNode(depth);
        Node node = new Node(in.readChar());
        node.end = in.readBoolean();
        int count = in.readCount("record");
        for (int i = 0; i < count; i++) {
            node.records.add(restore(in.readRecord()));
        }
        size += count;
        int mask = in.readByte();
        if ((mask & ~0b111) != 0) {
            throw new PersistenceCorruptException("Invalid child mask: " + mask);
        }
        for (int branch = GREATER; branch >= LESS; branch--) {
            if ((mask & (1 << branch)) != 0) {
                parents.push(node);
                branches.push(branch);
                depths.push(depth + 1);
            }
        }
        return node;
    }
}
