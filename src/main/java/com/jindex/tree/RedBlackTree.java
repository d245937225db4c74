package com.jindex.tree;

import com.jindex.index.AbstractIndex;
import com.jindex.index.ComparisonCounter;
import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.index.RatingIndex;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * Red-black tree keyed by rating, stored as an arena of index-addressed
 * slots. Slot 0 is the black sentinel: it stands in for every missing child
 * and for the parent of the root.
 */
public class RedBlackTree extends AbstractIndex implements RatingIndex {
    static final int NIL = 0;
    private static final int INITIAL_SLOTS = 16;

    private double[] keys;
    private int[] left;
    private int[] right;
    private int[] parent;
    private boolean[] black;
    private final List<Map<String, Object>> records;
    private int slots;
    private int root = NIL;

    public RedBlackTree() {
        this(INITIAL_SLOTS);
    }

    private RedBlackTree(int capacity) {
        keys = new double[capacity];
        left = new int[capacity];
        right = new int[capacity];
        parent = new int[capacity];
        black = new boolean[capacity];
        records = new ArrayList<>(capacity);
        black[NIL] = true;
        records.add(null);
        slots = 1;
    }

    @Override
    public IndexType type() {
        return IndexType.RED_BLACK;
    }

    @Override
    public void insert(double key, Map<String, Object> record) {
        Keys.checkRating(key);
        int z = allocate(key, admit(record));

        int y = NIL;
        int x = root;
        while (x != NIL) {
            y = x;
            x = key <= keys[x] ? left[x] : right[x];
        }
        parent[z] = y;
        if (y == NIL) {
            root = z;
        } else if (key <= keys[y]) {
            left[y] = z;
        } else {
            right[y] = z;
        }
        size++;
        fixInsert(z);
    }

    private int allocate(double key, Map<String, Object> record) {
        if (slots == keys.length) {
            int capacity = keys.length * 2;
            keys = Arrays.copyOf(keys, capacity);
            left = Arrays.copyOf(left, capacity);
            right = Arrays.copyOf(right, capacity);
            parent = Arrays.copyOf(parent, capacity);
            black = Arrays.copyOf(black, capacity);
        }
        int slot = slots++;
        keys[slot] = key;
        left[slot] = NIL;
        right[slot] = NIL;
        parent[slot] = NIL;
        black[slot] = false;
        records.add(record);
        return slot;
    }

    private void fixInsert(int z) {
        while (!black[parent[z]]) {
            int p = parent[z];
            int g = parent[p];
            if (p == left[g]) {
                int uncle = right[g];
                if (!black[uncle]) {
                    black[p] = true;
                    black[uncle] = true;
                    black[g] = false;
                    z = g;
                } else {
                    if (z == right[p]) {
                        z = p;
                        rotateLeft(z);
                        p = parent[z];
                    }
                    black[p] = true;
                    black[g] = false;
                    rotateRight(g);
                }
            } else {
                int uncle = left[g];
                if (!black[uncle]) {
                    black[p] = true;
                    black[uncle] = true;
                    black[g] = false;
                    z = g;
                } else {
                    if (z == left[p]) {
                        z = p;
                        rotateRight(z);
                        p = parent[z];
                    }
                    black[p] = true;
                    black[g] = false;
                    rotateLeft(g);
                }
            }
        }
        black[root] = true;
        assert black[NIL] && left[NIL] == NIL && right[NIL] == NIL : "sentinel modified";
    }

    private void rotateLeft(int x) {
        int y = right[x];
        right[x] = left[y];
        if (left[y] != NIL) {
            parent[left[y]] = x;
        }
        parent[y] = parent[x];
        if (parent[x] == NIL) {
            root = y;
        } else if (x == left[parent[x]]) {
            left[parent[x]] = y;
        } else {
            right[parent[x]] = y;
        }
        left[y] = x;
        parent[x] = y;
    }

    private void rotateRight(int y) {
        int x = left[y];
        left[y] = right[x];
        if (right[x] != NIL) {
            parent[right[x]] = y;
        }
        parent[x] = parent[y];
        if (parent[y] == NIL) {
            root = x;
        } else if (y == right[parent[y]]) {
            right[parent[y]] = x;
        } else {
            left[parent[y]] = x;
        }
        right[x] = y;
        parent[y] = x;
    }

    @Override
    public List<Map<String, Object>> search(double key, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        if (root == NIL) {
            return results;
        }
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            int node = stack.pop();
            counter.increment();
            if (key < keys[node]) {
                pushIfPresent(stack, left[node]);
            } else if (key > keys[node]) {
                pushIfPresent(stack, right[node]);
            } else {
                results.add(records.get(node));
                pushIfPresent(stack, right[node]);
                pushIfPresent(stack, left[node]);
            }
        }
        return results;
    }

    @Override
    public List<Map<String, Object>> getRange(double min, double max, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                current = min <= keys[current] ? left[current] : NIL;
            }
            int node = stack.pop();
            counter.increment();
            if (min <= keys[node] && keys[node] <= max) {
                results.add(records.get(node));
                counter.increment();
            }
            current = max >= keys[node] ? right[node] : NIL;
        }
        return results;
    }

    @Override
    public List<Map<String, Object>> getTopK(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        List<Integer> nodes = new ArrayList<>(size);
        inOrder(nodes::add);
        nodes.sort(Comparator.comparingDouble((Integer n) -> keys[n]).reversed());
        List<Map<String, Object>> top = new ArrayList<>(Math.min(k, nodes.size()));
        for (int i = 0; i < k && i < nodes.size(); i++) {
            top.add(records.get(nodes.get(i)));
        }
        return top;
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        inOrder(node -> action.accept(records.get(node)));
    }

    public List<Double> keysInOrder() {
        List<Double> result = new ArrayList<>(size);
        inOrder(node -> result.add(keys[node]));
        return result;
    }

    private void inOrder(IntConsumer visitor) {
        Deque<Integer> stack = new ArrayDeque<>();
        int current = root;
        while (current != NIL || !stack.isEmpty()) {
            while (current != NIL) {
                stack.push(current);
                current = left[current];
            }
            int node = stack.pop();
            visitor.accept(node);
            current = right[node];
        }
    }

    @Override
    public int getHeight() {
        if (root == NIL) {
            return 0;
        }
        int height = 0;
        Deque<Integer> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                int node = level.poll();
                if (left[node] != NIL) {
                    level.add(left[node]);
                }
                if (right[node] != NIL) {
                    level.add(right[node]);
                }
            }
        }
        return height;
    }

    int rootSlot() {
        return root;
    }

    int leftOf(int slot) {
        return left[slot];
    }

    int rightOf(int slot) {
        return right[slot];
    }

    int parentOf(int slot) {
        return parent[slot];
    }

    boolean isBlack(int slot) {
        return black[slot];
    }

    double keyOf(int slot) {
        return keys[slot];
    }

    /**
     * Writes the arena slot by slot, sentinel included. The layout is
     * independent of tree height; the depth budget is still checked against
     * the measured height.
     */
    @Override
    public void writeTo(NodeOutput out) throws IOException {
        out.enterNode(getHeight());
        out.writeInt(size);
        out.writeInt(slots);
        out.writeInt(root);
        for (int slot = 0; slot < slots; slot++) {
            out.writeBoolean(black[slot]);
            out.writeInt(left[slot]);
            out.writeInt(right[slot]);
            out.writeInt(parent[slot]);
            if (slot != NIL) {
                out.writeDouble(keys[slot]);
                out.writeRecord(records.get(slot));
            }
        }
    }

    public static RedBlackTree readFrom(NodeInput in) throws IOException {
        int size = in.readInt();
        int slots = in.readCount("slot");
        if (slots != size + 1) {
            throw new PersistenceCorruptException("Arena of " + slots + " slots cannot hold " + size + " nodes");
        }
        int root = in.readSlot(slots);
        RedBlackTree tree = new RedBlackTree(Math.max(slots, INITIAL_SLOTS));
        tree.records.clear();
        for (int slot = 0; slot < slots; slot++) {
            tree.black[slot] = in.readBoolean();
            tree.left[slot] = in.readSlot(slots);
            tree.right[slot] = in.readSlot(slots);
            tree.parent[slot] = in.readSlot(slots);
            if (slot == NIL) {
                tree.records.add(null);
            } else {
                tree.keys[slot] = in.readDouble();
                tree.records.add(tree.restore(in.readRecord()));
            }
        }
        if (!tree.black[NIL] || tree.left[NIL] != NIL || tree.right[NIL] != NIL) {
            throw new PersistenceCorruptException("Sentinel slot is not a black leaf");
        }
        tree.slots = slots;
        tree.root = root;
        tree.size = size;
        tree.checkReachable();
        in.enterNode(tree.getHeight());
        return tree;
    }

    /**
     * Every slot but the sentinel must be reachable from the root exactly once.
     */
    private void checkReachable() throws PersistenceCorruptException {
        boolean[] seen = new boolean[slots];
        int reached = 0;
        Deque<Integer> stack = new ArrayDeque<>();
        if (root != NIL) {
            stack.push(root);
        }
        while (!stack.isEmpty()) {
            int node = stack.pop();
            if (seen[node]) {
                throw new PersistenceCorruptException("Slot " + node + " is linked more than once");
            }
            seen[node] = true;
            reached++;
            pushIfPresent(stack, left[node]);
            pushIfPresent(stack, right[node]);
        }
        if (reached != size) {
            throw new PersistenceCorruptException("Reached " + reached + " of " + size + " nodes from the root");
        }
    }

    private static void pushIfPresent(Deque<Integer> stack, int node) {
        if (node != NIL) {
            stack.push(node);
        }
    }
}
