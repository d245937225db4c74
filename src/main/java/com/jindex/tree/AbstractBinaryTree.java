package com.jindex.tree;

import com.jindex.index.AbstractIndex;
import com.jindex.index.ComparisonCounter;
import com.jindex.index.RatingIndex;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.NodeOutput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Queries shared by the linked binary trees. Equal keys are routed to the
 * left subtree on insert, so lookups must look on both sides of a match.
 *
 * <p>All traversals use an explicit stack: a degenerate tree is bounded by
 * heap, not by the call stack.
 */
public abstract class AbstractBinaryTree extends AbstractIndex implements RatingIndex {
    private static final byte NO_NODE = 0;
    private static final byte NODE = 1;

    TreeNode root;

    @Override
    public List<Map<String, Object>> search(double key, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        if (root == null) {
            return results;
        }
        Deque<TreeNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TreeNode node = stack.pop();
            counter.increment();
            if (key < node.key) {
                pushIfPresent(stack, node.left);
            } else if (key > node.key) {
                pushIfPresent(stack, node.right);
            } else {
                results.add(node.record);
                pushIfPresent(stack, node.right);
                pushIfPresent(stack, node.left);
            }
        }
        return results;
    }

    /**
     * In-order walk pruned by the bounds: descends left only while
     * {@code min <= key} and right only while {@code max >= key}. Equal keys
     * may sit on either side once rotations have run.
     */
    @Override
    public List<Map<String, Object>> getRange(double min, double max, ComparisonCounter counter) {
        List<Map<String, Object>> results = new ArrayList<>();
        Deque<TreeNode> stack = new ArrayDeque<>();
        TreeNode current = root;
        while (current != null || !stack.isEmpty()) {
            while (current != null) {
                stack.push(current);
                current = min <= current.key ? current.left : null;
            }
            TreeNode node = stack.pop();
            counter.increment();
            if (min <= node.key && node.key <= max) {
                results.add(node.record);
                counter.increment();
            }
            current = max >= node.key ? node.right : null;
        }
        return results;
    }

    @Override
    public List<Map<String, Object>> getTopK(int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        List<TreeNode> nodes = new ArrayList<>(size);
        inOrder(nodes::add);
        // stable sort: equal keys keep their in-order position
        nodes.sort(Comparator.comparingDouble((TreeNode n) -> n.key).reversed());
        List<Map<String, Object>> top = new ArrayList<>(Math.min(k, nodes.size()));
        for (int i = 0; i < k && i < nodes.size(); i++) {
            top.add(nodes.get(i).record);
        }
        return top;
    }

    @Override
    public void forEachRecord(Consumer<Map<String, Object>> action) {
        inOrder(node -> action.accept(node.record));
    }

    /**
     * Keys in traversal order, mostly for invariant checks.
     */
    public List<Double> keysInOrder() {
        List<Double> keys = new ArrayList<>(size);
        inOrder(node -> keys.add(node.key));
        return keys;
    }

    void inOrder(Consumer<TreeNode> visitor) {
        Deque<TreeNode> stack = new ArrayDeque<>();
        TreeNode current = root;
        while (current != null || !stack.isEmpty()) {
            while (current != null) {
                stack.push(current);
                current = current.left;
            }
            TreeNode node = stack.pop();
            visitor.accept(node);
            current = node.right;
        }
    }

    /**
     * Level-by-level walk; 0 for an empty tree.
     */
    @Override
    public int getHeight() {
        if (root == null) {
            return 0;
        }
        int height = 0;
        Deque<TreeNode> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            height++;
            for (int i = level.size(); i > 0; i--) {
                TreeNode node = level.poll();
                if (node.left != null) {
                    level.add(node.left);
                }
                if (node.right != null) {
                    level.add(node.right);
                }
            }
        }
        return height;
    }

    /**
     * Pre-order: a marker byte per child slot, then key, cached height and
     * record for every present node.
     */
    @Override
    public void writeTo(NodeOutput out) throws IOException {
        out.writeInt(size);
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root, 1));
        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            TreeNode node = frame.node;
            if (node == null) {
                out.writeByte(NO_NODE);
                continue;
            }
            out.enterNode(frame.depth);
            out.writeByte(NODE);
            out.writeDouble(node.key);
            out.writeInt(node.height);
            out.writeRecord(node.record);
            stack.push(new Frame(node.right, frame.depth + 1));
            stack.push(new Frame(node.left, frame.depth + 1));
        }
    }

    /**
     * Rebuilds the exact shape written by {@link #writeTo(NodeOutput)}.
     */
    void readNodes(NodeInput in) throws IOException {
        int expected = in.readInt();
        Deque<Slot> pending = new ArrayDeque<>();
        pending.push(new Slot(null, false, 1));
        int restored = 0;
        while (!pending.isEmpty()) {
            Slot slot = pending.pop();
            byte marker = in.readByte();
            if (marker == NO_NODE) {
                continue;
            }
            if (marker != NODE) {
                throw new PersistenceCorruptException("Unknown node marker: " + marker);
            }
            in.enterNode(slot.depth);
            double key = in.readDouble();
            int height = in.readInt();
            TreeNode node = new TreeNode(key, restore(in.readRecord()));
            node.height = height;
            if (slot.parent == null) {
                root = node;
            } else if (slot.left) {
                slot.parent.left = node;
            } else {
                slot.parent.right = node;
            }
            restored++;
            pending.push(new Slot(node, false, slot.depth + 1));
            pending.push(new Slot(node, true, slot.depth + 1));
        }
        if (restored != expected) {
            throw new PersistenceCorruptException(
                "Expected " + expected + " nodes but restored " + restored);
        }
        size = restored;
    }

    private static void pushIfPresent(Deque<TreeNode> stack, TreeNode node) {
        if (node != null) {
            stack.push(node);
        }
    }

    private static final class Frame {
        final TreeNode node;
        final int depth;

        Frame(TreeNode node, int depth) {
            this.node = node;
            this.depth = depth;
        }
    }

    private static final class Slot {
        final TreeNode parent;
        final boolean left;
        final int depth;

        Slot(TreeNode parent, boolean left, int depth) {
            this.parent = parent;
            this.left = left;
            this.depth = depth;
        }
    }
}
