package com.jindex.tree;

import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.persistence.NodeInput;
import com.jindex.persistence.PersistenceCorruptException;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * AVL tree keyed by rating. Heights are cached on every node, so
 * {@link #getHeight()} is O(1).
 */
public class AvlTree extends AbstractBinaryTree {
    private long rotations;

    @Override
    public IndexType type() {
        return IndexType.AVL;
    }

    /**
     * Descends to the insertion point recording the path, then walks the path
     * back up refreshing heights and rotating the first unbalanced node.
     */
    @Override
    public void insert(double key, Map<String, Object> record) {
        Keys.checkRating(key);
        TreeNode node = new TreeNode(key, admit(record));
        size++;
        if (root == null) {
            root = node;
            return;
        }

        Deque<TreeNode> path = new ArrayDeque<>();
        TreeNode current = root;
        while (current != null) {
            path.push(current);
            current = key <= current.key ? current.left : current.right;
        }
        TreeNode parent = path.peek();
        if (key <= parent.key) {
            parent.left = node;
        } else {
            parent.right = node;
        }

        while (!path.isEmpty()) {
            TreeNode ancestor = path.pop();
            updateHeight(ancestor);
            TreeNode subtree = rebalance(ancestor, key);
            if (subtree != ancestor) {
                TreeNode above = path.peek();
                if (above == null) {
                    root = subtree;
                } else if (above.left == ancestor) {
                    above.left = subtree;
                } else {
                    above.right = subtree;
                }
            }
            assert Math.abs(balance(subtree)) <= 1 : "unbalanced after insert of " + key;
        }
    }

    private TreeNode rebalance(TreeNode node, double key) {
        int balance = balance(node);
        if (balance > 1 && key <= node.left.key) {
            return rotateRight(node);
        }
        if (balance < -1 && key > node.right.key) {
            return rotateLeft(node);
        }
        if (balance > 1) {
            node.left = rotateLeft(node.left);
            return rotateRight(node);
        }
        if (balance < -1) {
            node.right = rotateRight(node.right);
            return rotateLeft(node);
        }
        return node;
    }

    private TreeNode rotateRight(TreeNode y) {
        TreeNode x = y.left;
        y.left = x.right;
        x.right = y;
        updateHeight(y);
        updateHeight(x);
        rotations++;
        return x;
    }

    private TreeNode rotateLeft(TreeNode x) {
        TreeNode y = x.right;
        x.right = y.left;
        y.left = x;
        updateHeight(x);
        updateHeight(y);
        rotations++;
        return y;
    }

    private static int height(TreeNode node) {
        return node == null ? 0 : node.height;
    }

    static int balance(TreeNode node) {
        return node == null ? 0 : height(node.left) - height(node.right);
    }

    private static void updateHeight(TreeNode node) {
        node.height = 1 + Math.max(height(node.left), height(node.right));
    }

    @Override
    public int getHeight() {
        return height(root);
    }

    /**
     * Rotations performed since construction; not persisted.
     */
    public long getRotationCount() {
        return rotations;
    }

    public static AvlTree readFrom(NodeInput in) throws IOException {
        AvlTree tree = new AvlTree();
        tree.readNodes(in);
        if (tree.getHeight() != tree.measureHeight()) {
            throw new PersistenceCorruptException("Cached AVL height does not match the restored shape");
        }
        return tree;
    }

    /**
     * Height found by walking the nodes instead of trusting the cache.
     */
    private int measureHeight() {
        return super.getHeight();
    }
}
