package com.jindex.tree;

import com.jindex.index.IndexType;
import com.jindex.index.Keys;
import com.jindex.persistence.NodeInput;

import java.io.IOException;
import java.util.Map;

/**
 * Unbalanced binary search tree keyed by rating. Sorted input degrades it to
 * a list; every traversal is iterative so that stays safe.
 */
public class BinarySearchTree extends AbstractBinaryTree {

    @Override
    public IndexType type() {
        return IndexType.BST;
    }

    @Override
    public void insert(double key, Map<String, Object> record) {
        Keys.checkRating(key);
        TreeNode node = new TreeNode(key, admit(record));
        size++;
        if (root == null) {
            root = node;
            return;
        }
        TreeNode current = root;
        while (true) {
            if (key <= current.key) {
                if (current.left == null) {
                    current.left = node;
                    return;
                }
                current = current.left;
            } else {
                if (current.right == null) {
                    current.right = node;
                    return;
                }
                current = current.right;
            }
        }
    }

    public static BinarySearchTree readFrom(NodeInput in) throws IOException {
        BinarySearchTree tree = new BinarySearchTree();
        tree.readNodes(in);
        return tree;
    }
}
