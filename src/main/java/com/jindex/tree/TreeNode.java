package com.jindex.tree;

import java.util.Map;

/**
 * Node of the linked binary trees. {@code height} is maintained by the AVL
 * tree only.
 */
final class TreeNode {
    final double key;
    final Map<String, Object> record;
    TreeNode left;
    TreeNode right;
    int height = 1;

    TreeNode(double key, Map<String, Object> record) {
        this.key = key;
        this.record = record;
    }
}
