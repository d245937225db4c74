package com.jindex.index;

/**
 * Thrown when walking a structure goes deeper than the configured budget.
 */
public class RecursionDepthExceededException extends IndexException {
    private final int depth;
    private final int limit;

    public RecursionDepthExceededException(int depth, int limit) {
        super("Traversal depth " + depth + " exceeds the limit of " + limit);
        this.depth = depth;
        this.limit = limit;
    }

    public int getDepth() {
        return depth;
    }

    public int getLimit() {
        return limit;
    }
}
