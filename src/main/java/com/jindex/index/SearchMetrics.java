package com.jindex.index;

/**
 * Cost of one prefix search, reported to benchmarking callers.
 */
public class SearchMetrics {
    private final long comparisons;
    private final double elapsedMillis;
    private final long memoryBytes;
    private final int resultCount;

    public SearchMetrics(long comparisons, double elapsedMillis, long memoryBytes, int resultCount) {
        this.comparisons = comparisons;
        this.elapsedMillis = elapsedMillis;
        this.memoryBytes = memoryBytes;
        this.resultCount = resultCount;
    }

    public static SearchMetrics since(long startNanos, long comparisons, long memoryBytes, int resultCount) {
        double elapsed = (System.nanoTime() - startNanos) / 1_000_000.0;
        return new SearchMetrics(comparisons, elapsed, memoryBytes, resultCount);
    }

    public long getComparisons() {
        return comparisons;
    }

    public double getElapsedMillis() {
        return elapsedMillis;
    }

    public long getMemoryBytes() {
        return memoryBytes;
    }

    public int getResultCount() {
        return resultCount;
    }

    @Override
    public String toString() {
        return String.format("SearchMetrics{comparisons=%d, elapsedMillis=%.3f, memoryBytes=%d, resultCount=%d}",
            comparisons, elapsedMillis, memoryBytes, resultCount);
    }
}
