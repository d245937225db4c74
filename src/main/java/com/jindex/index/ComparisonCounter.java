package com.jindex.index;

/**
 * Callback threaded through a traversal to count key comparisons.
 */
@FunctionalInterface
public interface ComparisonCounter {

    ComparisonCounter NOOP = n -> { };

    void add(int comparisons);

    default void increment() {
        add(1);
    }

    static Tally tally() {
        return new Tally();
    }

    /**
     * Counter that keeps a running total. Not thread-safe; use one per query.
     */
    final class Tally implements ComparisonCounter {
        private long count;

        @Override
        public void add(int comparisons) {
            count += comparisons;
        }

        public long getCount() {
            return count;
        }
    }
}
