package net.littleredcomputer.heap;

/**
 * Selects which extreme of the element order is kept at the root of a heap.
 */
public enum HeapMode {
    /** The root holds the greatest element. */
    MAX,
    /** The root holds the least element. */
    MIN;

    /**
     * Turns the result of an ordering comparison of (x, y) into a priority comparison:
     * the result is positive exactly when x belongs nearer the root than y.
     */
    int orient(int c) {
        int s = Integer.signum(c);
        return this == MAX ? s : -s;
    }
}
