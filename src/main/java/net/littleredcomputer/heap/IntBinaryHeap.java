package net.littleredcomputer.heap;

import com.google.common.primitives.Ints;
import gnu.trove.list.array.TIntArrayList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.function.IntBinaryOperator;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A binary heap of unboxed ints. Same layout and operations as {@link BinaryHeap}; the
 * element order is given by an {@link IntBinaryOperator} returning a negative, zero or
 * positive result in the manner of {@link Integer#compare}.
 */
public class IntBinaryHeap {
    private static final Logger log = LogManager.getFormatterLogger();

    private final TIntArrayList a = new TIntArrayList();
    private final HeapMode mode;
    private final IntBinaryOperator compare;

    public IntBinaryHeap() {
        this(HeapMode.MAX);
    }

    public IntBinaryHeap(HeapMode mode) {
        this(mode, Integer::compare);
    }

    public IntBinaryHeap(HeapMode mode, IntBinaryOperator compare) {
        this.mode = checkNotNull(mode, "mode");
        this.compare = checkNotNull(compare, "compare");
    }

    /** Builds a heap of the given values in linear time. */
    public static IntBinaryHeap build(HeapMode mode, int... values) {
        IntBinaryHeap h = new IntBinaryHeap(mode);
        h.addAll(values);
        return h;
    }

    public HeapMode mode() { return mode; }

    public int size() { return a.size(); }

    public boolean isEmpty() { return a.isEmpty(); }

    public void clear() { a.resetQuick(); }

    public void insert(int value) {
        a.add(value);
        siftUp(a.size() - 1);
    }

    public void addAll(int... values) {
        a.add(values);
        heapify();
    }

    public int peek() {
        if (a.isEmpty()) throw new EmptyHeapException("peek");
        return a.get(0);
    }

    public int extract() {
        if (a.isEmpty()) throw new EmptyHeapException("extract");
        int top = a.get(0);
        if (a.size() > 1) {
            a.set(0, a.removeAt(a.size() - 1));
            siftDown(0);
        }
        else a.resetQuick();
        return top;
    }

    public int replaceRoot(int value) {
        if (a.isEmpty()) throw new EmptyHeapException("replaceRoot");
        int top = a.get(0);
        a.set(0, value);
        siftDown(0);
        return top;
    }

    public boolean update(int oldValue, int newValue) {
        int i = a.indexOf(oldValue);
        if (i < 0) return false;
        a.set(i, newValue);
        restore(i);
        return true;
    }

    public boolean remove(int value) {
        int i = a.indexOf(value);
        if (i < 0) return false;
        int last = a.removeAt(a.size() - 1);
        if (i < a.size()) {
            a.set(i, last);
            restore(i);
        }
        return true;
    }

    public boolean contains(int value) {
        return a.contains(value);
    }

    /** A copy of the backing array in heap order. */
    public int[] toArray() {
        return a.toArray();
    }

    private boolean better(int x, int y) {
        return mode.orient(compare.applyAsInt(x, y)) > 0;
    }

    boolean isHeap() {
        for (int i = 1; i < a.size(); ++i) {
            if (better(a.get(i), a.get(BinaryHeap.parent(i)))) return false;
        }
        return true;
    }

    private void heapify() {
        final int n = a.size();
        log.trace("heapify %d ints (%s)", n, mode);
        for (int start = n / 2 - 1; start >= 0; --start) siftDown(start);
    }

    private void restore(int i) {
        if (i > 0 && better(a.get(i), a.get(BinaryHeap.parent(i)))) siftUp(i);
        else siftDown(i);
    }

    private void siftUp(int i) {
        while (i > 0) {
            int p = BinaryHeap.parent(i);
            if (!better(a.get(i), a.get(p))) return;
            int tmp = a.get(p);
            a.set(p, a.get(i));
            a.set(i, tmp);
            i = p;
        }
    }

    private void siftDown(int root) {
        final int n = a.size();
        while (root < n / 2) {
            int child = BinaryHeap.left(root);
            int swap = root;
            if (better(a.get(child), a.get(swap))) swap = child;
            if (child + 1 < n && better(a.get(child + 1), a.get(swap))) swap = child + 1;
            if (swap == root) return;
            int tmp = a.get(root);
            a.set(root, a.get(swap));
            a.set(swap, tmp);
            root = swap;
        }
    }

    @Override
    public String toString() {
        return "[" + Ints.join(", ", a.toArray()) + "]";
    }
}
