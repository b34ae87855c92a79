package net.littleredcomputer.heap;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A binary heap kept in the array representation of a complete binary tree: the children
 * of position i live at 2i+1 and 2i+2, and its parent at (i-1)/2. Depending on the
 * {@link HeapMode} fixed at creation, position 0 always holds the greatest or the least
 * element under the heap's comparator.
 * <p>
 * Instances are not thread-safe; every operation must run under one lock if the heap is shared.
 *
 * @param <T> element type. Null elements are not permitted.
 */
public class BinaryHeap<T> {
    private static final Logger log = LogManager.getFormatterLogger();
    private static final Joiner commaJoiner = Joiner.on(", ");

    private final ArrayList<T> a = new ArrayList<>();
    private final HeapMode mode;
    private final Comparator<? super T> comparator;

    private BinaryHeap(HeapMode mode, Comparator<? super T> comparator) {
        this.mode = checkNotNull(mode, "mode");
        this.comparator = checkNotNull(comparator, "comparator");
    }

    /** An empty max heap under natural ordering. */
    public static <T extends Comparable<? super T>> BinaryHeap<T> create() {
        return create(HeapMode.MAX);
    }

    public static <T extends Comparable<? super T>> BinaryHeap<T> create(HeapMode mode) {
        return new BinaryHeap<>(mode, Comparator.<T>naturalOrder());
    }

    public static <T> BinaryHeap<T> create(HeapMode mode, Comparator<? super T> comparator) {
        return new BinaryHeap<>(mode, comparator);
    }

    /**
     * Builds a heap holding exactly the given values in linear time, by sifting down every
     * parent position from the last one back to the root.
     */
    public static <T extends Comparable<? super T>> BinaryHeap<T> build(HeapMode mode, Collection<? extends T> values) {
        return build(mode, Comparator.<T>naturalOrder(), values);
    }

    public static <T> BinaryHeap<T> build(HeapMode mode, Comparator<? super T> comparator, Collection<? extends T> values) {
        BinaryHeap<T> h = new BinaryHeap<>(mode, comparator);
        h.addAll(values);
        return h;
    }

    public HeapMode mode() { return mode; }

    public int size() { return a.size(); }

    public boolean isEmpty() { return a.isEmpty(); }

    public void clear() { a.clear(); }

    public void insert(@Nonnull T value) {
        a.add(checkNotNull(value));
        siftUp(a.size() - 1);
    }

    /**
     * Adds all of the values to the heap, which need not be empty, and restores the heap
     * property over the whole array bottom-up. No element is added if any value is null.
     */
    public void addAll(Collection<? extends T> values) {
        for (T v : checkNotNull(values, "values")) checkNotNull(v, "null element");
        a.addAll(values);
        heapify();
    }

    public T peek() {
        if (a.isEmpty()) throw new EmptyHeapException("peek");
        return a.get(0);
    }

    /** Removes and returns the root. */
    public T extract() {
        if (a.isEmpty()) throw new EmptyHeapException("extract");
        T top = a.get(0);
        T last = a.remove(a.size() - 1);
        if (!a.isEmpty()) {
            a.set(0, last);
            siftDown(0);
        }
        return top;
    }

    /** As {@link #extract()}, but an empty heap yields {@link Optional#empty()} instead of an exception. */
    @CheckReturnValue
    public Optional<T> poll() {
        return a.isEmpty() ? Optional.empty() : Optional.of(extract());
    }

    /**
     * Replaces the root with {@code value} and returns the old root. Cheaper than an
     * extract followed by an insert, since only one sift is needed.
     *
     * @throws EmptyHeapException if there is no root to replace
     */
    public T replaceRoot(@Nonnull T value) {
        checkNotNull(value);
        if (a.isEmpty()) throw new EmptyHeapException("replaceRoot");
        T top = a.set(0, value);
        siftDown(0);
        return top;
    }

    /**
     * Replaces an occurrence of {@code oldValue} with {@code newValue}, moving it up or down
     * the tree as the new priority requires. When {@code oldValue} occurs more than once, which
     * occurrence is replaced is unspecified.
     *
     * @return false, leaving the heap untouched, if {@code oldValue} is not present
     */
    public boolean update(T oldValue, @Nonnull T newValue) {
        checkNotNull(newValue);
        int i = a.indexOf(oldValue);
        if (i < 0) {
            log.trace("update: %s not present", oldValue);
            return false;
        }
        a.set(i, newValue);
        restore(i);
        return true;
    }

    /**
     * Removes one occurrence of {@code value}. The last element fills the hole and is then
     * sifted in whichever direction it needs to go.
     */
    public boolean remove(T value) {
        int i = a.indexOf(value);
        if (i < 0) return false;
        T last = a.remove(a.size() - 1);
        if (i < a.size()) {
            a.set(i, last);
            restore(i);
        }
        return true;
    }

    public boolean contains(T value) {
        return a.contains(value);
    }

    /** A copy of the backing array in heap order (not sorted order). */
    public List<T> toList() {
        return Lists.newArrayList(a);
    }

    public Optional<T> parentOf(int i) {
        checkElementIndex(i, a.size());
        return i == 0 ? Optional.empty() : Optional.of(a.get(parent(i)));
    }

    public Optional<T> leftChildOf(int i) {
        checkElementIndex(i, a.size());
        return elementAt(left(i));
    }

    public Optional<T> rightChildOf(int i) {
        checkElementIndex(i, a.size());
        return elementAt(right(i));
    }

    private Optional<T> elementAt(int i) {
        return i < a.size() ? Optional.of(a.get(i)) : Optional.empty();
    }

    static int parent(int i) { return (i - 1) / 2; }
    static int left(int i) { return 2 * i + 1; }
    static int right(int i) { return 2 * i + 2; }

    // True if x belongs strictly nearer the root than y.
    private boolean better(T x, T y) {
        return mode.orient(comparator.compare(x, y)) > 0;
    }

    /** Checks the heap property at every non-root position. */
    boolean isHeap() {
        for (int i = 1; i < a.size(); ++i) {
            if (better(a.get(i), a.get(parent(i)))) return false;
        }
        return true;
    }

    private void heapify() {
        final int n = a.size();
        log.trace("heapify %d elements (%s)", n, mode);
        for (int start = n / 2 - 1; start >= 0; --start) siftDown(start);
    }

    // Only one direction can apply, since only the element at i changed.
    private void restore(int i) {
        if (i > 0 && better(a.get(i), a.get(parent(i)))) siftUp(i);
        else siftDown(i);
    }

    // The array holds a permutation of the elements after every step, even if the comparator throws.
    private void siftUp(int i) {
        while (i > 0) {
            int p = parent(i);
            if (!better(a.get(i), a.get(p))) return;
            T tmp = a.get(p);
            a.set(p, a.get(i));
            a.set(i, tmp);
            i = p;
        }
    }

    private void siftDown(int root) {
        final int n = a.size();
        // root has a left child iff root < n/2; unlike left(root) <= n-1 this cannot overflow.
        while (root < n / 2) {
            int child = left(root);
            int swap = root;
            if (better(a.get(child), a.get(swap))) swap = child;
            if (child + 1 < n && better(a.get(child + 1), a.get(swap))) swap = child + 1;
            if (swap == root) return;
            T tmp = a.get(root);
            a.set(root, a.get(swap));
            a.set(swap, tmp);
            root = swap;
        }
    }

    /**
     * Renders the tree one level per line, each element in brackets, e.g.
     * <pre>
     * [12]
     * [10][7]
     * [8][5]
     * </pre>
     */
    public String toTreeString() {
        if (a.isEmpty()) return "(empty heap)";
        StringBuilder sb = new StringBuilder();
        for (int i = 0, levelEnd = 0; i < a.size(); ++i) {
            if (i > levelEnd) {
                sb.append('\n');
                levelEnd = right(levelEnd);
            }
            sb.append('[').append(a.get(i)).append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "[" + commaJoiner.join(a) + "]";
    }
}
