package com.github.alexishuf.fasterdeque.deque;

import com.github.alexishuf.fasterdeque.FDProperties;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

import static java.lang.System.arraycopy;
import static java.util.Objects.requireNonNull;

/**
 * A double-ended queue stored in a single circular array.
 *
 * <p>The logical sequence is {@code backing[(head+i) % capacity()]} for {@code i} in
 * {@code [0, size())}. That range wraps past the end of the backing array at most once,
 * thus it always decomposes into a <i>front run</i> starting at {@code head} and a
 * (possibly empty) <i>back run</i> starting at index 0. Pushes and removals at either end
 * only move {@code head} or {@code size}, never elements. Reallocations (growth and
 * {@link #clip()}) copy the front run and then the back run into the new array and reset
 * {@code head} to 0.</p>
 *
 * <p>Elements are never {@code null}. Probing methods ({@link #front()}, {@link #back()},
 * {@link #at(int)}, {@link #removeFront()} and {@link #removeBack()}) return {@code null}
 * to signal there is no such element.</p>
 *
 * <p>Instances are not thread-safe. Concurrent use requires external synchronization.</p>
 *
 * @param <T> the element type
 */
public class RingDeque<T> implements Iterable<T> {
    private static final Logger log = LoggerFactory.getLogger(RingDeque.class);
    private static final Object[] EMPTY = new Object[0];

    /** Largest backing array a {@link RingDeque} will allocate. */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private Object[] backing = EMPTY;
    private int head, size;

    /** Create an empty deque that will only allocate on its first push. */
    public RingDeque() { }

    /**
     * Create an empty deque that can receive {@code capacity} pushes without reallocating.
     *
     * @throws IllegalArgumentException if {@code capacity < 0}
     */
    public RingDeque(int capacity) {
        if (capacity < 0)
            throw new IllegalArgumentException("Negative capacity: "+capacity);
        if (capacity > 0)
            reallocate(capacity);
    }

    /** Create a deque holding {@code items}, in order. */
    @SafeVarargs public static <T> RingDeque<T> of(T... items) {
        RingDeque<T> deque = new RingDeque<>(items.length);
        deque.pushBackAll(items);
        return deque;
    }

    /** Create a deque holding the items of {@code collection} in iteration order. */
    public static <T> RingDeque<T> copyOf(Collection<? extends T> collection) {
        RingDeque<T> deque = new RingDeque<>(collection.size());
        deque.pushBackAll(collection);
        return deque;
    }

    /* --- --- --- size & capacity --- --- --- */

    /** Number of elements in the deque, not to be confused with {@link #capacity()}. */
    public @NonNegative int size() { return size; }

    /** Equivalent to {@code size() == 0}. */
    public boolean isEmpty() { return size == 0; }

    /** Total number of slots in the backing array, used or not. */
    public @NonNegative int capacity() { return backing.length; }

    /** How many elements can be pushed before a reallocation: {@code capacity()-size()}. */
    public @NonNegative int remainingCapacity() { return backing.length-size; }

    /**
     * Ensure at least {@code n} more elements can be pushed without reallocating.
     *
     * <p>If a reallocation is needed, the new capacity follows an amortized growth policy
     * (see {@link FDProperties#dequeGrowDoublingLimit()}), thus it may be larger than
     * {@code size()+n}.</p>
     *
     * @throws IllegalArgumentException if {@code n < 0}
     * @throws IllegalStateException if {@code size()+n} exceeds {@link #MAX_CAPACITY}
     */
    public void grow(int n) {
        if (n < 0)
            throw new IllegalArgumentException("Cannot grow by negative n="+n);
        if (backing.length-size < n)
            reallocate(grownCapacity(backing.length, size, n));
    }

    /** Reallocate the backing array so that {@code capacity() == size()}. */
    public void clip() {
        if (backing.length != size)
            reallocate(size);
    }

    static int grownCapacity(int capacity, int size, int n) {
        long required = (long)size + n;
        if (required > MAX_CAPACITY) {
            throw new IllegalStateException("Cannot fit "+n+" more elements into a deque of "
                                            +size+": exceeds maximum array size");
        }
        int doublingLimit = FDProperties.dequeGrowDoublingLimit();
        long candidate = capacity < doublingLimit ? 2L*capacity
                       : capacity + (capacity + 3L*doublingLimit)/4;
        return (int)Math.min(MAX_CAPACITY, Math.max(required, candidate));
    }

    private void reallocate(int capacity) {
        Object[] copy = capacity == 0 ? EMPTY : new Object[capacity];
        copyRuns(copy);
        if (capacity >= FDProperties.dequeGrowLogThreshold() && log.isDebugEnabled())
            log.debug("Reallocated {}-element deque from {} to {} slots", size, backing.length, capacity);
        backing = copy;
        head = 0;
    }

    /* --- --- --- ring arithmetic --- --- --- */

    /** Physical index of the logical index {@code i}, where {@code 0 <= i <= size()}. */
    private int physical(int i) {
        int p = head + i, cap = backing.length;
        return p >= cap ? p - cap : p;
    }

    /**
     * End (exclusive) of the first contiguous run of the {@code n} slots starting at
     * physical index {@code begin}. The remaining {@code n-(end-begin)} slots, if any,
     * start at physical index 0.
     */
    private int runEnd(int begin, int n) {
        return Math.min(begin + n, backing.length);
    }

    /** Copy the front run and then the back run into {@code dst}, starting at 0. */
    private void copyRuns(Object[] dst) {
        int frontLen = runEnd(head, size) - head;
        arraycopy(backing, head, dst, 0, frontLen);
        arraycopy(backing, 0, dst, frontLen, size-frontLen);
    }

    /** Null out the {@code n} slots starting at logical index {@code begin}. */
    private void clearSlots(int begin, int n) {
        if (n == 0)
            return;
        int p = physical(begin), end = runEnd(p, n);
        Arrays.fill(backing, p, end, null);
        Arrays.fill(backing, 0, n-(end-p), null);
    }

    private void checkIndex(int i) {
        if (i < 0 || i >= size)
            throw new IndexOutOfBoundsException("index="+i+", size="+size);
    }

    /* --- --- --- insertion --- --- --- */

    /** Add {@code item} before the first element, i.e., {@code front() == item}. */
    public void pushFront(T item) {
        requireNonNull(item, "RingDeque does not accept null elements");
        if (size == backing.length)
            reallocate(grownCapacity(backing.length, size, 1));
        int h = head-1;
        if (h < 0)
            h = backing.length-1;
        backing[h] = item;
        head = h;
        ++size;
    }

    /** Add {@code item} after the last element, i.e. {@code back() == item}. */
    public void pushBack(T item) {
        requireNonNull(item, "RingDeque does not accept null elements");
        if (size == backing.length)
            reallocate(grownCapacity(backing.length, size, 1));
        backing[physical(size)] = item;
        ++size;
    }

    /**
     * Equivalent to {@link #pushBack(Object)} for each item in order, but reallocates
     * at most once. If any item is {@code null}, no item is added.
     */
    @SafeVarargs public final void pushBackAll(T... items) {
        for (T item : items)
            requireNonNull(item, "RingDeque does not accept null elements");
        grow(items.length);
        for (T item : items)
            backing[physical(size++)] = item;
    }

    /**
     * Equivalent to {@link #pushBack(Object)} for each item of {@code items} in iteration
     * order, but reallocates at most once. If any item is {@code null}, no item is added.
     */
    public void pushBackAll(Collection<? extends T> items) {
        for (T item : items)
            requireNonNull(item, "RingDeque does not accept null elements");
        grow(items.size());
        for (T item : items) {
            if (size == backing.length) // collection grew while iterating
                reallocate(grownCapacity(backing.length, size, 1));
            backing[physical(size++)] = item;
        }
    }

    /* --- --- --- access --- --- --- */

    /** Get the first element or {@code null} if empty. */
    @SuppressWarnings("unchecked") public @Nullable T front() {
        return size == 0 ? null : (T)backing[head];
    }

    /** Get the last element or {@code null} if empty. */
    @SuppressWarnings("unchecked") public @Nullable T back() {
        return size == 0 ? null : (T)backing[physical(size-1)];
    }

    /** Get the {@code i}-th element or {@code null} if {@code i < 0 || i >= size()}. */
    @SuppressWarnings("unchecked") public @Nullable T at(int i) {
        return i < 0 || i >= size ? null : (T)backing[physical(i)];
    }

    /**
     * Get the {@code i}-th element, where {@code 0 <= i < size()}.
     *
     * @throws IndexOutOfBoundsException if {@code i < 0 || i >= size()}
     */
    @SuppressWarnings("unchecked") public @NonNull T get(int i) {
        checkIndex(i);
        return (T)backing[physical(i)];
    }

    /**
     * Replace the {@code i}-th element with {@code item}.
     *
     * @return the element previously at index {@code i}
     * @throws IndexOutOfBoundsException if {@code i < 0 || i >= size()}
     */
    @SuppressWarnings("unchecked") public T set(int i, T item) {
        requireNonNull(item, "RingDeque does not accept null elements");
        checkIndex(i);
        int p = physical(i);
        T old = (T)backing[p];
        backing[p] = item;
        return old;
    }

    /**
     * Exchange the elements at logical indices {@code i} and {@code j}.
     *
     * @throws IndexOutOfBoundsException if either index is outside {@code [0, size())}
     */
    public void swap(int i, int j) {
        checkIndex(i);
        checkIndex(j);
        int pi = physical(i), pj = physical(j);
        Object tmp = backing[pi];
        backing[pi] = backing[pj];
        backing[pj] = tmp;
    }

    /* --- --- --- removal --- --- --- */

    /** Remove and return the first element, or return {@code null} if empty. */
    @SuppressWarnings("unchecked") public @Nullable T removeFront() {
        if (size == 0)
            return null;
        int h = head;
        T item = (T)backing[h];
        backing[h] = null;
        head = ++h == backing.length ? 0 : h;
        --size;
        return item;
    }

    /** Remove and return the last element, or return {@code null} if empty. */
    @SuppressWarnings("unchecked") public @Nullable T removeBack() {
        if (size == 0)
            return null;
        int p = physical(size-1);
        T item = (T)backing[p];
        backing[p] = null;
        --size;
        return item;
    }

    /**
     * Remove the first {@code n} elements.
     *
     * @throws IllegalArgumentException if {@code n < 0 || n > size()}
     */
    public void discardFront(int n) {
        if (n < 0 || n > size)
            throw new IllegalArgumentException("Cannot remove first "+n+" elements out of "+size);
        clearSlots(0, n);
        head = physical(n);
        size -= n;
    }

    /**
     * Remove the last {@code n} elements.
     *
     * @throws IllegalArgumentException if {@code n < 0 || n > size()}
     */
    public void discardBack(int n) {
        if (n < 0 || n > size)
            throw new IllegalArgumentException("Cannot remove last "+n+" elements out of "+size);
        clearSlots(size-n, n);
        size -= n;
    }

    /** Remove all elements, keeping the backing array. */
    public void clear() {
        clearSlots(0, size);
        head = size = 0;
    }

    /* --- --- --- copies --- --- --- */

    /** A new array with the elements from front to back. */
    public Object[] toArray() {
        Object[] copy = new Object[size];
        copyRuns(copy);
        return copy;
    }

    /** A new mutable {@link List} with the elements from front to back. */
    @SuppressWarnings("unchecked") public List<T> toList() {
        ArrayList<T> list = new ArrayList<>(size);
        int frontEnd = runEnd(head, size), backLen = size-(frontEnd-head);
        for (int p = head; p < frontEnd; p++) list.add((T)backing[p]);
        for (int p = 0;    p < backLen;  p++) list.add((T)backing[p]);
        return list;
    }

    /* --- --- --- traversal --- --- --- */

    /** Equivalent to {@code forward().iterator()}. */
    @Override public It iterator() { return new It(false); }

    /** Traversal from index {@code 0} to {@code size()-1}. */
    public Traversal forward() { return new Traversal(false); }

    /** Traversal from index {@code size()-1} down to {@code 0}. */
    public Traversal reverse() { return new Traversal(true); }

    /**
     * A lazy and restartable view of the deque elements in one direction. Each
     * {@link #iterator()} starts from the current state of the deque. Results are
     * undefined if the deque is modified while an iterator is in use.
     */
    public final class Traversal implements Iterable<T> {
        private final boolean reverse;

        private Traversal(boolean reverse) { this.reverse = reverse; }

        @Override public It iterator() { return new It(reverse); }

        /**
         * Call {@code visitor} with each (index, element) pair, stopping as soon as
         * {@code visitor} returns {@code false}.
         *
         * @return {@code true} iff all elements were visited
         */
        public boolean forEachIndexed(IndexedVisitor<? super T> visitor) {
            for (It it = new It(reverse); it.hasNext(); ) {
                T item = it.next();
                if (!visitor.visit(it.index(), item))
                    return false;
            }
            return true;
        }

        @Override public String toString() {
            return (reverse ? "reverse(" : "forward(")+RingDeque.this+")";
        }
    }

    public final class It implements Iterator<T> {
        private final boolean reverse;
        private int next, index = -1;

        private It(boolean reverse) {
            this.reverse = reverse;
            this.next = reverse ? size-1 : 0;
        }

        @Override public boolean hasNext() { return next >= 0 && next < size; }

        @SuppressWarnings("unchecked") @Override public T next() {
            if (!hasNext())
                throw new NoSuchElementException();
            index = next;
            next += reverse ? -1 : 1;
            return (T)backing[physical(index)];
        }

        /** Logical index of the element last returned by {@link #next()}, or -1. */
        public int index() { return index; }
    }

    /* --- --- --- formatting --- --- --- */

    @Override public String toString() {
        var sb = new StringBuilder().append("RingDeque{len: ").append(size)
                .append(", cap: ").append(backing.length).append(", items: [");
        int budget = Math.min(size, FDProperties.dequeFormatMaxItems());
        int frontEnd = runEnd(head, size), backLen = size-(frontEnd-head);
        for (int p = head; p < frontEnd && budget > 0; ++p, --budget)
            sb.append(backing[p]).append(", ");
        for (int p = 0;    p < backLen  && budget > 0; ++p, --budget)
            sb.append(backing[p]).append(", ");
        if (size > FDProperties.dequeFormatMaxItems())
            sb.append("...");
        else if (size > 0)
            sb.setLength(sb.length()-2);
        return sb.append("]}").toString();
    }
}
