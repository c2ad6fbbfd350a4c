package com.github.alexishuf.fasterdeque.sort;

import com.github.alexishuf.fasterdeque.deque.RingDeque;
import org.checkerframework.checker.index.qual.NonNegative;

import java.util.Comparator;

import static java.util.Objects.requireNonNull;

/**
 * An {@link IndexedSortable} view over the logical positions of a {@link RingDeque}.
 *
 * <p>The view does not copy the deque: {@link #swapAt(int, int)} permutes the deque itself
 * and {@link #size()} always reflects the deque current size. Sorting changes neither
 * {@link RingDeque#size()} nor {@link RingDeque#capacity()}.</p>
 */
public final class SortableDeque<T> implements IndexedSortable {
    private final RingDeque<T> deque;
    private final Comparator<? super T> order;

    private SortableDeque(RingDeque<T> deque, Comparator<? super T> order) {
        this.deque = requireNonNull(deque);
        this.order = requireNonNull(order);
    }

    /** View of {@code deque} ordered by the natural order of {@code T}. */
    public static <T extends Comparable<? super T>> SortableDeque<T> natural(RingDeque<T> deque) {
        return new SortableDeque<>(deque, Comparator.naturalOrder());
    }

    /** View of {@code deque} ordered by {@code order}, which must be a total order. */
    public static <T> SortableDeque<T> ordered(RingDeque<T> deque, Comparator<? super T> order) {
        return new SortableDeque<>(deque, order);
    }

    public RingDeque<T> deque() { return deque; }

    @Override public @NonNegative int size() { return deque.size(); }

    /** @throws IndexOutOfBoundsException if {@code i} or {@code j} is outside {@code [0, size())} */
    @Override public boolean compareLess(int i, int j) {
        return order.compare(deque.get(i), deque.get(j)) < 0;
    }

    @Override public int compare(int i, int j) {
        return order.compare(deque.get(i), deque.get(j));
    }

    /** @throws IndexOutOfBoundsException if {@code i} or {@code j} is outside {@code [0, size())} */
    @Override public void swapAt(int i, int j) { deque.swap(i, j); }

    /** Sort the deque in place using {@link Sorts#quickSort(IndexedSortable)}. */
    public void sort() { Sorts.quickSort(this); }

    /** Sort the deque in place using {@link Sorts#mergeSort(IndexedSortable)}. */
    public void stableSort() { Sorts.mergeSort(this); }

    @Override public String toString() { return "SortableDeque"+deque; }
}
