package com.github.alexishuf.fasterdeque.sort;

import org.checkerframework.checker.index.qual.NonNegative;

/**
 * A sequence that can be sorted in place by algorithms that only compare and swap
 * positions. See {@link Sorts}.
 *
 * <p>Implementations must throw {@link IndexOutOfBoundsException} for any index outside
 * {@code [0, size())}: clamping or wrapping indices would silently corrupt a sort.</p>
 */
public interface IndexedSortable {
    /** Number of positions, valid indices are {@code [0, size())}. */
    @NonNegative int size();

    /** Whether the element at {@code i} is strictly less than the element at {@code j}. */
    boolean compareLess(int i, int j);

    /** Exchange the elements at positions {@code i} and {@code j}. */
    void swapAt(int i, int j);

    /**
     * Three-way comparison of positions {@code i} and {@code j}, consistent with
     * {@link #compareLess(int, int)}.
     */
    default int compare(int i, int j) {
        if (compareLess(i, j)) return -1;
        return compareLess(j, i) ? 1 : 0;
    }
}
