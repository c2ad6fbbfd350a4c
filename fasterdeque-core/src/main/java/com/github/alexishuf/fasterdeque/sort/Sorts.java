package com.github.alexishuf.fasterdeque.sort;

import it.unimi.dsi.fastutil.Arrays;

/**
 * Runs fastutil's swapper-driven sorting algorithms over an {@link IndexedSortable},
 * so that the sortable is permuted in place instead of being copied into an array.
 */
public final class Sorts {
    private Sorts() { }

    /** Sort {@code sortable} in place. The sort is not stable. */
    public static void quickSort(IndexedSortable sortable) {
        int n = sortable.size();
        if (n > 1)
            Arrays.quickSort(0, n, sortable::compare, sortable::swapAt);
    }

    /** Sort {@code sortable} in place, keeping the relative order of equal elements. */
    public static void mergeSort(IndexedSortable sortable) {
        int n = sortable.size();
        if (n > 1)
            Arrays.mergeSort(0, n, sortable::compare, sortable::swapAt);
    }

    /** Whether no position is {@link IndexedSortable#compareLess(int, int)} than its predecessor. */
    public static boolean isSorted(IndexedSortable sortable) {
        for (int i = 1, n = sortable.size(); i < n; i++) {
            if (sortable.compareLess(i, i-1)) return false;
        }
        return true;
    }
}
