package com.github.alexishuf.fasterdeque.deque;

/** Receives (index, element) pairs from {@link RingDeque.Traversal#forEachIndexed(IndexedVisitor)}. */
@FunctionalInterface
public interface IndexedVisitor<T> {
    /**
     * Visit the element at logical index {@code index}.
     *
     * @return {@code true} to continue the traversal, {@code false} to stop it.
     */
    boolean visit(int index, T item);
}
