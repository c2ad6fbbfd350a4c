package com.github.alexishuf.fasterdeque.deque;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class TraversalTest {

    /** A deque holding {@code 0..size-1} whose elements wrap around the backing array. */
    private static RingDeque<Integer> wrapped(int size) {
        RingDeque<Integer> deque = new RingDeque<>(size);
        for (int i = size/2; i < size; i++)
            deque.pushBack(i);
        for (int i = size/2-1; i >= 0; i--)
            deque.pushFront(i);
        assertEquals(size, deque.capacity());
        return deque;
    }

    @ParameterizedTest @ValueSource(ints = {0, 1, 2, 3, 8, 17, 64})
    void testForward(int size) {
        RingDeque<Integer> deque = wrapped(size);
        var it = deque.forward().iterator();
        assertEquals(-1, it.index());
        for (int i = 0; i < size; i++) {
            assertTrue(it.hasNext());
            assertEquals(i, it.next());
            assertEquals(i, it.index());
        }
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);

        List<Integer> iterated = new ArrayList<>();
        for (Integer i : deque)
            iterated.add(i);
        assertEquals(deque.toList(), iterated);
    }

    @ParameterizedTest @ValueSource(ints = {0, 1, 2, 3, 8, 17, 64})
    void testReverse(int size) {
        RingDeque<Integer> deque = wrapped(size);
        var it = deque.reverse().iterator();
        for (int i = size-1; i >= 0; i--) {
            assertTrue(it.hasNext());
            assertEquals(i, it.next());
            assertEquals(i, it.index());
        }
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void testForEachIndexed() {
        RingDeque<String> deque = RingDeque.of("a", "b", "c");
        List<String> pairs = new ArrayList<>();
        assertTrue(deque.forward().forEachIndexed((i, s) -> pairs.add(i+"="+s)));
        assertEquals(List.of("0=a", "1=b", "2=c"), pairs);

        pairs.clear();
        assertTrue(deque.reverse().forEachIndexed((i, s) -> pairs.add(i+"="+s)));
        assertEquals(List.of("2=c", "1=b", "0=a"), pairs);
    }

    @Test
    void testEarlyStop() {
        RingDeque<Integer> deque = wrapped(10);
        int[] visits = {0};
        assertFalse(deque.forward().forEachIndexed((i, v) -> ++visits[0] < 3));
        assertEquals(3, visits[0]);

        visits[0] = 0;
        assertFalse(deque.reverse().forEachIndexed((i, v) -> {
            ++visits[0];
            return v != 8;
        }));
        assertEquals(2, visits[0]);
    }

    @Test
    void testRestartable() {
        RingDeque<Integer> deque = RingDeque.of(1, 2);
        RingDeque<Integer>.Traversal forward = deque.forward(), reverse = deque.reverse();
        List<Integer> first = new ArrayList<>(), second = new ArrayList<>();
        forward.forEach(first::add);
        forward.forEach(second::add);
        assertEquals(List.of(1, 2), first);
        assertEquals(first, second);

        // each iteration observes the deque as it is when the iteration starts
        deque.pushFront(0);
        deque.pushBack(3);
        List<Integer> third = new ArrayList<>(), reversed = new ArrayList<>();
        forward.forEach(third::add);
        reverse.forEach(reversed::add);
        assertEquals(List.of(0, 1, 2, 3), third);
        assertEquals(List.of(3, 2, 1, 0), reversed);
    }

    @Test
    void testEmptyTraversal() {
        RingDeque<Integer> deque = new RingDeque<>();
        assertFalse(deque.iterator().hasNext());
        assertFalse(deque.reverse().iterator().hasNext());
        assertTrue(deque.forward().forEachIndexed((i, v) -> { throw new AssertionError(); }));
        assertEquals("reverse(RingDeque{len: 0, cap: 0, items: []})", deque.reverse().toString());
    }
}
