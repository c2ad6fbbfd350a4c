package com.github.alexishuf.fasterdeque.sort;

import com.github.alexishuf.fasterdeque.deque.RingDeque;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class SortableDequeTest {

    @Test
    void testSort() {
        RingDeque<Integer> deque = RingDeque.of(9, 8, 7, 6);
        SortableDeque<Integer> sortable = SortableDeque.natural(deque);
        assertFalse(Sorts.isSorted(sortable));
        sortable.sort();
        assertEquals(List.of(6, 7, 8, 9), deque.toList());
        assertTrue(Sorts.isSorted(sortable));
        assertEquals(4, deque.size());
        assertEquals(4, deque.capacity());
    }

    @Test
    void testScenario() {
        RingDeque<Integer> deque = RingDeque.of(9, 8, 7, 6);
        SortableDeque.natural(deque).sort();
        assertEquals(List.of(6, 7, 8, 9), deque.toList());
        for (int i = 5; i > 0; i--)
            deque.pushFront(i);
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9), deque.toList());
        assertEquals(9, deque.size());
        assertEquals(16, deque.capacity());
        assertEquals("RingDeque{len: 9, cap: 16, items: [1, 2, 3, 4, 5, 6, 7, 8, 9]}",
                     deque.toString());

        List<Integer> reversed = new ArrayList<>();
        deque.reverse().forEach(reversed::add);
        assertEquals(List.of(9, 8, 7, 6, 5, 4, 3, 2, 1), reversed);

        List<Integer> removed = new ArrayList<>();
        for (Integer i; (i = deque.removeBack()) != null; )
            removed.add(i);
        assertEquals(List.of(9, 8, 7, 6, 5, 4, 3, 2, 1), removed);
        assertNull(deque.removeBack());
        assertTrue(deque.isEmpty());
    }

    @Test
    void testCompareLess() {
        RingDeque<String> deque = new RingDeque<>(3);
        deque.pushBack("b");
        deque.pushFront("a");
        deque.pushBack("b");
        SortableDeque<String> sortable = SortableDeque.natural(deque);
        assertEquals(3, sortable.size());
        assertTrue(sortable.compareLess(0, 1));
        assertFalse(sortable.compareLess(1, 0));
        assertFalse(sortable.compareLess(1, 2));
        assertEquals(0, sortable.compare(1, 2));
        assertEquals(1, sortable.compare(2, 0));
        assertSame(deque, sortable.deque());
    }

    @Test
    void testOutOfBounds() {
        SortableDeque<Integer> sortable = SortableDeque.natural(RingDeque.of(1, 2, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> sortable.compareLess(0, 3));
        assertThrows(IndexOutOfBoundsException.class, () -> sortable.compareLess(3, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> sortable.compareLess(-1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> sortable.swapAt(3, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> sortable.swapAt(0, -1));
        assertEquals(List.of(1, 2, 3), sortable.deque().toList());
    }

    @ParameterizedTest @ValueSource(ints = {0, 1, 2, 3, 7, 16, 100, 1000})
    void testSortWrapped(int size) {
        Random random = new Random(size);
        RingDeque<Integer> deque = new RingDeque<>(size);
        List<Integer> expected = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            int v = random.nextInt(size/2+1);
            if (random.nextBoolean()) deque.pushFront(v);
            else                      deque.pushBack(v);
        }
        expected.addAll(deque.toList());
        Collections.sort(expected);

        SortableDeque.natural(deque).sort();
        assertEquals(expected, deque.toList());
        assertEquals(size, deque.capacity());
    }

    @Test
    void testStableSort() {
        RingDeque<String> deque = new RingDeque<>(6);
        for (String s : List.of("b1", "a1", "b2"))
            deque.pushBack(s);
        for (String s : List.of("a2", "c1", "a3"))
            deque.pushFront(s); // a3 c1 a2 b1 a1 b2
        Comparator<String> firstLetter = Comparator.comparing(s -> s.charAt(0));
        SortableDeque<String> byLetter = SortableDeque.ordered(deque, firstLetter);
        byLetter.stableSort();
        assertEquals(List.of("a3", "a2", "a1", "b1", "b2", "c1"), deque.toList());
        assertTrue(Sorts.isSorted(byLetter));
    }

    @Test
    void testOrderedReverse() {
        RingDeque<Integer> deque = RingDeque.of(3, 1, 4, 1, 5, 9, 2, 6);
        SortableDeque.ordered(deque, Comparator.<Integer>reverseOrder()).sort();
        assertEquals(List.of(9, 6, 5, 4, 3, 2, 1, 1), deque.toList());
    }

    @Test
    void testSortsOnOtherSortable() {
        int[] values = {5, 3, 9, 1, 1, 0};
        IndexedSortable sortable = new IndexedSortable() {
            @Override public int size() { return values.length; }
            @Override public boolean compareLess(int i, int j) { return values[i] < values[j]; }
            @Override public void swapAt(int i, int j) {
                int tmp = values[i];
                values[i] = values[j];
                values[j] = tmp;
            }
        };
        Sorts.mergeSort(sortable);
        assertArrayEquals(new int[]{0, 1, 1, 3, 5, 9}, values);
        assertTrue(Sorts.isSorted(sortable));
    }
}
