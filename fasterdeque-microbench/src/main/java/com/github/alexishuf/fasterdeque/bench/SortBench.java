package com.github.alexishuf.fasterdeque.bench;

import com.github.alexishuf.fasterdeque.deque.RingDeque;
import com.github.alexishuf.fasterdeque.sort.SortableDeque;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@Threads(1)
@Fork(value = 1, warmups = 0)
@Measurement(iterations = 10, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@Warmup(iterations = 4, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@BenchmarkMode({Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class SortBench {
    @Param({"23"})              private int seed;
    @Param({"64", "4096"})      private int items;

    private List<Integer> shuffled;
    private RingDeque<Integer> deque;
    private ArrayList<Integer> list;

    @Setup(Level.Trial) public void setup() {
        shuffled = new ArrayList<>(items);
        for (int i = 0; i < items; i++)
            shuffled.add(i);
        Collections.shuffle(shuffled, new Random(seed));
        deque = new RingDeque<>(items);
        list = new ArrayList<>(items);
    }

    @Setup(Level.Invocation) public void invocationSetup() {
        deque.clear();
        // half pushed at the front so that the deque wraps around its backing array
        int half = shuffled.size()/2;
        for (int i = half-1; i >= 0; i--)
            deque.pushFront(shuffled.get(i));
        deque.pushBackAll(shuffled.subList(half, shuffled.size()));
        list.clear();
        list.addAll(shuffled);
    }

    @Benchmark public RingDeque<Integer> quickSortDeque() {
        SortableDeque.natural(deque).sort();
        return deque;
    }

    @Benchmark public RingDeque<Integer> mergeSortDeque() {
        SortableDeque.natural(deque).stableSort();
        return deque;
    }

    @Benchmark public List<Integer> sortList() {
        Collections.sort(list);
        return list;
    }
}
