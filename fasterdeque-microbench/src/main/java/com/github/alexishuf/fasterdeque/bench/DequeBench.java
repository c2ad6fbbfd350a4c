package com.github.alexishuf.fasterdeque.bench;

import com.github.alexishuf.fasterdeque.deque.RingDeque;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayDeque;
import java.util.concurrent.TimeUnit;

@State(Scope.Thread)
@Threads(1)
@Fork(value = 1, warmups = 0)
@Measurement(iterations = 10, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@Warmup(iterations = 4, time = 200, timeUnit = TimeUnit.MILLISECONDS)
@BenchmarkMode({Mode.AverageTime})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
public class DequeBench {
    @Param({"16", "1024", "65536"}) private int items;
    @Param({"0", "64"})             private int window;

    private Integer[] values;
    private RingDeque<Integer> ring;
    private ArrayDeque<Integer> array;

    @Setup(Level.Trial) public void setup() {
        values = new Integer[items];
        for (int i = 0; i < items; i++)
            values[i] = i;
    }

    @Setup(Level.Iteration) public void iterationSetup() {
        ring = new RingDeque<>();
        array = new ArrayDeque<>();
        System.gc();
    }

    /* push everything at the back, keep at most window items, then drain from the front */

    @Benchmark public int ringFifo() {
        RingDeque<Integer> ring = this.ring;
        int acc = 0;
        for (Integer v : values) {
            ring.pushBack(v);
            if (ring.size() > window)
                acc += ring.removeFront();
        }
        for (Integer v; (v = ring.removeFront()) != null; )
            acc += v;
        return acc;
    }

    @Benchmark public int arrayFifo() {
        ArrayDeque<Integer> array = this.array;
        int acc = 0;
        for (Integer v : values) {
            array.addLast(v);
            if (array.size() > window)
                acc += array.pollFirst();
        }
        for (Integer v; (v = array.pollFirst()) != null; )
            acc += v;
        return acc;
    }

    /* alternate ends, forcing head to wrap around */

    @Benchmark public int ringAlternate() {
        RingDeque<Integer> ring = this.ring;
        int acc = 0;
        for (int i = 0; i < values.length; i++) {
            if ((i & 1) == 0) ring.pushFront(values[i]);
            else              ring.pushBack(values[i]);
        }
        for (int i = 0; !ring.isEmpty(); i++) {
            Integer v = (i & 1) == 0 ? ring.removeBack() : ring.removeFront();
            acc += v == null ? 0 : v;
        }
        return acc;
    }

    @Benchmark public int arrayAlternate() {
        ArrayDeque<Integer> array = this.array;
        int acc = 0;
        for (int i = 0; i < values.length; i++) {
            if ((i & 1) == 0) array.addFirst(values[i]);
            else              array.addLast(values[i]);
        }
        for (int i = 0; !array.isEmpty(); i++) {
            Integer v = (i & 1) == 0 ? array.pollLast() : array.pollFirst();
            acc += v == null ? 0 : v;
        }
        return acc;
    }

    @Benchmark public void ringIndexed(Blackhole bh) {
        RingDeque<Integer> ring = this.ring;
        ring.clear();
        ring.pushBackAll(values);
        for (int i = 0, n = ring.size(); i < n; i++)
            bh.consume(ring.get(i));
    }

    @Benchmark public void ringReverse(Blackhole bh) {
        RingDeque<Integer> ring = this.ring;
        ring.clear();
        ring.pushBackAll(values);
        for (Integer v : ring.reverse())
            bh.consume(v);
    }

    @Benchmark public void arrayReverse(Blackhole bh) {
        ArrayDeque<Integer> array = this.array;
        array.clear();
        for (Integer v : values)
            array.addLast(v);
        for (var it = array.descendingIterator(); it.hasNext(); )
            bh.consume(it.next());
    }
}
