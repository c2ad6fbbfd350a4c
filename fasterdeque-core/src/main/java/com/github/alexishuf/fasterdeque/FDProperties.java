package com.github.alexishuf.fasterdeque;

import com.github.alexishuf.fasterdeque.deque.RingDeque;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.index.qual.Positive;

@SuppressWarnings("unused")
public class FDProperties {

    /* --- --- --- property names --- --- --- */
    public static final String DEQUE_GROW_DOUBLING_LIMIT = "fasterdeque.deque.grow.doubling-limit";
    public static final String DEQUE_GROW_LOG_THRESHOLD  = "fasterdeque.deque.grow.log-threshold";
    public static final String DEQUE_FORMAT_MAX_ITEMS    = "fasterdeque.deque.format.max-items";

    /* --- --- --- default values --- --- --- */
    public static final int DEF_DEQUE_GROW_DOUBLING_LIMIT = 256;
    public static final int DEF_DEQUE_GROW_LOG_THRESHOLD  = 1<<20; // 1 Mi slots --> 4~8MiB
    public static final int DEF_DEQUE_FORMAT_MAX_ITEMS    = 1_000;

    /* --- --- --- cached values --- --- --- */
    private static int CACHE_DEQUE_GROW_DOUBLING_LIMIT = -1;
    private static int CACHE_DEQUE_GROW_LOG_THRESHOLD  = -1;
    private static int CACHE_DEQUE_FORMAT_MAX_ITEMS    = -1;

    /* --- --- --- internal use --- --- --- */

    protected interface Parser<T> {
        T parse(String source, String value) throws IllegalArgumentException;
    }

    protected static <T> T readProperty(String propertyName, T defaultValue,
                                        Parser<T> parser) {
        String source = "JVM property "+propertyName;
        String value = System.getProperty(propertyName);
        if (value == null) {
            String envName = envName(propertyName);
            source = "Environment var "+envName;
            value = System.getenv(envName);
        }
        return value == null ? defaultValue : parser.parse(source, value);
    }

    /** Name of the environment variable consulted when {@code propertyName} is not set. */
    public static String envName(String propertyName) {
        return propertyName.toUpperCase().replace('.', '_').replace('-', '_');
    }

    protected static @NonNegative int readNonNegativeInteger(String propertyName, int defaultValue) {
        return readProperty(propertyName, defaultValue, (src, val) -> {
            int i = -1;
            try { i = Integer.parseInt(val.trim()); } catch (NumberFormatException ignored) {}
            if (i < 0)
                throw new IllegalArgumentException(src+"="+val+" is not a non-negative integer");
            return i;
        });
    }

    protected static @Positive int readPositiveInt(String propertyName, int defaultValue) {
        return readProperty(propertyName, defaultValue, (src, val) -> {
            int i = -1;
            try { i = Integer.parseInt(val.trim()); } catch (NumberFormatException ignored) {}
            if (i < 1)
                throw new IllegalArgumentException(src+"="+val+" is not a positive integer");
            return i;
        });
    }

    /* --- --- --- management --- --- --- */

    /**
     * Drops all cached property values, causing properties to be re-read from
     * {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static void refresh() {
        CACHE_DEQUE_GROW_DOUBLING_LIMIT = -1;
        CACHE_DEQUE_GROW_LOG_THRESHOLD  = -1;
        CACHE_DEQUE_FORMAT_MAX_ITEMS    = -1;
    }

    /* --- --- --- accessors --- --- --- */

    /**
     * While the backing array of a {@link RingDeque} is smaller than this, growth doubles
     * its capacity. Beyond this, growth adds roughly a quarter of the current capacity,
     * so that large deques do not waste up to half of their backing array.
     *
     * <p>The default is {@link #DEF_DEQUE_GROW_DOUBLING_LIMIT}.</p>
     *
     * @return a positive capacity
     */
    public static @Positive int dequeGrowDoublingLimit() {
        int i = CACHE_DEQUE_GROW_DOUBLING_LIMIT;
        if (i < 0) {
            i = readPositiveInt(DEQUE_GROW_DOUBLING_LIMIT, DEF_DEQUE_GROW_DOUBLING_LIMIT);
            CACHE_DEQUE_GROW_DOUBLING_LIMIT = i;
        }
        return i;
    }

    /**
     * A {@link RingDeque} reallocation that yields a backing array with at least this
     * many slots will be logged at DEBUG level.
     *
     * <p>The default is {@link #DEF_DEQUE_GROW_LOG_THRESHOLD}.</p>
     */
    public static @Positive int dequeGrowLogThreshold() {
        int i = CACHE_DEQUE_GROW_LOG_THRESHOLD;
        if (i < 0) {
            i = readPositiveInt(DEQUE_GROW_LOG_THRESHOLD, DEF_DEQUE_GROW_LOG_THRESHOLD);
            CACHE_DEQUE_GROW_LOG_THRESHOLD = i;
        }
        return i;
    }

    /**
     * Maximum number of elements rendered by {@link RingDeque#toString()}. Remaining
     * elements are elided with {@code " ..."}. Zero renders no elements.
     *
     * <p>The default is {@link #DEF_DEQUE_FORMAT_MAX_ITEMS}.</p>
     */
    public static @NonNegative int dequeFormatMaxItems() {
        int i = CACHE_DEQUE_FORMAT_MAX_ITEMS;
        if (i < 0) {
            i = readNonNegativeInteger(DEQUE_FORMAT_MAX_ITEMS, DEF_DEQUE_FORMAT_MAX_ITEMS);
            CACHE_DEQUE_FORMAT_MAX_ITEMS = i;
        }
        return i;
    }
}
