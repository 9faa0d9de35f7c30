package com.logcount.cache;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;

/**
 * Per-minute event counts keyed by the start of each minute (UTC).
 *
 * <p>Every key passed in is truncated to its containing minute, so callers may hand in
 * raw event timestamps. Counts are never negative.
 *
 * <p>This class is NOT thread-safe by itself. The owning {@link CacheEntry} is only
 * touched while holding the fingerprint lock from {@link CacheStore#withLock}.
 */
public class BucketedSeries {

    private final NavigableMap<Instant, Long> buckets = new TreeMap<>();

    /**
     * Truncate a timestamp to the start of its minute.
     */
    public static Instant minuteOf(Instant timestamp) {
        return timestamp.truncatedTo(ChronoUnit.MINUTES);
    }

    /**
     * Add one to the bucket containing {@code timestamp}, creating it at 1 if absent.
     */
    public void increment(Instant timestamp) {
        buckets.merge(minuteOf(timestamp), 1L, Long::sum);
    }

    /**
     * Overwrite the count of the bucket containing {@code timestamp}.
     */
    public void setCount(Instant timestamp, long count) {
        if (count < 0) throw new IllegalArgumentException("Count must be non-negative: " + count);
        buckets.put(minuteOf(timestamp), count);
    }

    /**
     * @return the stored count for the bucket containing {@code timestamp}, or 0 if there is none
     */
    public long count(Instant timestamp) {
        return buckets.getOrDefault(minuteOf(timestamp), 0L);
    }

    /**
     * Remove every bucket strictly before {@code t}.
     *
     * @return number of buckets removed
     */
    public int pruneBefore(Instant t) {
        NavigableMap<Instant, Long> head = buckets.headMap(t, false);
        int removed = head.size();
        head.clear();
        return removed;
    }

    /**
     * Remove every bucket at or after {@code t}.
     *
     * @return number of buckets removed
     */
    public int pruneFrom(Instant t) {
        NavigableMap<Instant, Long> tail = buckets.tailMap(t, true);
        int removed = tail.size();
        tail.clear();
        return removed;
    }

    /**
     * Ascending, read-only live view of the bucket keys. Each iteration starts over
     * from the smallest key.
     */
    public NavigableSet<Instant> orderedKeys() {
        return Collections.unmodifiableNavigableSet(buckets.navigableKeySet());
    }

    public void clear() {
        buckets.clear();
    }

    public int size() {
        return buckets.size();
    }

    public boolean isEmpty() {
        return buckets.isEmpty();
    }
}
