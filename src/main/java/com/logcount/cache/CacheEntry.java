package com.logcount.cache;

import java.time.Instant;

/**
 * Cached per-minute counts for one query fingerprint, together with the window
 * {@code [startTime, endTime)} the counts are known to fully represent.
 *
 * <p>Merge and resolve logic lives in {@link CacheMerger} and {@link RangeResolver},
 * which need to compare the previous window against an incoming request.
 */
public class CacheEntry {

    private final String query;
    private final BucketedSeries series = new BucketedSeries();
    private Instant startTime;
    private Instant endTime;

    /**
     * @param query     Normalized fingerprint this entry belongs to
     * @param startTime Inclusive start of the validity window
     * @param endTime   Exclusive end of the validity window
     */
    public CacheEntry(String query, Instant startTime, Instant endTime) {
        this.query = query;
        reWindow(startTime, endTime);
    }

    /**
     * Move the validity window. Does not prune; see {@link CacheMerger}.
     */
    public void reWindow(Instant startTime, Instant endTime) {
        if (endTime.isBefore(startTime)) {
            throw new IllegalArgumentException("Window end " + endTime + " is before start " + startTime);
        }
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getQuery() {
        return query;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public BucketedSeries getSeries() {
        return series;
    }
}
