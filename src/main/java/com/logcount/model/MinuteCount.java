package com.logcount.model;

import java.time.Instant;

/**
 * Number of matching log events observed in a single one-minute bucket.
 *
 * @param time  Bucket start, truncated to the minute (UTC)
 * @param count Number of events in the bucket
 */
public record MinuteCount(Instant time, long count) {

    public MinuteCount {
        if (time == null) throw new IllegalArgumentException("Time must not be null");
        if (count < 0) throw new IllegalArgumentException("Count must be non-negative");
    }
}
