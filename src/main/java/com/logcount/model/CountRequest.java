package com.logcount.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * A request for per-minute event counts of one query over {@code [start, end)}.
 *
 * <p>{@code start} is truncated to its minute after validation, so the first bucket of the
 * answer always covers the whole minute the caller asked from.
 *
 * @param query Raw query text, sent upstream as-is
 * @param start Inclusive start of the requested window, minute-aligned
 * @param end   Exclusive end of the requested window
 */
public record CountRequest(String query, Instant start, Instant end) {

    public CountRequest {
        if (query == null || query.isBlank()) throw new MalformedRequestException("Query must not be blank");
        if (start == null || end == null) throw new MalformedRequestException("Start and end must both be set");
        if (!end.isAfter(start)) throw new MalformedRequestException("End must be after start");
        start = start.truncatedTo(ChronoUnit.MINUTES);
    }

    public static CountRequest ofEpochMillis(String query, long fromMs, long toMs) {
        return new CountRequest(query, Instant.ofEpochMilli(fromMs), Instant.ofEpochMilli(toMs));
    }

    /**
     * Cache key for this request. Queries differing only in case share a fingerprint.
     */
    public String fingerprint() {
        return query.toLowerCase(Locale.ROOT);
    }
}
