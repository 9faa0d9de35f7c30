package com.logcount.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.logcount.model.MinuteCount;

import java.util.ArrayList;
import java.util.List;

/**
 * Column-oriented count series, one column per field, ready to be drawn as a time series.
 *
 * <pre>
 * {
 *   "status": "ok",
 *   "query": "service:web status:error",
 *   "time": [1704103320000, 1704103500000],
 *   "entries": [3, 1]
 * }
 * </pre>
 */
public record CountResponse(
        @JsonProperty("status") String status,
        @JsonProperty("query") String query,
        @JsonProperty("time") List<Long> times,
        @JsonProperty("entries") List<Long> counts
) {

    /**
     * Build a successful response from counts sorted by time.
     */
    public static CountResponse ok(String query, List<MinuteCount> minuteCounts) {
        if (minuteCounts.isEmpty()) return noData(query);

        List<Long> t = new ArrayList<>(minuteCounts.size());
        List<Long> c = new ArrayList<>(minuteCounts.size());
        for (MinuteCount minuteCount : minuteCounts) {
            t.add(minuteCount.time().toEpochMilli());
            c.add(minuteCount.count());
        }
        return new CountResponse("ok", query, t, c);
    }

    public static CountResponse noData(String query) {
        return new CountResponse("no_data", query, List.of(), List.of());
    }

    public static CountResponse error(String message) {
        return new CountResponse("error: " + message, null, List.of(), List.of());
    }
}
