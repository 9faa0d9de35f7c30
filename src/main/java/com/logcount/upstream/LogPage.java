package com.logcount.upstream;

import com.logcount.event.LogEvent;

import java.util.List;

/**
 * One page of upstream results.
 *
 * @param events    Events on this page
 * @param nextLogId Continuation token for the next page; null or blank when exhausted
 */
public record LogPage(List<LogEvent> events, String nextLogId) {

    public LogPage {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static LogPage last(List<LogEvent> events) {
        return new LogPage(events, null);
    }

    public boolean hasMore() {
        return nextLogId != null && !nextLogId.isBlank();
    }
}
