package com.logcount.event;

import java.time.Instant;

/**
 * A single log line returned by the upstream log source. Only its timestamp
 * matters for counting.
 *
 * @param id        Upstream log id, may be null for synthetic events
 * @param timestamp When the event was logged
 */
public record LogEvent(String id, Instant timestamp) {

    public LogEvent {
        if (timestamp == null) throw new IllegalArgumentException("Timestamp must not be null");
    }

    public static LogEvent at(Instant timestamp) {
        return new LogEvent(null, timestamp);
    }
}
