package com.logcount.upstream;

import java.time.Instant;

/**
 * A paginated source of raw log events.
 *
 * <p>Implementations own transport, authentication and any retry policy. Failures of any
 * kind surface as {@link UpstreamFetchException}.
 */
public interface LogSource {

    /**
     * Fetch one page of events matching {@code queryText} within {@code [start, end)}.
     *
     * @param queryText Raw query text
     * @param start     Inclusive start
     * @param end       Exclusive end
     * @param startAt   Continuation token from the previous page, or null for the first page
     * @return the page; {@link LogPage#hasMore()} tells whether another call is needed
     */
    LogPage fetch(String queryText, Instant start, Instant end, String startAt);
}
