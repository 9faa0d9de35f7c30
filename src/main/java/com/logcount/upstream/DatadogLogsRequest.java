package com.logcount.upstream;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Request body for Datadog's {@code POST /api/v1/logs-queries/list}.
 *
 * <pre>
 * {
 *   "query": "service:web status:error",
 *   "time": {"from": "2024-01-01T10:00:00Z", "to": "2024-01-01T10:10:00Z"},
 *   "sort": "asc",
 *   "limit": 1000,
 *   "startAt": "AQAAAXa..."
 * }
 * </pre>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DatadogLogsRequest(String query, TimeRange time, String sort, int limit, String startAt) {

    public record TimeRange(String from, String to) {}
}
