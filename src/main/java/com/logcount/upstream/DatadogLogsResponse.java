package com.logcount.upstream;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response body of Datadog's logs list endpoint. Only the fields needed for counting are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatadogLogsResponse(List<Log> logs, String nextLogId, String status) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Log(String id, Content content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String timestamp, String message, String host, String service) {}
}
