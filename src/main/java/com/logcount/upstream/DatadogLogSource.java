package com.logcount.upstream;

import com.logcount.event.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link LogSource} backed by the Datadog logs list API.
 *
 * <p>Each call is a single POST; pagination is driven by the caller passing back
 * {@code nextLogId} as {@code startAt}. No retries are attempted here.
 */
public class DatadogLogSource implements LogSource {

    private static final Logger log = LoggerFactory.getLogger(DatadogLogSource.class);

    static final String LIST_PATH = "/api/v1/logs-queries/list";
    static final String API_KEY_HEADER = "DD-API-KEY";
    static final String APP_KEY_HEADER = "DD-APPLICATION-KEY";

    private final RestTemplate restTemplate;
    private final String listUrl;
    private final String apiKey;
    private final String appKey;
    private final int pageLimit;

    /**
     * @param restTemplate HTTP client, already configured with timeouts
     * @param baseUrl      e.g. {@code https://api.datadoghq.com}
     * @param apiKey       Datadog API key
     * @param appKey       Datadog application key
     * @param pageLimit    Maximum logs per page (Datadog caps this at 1000)
     */
    public DatadogLogSource(RestTemplate restTemplate, String baseUrl, String apiKey, String appKey, int pageLimit) {
        this.restTemplate = restTemplate;
        this.listUrl = stripTrailingSlash(baseUrl) + LIST_PATH;
        this.apiKey = apiKey;
        this.appKey = appKey;
        this.pageLimit = pageLimit;
    }

    @Override
    public LogPage fetch(String queryText, Instant start, Instant end, String startAt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(API_KEY_HEADER, apiKey);
        headers.set(APP_KEY_HEADER, appKey);

        DatadogLogsRequest body = new DatadogLogsRequest(
                queryText,
                new DatadogLogsRequest.TimeRange(start.toString(), end.toString()),
                "asc",
                pageLimit,
                startAt);

        DatadogLogsResponse response;
        try {
            response = restTemplate.postForObject(listUrl, new HttpEntity<>(body, headers), DatadogLogsResponse.class);
        } catch (RestClientException e) {
            log.warn("Datadog request failed: query='{}' from={} to={} startAt={} error={}",
                    queryText, start, end, startAt, e.getMessage());
            throw new UpstreamFetchException("Datadog logs request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new UpstreamFetchException("Datadog returned an empty response body");
        }
        // Datadog reports some auth failures with a 200 and status=error
        if ("error".equalsIgnoreCase(response.status())) {
            throw new UpstreamFetchException("Datadog responded with status=error for query '" + queryText + "'");
        }

        List<LogEvent> events = toEvents(response.logs());
        log.debug("Datadog page: query='{}' startAt={} logs={} nextLogId={}",
                queryText, startAt, events.size(), response.nextLogId());
        return new LogPage(events, response.nextLogId());
    }

    private static List<LogEvent> toEvents(List<DatadogLogsResponse.Log> logs) {
        if (logs == null) return List.of();

        List<LogEvent> events = new ArrayList<>(logs.size());
        for (DatadogLogsResponse.Log entry : logs) {
            if (entry.content() == null || entry.content().timestamp() == null) {
                throw new UpstreamFetchException("Datadog log " + entry.id() + " has no timestamp");
            }
            try {
                events.add(new LogEvent(entry.id(), Instant.parse(entry.content().timestamp())));
            } catch (DateTimeParseException e) {
                throw new UpstreamFetchException("Datadog log " + entry.id() + " has an unparseable timestamp: "
                        + entry.content().timestamp(), e);
            }
        }
        return events;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
