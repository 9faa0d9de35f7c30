package com.logcount.controller;

import com.logcount.model.CountRequest;
import com.logcount.model.MalformedRequestException;
import com.logcount.model.MinuteCount;
import com.logcount.service.LogCountService;
import com.logcount.upstream.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller exposing per-minute log event counts.
 *
 * <pre>
 * GET  /counts?query=status:error&amp;from=1704103200000&amp;to=1704103800000
 * POST /query   {"queries": [{"refId": "A", "queryText": "status:error", "from": ..., "to": ...}]}
 * </pre>
 *
 * Times are epoch milliseconds; {@code from} is inclusive and {@code to} exclusive.
 */
@RestController
@CrossOrigin(origins = "*")
public class CountController {

    private static final Logger log = LoggerFactory.getLogger(CountController.class);

    private final LogCountService logCountService;

    public CountController(LogCountService logCountService) {
        this.logCountService = logCountService;
    }

    /**
     * Per-minute counts for one query.
     *
     * @param query Query text, matched case-insensitively against the cache
     * @param from  Start time in epoch milliseconds (inclusive)
     * @param to    End time in epoch milliseconds (exclusive)
     */
    @GetMapping("/counts")
    public ResponseEntity<CountResponse> getCounts(
            @RequestParam String query,
            @RequestParam long from,
            @RequestParam long to
    ) {
        log.info("Count request: query='{}' from={} to={}", query, from, to);

        CountRequest request = CountRequest.ofEpochMillis(query, from, to);
        List<MinuteCount> counts = logCountService.count(request);

        if (counts.isEmpty()) {
            log.debug("No events for query='{}' from={} to={}", query, from, to);
        }
        return ResponseEntity.ok(CountResponse.ok(query, counts));
    }

    /**
     * Several queries in one call. Any failure fails the whole batch.
     */
    @PostMapping("/query")
    public ResponseEntity<BatchQueryResponse> query(@RequestBody BatchQueryRequest batch) {
        if (batch.queries() == null || batch.queries().isEmpty()) {
            throw new MalformedRequestException("At least one query is required");
        }

        Map<String, CountRequest> requests = new LinkedHashMap<>();
        for (BatchQueryRequest.Query q : batch.queries()) {
            if (q.refId() == null || q.refId().isBlank()) {
                throw new MalformedRequestException("Every query needs a refId");
            }
            if (q.from() == null || q.to() == null) {
                throw new MalformedRequestException("Query " + q.refId() + " needs both 'from' and 'to'");
            }
            if (requests.putIfAbsent(q.refId(), CountRequest.ofEpochMillis(q.queryText(), q.from(), q.to())) != null) {
                throw new MalformedRequestException("Duplicate refId: " + q.refId());
            }
        }
        log.info("Batch request: {} queries", requests.size());

        Map<String, List<MinuteCount>> counts = logCountService.countAll(requests);

        Map<String, CountResponse> results = new LinkedHashMap<>();
        counts.forEach((refId, minuteCounts) ->
                results.put(refId, CountResponse.ok(requests.get(refId).query(), minuteCounts)));
        return ResponseEntity.ok(new BatchQueryResponse(results));
    }

    @ExceptionHandler(MalformedRequestException.class)
    public ResponseEntity<CountResponse> handleMalformedRequest(MalformedRequestException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(CountResponse.error(e.getMessage()));
    }

    @ExceptionHandler(UpstreamFetchException.class)
    public ResponseEntity<CountResponse> handleUpstreamFailure(UpstreamFetchException e) {
        log.warn("Upstream fetch failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(CountResponse.error(e.getMessage()));
    }
}
