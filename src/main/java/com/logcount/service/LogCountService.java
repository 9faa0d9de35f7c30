package com.logcount.service;

import com.logcount.cache.BucketedSeries;
import com.logcount.cache.CacheEntry;
import com.logcount.cache.CacheMerger;
import com.logcount.cache.CacheStore;
import com.logcount.cache.RangeResolver;
import com.logcount.event.LogEvent;
import com.logcount.model.CountRequest;
import com.logcount.model.MinuteCount;
import com.logcount.upstream.LogPage;
import com.logcount.upstream.LogSource;
import com.logcount.upstream.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Answers per-minute count requests, fetching from the {@link LogSource} only what the
 * cache cannot already provide.
 *
 * <p>Each request runs RESOLVE, FETCH, MERGE and EXTRACT in order while holding the lock for
 * its fingerprint, so concurrent requests for the same query are serialized and never fetch
 * the same range twice. Requests for different queries proceed in parallel.
 *
 * <p>A failed fetch aborts before MERGE: the cache keeps its previous state and the
 * {@link UpstreamFetchException} reaches the caller unchanged.
 */
@Service
public class LogCountService {

    private static final Logger log = LoggerFactory.getLogger(LogCountService.class);

    private final CacheStore cacheStore;
    private final RangeResolver rangeResolver;
    private final CacheMerger cacheMerger;
    private final LogSource logSource;
    private final int maxPages;

    public LogCountService(CacheStore cacheStore,
                           RangeResolver rangeResolver,
                           CacheMerger cacheMerger,
                           LogSource logSource,
                           @Value("${logcount.upstream.max-pages:1000}") int maxPages) {
        if (maxPages < 1) {
            throw new IllegalArgumentException("Max pages must be at least 1: " + maxPages);
        }
        this.cacheStore = cacheStore;
        this.rangeResolver = rangeResolver;
        this.cacheMerger = cacheMerger;
        this.logSource = logSource;
        this.maxPages = maxPages;
    }

    /**
     * Per-minute counts for {@code [request.start(), request.end())}, ascending by time.
     * Minutes without events are absent.
     *
     * @throws UpstreamFetchException if the log source fails; the cache is left unchanged
     */
    public List<MinuteCount> count(CountRequest request) {
        String fingerprint = request.fingerprint();
        return cacheStore.withLock(fingerprint, () -> {
            Instant fetchStart = rangeResolver.resolveFetchStart(fingerprint, request.start());

            List<LogEvent> events = fetchStart.isBefore(request.end())
                    ? fetchAll(request.query(), fetchStart, request.end())
                    : List.of();

            CacheEntry entry = cacheMerger.merge(fingerprint, events, request.start(), request.end());

            List<MinuteCount> result = extract(entry);
            log.info("[{}] Served [{}, {}): fetched from {} ({} events), returning {} buckets",
                    fingerprint, request.start(), request.end(), fetchStart, events.size(), result.size());
            return result;
        });
    }

    /**
     * Runs each request in order. The first failure aborts the whole batch.
     *
     * @param requests Requests keyed by caller-chosen reference id
     * @return results keyed by the same reference ids, in the same order
     */
    public Map<String, List<MinuteCount>> countAll(Map<String, CountRequest> requests) {
        Map<String, List<MinuteCount>> results = new LinkedHashMap<>();
        requests.forEach((refId, request) -> results.put(refId, count(request)));
        return results;
    }

    /** Follows continuation tokens until the source reports no more pages. */
    private List<LogEvent> fetchAll(String queryText, Instant start, Instant end) {
        List<LogEvent> events = new ArrayList<>();
        LogPage page = logSource.fetch(queryText, start, end, null);
        events.addAll(page.events());

        int pages = 1;
        while (page.hasMore()) {
            if (pages >= maxPages) {
                throw new UpstreamFetchException("Pagination did not finish after " + maxPages
                        + " pages for query '" + queryText + "'");
            }
            page = logSource.fetch(queryText, start, end, page.nextLogId());
            events.addAll(page.events());
            pages++;
        }

        log.debug("Fetched {} events in {} pages: query='{}' range=[{}, {})", events.size(), pages, queryText, start, end);
        return events;
    }

    /** Must be called while holding the fingerprint lock. */
    private static List<MinuteCount> extract(CacheEntry entry) {
        BucketedSeries series = entry.getSeries();
        List<MinuteCount> result = new ArrayList<>(series.size());
        for (Instant minute : series.orderedKeys()) {
            result.add(new MinuteCount(minute, series.count(minute)));
        }
        return result;
    }
}
