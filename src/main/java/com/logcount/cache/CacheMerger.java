package com.logcount.cache;

import com.logcount.event.LogEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Folds freshly fetched events into the cache entry for a fingerprint.
 *
 * <p>Minutes present in the fetched batch are overwritten with the batch's count, so a
 * minute fetched twice (the refetch margin in {@link RangeResolver}) is corrected rather
 * than double counted. Merging the same batch twice gives the same result as merging it once.
 *
 * <p>Callers must hold the fingerprint lock ({@link CacheStore#withLock}).
 */
@Component
public class CacheMerger {

    private static final Logger log = LoggerFactory.getLogger(CacheMerger.class);

    private final CacheStore cacheStore;

    public CacheMerger(CacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * @param fingerprint Normalized query fingerprint
     * @param events      Every event fetched for {@code [fetchStart, reqEnd)}
     * @param reqStart    Start of the full requested window, becomes the entry's start
     * @param reqEnd      End of the full requested window, becomes the entry's end
     * @return the updated entry, already stored
     */
    public CacheEntry merge(String fingerprint, Collection<LogEvent> events, Instant reqStart, Instant reqEnd) {
        CacheEntry entry = cacheStore.get(fingerprint)
                .orElseGet(() -> new CacheEntry(fingerprint, reqStart, reqEnd));

        Map<Instant, Long> batchCounts = new TreeMap<>();
        for (LogEvent event : events) {
            batchCounts.merge(BucketedSeries.minuteOf(event.timestamp()), 1L, Long::sum);
        }

        BucketedSeries series = entry.getSeries();
        batchCounts.forEach(series::setCount);

        entry.reWindow(reqStart, reqEnd);
        int prunedBefore = series.pruneBefore(reqStart);
        int prunedAfter = series.pruneFrom(reqEnd);

        cacheStore.set(fingerprint, entry);

        log.debug("[{}] Merged {} events into {} minutes; window=[{}, {}) pruned={} buckets={}",
                fingerprint, events.size(), batchCounts.size(), reqStart, reqEnd,
                prunedBefore + prunedAfter, series.size());
        return entry;
    }
}
