package com.logcount.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides where an upstream fetch has to start for a request, given what is already cached.
 *
 * <p>When the requested start falls strictly inside the cached window, only the tail needs
 * fetching. The fetch starts a little before the cached end (the refetch margin, 2 minutes
 * by default) because events close to the previous boundary may have arrived late; those
 * minutes are overwritten on merge, never added to. Any other request is a full fetch.
 */
@Component
public class RangeResolver {

    private static final Logger log = LoggerFactory.getLogger(RangeResolver.class);

    private final CacheStore cacheStore;
    private final Duration refetchMargin;

    public RangeResolver(CacheStore cacheStore,
                         @Value("${logcount.cache.refetch-margin-minutes:2}") long refetchMarginMinutes) {
        if (refetchMarginMinutes < 0) {
            throw new IllegalArgumentException("Refetch margin must not be negative: " + refetchMarginMinutes);
        }
        this.cacheStore = cacheStore;
        this.refetchMargin = Duration.ofMinutes(refetchMarginMinutes);
    }

    /**
     * @param fingerprint Normalized query fingerprint
     * @param reqStart    Requested window start
     * @return the start time to send upstream
     */
    public Instant resolveFetchStart(String fingerprint, Instant reqStart) {
        return cacheStore.get(fingerprint)
                .map(entry -> resolveAgainst(entry, reqStart))
                .orElseGet(() -> {
                    log.debug("[{}] Cache miss: no entry, fetching from {}", fingerprint, reqStart);
                    return reqStart;
                });
    }

    private Instant resolveAgainst(CacheEntry entry, Instant reqStart) {
        Instant cachedStart = entry.getStartTime();
        Instant cachedEnd = entry.getEndTime();

        if (cachedEnd.isAfter(reqStart) && reqStart.isAfter(cachedStart)) {
            Instant fetchStart = BucketedSeries.minuteOf(cachedEnd.minus(refetchMargin));
            log.debug("[{}] Cache hit: cached=[{}, {}) reqStart={} fetchStart={}",
                    entry.getQuery(), cachedStart, cachedEnd, reqStart, fetchStart);
            return fetchStart;
        }

        log.debug("[{}] Cache miss: cached=[{}, {}) does not overlap reqStart={}",
                entry.getQuery(), cachedStart, cachedEnd, reqStart);
        return reqStart;
    }

    public Duration getRefetchMargin() {
        return refetchMargin;
    }
}
