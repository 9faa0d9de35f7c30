package com.logcount.controller;

import com.logcount.cache.CacheStore;
import com.logcount.cache.RangeResolver;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for health monitoring and cache introspection.
 */
@RestController
public class StatusController {

    private final CacheStore cacheStore;
    private final RangeResolver rangeResolver;

    public StatusController(CacheStore cacheStore, RangeResolver rangeResolver) {
        this.cacheStore = cacheStore;
        this.rangeResolver = rangeResolver;
    }

    /**
     * Simple liveness probe.
     * GET /ping → {"status": "ok"}
     */
    @GetMapping("/ping")
    public ResponseEntity<Map<String, String>> ping() {
        return ResponseEntity.ok(Map.of("status", "ok"));
    }

    /**
     * Cache status.
     * GET /status → entry and bucket counts, refetch margin, etc.
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().getEpochSecond(),
                "cachedQueries", cacheStore.size(),
                "totalBuckets", cacheStore.totalBuckets(),
                "refetchMarginMinutes", rangeResolver.getRefetchMargin().toMinutes(),
                "resolution", "1m"
        ));
    }

    /**
     * Lists the fingerprints currently cached.
     * GET /cache → ["service:web status:error", ...]
     */
    @GetMapping("/cache")
    public ResponseEntity<List<String>> cachedQueries() {
        return ResponseEntity.ok(cacheStore.fingerprints());
    }

    /**
     * Drops every cache entry.
     * DELETE /cache → {"cleared": 3}
     */
    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Integer>> clearCache() {
        return ResponseEntity.ok(Map.of("cleared", cacheStore.clear()));
    }
}
