package com.logcount.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory store of {@link CacheEntry}s keyed by normalized query fingerprint.
 *
 * <p>The map itself is a {@link ConcurrentHashMap}, so lookups never block. Entries are
 * mutable, though: anything that reads an entry and then writes it back must do so inside
 * {@link #withLock(String, Supplier)} for that fingerprint. Each fingerprint gets its own
 * {@link ReentrantLock}, so requests for different queries never contend.
 *
 * <p>Entries live for the lifetime of the process unless {@link #clear()} is called.
 * The lock registry is not cleared with them: it holds one lock per distinct fingerprint ever
 * queried, so its memory grows with the number of distinct queries and survives {@link #clear()}.
 */
@Repository
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final ConcurrentMap<String, CacheEntry> entries = new ConcurrentHashMap<>();

    /** Lock registry. Locks are never removed so two threads can't end up with different locks for one key. */
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * Pure lookup. An absent entry is never created here; callers create it explicitly.
     */
    public Optional<CacheEntry> get(String fingerprint) {
        return Optional.ofNullable(entries.get(fingerprint));
    }

    /**
     * Insert or replace the entry for a fingerprint.
     */
    public void set(String fingerprint, CacheEntry entry) {
        entries.put(fingerprint, entry);
        log.debug("Stored entry: fingerprint={} window=[{}, {}) buckets={}",
                fingerprint, entry.getStartTime(), entry.getEndTime(), entry.getSeries().size());
    }

    /**
     * Run {@code action} while holding the lock for {@code fingerprint}.
     */
    public <T> T withLock(String fingerprint, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(fingerprint, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops every entry.
     *
     * @return number of entries removed
     */
    public int clear() {
        int removed = entries.size();
        entries.clear();
        log.info("Cache cleared: {} entries removed", removed);
        return removed;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns the fingerprints currently cached, sorted.
     */
    public List<String> fingerprints() {
        return entries.keySet().stream()
                .sorted()
                .toList();
    }

    /**
     * Total number of minute buckets held across all entries. Useful for the status endpoint.
     */
    public long totalBuckets() {
        return entries.values().stream()
                .mapToLong(entry -> entry.getSeries().size())
                .sum();
    }
}
