package com.logcount.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheStore")
class CacheStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    private CacheStore store;

    private static CacheEntry entry(String query, long minutes) {
        CacheEntry entry = new CacheEntry(query, T0, T0.plusSeconds(minutes * 60));
        for (long m = 0; m < minutes; m++) {
            entry.getSeries().setCount(T0.plusSeconds(m * 60), 1);
        }
        return entry;
    }

    @BeforeEach
    void setUp() {
        store = new CacheStore();
    }

    @Test
    @DisplayName("get on an unknown fingerprint is empty and does not create an entry")
    void getDoesNotCreate() {
        assertThat(store.get("errors")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("set then get returns the same entry")
    void setAndGet() {
        CacheEntry entry = entry("errors", 3);
        store.set("errors", entry);

        assertThat(store.get("errors")).containsSame(entry);
    }

    @Test
    @DisplayName("set replaces the previous entry wholesale")
    void setReplaces() {
        store.set("errors", entry("errors", 3));
        CacheEntry replacement = entry("errors", 1);
        store.set("errors", replacement);

        assertThat(store.get("errors")).containsSame(replacement);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("different fingerprints are stored independently")
    void fingerprintIsolation() {
        store.set("errors", entry("errors", 2));
        store.set("warnings", entry("warnings", 5));

        assertThat(store.get("errors").orElseThrow().getSeries().size()).isEqualTo(2);
        assertThat(store.get("warnings").orElseThrow().getSeries().size()).isEqualTo(5);
        assertThat(store.get("debug")).isEmpty();
    }

    @Test
    @DisplayName("fingerprints are listed sorted and buckets are totalled across entries")
    void introspection() {
        store.set("warnings", entry("warnings", 5));
        store.set("errors", entry("errors", 2));

        assertThat(store.fingerprints()).containsExactly("errors", "warnings");
        assertThat(store.totalBuckets()).isEqualTo(7);
    }

    @Test
    @DisplayName("clear empties the store and reports how many entries it dropped")
    void clearEmptiesStore() {
        store.set("errors", entry("errors", 2));
        store.set("warnings", entry("warnings", 2));

        assertThat(store.clear()).isEqualTo(2);
        assertThat(store.size()).isZero();
        assertThat(store.get("errors")).isEmpty();
    }

    @Test
    @DisplayName("withLock returns the action's result")
    void withLockReturnsResult() {
        assertThat(store.withLock("errors", () -> 42)).isEqualTo(42);
    }

    @Test
    @DisplayName("withLock never lets two actions on one fingerprint overlap")
    void withLockSerializesSameFingerprint() throws InterruptedException {
        int threads = 8;
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        for (int t = 0; t < threads; t++) {
            executor.submit(() -> {
                try {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        store.withLock("errors", () -> {
                            int now = inside.incrementAndGet();
                            maxInside.accumulateAndGet(now, Math::max);
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("withLock on one fingerprint does not block another fingerprint")
    void withLockDoesNotBlockOtherFingerprints() throws InterruptedException {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        executor.submit(() -> store.withLock("errors", () -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));

        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();
        // "errors" is still locked by the other thread
        assertThat(store.withLock("warnings", () -> "ran")).isEqualTo("ran");

        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("clear drops entries but keeps locks, so a held lock still excludes other callers")
    void clearKeepsLocks() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        executor.submit(() -> store.withLock("errors", () -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return null;
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        store.set("errors", entry("errors", 3));
        store.clear();
        Future<String> waiting = executor.submit(() -> store.withLock("errors", () -> "ran"));

        assertThatThrownBy(() -> waiting.get(200, TimeUnit.MILLISECONDS)).isInstanceOf(TimeoutException.class);
        release.countDown();
        assertThat(waiting.get(5, TimeUnit.SECONDS)).isEqualTo("ran");
        assertThat(store.size()).isZero();

        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    }
}
