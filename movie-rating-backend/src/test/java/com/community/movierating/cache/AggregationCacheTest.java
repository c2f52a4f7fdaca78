package com.community.movierating.cache;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;
import com.community.movierating.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class AggregationCacheTest {

    private static final Duration TTL = Duration.ofSeconds(300);
    private static final RatingKey KEY = RatingKey.of("tt0111161", RatingContext.of(10L, 1L));
    private static final RatingKey OTHER = RatingKey.of("tt0068646", RatingContext.of(10L, 1L));

    private MutableClock clock;
    private AggregationCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-09-12T08:00:00Z"));
        cache = new AggregationCache(clock, TTL);
    }

    @Test
    void testMissThenHit() {
        assertTrue(cache.get(KEY).isEmpty());

        RatingStats stats = RatingStats.fromValues(List.of(7));
        assertTrue(cache.put(KEY, stats, cache.generation(KEY)));

        assertEquals(stats, cache.get(KEY).orElseThrow());
        assertEquals(1, cache.size());
    }

    @Test
    void testEntryExpiresAtTtl() {
        cache.put(KEY, RatingStats.fromValues(List.of(7)), cache.generation(KEY));

        clock.advance(TTL.minusSeconds(1));
        assertTrue(cache.get(KEY).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(KEY).isEmpty());
    }

    @Test
    void testInvalidateRemovesRegardlessOfTtl() {
        cache.put(KEY, RatingStats.fromValues(List.of(7)), cache.generation(KEY));
        cache.put(OTHER, RatingStats.fromValues(List.of(3)), cache.generation(OTHER));

        cache.invalidate(KEY);

        assertTrue(cache.get(KEY).isEmpty());
        assertTrue(cache.get(OTHER).isPresent());
    }

    @Test
    void testPutWithGenerationFromBeforeInvalidationIsRejected() {
        long observed = cache.generation(KEY);
        RatingStats beforeWrite = RatingStats.fromValues(List.of(7));

        // a write lands between the reader's store query and its put
        cache.invalidate(KEY);

        assertFalse(cache.put(KEY, beforeWrite, observed));
        assertTrue(cache.get(KEY).isEmpty());

        RatingStats afterWrite = RatingStats.fromValues(List.of(9));
        assertTrue(cache.put(KEY, afterWrite, cache.generation(KEY)));
        assertEquals(afterWrite, cache.get(KEY).orElseThrow());
    }

    @Test
    void testStalePutRejectedEvenAfterSweepDroppedTheSlot() {
        long observed = cache.generation(KEY);
        cache.invalidate(KEY);
        assertEquals(1, cache.sweepExpired());

        assertFalse(cache.put(KEY, RatingStats.fromValues(List.of(7)), observed));
        assertTrue(cache.get(KEY).isEmpty());
    }

    @Test
    void testSweepRemovesOnlyExpiredEntries() {
        cache.put(KEY, RatingStats.fromValues(List.of(7)), cache.generation(KEY));
        clock.advance(Duration.ofSeconds(200));
        cache.put(OTHER, RatingStats.fromValues(List.of(3)), cache.generation(OTHER));
        clock.advance(Duration.ofSeconds(100));

        assertEquals(1, cache.sweepExpired());
        assertTrue(cache.get(KEY).isEmpty());
        assertTrue(cache.get(OTHER).isPresent());
    }

    @Test
    void testClearForgetsEverythingAndOutstandingGenerations() {
        long observed = cache.generation(KEY);
        cache.put(OTHER, RatingStats.fromValues(List.of(3)), cache.generation(OTHER));

        cache.clear();

        assertEquals(0, cache.size());
        assertFalse(cache.put(KEY, RatingStats.fromValues(List.of(7)), observed));
    }

    @Test
    void testRejectsNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new AggregationCache(clock, Duration.ZERO));
    }

    @Test
    void testConcurrentAccessLeavesConsistentState() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        cache.invalidate(KEY);
                        cache.sweepExpired();
                    }
                    return null;
                });
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 2_000; i++) {
                        long generation = cache.generation(KEY);
                        cache.put(KEY, RatingStats.fromValues(List.of(5)), generation);
                        cache.get(KEY);
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }
        assertThat(cache.size()).isLessThanOrEqualTo(1);

        // a final write wins over anything published before it
        long stale = cache.generation(KEY);
        cache.invalidate(KEY);
        assertTrue(cache.get(KEY).isEmpty());
        assertFalse(cache.put(KEY, RatingStats.fromValues(List.of(1)), stale));
    }
}
