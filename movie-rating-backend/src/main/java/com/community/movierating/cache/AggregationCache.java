package com.community.movierating.cache;

import com.community.movierating.config.MovieRatingProperties;
import com.community.movierating.dto.RatingStats;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TTL cache of per-item aggregates.
 * <p>
 * Each key owns a slot holding a generation and, optionally, a cached entry. {@link #invalidate}
 * drops the entry and moves the slot to a fresh generation. A reader that missed records
 * {@link #generation} before querying the store and hands it back to {@link #put}; the put is
 * refused if the key was invalidated in between, so a snapshot taken before a write can never be
 * published after it.
 * <p>
 * Generations are drawn from one global sequence. When the sweep drops a slot, the slot's
 * generation is folded into {@code evictedFloor}, which is what absent keys report. A reader holding
 * a generation from before the sweep therefore never matches a slot created after it.
 */
@Component
public class AggregationCache {

    private static final Logger log = LoggerFactory.getLogger(AggregationCache.class);

    private final ConcurrentMap<RatingKey, Slot> slots = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong evictedFloor = new AtomicLong();

    private final Clock clock;
    private final Duration ttl;

    @Autowired
    public AggregationCache(Clock clock, MovieRatingProperties properties) {
        this(clock, properties.getCache().getTtl());
    }

    public AggregationCache(Clock clock, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("cache ttl must be positive: " + ttl);
        }
        this.clock = clock;
        this.ttl = ttl;
    }

    public Optional<RatingStats> get(RatingKey key) {
        Slot slot = slots.get(key);
        if (slot == null || slot.entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (slot.entry.isExpired(now, ttl)) {
            // drop the stale entry but keep the generation
            slots.computeIfPresent(key, (k, current) ->
                    current.entry != null && current.entry.isExpired(now, ttl) ? current.withoutEntry() : current);
            return Optional.empty();
        }
        return Optional.of(slot.entry.stats);
    }

    /**
     * Generation to pass to {@link #put} after reading the store.
     */
    public long generation(RatingKey key) {
        Slot slot = slots.get(key);
        return slot != null ? slot.generation : evictedFloor.get();
    }

    /**
     * Publishes stats computed after {@code observedGeneration} was read.
     *
     * @return false if the key was invalidated since, in which case nothing is stored
     */
    public boolean put(RatingKey key, RatingStats stats, long observedGeneration) {
        Instant now = clock.instant();
        boolean[] accepted = new boolean[1];
        slots.compute(key, (k, current) -> {
            long currentGeneration = current != null ? current.generation : evictedFloor.get();
            if (currentGeneration != observedGeneration) {
                return current;
            }
            accepted[0] = true;
            return new Slot(currentGeneration, new Entry(stats, now));
        });
        if (!accepted[0]) {
            log.debug("Rejected stale aggregate for {} (observed generation {})", key, observedGeneration);
        }
        return accepted[0];
    }

    /**
     * Unconditionally removes the entry for {@code key}, regardless of its remaining TTL.
     */
    public void invalidate(RatingKey key) {
        slots.compute(key, (k, current) -> new Slot(sequence.incrementAndGet(), null));
    }

    /**
     * Removes expired entries, and slots left empty by invalidation.
     *
     * @return number of slots removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        AtomicInteger removed = new AtomicInteger();
        for (RatingKey key : slots.keySet()) {
            slots.computeIfPresent(key, (k, slot) -> {
                if (slot.entry != null && !slot.entry.isExpired(now, ttl)) {
                    return slot;
                }
                evictedFloor.accumulateAndGet(slot.generation, Math::max);
                removed.incrementAndGet();
                return null;
            });
        }
        return removed.get();
    }

    @Scheduled(fixedDelayString = "${movie-rating.cache.sweep-interval-ms:60000}")
    public void scheduledSweep() {
        int removed = sweepExpired();
        if (removed > 0) {
            log.debug("Aggregate cache sweep removed {} slots, {} remaining", removed, slots.size());
        }
    }

    /**
     * Number of live cached aggregates.
     */
    public int size() {
        int count = 0;
        for (Slot slot : slots.values()) {
            if (slot.entry != null) {
                count++;
            }
        }
        return count;
    }

    @PreDestroy
    public void clear() {
        // raise the floor past everything handed out so far
        evictedFloor.accumulateAndGet(sequence.incrementAndGet(), Math::max);
        slots.clear();
    }

    private static final class Slot {
        private final long generation;
        private final Entry entry;

        private Slot(long generation, Entry entry) {
            this.generation = generation;
            this.entry = entry;
        }

        private Slot withoutEntry() {
            return new Slot(generation, null);
        }
    }

    private static final class Entry {
        private final RatingStats stats;
        private final Instant insertedAt;

        private Entry(RatingStats stats, Instant insertedAt) {
            this.stats = stats;
            this.insertedAt = insertedAt;
        }

        // age must never exceed the ttl when read
        private boolean isExpired(Instant now, Duration ttl) {
            return Duration.between(insertedAt, now).compareTo(ttl) >= 0;
        }
    }
}
