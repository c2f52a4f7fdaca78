package com.community.movierating.service;

import com.community.movierating.cache.AggregationCache;
import com.community.movierating.cache.RatingKey;
import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;
import com.community.movierating.dto.RatingSummaryDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Entry point for rating reads and writes.
 * <p>
 * Writes go to the {@link RatingStore} and invalidate the aggregate before returning, whether the
 * write succeeded or not. Reads are served from the {@link AggregationCache} and fall back to the
 * store on a miss or when the cache itself misbehaves.
 */
@Service
public class RatingService {

    private static final Logger log = LoggerFactory.getLogger(RatingService.class);

    static final String NOT_RATED_TEXT = "Not Rated yet";

    private final RatingStore ratingStore;
    private final AggregationCache aggregationCache;

    public RatingService(RatingStore ratingStore, AggregationCache aggregationCache) {
        this.ratingStore = ratingStore;
        this.aggregationCache = aggregationCache;
    }

    public OptionalInt findRating(Long userId, String imdbId, RatingContext context) {
        return ratingStore.findRating(userId, imdbId, context);
    }

    public boolean hasRated(Long userId, String imdbId, RatingContext context) {
        return ratingStore.hasRated(userId, imdbId, context);
    }

    /**
     * Inserts or replaces the user's rating.
     */
    public void recordRating(Long userId, String imdbId, RatingContext context, int rating) {
        RatingKey key = RatingKey.of(imdbId, context);
        try {
            ratingStore.upsert(userId, imdbId, context, rating);
        } finally {
            invalidate(key);
        }
    }

    /**
     * Deletes the user's rating; absent ratings are not an error.
     *
     * @return true if a rating was deleted
     */
    public boolean withdrawRating(Long userId, String imdbId, RatingContext context) {
        RatingKey key = RatingKey.of(imdbId, context);
        try {
            return ratingStore.remove(userId, imdbId, context);
        } finally {
            invalidate(key);
        }
    }

    /**
     * Current aggregate, from the cache when possible.
     */
    public RatingStats currentStats(String imdbId, RatingContext context) {
        RatingKey key = RatingKey.of(imdbId, context);
        long generation;
        try {
            Optional<RatingStats> cached = aggregationCache.get(key);
            if (cached.isPresent()) {
                return cached.get();
            }
            generation = aggregationCache.generation(key);
        } catch (RuntimeException e) {
            log.warn("Aggregate cache read failed for {}, using the store", key, e);
            return ratingStore.statsFor(imdbId, context);
        }

        RatingStats stats = ratingStore.statsFor(imdbId, context);
        try {
            aggregationCache.put(key, stats, generation);
        } catch (RuntimeException e) {
            log.warn("Aggregate cache write failed for {}", key, e);
        }
        return stats;
    }

    /**
     * Rating block for composing or re-rendering a summary message.
     */
    public RatingSummaryDTO validateRating(String imdbId, RatingContext context) {
        RatingStats stats = currentStats(imdbId, context);
        return new RatingSummaryDTO(imdbId, context.getChannelId(), context.getGuildId(),
                stats.getAverage(), stats.getCount(), displayText(stats));
    }

    static String displayText(RatingStats stats) {
        if (stats.isEmpty()) {
            return NOT_RATED_TEXT;
        }
        String votes = stats.getCount() == 1 ? "vote" : "votes";
        return String.format(Locale.ROOT, "⭐ %.1f/10 (%d %s)", stats.getAverage(), stats.getCount(), votes);
    }

    public long countRatings() {
        return ratingStore.countAll();
    }

    private void invalidate(RatingKey key) {
        try {
            aggregationCache.invalidate(key);
        } catch (RuntimeException e) {
            // the entry may still be live; nothing else can be done here
            log.error("Aggregate cache invalidation failed for {}", key, e);
        }
    }
}
