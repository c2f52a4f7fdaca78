package com.community.movierating.service;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;

import java.util.OptionalInt;

/**
 * Durable per-user ratings keyed by (user, movie, context).
 * <p>
 * All methods throw {@link com.community.movierating.exception.RatingPersistenceException} when the
 * database cannot be reached.
 */
public interface RatingStore {

    boolean hasRated(Long userId, String imdbId, RatingContext context);

    OptionalInt findRating(Long userId, String imdbId, RatingContext context);

    /**
     * Atomic insert-or-update on the (user, movie, context) unique key. Concurrent calls for the same
     * key never produce two rows; the last write wins.
     */
    void upsert(Long userId, String imdbId, RatingContext context, int rating);

    /**
     * Deletes the rating if present. Removing an absent rating is a successful no-op.
     *
     * @return true if a row was deleted
     */
    boolean remove(Long userId, String imdbId, RatingContext context);

    /**
     * Authoritative aggregate over all current ratings of the movie in the context.
     */
    RatingStats statsFor(String imdbId, RatingContext context);

    long countAll();
}
