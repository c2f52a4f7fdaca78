package com.community.movierating.gateway;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;

import java.util.concurrent.CompletableFuture;

/**
 * Projection of the aggregate onto the posted summary message.
 */
public interface RatingDisplay {

    /**
     * Re-renders the rating field of the summary for {@code imdbId} in {@code context}.
     * Completes exceptionally with {@link DisplayMessageGoneException} when the message no longer exists.
     */
    CompletableFuture<Void> refresh(String imdbId, RatingContext context, Long messageId, RatingStats stats);
}
