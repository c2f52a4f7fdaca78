package com.community.movierating.gateway;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Fallback display: logs the aggregate instead of editing a message.
 */
public class LoggingRatingDisplay implements RatingDisplay {

    private static final Logger log = LoggerFactory.getLogger(LoggingRatingDisplay.class);

    @Override
    public CompletableFuture<Void> refresh(String imdbId, RatingContext context, Long messageId, RatingStats stats) {
        log.info("[display] {} in {} (message {}): average {} over {} votes",
                imdbId, context, messageId, stats.getAverage(), stats.getCount());
        return CompletableFuture.completedFuture(null);
    }
}
