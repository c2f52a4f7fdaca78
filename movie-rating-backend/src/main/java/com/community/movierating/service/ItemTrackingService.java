package com.community.movierating.service;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.entity.TrackedItem;

import java.util.Optional;

public interface ItemTrackingService {

    /**
     * Records that a summary for {@code imdbId} was posted as {@code messageId}.
     * Re-uses a row whose message was cleared; refuses a second active message.
     *
     * @throws com.community.movierating.exception.ItemAlreadyPostedException if an active message exists
     */
    TrackedItem registerPosting(String imdbId, RatingContext context, Long messageId, String trailerUrl);

    Optional<TrackedItem> findByDisplayMessage(Long messageId, RatingContext context);

    Optional<TrackedItem> findItem(String imdbId, RatingContext context);

    /**
     * Forgets the summary message so the movie can be posted again. Ratings are kept.
     *
     * @return true if a reference was cleared
     */
    boolean clearDisplayMessage(String imdbId, RatingContext context);

    long countTracked();

    long countGuilds();
}
