package com.community.movierating.exception;

import com.community.movierating.dto.RatingContext;

/**
 * An item already has an active summary message in the context.
 */
public class ItemAlreadyPostedException extends RuntimeException {

    private final Long existingMessageId;

    public ItemAlreadyPostedException(String imdbId, RatingContext context, Long existingMessageId) {
        super("Movie " + imdbId + " is already posted in " + context + " as message " + existingMessageId);
        this.existingMessageId = existingMessageId;
    }

    public Long getExistingMessageId() {
        return existingMessageId;
    }
}
