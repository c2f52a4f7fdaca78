package com.community.movierating.gateway;

/**
 * The summary message behind a tracked item was deleted on the chat side.
 */
public class DisplayMessageGoneException extends RuntimeException {

    private final Long messageId;

    public DisplayMessageGoneException(Long messageId) {
        super("Display message " + messageId + " no longer exists");
        this.messageId = messageId;
    }

    public Long getMessageId() {
        return messageId;
    }
}
