package com.community.movierating.gateway;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Outbound operations against the chat platform.
 * <p>
 * Implementations must not block the caller; failures are reported through the returned future.
 */
public interface ChatGateway {

    /**
     * Removes {@code userId}'s {@code emoji} reaction from a message.
     */
    CompletableFuture<Void> removeReaction(Long userId, Long channelId, Long messageId, String emoji);

    /**
     * Posts a short explanatory message that deletes itself after {@code lifetime}.
     */
    CompletableFuture<Void> sendTransientNotice(Long channelId, String text, Duration lifetime);
}
