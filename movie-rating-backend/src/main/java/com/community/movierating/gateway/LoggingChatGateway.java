package com.community.movierating.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback used when no chat platform adapter is registered: logs what would have been sent.
 */
public class LoggingChatGateway implements ChatGateway {

    private static final Logger log = LoggerFactory.getLogger(LoggingChatGateway.class);

    @Override
    public CompletableFuture<Void> removeReaction(Long userId, Long channelId, Long messageId, String emoji) {
        log.info("[gateway] remove reaction {} of user {} on message {} (channel {})", emoji, userId, messageId, channelId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> sendTransientNotice(Long channelId, String text, Duration lifetime) {
        log.info("[gateway] notice to channel {} for {}s: {}", channelId, lifetime.toSeconds(), text);
        return CompletableFuture.completedFuture(null);
    }
}
