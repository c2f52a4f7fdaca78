package com.community.movierating.service;

import com.community.movierating.dto.ReactionEvent;
import com.community.movierating.dto.ReactionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs reaction events off the caller's thread.
 * <p>
 * Events for the same summary message are chained so they are applied in arrival order (a quick
 * add-then-remove must not be reordered); events for different messages run in parallel. Each chain
 * is dropped once its last event completes.
 */
@Service
public class ReactionEventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ReactionEventDispatcher.class);

    private final ReactionEventRouter router;
    private final Executor executor;

    private final Map<String, CompletableFuture<ReactionOutcome>> tails = new ConcurrentHashMap<>();

    public ReactionEventDispatcher(ReactionEventRouter router,
                                   @Qualifier("reactionEventExecutor") Executor executor) {
        this.router = router;
        this.executor = executor;
    }

    public CompletableFuture<ReactionOutcome> dispatchAdd(ReactionEvent event) {
        return enqueue(event, router::onReactionAdd);
    }

    public CompletableFuture<ReactionOutcome> dispatchRemove(ReactionEvent event) {
        return enqueue(event, router::onReactionRemove);
    }

    /**
     * Number of messages with events still in flight.
     */
    public int pendingChains() {
        return tails.size();
    }

    private CompletableFuture<ReactionOutcome> enqueue(ReactionEvent event,
                                                       Function<ReactionEvent, ReactionOutcome> handler) {
        String key = chainKey(event);
        CompletableFuture<ReactionOutcome> next = tails.compute(key, (k, tail) -> {
            CompletableFuture<?> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            // a failed predecessor must not block the events behind it
            return previous.handle((ignored, failure) -> null)
                    .thenApplyAsync(ignored -> handler.apply(event), executor);
        });
        next.whenComplete((outcome, failure) -> {
            tails.remove(key, next);
            if (failure != null) {
                log.error("Reaction event {} on message {} failed", event.getEmoji(), event.getMessageId(), failure);
            } else {
                log.debug("Reaction event {} by user {} on message {}: {}", event.getEmoji(), event.getUserId(),
                        event.getMessageId(), outcome);
            }
        });
        return next;
    }

    private static String chainKey(ReactionEvent event) {
        return event.getGuildId() + "/" + event.getChannelId() + "/" + event.getMessageId();
    }
}
