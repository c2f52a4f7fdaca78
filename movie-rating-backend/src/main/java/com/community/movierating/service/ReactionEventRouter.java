package com.community.movierating.service;

import com.community.movierating.codec.EmojiRatingCodec;
import com.community.movierating.config.MovieRatingProperties;
import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;
import com.community.movierating.dto.ReactionEvent;
import com.community.movierating.dto.ReactionOutcome;
import com.community.movierating.entity.TrackedItem;
import com.community.movierating.exception.RatingPersistenceException;
import com.community.movierating.gateway.ChatGateway;
import com.community.movierating.gateway.DisplayMessageGoneException;
import com.community.movierating.gateway.RatingDisplay;
import com.community.movierating.guard.SelfActionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Turns reaction add/remove events on movie summaries into rating changes.
 * <p>
 * Add: received, emoji validated, checked against the user's existing vote, persisted (which
 * invalidates the aggregate), then a display refresh is requested. Invalid and duplicate reactions
 * are stripped again after marking the {@link SelfActionGuard}, and the user gets a short notice.
 * <p>
 * Remove: the guard is consulted first so the engine's own removals are not mistaken for the user
 * withdrawing a vote. Otherwise the matching rating is deleted and the display refreshed.
 * <p>
 * Every call returns a terminal {@link ReactionOutcome}. Persistence is the source of truth: once a
 * rating is written, failures of the chat side are only logged.
 */
@Service
public class ReactionEventRouter {

    private static final Logger log = LoggerFactory.getLogger(ReactionEventRouter.class);

    static final String INVALID_EMOJI_NOTICE = "<@%d> please rate with a single reaction from 1️⃣ to 🔟.";
    static final String DUPLICATE_NOTICE = "<@%d> you already rated this movie %d/10.";

    private final EmojiRatingCodec codec;
    private final SelfActionGuard selfActionGuard;
    private final RatingService ratingService;
    private final ItemTrackingService itemTrackingService;
    private final ChatGateway chatGateway;
    private final RatingDisplay ratingDisplay;
    private final MovieRatingProperties properties;

    public ReactionEventRouter(EmojiRatingCodec codec,
                               SelfActionGuard selfActionGuard,
                               RatingService ratingService,
                               ItemTrackingService itemTrackingService,
                               ChatGateway chatGateway,
                               RatingDisplay ratingDisplay,
                               MovieRatingProperties properties) {
        this.codec = codec;
        this.selfActionGuard = selfActionGuard;
        this.ratingService = ratingService;
        this.itemTrackingService = itemTrackingService;
        this.chatGateway = chatGateway;
        this.ratingDisplay = ratingDisplay;
        this.properties = properties;
    }

    public ReactionOutcome onReactionAdd(ReactionEvent event) {
        if (isBotUser(event.getUserId())) {
            log.debug("Ignoring own reaction {} on message {}", event.getEmoji(), event.getMessageId());
            return ReactionOutcome.IGNORED_SELF_ACTION;
        }
        if (!hasContext(event)) {
            return ReactionOutcome.IGNORED_UNTRACKED;
        }
        RatingContext context = event.context();
        try {
            Optional<TrackedItem> tracked = itemTrackingService.findByDisplayMessage(event.getMessageId(), context);
            if (tracked.isEmpty()) {
                log.debug("Reaction on untracked message {} in {}", event.getMessageId(), context);
                return ReactionOutcome.IGNORED_UNTRACKED;
            }
            TrackedItem item = tracked.get();

            OptionalInt decoded = codec.decodeRating(event.getEmoji());
            if (decoded.isEmpty()) {
                log.warn("Rejected reaction {} from user {} on {}: not a rating", event.getEmoji(), event.getUserId(), item.getImdbId());
                stripReaction(event, event.getEmoji(), String.format(INVALID_EMOJI_NOTICE, event.getUserId()));
                return ReactionOutcome.REJECTED_INVALID_EMOJI;
            }
            int rating = decoded.getAsInt();

            OptionalInt previous = ratingService.findRating(event.getUserId(), item.getImdbId(), context);
            if (previous.isPresent() && previous.getAsInt() == rating) {
                log.warn("Rejected duplicate rating {} from user {} on {} in {}", rating, event.getUserId(), item.getImdbId(), context);
                stripReaction(event, event.getEmoji(), String.format(DUPLICATE_NOTICE, event.getUserId(), rating));
                return ReactionOutcome.REJECTED_DUPLICATE;
            }

            ratingService.recordRating(event.getUserId(), item.getImdbId(), context, rating);

            ReactionOutcome outcome;
            if (previous.isPresent()) {
                log.info("User {} changed rating of {} in {}: {} -> {}", event.getUserId(), item.getImdbId(), context,
                        previous.getAsInt(), rating);
                // the old keycap would otherwise stay on the message next to the new one
                codec.encode(previous.getAsInt()).ifPresent(oldEmoji -> stripReaction(event, oldEmoji, null));
                outcome = ReactionOutcome.UPDATED;
            } else {
                log.info("User {} rated {} in {}: {}", event.getUserId(), item.getImdbId(), context, rating);
                outcome = ReactionOutcome.ACCEPTED;
            }

            requestRefresh(item, context);
            return outcome;
        } catch (RatingPersistenceException | DataAccessException e) {
            log.error("Failed to process reaction add {} from user {} on message {} in {}",
                    event.getEmoji(), event.getUserId(), event.getMessageId(), context, e);
            return ReactionOutcome.FAILED_PERSISTENCE;
        }
    }

    public ReactionOutcome onReactionRemove(ReactionEvent event) {
        if (!hasContext(event)) {
            return ReactionOutcome.IGNORED_UNTRACKED;
        }
        RatingContext context = event.context();
        if (selfActionGuard.isSelfInitiated(event.getUserId(), event.getMessageId(), codec.canonical(event.getEmoji()))) {
            log.debug("Ignoring echo of corrective removal {} for user {} on message {}",
                    event.getEmoji(), event.getUserId(), event.getMessageId());
            return ReactionOutcome.IGNORED_SELF_ACTION;
        }
        if (isBotUser(event.getUserId())) {
            return ReactionOutcome.IGNORED_SELF_ACTION;
        }
        try {
            Optional<TrackedItem> tracked = itemTrackingService.findByDisplayMessage(event.getMessageId(), context);
            if (tracked.isEmpty()) {
                log.debug("Reaction removed from untracked message {} in {}", event.getMessageId(), context);
                return ReactionOutcome.IGNORED_UNTRACKED;
            }
            TrackedItem item = tracked.get();

            OptionalInt decoded = codec.decodeRating(event.getEmoji());
            if (decoded.isEmpty()) {
                log.info("Ignoring removal of non-rating reaction {} by user {} on {}", event.getEmoji(), event.getUserId(), item.getImdbId());
                return ReactionOutcome.IGNORED_INVALID_EMOJI;
            }

            OptionalInt current = ratingService.findRating(event.getUserId(), item.getImdbId(), context);
            if (current.isEmpty() || current.getAsInt() != decoded.getAsInt()) {
                log.info("Ignoring removal of {} by user {} on {}: stored rating is {}", event.getEmoji(), event.getUserId(),
                        item.getImdbId(), current.isPresent() ? current.getAsInt() : "none");
                return ReactionOutcome.IGNORED_STALE;
            }

            ratingService.withdrawRating(event.getUserId(), item.getImdbId(), context);
            log.info("User {} withdrew rating {} of {} in {}", event.getUserId(), decoded.getAsInt(), item.getImdbId(), context);

            requestRefresh(item, context);
            return ReactionOutcome.REMOVED;
        } catch (RatingPersistenceException | DataAccessException e) {
            log.error("Failed to process reaction remove {} from user {} on message {} in {}",
                    event.getEmoji(), event.getUserId(), event.getMessageId(), context, e);
            return ReactionOutcome.FAILED_PERSISTENCE;
        }
    }

    /**
     * Removes a reaction on the user's behalf. The guard is marked before the gateway call so the
     * echoed remove event is recognised.
     */
    private void stripReaction(ReactionEvent event, String emoji, String notice) {
        // keyed by the canonical keycap so "7⃣" and "7️⃣" echoes both match
        selfActionGuard.mark(event.getUserId(), event.getMessageId(), codec.canonical(emoji));
        whenFailed(call(() -> chatGateway.removeReaction(event.getUserId(), event.getChannelId(), event.getMessageId(), emoji)),
                e -> log.warn("Could not remove reaction {} of user {} on message {}", emoji, event.getUserId(), event.getMessageId(), e));
        if (notice != null) {
            Duration lifetime = properties.getNotice().getLifetime();
            whenFailed(call(() -> chatGateway.sendTransientNotice(event.getChannelId(), notice, lifetime)),
                    e -> log.warn("Could not send notice to channel {}: {}", event.getChannelId(), notice, e));
        }
    }

    private void requestRefresh(TrackedItem item, RatingContext context) {
        if (item.getMessageId() == null) {
            return;
        }
        RatingStats stats;
        try {
            stats = ratingService.currentStats(item.getImdbId(), context);
        } catch (RatingPersistenceException e) {
            // the rating is stored; the next read repairs the display
            log.warn("Rating of {} in {} saved but aggregate unavailable, display not refreshed", item.getImdbId(), context, e);
            return;
        }
        whenFailed(call(() -> ratingDisplay.refresh(item.getImdbId(), context, item.getMessageId(), stats)),
                e -> onRefreshFailure(item, context, e));
    }

    private void onRefreshFailure(TrackedItem item, RatingContext context, Throwable failure) {
        if (failure instanceof DisplayMessageGoneException) {
            log.warn("Summary message {} of {} in {} is gone, clearing it", item.getMessageId(), item.getImdbId(), context);
            try {
                itemTrackingService.clearDisplayMessage(item.getImdbId(), context);
            } catch (RuntimeException e) {
                log.error("Could not clear display message of {} in {}", item.getImdbId(), context, e);
            }
            return;
        }
        log.warn("Display refresh of {} in {} failed", item.getImdbId(), context, failure);
    }

    // direct-message reactions carry no guild and cannot belong to a tracked summary
    private static boolean hasContext(ReactionEvent event) {
        if (event.getChannelId() == null || event.getGuildId() == null) {
            log.debug("Ignoring reaction {} on message {} outside a guild channel", event.getEmoji(), event.getMessageId());
            return false;
        }
        return true;
    }

    private boolean isBotUser(Long userId) {
        return userId != null && userId.equals(properties.getBotUserId());
    }

    private static CompletableFuture<Void> call(Supplier<CompletableFuture<Void>> action) {
        try {
            CompletableFuture<Void> future = action.get();
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void whenFailed(CompletableFuture<Void> future, Consumer<Throwable> handler) {
        future.whenComplete((ignored, failure) -> {
            if (failure != null) {
                handler.accept(failure instanceof CompletionException && failure.getCause() != null
                        ? failure.getCause() : failure);
            }
        });
    }
}
