package com.community.movierating.controller;

import com.community.movierating.dto.CommonResponse;
import com.community.movierating.dto.ReactionEvent;
import com.community.movierating.dto.ReactionOutcome;
import com.community.movierating.service.ReactionEventDispatcher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

/**
 * Webhook for gateway adapters running out of process. Responds once the event reached a terminal state.
 */
@RestController
@RequestMapping("/api/v1/reactions")
public class ReactionController {

    private final ReactionEventDispatcher dispatcher;

    public ReactionController(ReactionEventDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    @PostMapping("/add")
    public CompletableFuture<ResponseEntity<CommonResponse<ReactionOutcome>>> reactionAdded(@RequestBody ReactionEvent event) {
        validate(event);
        return dispatcher.dispatchAdd(event).thenApply(ReactionController::toResponse);
    }

    @PostMapping("/remove")
    public CompletableFuture<ResponseEntity<CommonResponse<ReactionOutcome>>> reactionRemoved(@RequestBody ReactionEvent event) {
        validate(event);
        return dispatcher.dispatchRemove(event).thenApply(ReactionController::toResponse);
    }

    private static void validate(ReactionEvent event) {
        if (event.getUserId() == null || event.getMessageId() == null || event.getEmoji() == null) {
            throw new IllegalArgumentException("userId, messageId and emoji are required");
        }
        // channel and guild are checked by RatingContext
        event.context();
    }

    private static ResponseEntity<CommonResponse<ReactionOutcome>> toResponse(ReactionOutcome outcome) {
        if (outcome == ReactionOutcome.FAILED_PERSISTENCE) {
            return ResponseEntity.status(503).body(CommonResponse.of(503, "Rating store unavailable", outcome));
        }
        return ResponseEntity.ok(CommonResponse.success(outcome));
    }
}
