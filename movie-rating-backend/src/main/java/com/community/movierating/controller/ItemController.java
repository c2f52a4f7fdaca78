package com.community.movierating.controller;

import com.community.movierating.dto.CommonResponse;
import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingSummaryDTO;
import com.community.movierating.dto.TrackedItemDTO;
import com.community.movierating.entity.TrackedItem;
import com.community.movierating.service.ItemTrackingService;
import com.community.movierating.service.RatingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/items")
public class ItemController {

    private final ItemTrackingService itemTrackingService;
    private final RatingService ratingService;

    public ItemController(ItemTrackingService itemTrackingService, RatingService ratingService) {
        this.itemTrackingService = itemTrackingService;
        this.ratingService = ratingService;
    }

    /**
     * POST /api/v1/items
     * Registers a posted summary message and returns the rating block to render on it.
     * 409 when the movie already has an active summary in the channel.
     */
    @PostMapping
    public ResponseEntity<CommonResponse<RatingSummaryDTO>> registerPosting(@RequestBody TrackedItemDTO request) {
        RatingContext context = RatingContext.of(request.getChannelId(), request.getGuildId());
        TrackedItem item = itemTrackingService.registerPosting(request.getImdbId(), context,
                request.getMessageId(), request.getTrailerUrl());
        RatingSummaryDTO summary = ratingService.validateRating(item.getImdbId(), context);
        return ResponseEntity.status(201).body(CommonResponse.of(201, "Tracking " + item.getImdbId(), summary));
    }

    /**
     * DELETE /api/v1/items/{imdbId}/message?channelId=&guildId=
     * Called when the summary message was deleted, so the movie can be posted again.
     */
    @DeleteMapping("/{imdbId}/message")
    public ResponseEntity<CommonResponse<Boolean>> clearDisplayMessage(@PathVariable("imdbId") String imdbId,
                                                                       @RequestParam("channelId") Long channelId,
                                                                       @RequestParam("guildId") Long guildId) {
        boolean cleared = itemTrackingService.clearDisplayMessage(imdbId, RatingContext.of(channelId, guildId));
        return ResponseEntity.ok(CommonResponse.success(cleared));
    }
}
