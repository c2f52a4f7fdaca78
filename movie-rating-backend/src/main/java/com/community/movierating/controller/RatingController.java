package com.community.movierating.controller;

import com.community.movierating.dto.CommonResponse;
import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingSummaryDTO;
import com.community.movierating.service.RatingService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.OptionalInt;

@RestController
@RequestMapping("/api/v1/ratings")
public class RatingController {

    private final RatingService ratingService;

    public RatingController(RatingService ratingService) {
        this.ratingService = ratingService;
    }

    /**
     * GET /api/v1/ratings/item/{imdbId}?channelId=&guildId=
     * Aggregate and display text for a movie, as used when composing its summary.
     */
    @GetMapping("/item/{imdbId}")
    public ResponseEntity<CommonResponse<RatingSummaryDTO>> getItemRating(@PathVariable("imdbId") String imdbId,
                                                                          @RequestParam("channelId") Long channelId,
                                                                          @RequestParam("guildId") Long guildId) {
        RatingSummaryDTO summary = ratingService.validateRating(imdbId, RatingContext.of(channelId, guildId));
        return ResponseEntity.ok(CommonResponse.success(summary));
    }

    /**
     * GET /api/v1/ratings/item/{imdbId}/user/{userId}?channelId=&guildId=
     * A single user's vote; 404 when the user has not rated the movie.
     */
    @GetMapping("/item/{imdbId}/user/{userId}")
    public ResponseEntity<CommonResponse<Integer>> getUserRating(@PathVariable("imdbId") String imdbId,
                                                                 @PathVariable("userId") Long userId,
                                                                 @RequestParam("channelId") Long channelId,
                                                                 @RequestParam("guildId") Long guildId) {
        OptionalInt rating = ratingService.findRating(userId, imdbId, RatingContext.of(channelId, guildId));
        if (rating.isEmpty()) {
            return ResponseEntity.status(404).body(CommonResponse.error(404, "User " + userId + " has not rated " + imdbId));
        }
        return ResponseEntity.ok(CommonResponse.success(rating.getAsInt()));
    }
}
