package com.community.movierating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rating block shown on a movie summary message.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RatingSummaryDTO {

    private String imdbId;

    private Long channelId;

    private Long guildId;

    private Double average;

    private Integer count;

    // "⭐ 7.0/10 (1 vote)" or "Not Rated yet"
    private String displayText;
}
