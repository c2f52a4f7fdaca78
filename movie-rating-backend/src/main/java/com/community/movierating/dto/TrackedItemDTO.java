package com.community.movierating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body for registering a posted movie summary.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrackedItemDTO {

    private String imdbId;

    private Long channelId;

    private Long guildId;

    private Long messageId;

    private String trailerUrl;
}
