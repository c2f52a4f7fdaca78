package com.community.movierating.dto;

import lombok.Value;

/**
 * Scope within which an item's ratings are tracked: one channel inside one guild.
 */
@Value
public class RatingContext {

    Long channelId;

    Long guildId;

    public static RatingContext of(Long channelId, Long guildId) {
        if (channelId == null || guildId == null) {
            throw new IllegalArgumentException("channelId and guildId are required");
        }
        return new RatingContext(channelId, guildId);
    }

    @Override
    public String toString() {
        return guildId + "/" + channelId;
    }
}
