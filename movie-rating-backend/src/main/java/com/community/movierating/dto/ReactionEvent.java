package com.community.movierating.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound reaction add/remove event as reported by the chat gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReactionEvent {

    private Long userId;

    /** Id of the summary message the reaction was placed on. */
    private Long messageId;

    private Long channelId;

    private Long guildId;

    /** Raw emoji symbol, e.g. "7️⃣". */
    private String emoji;

    public RatingContext context() {
        return RatingContext.of(channelId, guildId);
    }
}
