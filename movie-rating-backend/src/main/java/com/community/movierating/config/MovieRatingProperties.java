package com.community.movierating.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine configuration bound from the {@code movie-rating} prefix, e.g.:
 * <pre>
 * movie-rating:
 *   bot-user-id: 1234567890
 *   cache:
 *     ttl: 300s
 *     sweep-interval-ms: 60000
 *   guard:
 *     cooldown: 5s
 *   notice:
 *     lifetime: 5s
 *   events:
 *     pool-size: 4
 * </pre>
 * The rating scale (1-10) is fixed and lives in {@link com.community.movierating.codec.EmojiRatingCodec}.
 */
@Data
@ConfigurationProperties(prefix = "movie-rating")
public class MovieRatingProperties {

    /**
     * Account id of the bot itself. Reactions it adds (e.g. seeding the keycaps) are ignored.
     */
    private Long botUserId;

    private Cache cache = new Cache();

    private Guard guard = new Guard();

    private Notice notice = new Notice();

    private Events events = new Events();

    @Data
    public static class Cache {
        /** Maximum age of an aggregate entry. */
        private Duration ttl = Duration.ofSeconds(300);
        /** Delay between background sweeps of expired entries. */
        private long sweepIntervalMs = 60_000L;
    }

    @Data
    public static class Guard {
        /** How long a corrective removal stays suppressed. */
        private Duration cooldown = Duration.ofSeconds(5);
    }

    @Data
    public static class Notice {
        /** Lifetime of the explanatory message posted after a rejected reaction. */
        private Duration lifetime = Duration.ofSeconds(5);
    }

    @Data
    public static class Events {
        private int poolSize = 4;
        private int queueCapacity = 1000;
    }
}
