package com.community.movierating.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * TrackedItem Entity: a movie posted as a summary message in one channel.
 * <p>
 * At most one row per (imdb_id, channel_id, guild_id). {@code messageId} is cleared, not the row,
 * when the summary message disappears, so the movie can be posted again.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "movies",
        uniqueConstraints = @UniqueConstraint(name = "uk_movies_movie_channel",
                columnNames = {"imdb_id", "channel_id", "guild_id"}))
public class TrackedItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "imdb_id", nullable = false)
    private String imdbId;

    /** Summary message; null until posted or after the message was deleted. */
    @Column(name = "message_id")
    private Long messageId;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(name = "guild_id", nullable = false)
    private Long guildId;

    @Column(name = "trailer_url")
    private String trailerUrl;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
