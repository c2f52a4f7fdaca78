package com.community.movierating.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * UserRating Entity: one user's 1-10 vote on one movie in one channel.
 * Rows are written only through {@link com.community.movierating.service.RatingStore}; this mapping
 * is used for reads.
 */
@Entity
@Data
@Table(name = "ratings",
        uniqueConstraints = @UniqueConstraint(name = "uk_ratings_user_movie_channel",
                columnNames = {"user_id", "imdb_id", "channel_id", "guild_id"}))
public class UserRating implements Serializable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "imdb_id", nullable = false)
    private String imdbId;

    /** 1 to 10, enforced by a CHECK constraint */
    @Column(name = "rating", nullable = false)
    private Integer rating;

    @Column(name = "channel_id", nullable = false)
    private Long channelId;

    @Column(name = "guild_id", nullable = false)
    private Long guildId;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
