package com.community.movierating.service;

import com.community.movierating.codec.EmojiRatingCodec;
import com.community.movierating.dto.RatingContext;
import com.community.movierating.dto.RatingStats;
import com.community.movierating.exception.RatingPersistenceException;
import com.community.movierating.repository.UserRatingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalInt;

/**
 * MySQL-backed {@link RatingStore}. Writes go through native SQL so the uniqueness of
 * (user_id, imdb_id, channel_id, guild_id) is enforced by the database in a single statement.
 */
@Service
public class RatingStoreImpl implements RatingStore {

    private static final Logger log = LoggerFactory.getLogger(RatingStoreImpl.class);

    private static final String UPSERT_SQL =
            "INSERT INTO ratings (user_id, imdb_id, rating, channel_id, guild_id, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) " +
            "ON DUPLICATE KEY UPDATE rating = ?, updated_at = ?";

    private static final String DELETE_SQL =
            "DELETE FROM ratings WHERE user_id = ? AND imdb_id = ? AND channel_id = ? AND guild_id = ?";

    private static final String SELECT_ONE_SQL =
            "SELECT rating FROM ratings WHERE user_id = ? AND imdb_id = ? AND channel_id = ? AND guild_id = ?";

    private final JdbcTemplate jdbcTemplate;
    private final UserRatingRepository ratingRepository;
    private final Clock clock;

    public RatingStoreImpl(JdbcTemplate jdbcTemplate, UserRatingRepository ratingRepository, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.ratingRepository = ratingRepository;
        this.clock = clock;
    }

    @Override
    public boolean hasRated(Long userId, String imdbId, RatingContext context) {
        try {
            return ratingRepository.existsByUserIdAndImdbIdAndChannelIdAndGuildId(
                    userId, imdbId, context.getChannelId(), context.getGuildId());
        } catch (DataAccessException e) {
            throw failure("check rating", userId, imdbId, context, e);
        }
    }

    @Override
    public OptionalInt findRating(Long userId, String imdbId, RatingContext context) {
        try {
            List<Integer> values = jdbcTemplate.queryForList(SELECT_ONE_SQL, Integer.class,
                    userId, imdbId, context.getChannelId(), context.getGuildId());
            return values.isEmpty() ? OptionalInt.empty() : OptionalInt.of(values.get(0));
        } catch (DataAccessException e) {
            throw failure("read rating", userId, imdbId, context, e);
        }
    }

    @Override
    public void upsert(Long userId, String imdbId, RatingContext context, int rating) {
        if (rating < EmojiRatingCodec.MIN_RATING || rating > EmojiRatingCodec.MAX_RATING) {
            throw new IllegalArgumentException("rating must be between " + EmojiRatingCodec.MIN_RATING
                    + " and " + EmojiRatingCodec.MAX_RATING + ": " + rating);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        try {
            jdbcTemplate.update(UPSERT_SQL, ps -> {
                ps.setLong(1, userId);
                ps.setString(2, imdbId);
                ps.setInt(3, rating);
                ps.setLong(4, context.getChannelId());
                ps.setLong(5, context.getGuildId());
                ps.setObject(6, now);
                ps.setObject(7, now);
                ps.setInt(8, rating);
                ps.setObject(9, now);
            });
        } catch (DataAccessException e) {
            throw failure("upsert rating", userId, imdbId, context, e);
        }
        log.debug("Upserted rating {} for user {} on {} in {}", rating, userId, imdbId, context);
    }

    @Override
    public boolean remove(Long userId, String imdbId, RatingContext context) {
        try {
            int deleted = jdbcTemplate.update(DELETE_SQL, userId, imdbId, context.getChannelId(), context.getGuildId());
            return deleted > 0;
        } catch (DataAccessException e) {
            throw failure("remove rating", userId, imdbId, context, e);
        }
    }

    @Override
    public RatingStats statsFor(String imdbId, RatingContext context) {
        try {
            List<Integer> values = ratingRepository.findRatingValues(imdbId, context.getChannelId(), context.getGuildId());
            return RatingStats.fromValues(values);
        } catch (DataAccessException e) {
            throw new RatingPersistenceException("Failed to aggregate ratings for " + imdbId + " in " + context, e);
        }
    }

    @Override
    public long countAll() {
        try {
            return ratingRepository.count();
        } catch (DataAccessException e) {
            throw new RatingPersistenceException("Failed to count ratings", e);
        }
    }

    private RatingPersistenceException failure(String action, Long userId, String imdbId,
                                               RatingContext context, DataAccessException cause) {
        return new RatingPersistenceException(
                "Failed to " + action + " (user " + userId + ", movie " + imdbId + ", context " + context + ")", cause);
    }
}
