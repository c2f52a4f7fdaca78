package com.community.movierating.repository;

import com.community.movierating.entity.UserRating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserRatingRepository extends JpaRepository<UserRating, Long> {

    boolean existsByUserIdAndImdbIdAndChannelIdAndGuildId(Long userId, String imdbId,
                                                          Long channelId, Long guildId);

    @Query("SELECT r.rating FROM UserRating r WHERE r.imdbId = :imdbId AND r.channelId = :channelId AND r.guildId = :guildId")
    List<Integer> findRatingValues(@Param("imdbId") String imdbId, @Param("channelId") Long channelId,
                                   @Param("guildId") Long guildId);
}
