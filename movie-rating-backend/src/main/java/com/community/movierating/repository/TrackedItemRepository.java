package com.community.movierating.repository;

import com.community.movierating.entity.TrackedItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TrackedItemRepository extends JpaRepository<TrackedItem, Long> {

    Optional<TrackedItem> findByImdbIdAndChannelIdAndGuildId(String imdbId, Long channelId, Long guildId);

    /**
     * Resolves the movie behind a reaction's message.
     */
    Optional<TrackedItem> findByMessageIdAndChannelIdAndGuildId(Long messageId, Long channelId, Long guildId);

    @Query("SELECT COUNT(DISTINCT t.guildId) FROM TrackedItem t")
    long countDistinctGuilds();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE TrackedItem t SET t.messageId = NULL WHERE t.imdbId = :imdbId AND t.channelId = :channelId AND t.guildId = :guildId")
    int clearMessageId(@Param("imdbId") String imdbId, @Param("channelId") Long channelId,
                       @Param("guildId") Long guildId);
}
