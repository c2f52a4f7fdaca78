package com.community.movierating.service;

import com.community.movierating.dto.RatingContext;
import com.community.movierating.entity.TrackedItem;
import com.community.movierating.exception.ItemAlreadyPostedException;
import com.community.movierating.repository.TrackedItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class ItemTrackingServiceImpl implements ItemTrackingService {

    private static final Logger log = LoggerFactory.getLogger(ItemTrackingServiceImpl.class);

    private final TrackedItemRepository itemRepository;
    private final Clock clock;

    public ItemTrackingServiceImpl(TrackedItemRepository itemRepository, Clock clock) {
        this.itemRepository = itemRepository;
        this.clock = clock;
    }

    @Override
    @Transactional
    public TrackedItem registerPosting(String imdbId, RatingContext context, Long messageId, String trailerUrl) {
        if (imdbId == null || imdbId.isBlank()) {
            throw new IllegalArgumentException("imdbId is required");
        }
        if (messageId == null) {
            throw new IllegalArgumentException("messageId is required");
        }

        Optional<TrackedItem> existing = findItem(imdbId, context);
        if (existing.isPresent()) {
            TrackedItem item = existing.get();
            if (item.getMessageId() != null) {
                throw new ItemAlreadyPostedException(imdbId, context, item.getMessageId());
            }
            // message was deleted earlier: point the row at the new posting
            item.setMessageId(messageId);
            if (trailerUrl != null) {
                item.setTrailerUrl(trailerUrl);
            }
            log.info("Re-posted movie {} in {} as message {}", imdbId, context, messageId);
            return itemRepository.save(item);
        }

        TrackedItem item = new TrackedItem(null, imdbId, messageId, context.getChannelId(), context.getGuildId(),
                trailerUrl, LocalDateTime.now(clock));
        try {
            TrackedItem saved = itemRepository.saveAndFlush(item);
            log.info("Tracking movie {} in {} as message {}", imdbId, context, messageId);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // another posting won the unique key
            throw new ItemAlreadyPostedException(imdbId, context, null);
        }
    }

    @Override
    public Optional<TrackedItem> findByDisplayMessage(Long messageId, RatingContext context) {
        return itemRepository.findByMessageIdAndChannelIdAndGuildId(messageId, context.getChannelId(), context.getGuildId());
    }

    @Override
    public Optional<TrackedItem> findItem(String imdbId, RatingContext context) {
        return itemRepository.findByImdbIdAndChannelIdAndGuildId(imdbId, context.getChannelId(), context.getGuildId());
    }

    @Override
    @Transactional
    public boolean clearDisplayMessage(String imdbId, RatingContext context) {
        int updated = itemRepository.clearMessageId(imdbId, context.getChannelId(), context.getGuildId());
        if (updated > 0) {
            log.info("Cleared display message of movie {} in {}", imdbId, context);
        }
        return updated > 0;
    }

    @Override
    public long countTracked() {
        return itemRepository.count();
    }

    @Override
    public long countGuilds() {
        return itemRepository.countDistinctGuilds();
    }
}
