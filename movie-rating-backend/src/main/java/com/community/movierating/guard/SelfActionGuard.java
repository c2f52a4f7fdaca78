package com.community.movierating.guard;

import com.community.movierating.config.MovieRatingProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers reaction removals the engine performed itself.
 * <p>
 * The gateway reports such a removal back as an ordinary remove event. Without a marker the router
 * would delete the user's rating (or bounce between add and remove). A marker lives for the configured
 * cooldown and is consumed by the first lookup that matches it. Losing a marker early costs at most
 * one redundant processing cycle, so nothing here is persisted.
 */
@Component
public class SelfActionGuard {

    private static final Logger log = LoggerFactory.getLogger(SelfActionGuard.class);

    private final Map<SelfActionKey, Instant> markers = new ConcurrentHashMap<>();

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration cooldown;

    @Autowired
    public SelfActionGuard(TaskScheduler taskScheduler, Clock clock, MovieRatingProperties properties) {
        this(taskScheduler, clock, properties.getGuard().getCooldown());
    }

    public SelfActionGuard(TaskScheduler taskScheduler, Clock clock, Duration cooldown) {
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("guard cooldown must be positive: " + cooldown);
        }
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.cooldown = cooldown;
    }

    /**
     * Records that the engine is about to remove this reaction. Must be called before the removal is sent.
     */
    public void mark(Long userId, Long messageId, String emoji) {
        SelfActionKey key = new SelfActionKey(userId, messageId, emoji);
        Instant expiresAt = clock.instant().plus(cooldown);
        markers.put(key, expiresAt);
        taskScheduler.schedule(() -> expire(key, expiresAt), expiresAt);
        log.debug("Self-action marked: {} (expires {})", key, expiresAt);
    }

    /**
     * Returns true if a live marker matches, consuming it.
     */
    public boolean isSelfInitiated(Long userId, Long messageId, String emoji) {
        SelfActionKey key = new SelfActionKey(userId, messageId, emoji);
        Instant expiresAt = markers.remove(key);
        if (expiresAt == null) {
            return false;
        }
        if (!clock.instant().isBefore(expiresAt)) {
            log.debug("Self-action marker for {} already expired at {}", key, expiresAt);
            return false;
        }
        return true;
    }

    public int size() {
        return markers.size();
    }

    // only drops the marker it was scheduled for; a re-mark keeps its own expiry
    void expire(SelfActionKey key, Instant expiresAt) {
        if (markers.remove(key, expiresAt)) {
            log.debug("Self-action marker expired: {}", key);
        }
    }

    @PreDestroy
    public void clear() {
        markers.clear();
    }
}
