package com.community.movierating.service;

import com.community.movierating.cache.AggregationCache;
import com.community.movierating.dto.EngineMetricsDTO;
import com.community.movierating.guard.SelfActionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class SystemStatusServiceImpl implements SystemStatusService {

    private static final Logger log = LoggerFactory.getLogger(SystemStatusServiceImpl.class);

    private final ItemTrackingService itemTrackingService;
    private final RatingService ratingService;
    private final AggregationCache aggregationCache;
    private final SelfActionGuard selfActionGuard;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private final Instant startedAt;

    public SystemStatusServiceImpl(ItemTrackingService itemTrackingService,
                                   RatingService ratingService,
                                   AggregationCache aggregationCache,
                                   SelfActionGuard selfActionGuard,
                                   JdbcTemplate jdbcTemplate,
                                   Clock clock) {
        this.itemTrackingService = itemTrackingService;
        this.ratingService = ratingService;
        this.aggregationCache = aggregationCache;
        this.selfActionGuard = selfActionGuard;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @Override
    public Map<String, Object> health() {
        Instant now = clock.instant();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("timestamp", now.toString());
        body.put("uptimeSeconds", Math.max(0, Duration.between(startedAt, now).getSeconds()));
        return body;
    }

    @Override
    public boolean isDatabaseReachable() {
        try {
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM movies", Long.class);
            return true;
        } catch (DataAccessException e) {
            log.error("Readiness check failed", e);
            return false;
        }
    }

    @Override
    public EngineMetricsDTO getMetrics() {
        EngineMetricsDTO metrics = new EngineMetricsDTO();
        metrics.setGuildsConfigured(itemTrackingService.countGuilds());
        metrics.setMoviesTracked(itemTrackingService.countTracked());
        metrics.setRatingsTotal(ratingService.countRatings());
        metrics.setCachedAggregates(aggregationCache.size());
        metrics.setPendingSelfActions(selfActionGuard.size());
        metrics.setTimestamp(clock.instant().toString());
        return metrics;
    }
}
