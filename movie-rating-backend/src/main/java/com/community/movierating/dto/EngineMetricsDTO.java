package com.community.movierating.dto;

import lombok.Data;

/**
 * Counters served by the metrics endpoint.
 */
@Data
public class EngineMetricsDTO {

    private Long guildsConfigured;

    private Long moviesTracked;

    private Long ratingsTotal;

    private Integer cachedAggregates;

    private Integer pendingSelfActions;

    // ISO 8601, UTC
    private String timestamp;
}
