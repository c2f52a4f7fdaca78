package com.community.movierating.service;

import com.community.movierating.dto.EngineMetricsDTO;

import java.util.Map;

/**
 * Health, readiness and counters of the running engine.
 */
public interface SystemStatusService {

    /**
     * Liveness: status and uptime, no I/O.
     */
    Map<String, Object> health();

    /**
     * Readiness: probes the database.
     *
     * @return true when the database answered
     */
    boolean isDatabaseReachable();

    EngineMetricsDTO getMetrics();
}
