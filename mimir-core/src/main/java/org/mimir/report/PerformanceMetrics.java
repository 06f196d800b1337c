package org.mimir.report;

import java.time.Duration;
import java.util.Map;

/**
 * @param team                   null for all teams
 * @param misses                 successful resolutions served by a network tier
 * @param avgLatencyMillisByTier keyed by tier id
 * @param bandwidthSavedBytes    bytes served from cache or shared through single-flight instead of downloaded
 */
public record PerformanceMetrics(
        String team,
        Duration window,
        long requests,
        long hits,
        long misses,
        long failures,
        double hitRate,
        Map<String, Double> avgLatencyMillisByTier,
        Map<String, Long> requestsByTier,
        long bandwidthSavedBytes,
        long corruptionsHealed,
        long coalescedWaiters
) {
    public double missRate() {
        return requests == 0 ? 0.0 : 1.0 - hitRate;
    }
}
