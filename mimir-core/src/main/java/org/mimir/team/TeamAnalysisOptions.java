package org.mimir.team;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tuning for co-occurrence analysis, bundle proposals and warm schedules.
 *
 * @param pairWindow   width of the fixed buckets events are paired in
 * @param warmHours    number of busiest hours a warm schedule covers
 */
public record TeamAnalysisOptions(
        Duration analysisWindow,
        Duration pairWindow,
        double bundleThreshold,
        long minPairUsage,
        int warmHours,
        Duration warmLeadTime,
        ZoneId zone
) {
    public TeamAnalysisOptions {
        if (pairWindow == null || pairWindow.isZero() || pairWindow.isNegative()) {
            throw new IllegalArgumentException("pairWindow must be positive");
        }
        if (bundleThreshold < 0 || bundleThreshold > 1) {
            throw new IllegalArgumentException("bundleThreshold must be within [0, 1]");
        }
    }

    public static TeamAnalysisOptions defaults() {
        return new TeamAnalysisOptions(Duration.ofDays(7), Duration.ofHours(1), 0.7, 3, 3,
                Duration.ofMinutes(30), ZoneId.of("UTC"));
    }
}
