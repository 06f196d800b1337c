package org.mimir.team;

import java.time.Duration;
import java.util.Locale;

/**
 * Team-level caching posture. Each strategy fixes the defaults the coordinator and
 * reporter work with.
 */
public enum CacheStrategy {
    AGGRESSIVE(10L * 1024 * 1024 * 1024, Duration.ofHours(48), 10, Duration.ofMinutes(30), 0.30, 0.90),
    BALANCED(5L * 1024 * 1024 * 1024, Duration.ofHours(24), 5, Duration.ofMinutes(60), 0.20, 0.80),
    CONSERVATIVE(2L * 1024 * 1024 * 1024, Duration.ofHours(6), 3, Duration.ofMinutes(120), 0.10, 0.70);

    private final long maxCacheBytes;
    private final Duration retention;
    private final int preloadCount;
    private final Duration syncFrequency;
    private final double hitRateUplift;
    private final double hitRateCap;

    CacheStrategy(long maxCacheBytes, Duration retention, int preloadCount, Duration syncFrequency,
                  double hitRateUplift, double hitRateCap) {
        this.maxCacheBytes = maxCacheBytes;
        this.retention = retention;
        this.preloadCount = preloadCount;
        this.syncFrequency = syncFrequency;
        this.hitRateUplift = hitRateUplift;
        this.hitRateCap = hitRateCap;
    }

    public long maxCacheBytes() {
        return maxCacheBytes;
    }

    public Duration retention() {
        return retention;
    }

    /** References pre-warmed per schedule slot. */
    public int preloadCount() {
        return preloadCount;
    }

    /** Minimum spacing between two warm runs for a team. */
    public Duration syncFrequency() {
        return syncFrequency;
    }

    /** Hit rate this strategy is expected to reach from {@code current}. */
    public double projectedHitRate(double current) {
        return Math.min(hitRateCap, current + hitRateUplift);
    }

    public static CacheStrategy fromName(String name) {
        if (name == null || name.isBlank()) return BALANCED;
        return valueOf(name.strip().toUpperCase(Locale.ROOT));
    }
}
