package org.mimir.report;

import org.mimir.artifact.SourceTier;
import org.mimir.team.CacheStrategy;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.WarmSlot;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns resolution samples and team usage into metrics and prioritized recommendations.
 */
public class PerformanceReporter {

    /** Hit rate under which a larger cache is recommended. */
    public static final double LOW_WATER_HIT_RATE = 0.7;
    /** Fewer requests than this are not enough to judge the hit rate. */
    public static final int MIN_REQUESTS = 10;
    public static final Duration DEFAULT_WINDOW = Duration.ofHours(24);
    private static final int MAX_BUNDLE_RECOMMENDATIONS = 3;

    private final ResolutionMetrics metrics;
    private final TeamCacheCoordinator teams;
    private final Clock clock;

    public PerformanceReporter(ResolutionMetrics metrics, TeamCacheCoordinator teams, Clock clock) {
        this.metrics = metrics;
        this.teams = teams;
        this.clock = clock;
    }

    public PerformanceMetrics metrics(String team, Duration window) {
        List<ResolutionMetrics.Sample> samples = metrics.samples(team, clock.instant().minus(window));

        long hits = 0, misses = 0, failures = 0, saved = 0, shared = 0;
        Map<SourceTier, long[]> latency = new LinkedHashMap<>();
        Map<String, Long> byTier = new LinkedHashMap<>();
        for (ResolutionMetrics.Sample s : samples) {
            if (!s.success()) {
                failures++;
                continue;
            }
            if (s.tier() == SourceTier.CACHE) {
                hits++;
                saved += s.bytes();
            } else {
                misses++;
            }
            if (s.shared()) {
                shared++;
                if (s.tier() != SourceTier.CACHE) saved += s.bytes();
            }
            if (s.tier() != null) {
                byTier.merge(s.tier().id(), 1L, Long::sum);
                long[] acc = latency.computeIfAbsent(s.tier(), t -> new long[2]);
                acc[0] += s.durationMillis();
                acc[1]++;
            }
        }
        Map<String, Double> avg = new LinkedHashMap<>();
        for (SourceTier t : SourceTier.values()) {
            long[] acc = latency.get(t);
            if (acc != null) avg.put(t.id(), (double) acc[0] / acc[1]);
        }
        long requests = samples.size();
        double hitRate = requests == 0 ? 0.0 : (double) hits / requests;
        return new PerformanceMetrics(team, window, requests, hits, misses, failures, hitRate, avg, byTier,
                saved, metrics.corruptionsHealed(), shared);
    }

    /**
     * Recommendations for {@code team}, highest priority first.
     */
    public List<OptimizationRecommendation> recommendations(String team) {
        PerformanceMetrics m = metrics(team, DEFAULT_WINDOW);
        CacheStrategy strategy = teams.teamConfig(team).cacheStrategy();
        List<OptimizationRecommendation> out = new ArrayList<>();

        if (m.requests() >= MIN_REQUESTS && m.hitRate() < LOW_WATER_HIT_RATE) {
            double projected = strategy.projectedHitRate(m.hitRate());
            double gain = Math.max(0.0, projected - m.hitRate());
            out.add(OptimizationRecommendation.of(RecommendationKind.RAISE_CACHE_SIZE, gain,
                    String.format(Locale.ROOT, "Cache hit rate %s is below the %s low-water mark over %d requests",
                            pct(m.hitRate()), pct(LOW_WATER_HIT_RATE), m.requests()),
                    String.format(Locale.ROOT, "Hit rate %s -> %s with a %s cache (%d GiB, %dh retention)",
                            pct(m.hitRate()), pct(projected), strategy.name().toLowerCase(Locale.ROOT),
                            strategy.maxCacheBytes() >> 30, strategy.retention().toHours())));
        }

        long events = teams.eventCount(team, teams.options().analysisWindow());
        teams.unbundledPairs(team).stream().limit(MAX_BUNDLE_RECOMMENDATIONS).forEach(p -> {
            double share = events == 0 ? 0.0 : Math.min(1.0, 2.0 * p.usageCount() / events);
            out.add(OptimizationRecommendation.of(RecommendationKind.CREATE_BUNDLE, p.score() * share,
                    String.format(Locale.ROOT, "%s and %s are used together (score %.2f, %d joint uses) but are not bundled",
                            p.referenceA(), p.referenceB(), p.score(), p.usageCount()),
                    String.format(Locale.ROOT, "One bundle pull replaces two resolutions for %s of team usage", pct(share))));
        });

        List<WarmSlot> schedule = teams.warmSchedule(team);
        if (!schedule.isEmpty() && events > 0 && m.requests() > 0 && m.misses() + m.failures() > 0) {
            long peak = schedule.stream().mapToLong(WarmSlot::volume).sum();
            double peakShare = (double) peak / events;
            double gain = m.missRate() * peakShare;
            WarmSlot first = schedule.get(0);
            out.add(OptimizationRecommendation.of(RecommendationKind.PRELOAD, gain,
                    String.format(Locale.ROOT, "%s of usage falls in %d peak hours; busiest starts at %02d:00",
                            pct(peakShare), schedule.size(), first.hourOfDay()),
                    String.format(Locale.ROOT, "Pre-warm %d references at %s ahead of peak hours", first.references().size(), first.time())));
        }

        long http = m.requestsByTier().getOrDefault(SourceTier.HTTP.id(), 0L);
        if (m.misses() > 0 && http * 2 > m.misses()) {
            double httpShare = (double) http / m.requests();
            out.add(OptimizationRecommendation.of(RecommendationKind.PUBLISH_TO_REGISTRY, httpShare * 0.5,
                    String.format(Locale.ROOT, "%d of %d cache misses were served by direct HTTP download", http, m.misses()),
                    "Publishing these artifacts to the team registry makes misses content-addressed and faster"));
        }

        out.sort(Comparator.comparing(OptimizationRecommendation::priority)
                .thenComparing(Comparator.comparingDouble(OptimizationRecommendation::projectedImprovement).reversed()));
        return out;
    }

    private static String pct(double v) {
        return String.format(Locale.ROOT, "%.0f%%", v * 100.0);
    }
}
