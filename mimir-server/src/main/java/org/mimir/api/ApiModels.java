package org.mimir.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.InstallResult;
import org.mimir.report.PerformanceMetrics;
import org.mimir.team.Bundle;
import org.mimir.team.CoOccurrencePair;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.WarmSlot;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class ApiModels {

    private ApiModels() {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PullResponse(
            String reference,
            String path,
            String digest,
            long sizeBytes,
            String tier,
            long durationMillis
    ) {
        static PullResponse from(ArtifactReference ref, InstallResult r) {
            return new PullResponse(ref.canonical(), r.binaryPath().toString(), r.digest().toString(), r.sizeBytes(),
                    r.tierId(), r.duration().toMillis());
        }
    }

    public record CacheEntryView(
            String reference,
            String digest,
            long sizeBytes,
            Instant createdAt,
            Instant lastAccessedAt,
            String sourceTier
    ) {
        static CacheEntryView from(CacheEntry e) {
            return new CacheEntryView(e.reference().canonical(), e.digest().toString(), e.sizeBytes(), e.createdAt(),
                    e.lastAccessedAt(), e.sourceTier().id());
        }
    }

    public record VersionsResponse(String repository, List<String> versions) {}

    public record ClearResponse(int removed) {}

    public record EvictResponse(int removed, long bytesFreed) {}

    public record PrewarmResponse(String team, int warmed) {}

    /** {@code timestamp} defaults to now. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UsageEventRequest(String reference, String actor, Instant timestamp) {}

    public record CoOccurrenceView(String referenceA, String referenceB, double score, long usageCount) {
        static CoOccurrenceView from(CoOccurrencePair p) {
            return new CoOccurrenceView(p.referenceA().canonical(), p.referenceB().canonical(), p.score(), p.usageCount());
        }
    }

    public record BundleView(
            String name,
            String reference,
            List<String> members,
            String digest,
            String description,
            Instant createdAt
    ) {
        static BundleView from(String team, Bundle b) {
            return new BundleView(b.name(), TeamCacheCoordinator.bundleReference(team, b).canonical(),
                    b.members().stream().map(ArtifactReference::canonical).toList(),
                    b.digest().toString(), b.description(), b.createdAt());
        }
    }

    public record WarmSlotView(String time, int hourOfDay, long volume, List<String> references) {
        static WarmSlotView from(WarmSlot s) {
            return new WarmSlotView(s.time().toString(), s.hourOfDay(), s.volume(),
                    s.references().stream().map(ArtifactReference::canonical).toList());
        }
    }

    public record TeamView(String name, List<String> members, String strategy, List<String> bundleDependencies) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MetricsView(
            String team,
            long windowMinutes,
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
        static MetricsView from(PerformanceMetrics m) {
            return new MetricsView(m.team(), m.window().toMinutes(), m.requests(), m.hits(), m.misses(), m.failures(),
                    m.hitRate(), m.avgLatencyMillisByTier(), m.requestsByTier(), m.bandwidthSavedBytes(),
                    m.corruptionsHealed(), m.coalescedWaiters());
        }
    }

    public record TierFailureView(String tier, String message) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
            String errorCode,
            String message,
            String reference,
            List<TierFailureView> failures,
            List<String> skippedTiers
    ) {}
}
