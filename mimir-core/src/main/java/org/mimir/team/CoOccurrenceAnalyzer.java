package org.mimir.team;

import org.mimir.artifact.ArtifactReference;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pairs references used by the same actor within the same fixed time bucket.
 * <p>
 * For each bucket and each pair of distinct references in it, the joint count grows by
 * {@code min(countA, countB)}. The score is {@code joint / max(totalA, totalB)}: symmetric, and
 * never above 1 since the joint count cannot exceed either total.
 */
public final class CoOccurrenceAnalyzer {
    private CoOccurrenceAnalyzer() {}

    private record Bucket(String actor, long slot) {}

    private record Pair(ArtifactReference a, ArtifactReference b) {}

    public static final Comparator<CoOccurrencePair> STRONGEST_FIRST = Comparator
            .comparingDouble(CoOccurrencePair::score).reversed()
            .thenComparing(Comparator.comparingLong(CoOccurrencePair::usageCount).reversed())
            .thenComparing(p -> p.referenceA().canonical())
            .thenComparing(p -> p.referenceB().canonical());

    public static List<CoOccurrencePair> analyze(Collection<UsageEvent> events, Duration pairWindow) {
        long slotMillis = pairWindow.toMillis();
        Map<ArtifactReference, Long> totals = new HashMap<>();
        Map<Bucket, Map<ArtifactReference, Long>> buckets = new HashMap<>();
        for (UsageEvent e : events) {
            totals.merge(e.reference(), 1L, Long::sum);
            Bucket b = new Bucket(e.actor(), Math.floorDiv(e.timestamp().toEpochMilli(), slotMillis));
            buckets.computeIfAbsent(b, k -> new HashMap<>()).merge(e.reference(), 1L, Long::sum);
        }

        Map<Pair, Long> joint = new HashMap<>();
        for (Map<ArtifactReference, Long> counts : buckets.values()) {
            if (counts.size() < 2) continue;
            List<ArtifactReference> refs = new ArrayList<>(counts.keySet());
            refs.sort(Comparator.comparing(ArtifactReference::canonical));
            for (int i = 0; i < refs.size(); i++) {
                for (int j = i + 1; j < refs.size(); j++) {
                    long together = Math.min(counts.get(refs.get(i)), counts.get(refs.get(j)));
                    joint.merge(new Pair(refs.get(i), refs.get(j)), together, Long::sum);
                }
            }
        }

        List<CoOccurrencePair> out = new ArrayList<>(joint.size());
        for (var e : joint.entrySet()) {
            Pair p = e.getKey();
            long denom = Math.max(totals.get(p.a()), totals.get(p.b()));
            double score = denom == 0 ? 0.0 : (double) e.getValue() / denom;
            out.add(CoOccurrencePair.of(p.a(), p.b(), score, e.getValue()));
        }
        out.sort(STRONGEST_FIRST);
        return out;
    }
}
