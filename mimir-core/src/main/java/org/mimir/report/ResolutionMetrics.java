package org.mimir.report;

import org.mimir.artifact.InstallResult;
import org.mimir.artifact.SourceTier;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory resolution counters plus a bounded window of recent samples for per-team and
 * per-window reporting.
 */
public class ResolutionMetrics {

    /**
     * @param shared the caller joined another caller's in-flight resolution
     */
    public record Sample(Instant at, String team, SourceTier tier, boolean success, long durationMillis,
                         long bytes, boolean shared) {}

    private final LongAdder requests = new LongAdder();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder failures = new LongAdder();
    private final LongAdder coalesced = new LongAdder();
    private final LongAdder corruptionsHealed = new LongAdder();

    private final ConcurrentLinkedDeque<Sample> samples = new ConcurrentLinkedDeque<>();
    private final AtomicInteger sampleCount = new AtomicInteger();
    private final int maxSamples;
    private final Clock clock;

    public ResolutionMetrics() {
        this(100_000, Clock.systemUTC());
    }

    public ResolutionMetrics(int maxSamples, Clock clock) {
        this.maxSamples = Math.max(1, maxSamples);
        this.clock = clock;
    }

    public void record(String team, InstallResult result, boolean shared) {
        requests.increment();
        if (!result.success()) {
            failures.increment();
        } else if (result.tierUsed() == SourceTier.CACHE) {
            hits.increment();
        } else {
            misses.increment();
        }
        if (shared) coalesced.increment();

        samples.addLast(new Sample(clock.instant(), team, result.tierUsed(), result.success(),
                result.duration() == null ? 0L : result.duration().toMillis(), result.sizeBytes(), shared));
        if (sampleCount.incrementAndGet() > maxSamples) {
            if (samples.pollFirst() != null) sampleCount.decrementAndGet();
        }
    }

    public void recordCorruptionHealed() {
        corruptionsHealed.increment();
    }

    /** Samples at or after {@code from}; all teams when {@code team} is null. */
    public List<Sample> samples(String team, Instant from) {
        return samples.stream()
                .filter(s -> from == null || !s.at().isBefore(from))
                .filter(s -> team == null || Objects.equals(team, s.team()))
                .toList();
    }

    public long requests() { return requests.sum(); }
    public long hits() { return hits.sum(); }
    public long misses() { return misses.sum(); }
    public long failures() { return failures.sum(); }
    public long coalesced() { return coalesced.sum(); }
    public long corruptionsHealed() { return corruptionsHealed.sum(); }
}
