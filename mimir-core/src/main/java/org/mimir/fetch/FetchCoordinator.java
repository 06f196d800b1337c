package org.mimir.fetch;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.error.ResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * Single-flight per reference: while an attempt for a reference runs, further callers wait on
 * it instead of starting their own, and all of them receive the same {@link InstallResult}.
 * <p>
 * The attempt runs on the coordinator's executor, never on a caller's thread, so a caller that
 * stops waiting does not abort it.
 */
public class FetchCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(FetchCoordinator.class);

    /** The work done once per flight. Implementations re-check the cache before installing. */
    @FunctionalInterface
    public interface Attempt {
        InstallResult run(ArtifactReference reference, Digest expected);
    }

    /** @param shared true when the caller joined a flight started by someone else */
    public record Acquired(InstallResult result, boolean shared) {}

    private static final class Flight {
        final CompletableFuture<InstallResult> result = new CompletableFuture<>();
        final AtomicInteger waiters = new AtomicInteger();
    }

    private final ConcurrentHashMap<ArtifactReference, Flight> inFlight = new ConcurrentHashMap<>();
    private final Attempt attempt;
    private final Executor executor;
    private final LongAdder flights = new LongAdder();
    private final LongAdder coalesced = new LongAdder();

    public FetchCoordinator(Attempt attempt, Executor executor) {
        this.attempt = attempt;
        this.executor = executor;
    }

    public InstallResult acquire(ArtifactReference ref, Digest expected) {
        return acquireTracked(ref, expected).result();
    }

    public Acquired acquireTracked(ArtifactReference ref, Digest expected) {
        Joined joined = join(ref, expected);
        try {
            return new Acquired(joined.future().get(), joined.shared());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResolutionException(ref, "Interrupted while waiting for " + ref, e);
        } catch (ExecutionException e) {
            throw new ResolutionException(ref, "Resolution of " + ref + " failed unexpectedly", e.getCause());
        }
    }

    /**
     * Returns a private view of the shared result; cancelling it leaves the flight running.
     */
    public CompletableFuture<InstallResult> acquireAsync(ArtifactReference ref, Digest expected) {
        return join(ref, expected).future();
    }

    /** Number of callers attached to the current flight for {@code ref}, 0 when idle. */
    public int waiters(ArtifactReference ref) {
        Flight f = inFlight.get(ref);
        return f == null ? 0 : f.waiters.get();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public long flightsStarted() {
        return flights.sum();
    }

    public long coalescedWaiters() {
        return coalesced.sum();
    }

    private record Joined(CompletableFuture<InstallResult> future, boolean shared) {}

    private Joined join(ArtifactReference ref, Digest expected) {
        Flight mine = new Flight();
        Flight flight = inFlight.putIfAbsent(ref, mine);
        boolean leader = flight == null;
        if (leader) flight = mine;
        flight.waiters.incrementAndGet();

        if (leader) {
            flights.increment();
            start(ref, expected, mine);
        } else {
            coalesced.increment();
            logger.debug("Joining in-flight resolution of {} ({} waiters)", ref, flight.waiters.get());
        }
        return new Joined(flight.result.copy(), !leader);
    }

    private void start(ArtifactReference ref, Digest expected, Flight flight) {
        Runnable task = () -> run(ref, expected, flight);
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            logger.warn("Fetch executor rejected {}; running on caller thread", ref);
            task.run();
        }
    }

    private void run(ArtifactReference ref, Digest expected, Flight flight) {
        long t0 = System.nanoTime();
        InstallResult result;
        try {
            result = attempt.run(ref, expected);
        } catch (ResolutionException e) {
            result = InstallResult.failed(e, null, Duration.ofNanos(System.nanoTime() - t0));
        } catch (RuntimeException e) {
            logger.error("Unexpected failure resolving {}", ref, e);
            result = InstallResult.failed(new ResolutionException(ref, "Unexpected failure: " + e.getMessage(), e),
                    null, Duration.ofNanos(System.nanoTime() - t0));
        }
        flight.result.complete(result);
        inFlight.remove(ref, flight);
    }
}
