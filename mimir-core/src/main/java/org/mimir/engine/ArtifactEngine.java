package org.mimir.engine;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.CacheCorruptionException;
import org.mimir.error.ResolutionException;
import org.mimir.error.VerificationFailedException;
import org.mimir.fetch.FetchCoordinator;
import org.mimir.install.TieredInstaller;
import org.mimir.install.registry.ArtifactRegistry;
import org.mimir.report.ResolutionMetrics;
import org.mimir.resolve.ReferenceResolver;
import org.mimir.store.DigestStore;
import org.mimir.store.EvictionPolicy;
import org.mimir.store.EvictionReport;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.UsageEvent;
import org.mimir.team.WarmSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.Executor;

/**
 * Entry point for pulling, listing, inspecting and clearing artifacts.
 * <p>
 * A pull is served from the local cache when possible (the blob is re-hashed first), otherwise
 * through the {@link FetchCoordinator} so concurrent pulls of one reference share one install.
 */
public class ArtifactEngine {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactEngine.class);

    private final DigestStore store;
    private final ReferenceResolver resolver;
    private final TieredInstaller installer;
    private final FetchCoordinator coordinator;
    private final ArtifactRegistry registry;
    private final TeamCacheCoordinator teams;
    private final ResolutionMetrics metrics;
    private final boolean verifyOnHit;
    private final Clock clock;

    public ArtifactEngine(DigestStore store, TieredInstaller installer, Executor fetchExecutor,
                          ArtifactRegistry registry, TeamCacheCoordinator teams, ResolutionMetrics metrics,
                          boolean verifyOnHit, Clock clock) {
        this.store = store;
        this.resolver = new ReferenceResolver(store, clock);
        this.installer = installer;
        this.coordinator = new FetchCoordinator(this::installIfMissing, fetchExecutor);
        this.registry = registry == null ? ArtifactRegistry.none() : registry;
        this.teams = teams;
        this.metrics = metrics;
        this.verifyOnHit = verifyOnHit;
        this.clock = clock;
    }

    public FetchCoordinator coordinator() {
        return coordinator;
    }

    public DigestStore store() {
        return store;
    }

    // ----------------------------------------------------------------------
    // Pull
    // ----------------------------------------------------------------------

    public Path pull(ArtifactReference ref) {
        return pull(PullRequest.of(ref));
    }

    public Path pull(ArtifactReference ref, Digest expected) {
        return pull(new PullRequest(ref, expected, null, null));
    }

    /**
     * @return path of a blob that hashes to its recorded digest
     * @throws ResolutionException when the artifact cannot be produced
     */
    public Path pull(PullRequest request) {
        InstallResult result = resolve(request);
        if (!result.success()) {
            throw result.error();
        }
        return result.binaryPath();
    }

    /** Like {@link #pull(PullRequest)} but reports failure in the result instead of throwing. */
    public InstallResult resolve(PullRequest request) {
        ArtifactReference ref = request.reference();
        Digest expected = request.expectedDigest();

        Optional<InstallResult> hit = fromCache(ref, expected);
        InstallResult result;
        boolean shared = false;
        if (hit.isPresent()) {
            result = hit.get();
        } else {
            FetchCoordinator.Acquired acquired = coordinator.acquireTracked(ref, expected);
            result = acquired.result();
            shared = acquired.shared();
            if (result.success() && expected != null && !expected.equals(result.digest())) {
                // Joined a flight started with a different pin.
                result = InstallResult.failed(
                        new VerificationFailedException(ref, result.tierUsed(), expected, result.digest()),
                        result.tierUsed(), result.duration());
            }
        }

        metrics.record(request.team(), result, shared);
        if (result.success() && request.team() != null && teams != null) {
            teams.record(new UsageEvent(request.team(), ref, request.actor(), clock.instant()));
        }
        return result;
    }

    /** Runs once per flight; a concurrent flight may have filled the cache meanwhile. */
    private InstallResult installIfMissing(ArtifactReference ref, Digest expected) {
        Optional<InstallResult> hit = fromCache(ref, expected);
        if (hit.isPresent()) return hit.get();
        return installer.install(ref, expected);
    }

    private Optional<InstallResult> fromCache(ArtifactReference ref, Digest expected) {
        Optional<CacheEntry> entry = resolver.resolve(ref);
        if (entry.isEmpty()) return Optional.empty();
        Digest digest = entry.get().digest();
        if (expected != null && !expected.equals(digest)) {
            logger.info("Cached {} is {} but {} was requested; resolving again", ref, digest, expected);
            return Optional.empty();
        }
        Path path = store.pathFor(digest);
        if (verifyOnHit) {
            try {
                path = store.verifiedPath(digest);
            } catch (CacheCorruptionException e) {
                metrics.recordCorruptionHealed();
                logger.warn("Corrupt cache entry for {} removed, re-resolving: {}", ref, e.getMessage());
                return Optional.empty();
            } catch (ArtifactNotFoundException e) {
                logger.warn("Blob for {} vanished, re-resolving", ref);
                return Optional.empty();
            }
        }
        return Optional.of(InstallResult.cacheHit(entry.get(), path));
    }

    // ----------------------------------------------------------------------
    // Inspection and maintenance
    // ----------------------------------------------------------------------

    /**
     * Tags known for {@code ecosystem/namespace/name}, locally and in the registry. A registry
     * failure degrades to the local tags.
     */
    public List<String> list(String repository) {
        TreeSet<String> tags = new TreeSet<>(store.index().tags(repository));
        if (registry.isConfigured()) {
            try {
                tags.addAll(registry.listTags(repository));
            } catch (ResolutionException e) {
                logger.warn("Registry listing failed for {}, showing local tags only: {}", repository, e.getMessage());
            }
        }
        return new ArrayList<>(tags);
    }

    public CacheEntry info(ArtifactReference ref) {
        return store.lookup(ref)
                .orElseThrow(() -> new ArtifactNotFoundException(ref, ref + " is not cached"));
    }

    /** @param olderThan null clears everything */
    public int clear(Duration olderThan) {
        return store.clear(olderThan);
    }

    public EvictionReport evict(EvictionPolicy policy) {
        return store.evict(policy);
    }

    /**
     * Pulls every reference, logging rather than propagating failures.
     *
     * @return number of references now cached
     */
    public int prewarm(Collection<ArtifactReference> references) {
        int ok = 0;
        for (ArtifactReference ref : references) {
            InstallResult r = resolve(PullRequest.of(ref));
            if (r.success()) {
                ok++;
            } else {
                logger.warn("Pre-warm of {} failed: {}", ref, r.error().getMessage());
            }
        }
        logger.info("Pre-warmed {}/{} references", ok, references.size());
        return ok;
    }

    /**
     * Pulls the references of {@code team}'s warm slot that is due now.
     *
     * @return number of references now cached, 0 when no slot is due
     */
    public int prewarm(String team) {
        if (teams == null) return 0;
        Optional<WarmSlot> slot = teams.dueSlot(team);
        if (slot.isEmpty()) {
            logger.debug("No warm slot due for team {}", team);
            return 0;
        }
        logger.info("Pre-warming {} references for team {} ahead of {}:00",
                slot.get().references().size(), team, slot.get().hourOfDay());
        return prewarm(slot.get().references());
    }
}
