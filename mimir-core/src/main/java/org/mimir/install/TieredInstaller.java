package org.mimir.install;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.artifact.SourceTier;
import org.mimir.error.AggregateResolutionFailedException;
import org.mimir.error.ResolutionException;
import org.mimir.error.TierFailedException;
import org.mimir.error.TierFailure;
import org.mimir.error.TierUnavailableException;
import org.mimir.error.VerificationFailedException;
import org.mimir.store.DigestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Tries each {@link InstallerTier} in order until one produces the artifact.
 * <ul>
 *   <li>skipped tiers cost nothing and are not failures;</li>
 *   <li>a failed tier falls through to the next one;</li>
 *   <li>a digest mismatch stops the chain and nothing is cached.</li>
 * </ul>
 */
public class TieredInstaller {
    private static final Logger logger = LoggerFactory.getLogger(TieredInstaller.class);

    private final List<InstallerTier> tiers;
    private final DigestStore store;
    private final Path workRoot;

    public TieredInstaller(List<InstallerTier> tiers, DigestStore store) {
        this(tiers, store, store.rootDir().resolve("work"));
    }

    public TieredInstaller(List<InstallerTier> tiers, DigestStore store, Path workRoot) {
        this.tiers = List.copyOf(tiers);
        this.store = store;
        this.workRoot = workRoot;
    }

    public List<InstallerTier> tiers() {
        return tiers;
    }

    public InstallResult install(ArtifactReference ref) {
        return install(ref, null);
    }

    public InstallResult install(ArtifactReference ref, Digest expected) {
        long t0 = System.nanoTime();
        Path workDir;
        try {
            Files.createDirectories(workRoot);
            workDir = Files.createTempDirectory(workRoot, "install-");
        } catch (IOException e) {
            return InstallResult.failed(
                    new ResolutionException(ref, "Cannot create work directory under " + workRoot, e), null, elapsed(t0));
        }

        List<TierFailure> failures = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        try {
            for (InstallerTier tier : tiers) {
                TierOutcome outcome = attempt(tier, ref, workDir);
                if (outcome.kind() == TierOutcome.Kind.SKIPPED) {
                    logger.debug("Tier {} skipped for {}: {}", tier.name(), ref, outcome.reason());
                    skipped.add(tier.name());
                    continue;
                }
                if (outcome.kind() == TierOutcome.Kind.FAILED) {
                    logger.warn("Tier {} failed for {}, falling through: {}", tier.name(), ref, outcome.error().getMessage());
                    failures.add(new TierFailure(tier.name(), outcome.error()));
                    continue;
                }
                return commit(ref, expected, tier, outcome, t0);
            }
        } finally {
            deleteQuietly(workDir);
        }

        AggregateResolutionFailedException error = new AggregateResolutionFailedException(ref, failures, skipped);
        logger.error("Resolution failed for {}: {}", ref, error.getMessage());
        return InstallResult.failed(error, null, elapsed(t0));
    }

    private TierOutcome attempt(InstallerTier tier, ArtifactReference ref, Path workDir) {
        try {
            return tier.attempt(ref, workDir);
        } catch (TierUnavailableException e) {
            return TierOutcome.skipped(e.getMessage());
        } catch (ResolutionException e) {
            return TierOutcome.failed(e);
        } catch (RuntimeException e) {
            return TierOutcome.failed(new TierFailedException(tier.tier(), ref,
                    tier.name() + " tier error: " + e.getMessage(), e));
        }
    }

    private InstallResult commit(ArtifactReference ref, Digest expected, InstallerTier tier, TierOutcome outcome, long t0) {
        Path artifact = outcome.artifact();
        Digest actual;
        try {
            actual = Digest.of(artifact);
        } catch (IOException e) {
            return InstallResult.failed(new TierFailedException(tier.tier(), ref,
                    "Cannot read artifact produced by " + tier.name() + ": " + artifact, e), tier.tier(), elapsed(t0));
        }

        if (outcome.declaredDigest() != null && !outcome.declaredDigest().equals(actual)) {
            return mismatch(ref, tier.tier(), outcome.declaredDigest(), actual, t0);
        }
        if (expected != null && !expected.equals(actual)) {
            return mismatch(ref, tier.tier(), expected, actual, t0);
        }

        Digest stored = store.put(artifact);
        CacheEntry entry = store.record(ref, stored, tier.tier());
        Duration took = elapsed(t0);
        logger.info("Installed {} via {} tier in {} ms ({}, {} bytes)",
                ref, tier.name(), took.toMillis(), stored, entry.sizeBytes());
        return InstallResult.installed(tier.tier(), store.pathFor(stored), stored, entry.sizeBytes(), took);
    }

    private static InstallResult mismatch(ArtifactReference ref, SourceTier tier, Digest expected, Digest actual, long t0) {
        VerificationFailedException e = new VerificationFailedException(ref, tier, expected, actual);
        logger.error("{}; discarding download, no further tiers tried", e.getMessage());
        return InstallResult.failed(e, tier, elapsed(t0));
    }

    private static Duration elapsed(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }

    private static void deleteQuietly(Path dir) {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            logger.warn("Failed to clean work directory {}", dir, e);
        }
    }
}
