package org.mimir.artifact;

import org.mimir.error.ResolutionException;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of one resolution attempt. Exactly one of {@code binaryPath} / {@code error} is set.
 * A cache hit is a zero-duration result with tier {@link SourceTier#CACHE}.
 */
public record InstallResult(
        boolean success,
        Path binaryPath,
        ResolutionException error,
        SourceTier tierUsed,
        Duration duration,
        Digest digest,
        long sizeBytes
) {

    public static InstallResult cacheHit(CacheEntry entry, Path path) {
        return new InstallResult(true, path, null, SourceTier.CACHE, Duration.ZERO, entry.digest(), entry.sizeBytes());
    }

    public static InstallResult installed(SourceTier tier, Path path, Digest digest, long sizeBytes, Duration duration) {
        return new InstallResult(true, path, null, tier, duration, digest, sizeBytes);
    }

    /** {@code tier} is the tier that produced the terminal error, or null when none applies. */
    public static InstallResult failed(ResolutionException error, SourceTier tier, Duration duration) {
        return new InstallResult(false, null, error, tier, duration, null, 0L);
    }

    public String tierId() {
        return tierUsed == null ? null : tierUsed.id();
    }
}
