package org.mimir.install;

import org.mimir.artifact.Digest;
import org.mimir.error.ResolutionException;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of a single {@link InstallerTier#attempt}.
 *
 * @param declaredDigest digest the tier itself vouches for (registry tag, configured checksum), may be null
 */
public record TierOutcome(Kind kind, Path artifact, Digest declaredDigest, ResolutionException error, String reason) {

    public enum Kind { FETCHED, SKIPPED, FAILED }

    public static TierOutcome fetched(Path artifact, Digest declaredDigest) {
        return new TierOutcome(Kind.FETCHED, Objects.requireNonNull(artifact, "artifact"), declaredDigest, null, null);
    }

    public static TierOutcome skipped(String reason) {
        return new TierOutcome(Kind.SKIPPED, null, null, null, reason);
    }

    public static TierOutcome failed(ResolutionException error) {
        return new TierOutcome(Kind.FAILED, null, null, Objects.requireNonNull(error, "error"), error.getMessage());
    }
}
