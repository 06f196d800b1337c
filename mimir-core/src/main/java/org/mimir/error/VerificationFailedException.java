package org.mimir.error;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;

/**
 * Fetched bytes did not hash to the expected digest. Terminal: no further tier is tried.
 */
public class VerificationFailedException extends ResolutionException {

    private final SourceTier tier;
    private final Digest expected;
    private final Digest actual;

    public VerificationFailedException(ArtifactReference reference, SourceTier tier, Digest expected, Digest actual) {
        super(reference, "Digest mismatch for " + reference + " from tier " + (tier == null ? "?" : tier.id())
                + ": expected " + expected + " but got " + actual);
        this.tier = tier;
        this.expected = expected;
        this.actual = actual;
    }

    public SourceTier getTier() {
        return tier;
    }

    public Digest getExpected() {
        return expected;
    }

    public Digest getActual() {
        return actual;
    }
}
