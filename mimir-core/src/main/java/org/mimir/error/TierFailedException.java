package org.mimir.error;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;

/**
 * A tier was attempted and failed (install error, network error, timeout).
 */
public class TierFailedException extends ResolutionException {

    private final SourceTier tier;

    public TierFailedException(SourceTier tier, ArtifactReference reference, String message) {
        super(reference, message);
        this.tier = tier;
    }

    public TierFailedException(SourceTier tier, ArtifactReference reference, String message, Throwable cause) {
        super(reference, message, cause);
        this.tier = tier;
    }

    public SourceTier getTier() {
        return tier;
    }
}
