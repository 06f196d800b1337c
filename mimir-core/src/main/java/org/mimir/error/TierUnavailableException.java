package org.mimir.error;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;

/**
 * A tier cannot serve this reference on this host (tool missing, nothing configured).
 * Only ever causes fallthrough.
 */
public class TierUnavailableException extends ResolutionException {

    private final SourceTier tier;

    public TierUnavailableException(SourceTier tier, ArtifactReference reference, String message) {
        super(reference, message);
        this.tier = tier;
    }

    public SourceTier getTier() {
        return tier;
    }
}
