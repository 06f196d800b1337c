package org.mimir.error;

import org.mimir.artifact.ArtifactReference;

import java.util.List;

/**
 * Every tier was tried (or skipped) without producing the artifact.
 */
public class AggregateResolutionFailedException extends ResolutionException {

    private final List<TierFailure> failures;
    private final List<String> skippedTiers;

    public AggregateResolutionFailedException(ArtifactReference reference, List<TierFailure> failures, List<String> skippedTiers) {
        super(reference, describe(reference, failures, skippedTiers));
        this.failures = List.copyOf(failures);
        this.skippedTiers = List.copyOf(skippedTiers);
    }

    public List<TierFailure> getFailures() {
        return failures;
    }

    public List<String> getSkippedTiers() {
        return skippedTiers;
    }

    /** True when every attempted tier reported the artifact as absent. */
    public boolean isNotFound() {
        return !failures.isEmpty()
                && failures.stream().allMatch(f -> f.error() instanceof ArtifactNotFoundException);
    }

    private static String describe(ArtifactReference reference, List<TierFailure> failures, List<String> skipped) {
        StringBuilder sb = new StringBuilder("All tiers failed for ").append(reference);
        if (failures.isEmpty()) {
            sb.append(": no tier attempted");
        }
        for (TierFailure f : failures) {
            sb.append("; ").append(f.tier()).append(": ").append(f.error().getMessage());
        }
        if (!skipped.isEmpty()) {
            sb.append(" (skipped: ").append(String.join(", ", skipped)).append(')');
        }
        return sb.toString();
    }
}
