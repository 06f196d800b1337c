package org.mimir.team;

import org.mimir.artifact.ArtifactReference;

/**
 * Two references used together. {@code referenceA} sorts before {@code referenceB} canonically,
 * so a pair has a single representation.
 *
 * @param score      joint usage over the larger individual usage, in [0, 1]
 * @param usageCount joint usage count
 */
public record CoOccurrencePair(ArtifactReference referenceA, ArtifactReference referenceB, double score, long usageCount) {

    public static CoOccurrencePair of(ArtifactReference x, ArtifactReference y, double score, long usageCount) {
        return x.canonical().compareTo(y.canonical()) <= 0
                ? new CoOccurrencePair(x, y, score, usageCount)
                : new CoOccurrencePair(y, x, score, usageCount);
    }

    public boolean involves(ArtifactReference ref) {
        return referenceA.equals(ref) || referenceB.equals(ref);
    }
}
