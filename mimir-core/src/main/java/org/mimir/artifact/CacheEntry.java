package org.mimir.artifact;

import java.time.Instant;
import java.util.Objects;

/**
 * One cached artifact: the reference it was resolved under and the blob it points at.
 */
public record CacheEntry(
        ArtifactReference reference,
        Digest digest,
        long sizeBytes,
        Instant createdAt,
        Instant lastAccessedAt,
        SourceTier sourceTier
) {
    public CacheEntry {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(lastAccessedAt, "lastAccessedAt");
        Objects.requireNonNull(sourceTier, "sourceTier");
    }

    public CacheEntry withLastAccessedAt(Instant at) {
        return new CacheEntry(reference, digest, sizeBytes, createdAt, at, sourceTier);
    }
}
