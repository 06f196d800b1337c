package org.mimir.store;

import org.mimir.artifact.Digest;

import java.time.Instant;

/** A blob as found on disk. */
public record BlobInfo(Digest digest, long sizeBytes, Instant lastAccessedAt) {
}
