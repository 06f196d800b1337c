package org.mimir.store;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;

import java.time.Instant;

/**
 * Single-line index record for a {@link CacheEntry}.
 */
public final class CacheEntryCodec {
    private CacheEntryCodec() {}

    public static String encode(CacheEntry e) {
        // reference \t digest \t size \t createdAtEpochMillis \t lastAccessedAtEpochMillis \t tier
        return e.reference().canonical() + "\t" +
                e.digest() + "\t" +
                e.sizeBytes() + "\t" +
                e.createdAt().toEpochMilli() + "\t" +
                e.lastAccessedAt().toEpochMilli() + "\t" +
                e.sourceTier().id() + "\n";
    }

    public static CacheEntry decode(String line) {
        String[] parts = line.strip().split("\t", 6);
        if (parts.length < 6) throw new IllegalArgumentException("Invalid index record: " + line);
        return new CacheEntry(
                ArtifactReference.parse(parts[0]),
                Digest.parse(parts[1]),
                Long.parseLong(parts[2]),
                Instant.ofEpochMilli(Long.parseLong(parts[3])),
                Instant.ofEpochMilli(Long.parseLong(parts[4])),
                SourceTier.fromId(parts[5])
        );
    }
}
