package org.mimir.error;

import org.mimir.artifact.Digest;

import java.nio.file.Path;

/**
 * A cached blob no longer hashes to its address. The store has already removed it.
 */
public class CacheCorruptionException extends ResolutionException {

    private final Digest expected;
    private final Digest actual;

    public CacheCorruptionException(Digest expected, Digest actual, Path path) {
        super(null, "Cached blob " + path + " is corrupt: expected " + expected + " but hashed to " + actual);
        this.expected = expected;
        this.actual = actual;
    }

    public Digest getExpected() {
        return expected;
    }

    public Digest getActual() {
        return actual;
    }
}
