package org.mimir.store;

import java.time.Duration;
import java.util.Objects;

/**
 * How {@link DigestStore#evict(EvictionPolicy)} decides what to remove.
 *
 * @param mode      SIZE evicts least-recently-accessed blobs until the store fits in {@code maxBytes};
 *                  AGE evicts every blob not accessed within {@code retention}
 */
public record EvictionPolicy(Mode mode, long maxBytes, Duration retention) {

    public enum Mode { SIZE, AGE }

    public EvictionPolicy {
        Objects.requireNonNull(mode, "mode");
        if (mode == Mode.SIZE && maxBytes < 0) {
            throw new IllegalArgumentException("maxBytes must be >= 0");
        }
        if (mode == Mode.AGE && (retention == null || retention.isNegative())) {
            throw new IllegalArgumentException("retention must be a non-negative duration");
        }
    }

    public static EvictionPolicy bySize(long maxBytes) {
        return new EvictionPolicy(Mode.SIZE, maxBytes, null);
    }

    public static EvictionPolicy byAge(Duration retention) {
        return new EvictionPolicy(Mode.AGE, -1L, retention);
    }
}
