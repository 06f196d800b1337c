package org.mimir.store;

import org.mimir.artifact.Digest;

import java.util.List;

public record EvictionReport(int removedCount, long bytesFreed, List<Digest> removed) {

    public static EvictionReport empty() {
        return new EvictionReport(0, 0L, List.of());
    }
}
