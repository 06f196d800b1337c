package org.mimir.artifact;

import java.util.Locale;

/** Where a resolved artifact came from. */
public enum SourceTier {
    CACHE("cache"),
    NATIVE("native"),
    REGISTRY("registry"),
    HTTP("http"),
    /** Produced locally, e.g. a published bundle manifest. */
    BUILT("built");

    private final String id;

    SourceTier(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static SourceTier fromId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Blank tier id");
        }
        String s = id.strip().toLowerCase(Locale.ROOT);
        for (SourceTier t : values()) {
            if (t.id.equals(s)) return t;
        }
        throw new IllegalArgumentException("Unknown tier id: " + id);
    }
}
