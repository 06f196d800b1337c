package org.mimir.report;

public enum RecommendationKind {
    RAISE_CACHE_SIZE,
    CREATE_BUNDLE,
    PRELOAD,
    PUBLISH_TO_REGISTRY
}
