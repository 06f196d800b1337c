package org.mimir.error;

/** One attempted tier and the error it produced. */
public record TierFailure(String tier, ResolutionException error) {
}
