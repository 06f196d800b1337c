package org.mimir.team;

import org.mimir.artifact.ArtifactReference;

import java.time.Instant;
import java.util.Objects;

/** A successful resolution by {@code actor} on behalf of {@code team}. */
public record UsageEvent(String team, ArtifactReference reference, String actor, Instant timestamp) {

    public UsageEvent {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(timestamp, "timestamp");
        actor = actor == null || actor.isBlank() ? "anonymous" : actor;
    }
}
