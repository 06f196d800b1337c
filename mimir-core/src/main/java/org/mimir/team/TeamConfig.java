package org.mimir.team;

import org.mimir.artifact.ArtifactReference;

import java.util.List;
import java.util.Objects;

/**
 * @param bundleDependencies references the team already ships together; pairs among them are
 *                           never proposed as a new bundle
 */
public record TeamConfig(String teamName, List<String> members, CacheStrategy cacheStrategy,
                         List<ArtifactReference> bundleDependencies) {

    public TeamConfig {
        Objects.requireNonNull(teamName, "teamName");
        members = members == null ? List.of() : List.copyOf(members);
        cacheStrategy = cacheStrategy == null ? CacheStrategy.BALANCED : cacheStrategy;
        bundleDependencies = bundleDependencies == null ? List.of() : List.copyOf(bundleDependencies);
    }

    public static TeamConfig defaults(String teamName) {
        return new TeamConfig(teamName, List.of(), CacheStrategy.BALANCED, List.of());
    }
}
