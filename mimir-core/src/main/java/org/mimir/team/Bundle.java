package org.mimir.team;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * A set of references shipped as one artifact. Membership never changes once published;
 * a different member set is a different bundle.
 */
public record Bundle(String name, List<ArtifactReference> members, Digest digest, String description, Instant createdAt) {

    public Bundle {
        members = members.stream()
                .sorted(Comparator.comparing(ArtifactReference::canonical))
                .distinct()
                .toList();
    }

    public boolean covers(ArtifactReference a, ArtifactReference b) {
        return members.contains(a) && members.contains(b);
    }
}
