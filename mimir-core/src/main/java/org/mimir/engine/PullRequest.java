package org.mimir.engine;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;

import java.util.Objects;

/**
 * @param expectedDigest optional pin; the pull fails if the artifact does not hash to it
 * @param team           optional; when set the pull is recorded as team usage
 */
public record PullRequest(ArtifactReference reference, Digest expectedDigest, String team, String actor) {

    public PullRequest {
        Objects.requireNonNull(reference, "reference");
    }

    public static PullRequest of(ArtifactReference reference) {
        return new PullRequest(reference, null, null, null);
    }
}
