package org.mimir.error;

import org.mimir.artifact.ArtifactReference;

/**
 * Root of every failure the engine surfaces while resolving an artifact.
 */
public class ResolutionException extends RuntimeException {

    private final transient ArtifactReference reference;

    public ResolutionException(ArtifactReference reference, String message) {
        super(message);
        this.reference = reference;
    }

    public ResolutionException(ArtifactReference reference, String message, Throwable cause) {
        super(message, cause);
        this.reference = reference;
    }

    /** May be null for failures not tied to a single reference. */
    public ArtifactReference getReference() {
        return reference;
    }
}
