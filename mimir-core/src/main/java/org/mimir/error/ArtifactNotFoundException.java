package org.mimir.error;

import org.mimir.artifact.ArtifactReference;

public class ArtifactNotFoundException extends ResolutionException {

    public ArtifactNotFoundException(ArtifactReference reference, String message) {
        super(reference, message);
    }

    public ArtifactNotFoundException(ArtifactReference reference, String message, Throwable cause) {
        super(reference, message, cause);
    }
}
