package org.mimir.install.ecosystem;

import org.mimir.artifact.ArtifactReference;

import java.nio.file.Path;

/**
 * A host package manager able to install artifacts of one or more ecosystems.
 */
public interface PackageManager {

    String name();

    boolean handles(String ecosystem);

    /** Whether the tool exists on this host. Cheap after the first call. */
    boolean isAvailable();

    /**
     * Installs {@code reference} under {@code targetDir}.
     *
     * @return path of the installed binary
     * @throws org.mimir.error.TierFailedException when the tool runs but the install fails
     */
    Path install(ArtifactReference reference, Path targetDir);
}
