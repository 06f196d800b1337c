package org.mimir.install;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;

import java.nio.file.Path;

/**
 * One distribution channel the {@link TieredInstaller} can try.
 * <p>
 * {@link #attempt} returns {@link TierOutcome#skipped} quickly and without I/O when the tier's
 * prerequisite (a tool, a configured source) is absent. Fetched files must be written under
 * {@code workDir}; the installer deletes it afterwards.
 */
public interface InstallerTier {

    SourceTier tier();

    default String name() {
        return tier().id();
    }

    TierOutcome attempt(ArtifactReference reference, Path workDir);
}
