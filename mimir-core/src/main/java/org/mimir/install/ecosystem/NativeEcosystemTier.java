package org.mimir.install.ecosystem;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;
import org.mimir.install.InstallerTier;
import org.mimir.install.TierOutcome;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Installs through the host's own package manager for the reference's ecosystem.
 * Skipped when no matching manager is installed.
 */
public class NativeEcosystemTier implements InstallerTier {

    private final List<PackageManager> managers;

    public NativeEcosystemTier(List<PackageManager> managers) {
        this.managers = List.copyOf(managers);
    }

    @Override
    public SourceTier tier() {
        return SourceTier.NATIVE;
    }

    @Override
    public TierOutcome attempt(ArtifactReference reference, Path workDir) {
        Optional<PackageManager> manager = managers.stream()
                .filter(m -> m.handles(reference.ecosystem()))
                .findFirst();
        if (manager.isEmpty()) {
            return TierOutcome.skipped("no package manager for ecosystem " + reference.ecosystem());
        }
        if (!manager.get().isAvailable()) {
            return TierOutcome.skipped(manager.get().name() + " is not installed");
        }
        Path binary = manager.get().install(reference, workDir.resolve("native"));
        return TierOutcome.fetched(binary, null);
    }
}
