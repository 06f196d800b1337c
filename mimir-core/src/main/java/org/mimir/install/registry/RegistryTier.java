package org.mimir.install.registry;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.install.InstallerTier;
import org.mimir.install.TierOutcome;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Pulls from the content-addressable registry. The tag's digest is declared to the installer,
 * so bytes that do not hash to it are rejected.
 */
public class RegistryTier implements InstallerTier {

    private final ArtifactRegistry registry;

    public RegistryTier(ArtifactRegistry registry) {
        this.registry = registry;
    }

    @Override
    public SourceTier tier() {
        return SourceTier.REGISTRY;
    }

    @Override
    public TierOutcome attempt(ArtifactReference reference, Path workDir) {
        if (!registry.isConfigured()) {
            return TierOutcome.skipped("no registry configured");
        }
        Optional<Digest> digest = registry.resolveTag(reference);
        if (digest.isEmpty()) {
            return TierOutcome.failed(new ArtifactNotFoundException(reference, "No registry tag for " + reference));
        }
        Path target = workDir.resolve("registry").resolve(digest.get().hex());
        registry.download(reference, digest.get(), target);
        return TierOutcome.fetched(target, digest.get());
    }
}
