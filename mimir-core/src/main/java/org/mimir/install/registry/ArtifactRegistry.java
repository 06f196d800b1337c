package org.mimir.install.registry;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Content-addressable remote registry: tags point at digests, digests address blobs.
 */
public interface ArtifactRegistry {

    boolean isConfigured();

    /** Digest the registry's tag for {@code reference} points at, empty when there is no such tag. */
    Optional<Digest> resolveTag(ArtifactReference reference);

    /** Downloads blob {@code digest} to {@code destination}. */
    void download(ArtifactReference reference, Digest digest, Path destination);

    List<String> listTags(String repository);

    void push(ArtifactReference reference, Digest digest, Path content);

    /** Placeholder used when no registry is configured. */
    static ArtifactRegistry none() {
        return NoRegistry.INSTANCE;
    }

    final class NoRegistry implements ArtifactRegistry {
        static final NoRegistry INSTANCE = new NoRegistry();

        private NoRegistry() {}

        @Override
        public boolean isConfigured() {
            return false;
        }

        @Override
        public Optional<Digest> resolveTag(ArtifactReference reference) {
            return Optional.empty();
        }

        @Override
        public void download(ArtifactReference reference, Digest digest, Path destination) {
            throw new UnsupportedOperationException("No registry configured");
        }

        @Override
        public List<String> listTags(String repository) {
            return List.of();
        }

        @Override
        public void push(ArtifactReference reference, Digest digest, Path content) {
            throw new UnsupportedOperationException("No registry configured");
        }
    }
}
