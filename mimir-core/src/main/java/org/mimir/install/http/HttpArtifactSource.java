package org.mimir.install.http;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;

import java.util.Map;
import java.util.Optional;

/**
 * Where to download one repository's artifacts from, and the SHA-256 checksums published
 * for each tag. URL placeholders: {@code {ecosystem}}, {@code {namespace}}, {@code {name}},
 * {@code {version}}, {@code {platform}}, {@code {tag}}.
 */
public record HttpArtifactSource(String urlTemplate, Map<String, String> checksums) {

    public HttpArtifactSource {
        if (urlTemplate == null || urlTemplate.isBlank()) {
            throw new IllegalArgumentException("urlTemplate is required");
        }
        checksums = checksums == null ? Map.of() : Map.copyOf(checksums);
    }

    public String urlFor(ArtifactReference ref) {
        return urlTemplate
                .replace("{ecosystem}", ref.ecosystem())
                .replace("{namespace}", ref.namespace())
                .replace("{name}", ref.name())
                .replace("{version}", ref.version())
                .replace("{platform}", ref.platform() == null ? "" : ref.platform())
                .replace("{tag}", ref.tag());
    }

    public Optional<Digest> checksumFor(ArtifactReference ref) {
        String c = checksums.get(ref.tag());
        return c == null || c.isBlank() ? Optional.empty() : Optional.of(Digest.parse(c));
    }
}
