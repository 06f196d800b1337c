package org.mimir.install.registry;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;

/**
 * Object keys inside the registry bucket:
 * <pre>
 *   {prefix}/refs/{ecosystem}/{namespace}/{name}/{tag}   -> "sha256:..." (text)
 *   {prefix}/blobs/sha256/{hex}                           -> blob bytes
 * </pre>
 */
public record RegistryLayout(String prefix) {

    public RegistryLayout {
        prefix = normalize(prefix);
    }

    public String tagKey(ArtifactReference ref) {
        return tagsPrefix(ref.repository()) + ref.tag();
    }

    public String tagsPrefix(String repository) {
        return prefix + "refs/" + repository + "/";
    }

    public String blobKey(Digest digest) {
        return prefix + "blobs/" + digest.algorithm() + "/" + digest.hex();
    }

    private static String normalize(String p) {
        if (p == null || p.isBlank()) return "";
        String s = p.strip();
        while (s.startsWith("/")) s = s.substring(1);
        while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
        return s.isEmpty() ? "" : s + "/";
    }
}
