package org.mimir.artifact;

import org.mimir.error.InvalidReferenceException;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable coordinate of a versioned artifact, used as the cache-lookup key before a digest is known.
 * <p>
 * Text form:
 * <pre>
 *   ecosystem/namespace/name:version[-platform]
 * </pre>
 * e.g. {@code registry.example/tools/protoc:31.1-linux-x86_64}. The namespace may span several
 * path segments. Two references differing only in platform are distinct artifacts.
 */
public record ArtifactReference(String ecosystem, String namespace, String name, String version, String platform) {

    private static final Pattern SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
    private static final Pattern VERSION = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._+-]*");
    private static final Set<String> OS_TOKENS = Set.of("linux", "darwin", "osx", "macos", "windows");

    public ArtifactReference {
        requireSegment("ecosystem", ecosystem);
        Objects.requireNonNull(namespace, "namespace");
        for (String part : namespace.split("/", -1)) {
            requireSegment("namespace", part);
        }
        requireSegment("name", name);
        if (version == null || !VERSION.matcher(version).matches()) {
            throw new InvalidReferenceException("Invalid version '" + version + "'");
        }
        if (platform != null && platform.isBlank()) {
            platform = null;
        }
        if (platform != null && !VERSION.matcher(platform).matches()) {
            throw new InvalidReferenceException("Invalid platform '" + platform + "'");
        }
    }

    public ArtifactReference(String ecosystem, String namespace, String name, String version) {
        this(ecosystem, namespace, name, version, null);
    }

    public static ArtifactReference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidReferenceException("Reference is blank");
        }
        String s = text.strip();
        int colon = s.lastIndexOf(':');
        if (colon < 0 || colon == s.length() - 1 || s.indexOf('/', colon) >= 0) {
            throw new InvalidReferenceException("Reference '" + text + "' is missing a version");
        }
        String path = s.substring(0, colon);
        String tag = s.substring(colon + 1);

        int lastSlash = path.lastIndexOf('/');
        int firstSlash = path.indexOf('/');
        if (lastSlash < 0 || lastSlash == path.length() - 1) {
            throw new InvalidReferenceException("Reference '" + text + "' is missing a name");
        }
        if (firstSlash == lastSlash) {
            throw new InvalidReferenceException("Reference '" + text + "' must be ecosystem/namespace/name:version");
        }
        String ecosystem = path.substring(0, firstSlash);
        String namespace = path.substring(firstSlash + 1, lastSlash);
        String name = path.substring(lastSlash + 1);

        String version = tag;
        String platform = null;
        int dash = tag.indexOf('-');
        if (dash > 0 && dash < tag.length() - 1 && isPlatform(tag.substring(dash + 1))) {
            version = tag.substring(0, dash);
            platform = tag.substring(dash + 1);
        }
        return new ArtifactReference(ecosystem, namespace, name, version, platform);
    }

    private static boolean isPlatform(String candidate) {
        int dash = candidate.indexOf('-');
        String os = (dash < 0 ? candidate : candidate.substring(0, dash)).toLowerCase(Locale.ROOT);
        return OS_TOKENS.contains(os);
    }

    private static void requireSegment(String field, String value) {
        if (value == null || !SEGMENT.matcher(value).matches()) {
            throw new InvalidReferenceException("Invalid " + field + " '" + value + "'");
        }
    }

    /** {@code ecosystem/namespace/name}, the part shared by every tag of the artifact. */
    public String repository() {
        return ecosystem + "/" + namespace + "/" + name;
    }

    /** {@code version[-platform]} */
    public String tag() {
        return platform == null ? version : version + "-" + platform;
    }

    public String canonical() {
        return repository() + ":" + tag();
    }

    public ArtifactReference withPlatform(String newPlatform) {
        return new ArtifactReference(ecosystem, namespace, name, version, newPlatform);
    }

    @Override
    public String toString() {
        return canonical();
    }
}
