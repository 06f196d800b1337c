package org.mimir.artifact;

import org.mimir.error.InvalidReferenceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArtifactReferenceTest {

    @Test
    void parse_withPlatformSuffix_splitsVersionAndPlatform() {
        ArtifactReference ref = ArtifactReference.parse("registry.example/tools/protoc:31.1-linux-x86_64");

        assertThat(ref.ecosystem()).isEqualTo("registry.example");
        assertThat(ref.namespace()).isEqualTo("tools");
        assertThat(ref.name()).isEqualTo("protoc");
        assertThat(ref.version()).isEqualTo("31.1");
        assertThat(ref.platform()).isEqualTo("linux-x86_64");
        assertThat(ref.canonical()).isEqualTo("registry.example/tools/protoc:31.1-linux-x86_64");
    }

    @Test
    void parse_prereleaseVersion_isNotMistakenForPlatform() {
        ArtifactReference ref = ArtifactReference.parse("npm/tools/buf:1.30.0-rc1");

        assertThat(ref.version()).isEqualTo("1.30.0-rc1");
        assertThat(ref.platform()).isNull();
    }

    @Test
    void parse_multiSegmentNamespace_isKept() {
        ArtifactReference ref = ArtifactReference.parse("buf.build/grpc/go/protoc-gen-go:1.5.1");

        assertThat(ref.namespace()).isEqualTo("grpc/go");
        assertThat(ref.repository()).isEqualTo("buf.build/grpc/go/protoc-gen-go");
    }

    @Test
    void platform_makesReferencesDistinct() {
        ArtifactReference linux = ArtifactReference.parse("r/tools/protoc:31.1-linux-x86_64");
        ArtifactReference mac = ArtifactReference.parse("r/tools/protoc:31.1-darwin-arm64");

        assertThat(linux).isNotEqualTo(mac);
        assertThat(linux.withPlatform("darwin-arm64")).isEqualTo(mac);
    }

    @Test
    void parse_missingVersion_isRejected() {
        assertThatThrownBy(() -> ArtifactReference.parse("r/tools/protoc"))
                .isInstanceOf(InvalidReferenceException.class)
                .hasMessageContaining("version");
        assertThatThrownBy(() -> ArtifactReference.parse("r/tools/protoc:"))
                .isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void parse_missingName_isRejected() {
        assertThatThrownBy(() -> ArtifactReference.parse("r/tools/:1.0"))
                .isInstanceOf(InvalidReferenceException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> ArtifactReference.parse("protoc:1.0"))
                .isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void parse_pathTraversal_isRejected() {
        assertThatThrownBy(() -> ArtifactReference.parse("r/../protoc:1.0"))
                .isInstanceOf(InvalidReferenceException.class);
    }
}
