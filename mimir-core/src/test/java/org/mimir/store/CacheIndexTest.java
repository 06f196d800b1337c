package org.mimir.store;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.InvalidReferenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheIndexTest {

    @TempDir
    Path root;

    private CacheIndex index;

    @BeforeEach
    void setUp() {
        index = new CacheIndex(root);
    }

    private static CacheEntry entry(String ref, Digest d) {
        Instant t = Instant.parse("2025-03-01T10:00:00Z");
        return new CacheEntry(ArtifactReference.parse(ref), d, 42, t, t, SourceTier.REGISTRY);
    }

    @Test
    void sameDigest_reachableFromSeveralReferences() {
        Digest d = Digest.of("shared");
        index.put(entry("r/tools/protoc:31.1", d));
        index.put(entry("r/tools/protoc:latest", d));

        assertThat(index.byDigest(d))
                .extracting(e -> e.reference().canonical())
                .containsExactlyInAnyOrder("r/tools/protoc:31.1", "r/tools/protoc:latest");
    }

    @Test
    void put_movedTag_dropsOldDigestSideRecord() {
        Digest v1 = Digest.of("v1");
        Digest v2 = Digest.of("v2");
        index.put(entry("r/tools/protoc:latest", v1));
        index.put(entry("r/tools/protoc:latest", v2));

        assertThat(index.get(ArtifactReference.parse("r/tools/protoc:latest")).orElseThrow().digest()).isEqualTo(v2);
        assertThat(index.byDigest(v1)).isEmpty();
        assertThat(index.byDigest(v2)).hasSize(1);
    }

    @Test
    void removeDigest_removesEveryReferencePointingAtIt() {
        Digest d = Digest.of("gone");
        Digest other = Digest.of("other");
        index.put(entry("r/tools/a:1", d));
        index.put(entry("r/tools/b:1", d));
        index.put(entry("r/tools/c:1", other));

        assertThat(index.removeDigest(d)).isEqualTo(2);
        assertThat(index.all()).extracting(CacheEntry::digest).containsExactly(other);
    }

    @Test
    void tags_listsLocalTagsOfRepository() {
        index.put(entry("r/tools/protoc:31.1-linux-x86_64", Digest.of("a")));
        index.put(entry("r/tools/protoc:30.0", Digest.of("b")));
        index.put(entry("r/tools/buf:1.0", Digest.of("c")));

        assertThat(index.tags("r/tools/protoc")).containsExactly("30.0", "31.1-linux-x86_64");
        assertThat(index.tags("r/tools/missing")).isEmpty();
    }

    @Test
    void tags_rejectsRepositoryEscapingIndex() {
        assertThatThrownBy(() -> index.tags("../../etc"))
                .isInstanceOf(InvalidReferenceException.class);
    }

    @Test
    void recordLayout_isTabSeparatedSingleLine() throws Exception {
        ArtifactReference ref = ArtifactReference.parse("r/tools/protoc:31.1");
        index.put(entry(ref.canonical(), Digest.of("x")));

        String line = Files.readString(index.refRecordPath(ref), StandardCharsets.UTF_8);
        assertThat(line).endsWith("\n");
        assertThat(line.strip().split("\t")).hasSize(6).startsWith("r/tools/protoc:31.1");
        assertThat(index.refRecordPath(ref)).isEqualTo(root.resolve("refs/r/tools/protoc/31.1.entry"));
    }

    @Test
    void unreadableRecord_isDroppedAsMiss() throws Exception {
        ArtifactReference ref = ArtifactReference.parse("r/tools/protoc:31.1");
        Path record = index.refRecordPath(ref);
        Files.createDirectories(record.getParent());
        Files.writeString(record, "garbage");

        assertThat(index.get(ref)).isEmpty();
        assertThat(Files.exists(record)).isFalse();
    }
}
