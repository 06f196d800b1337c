package org.mimir.install;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.artifact.SourceTier;
import org.mimir.error.AggregateResolutionFailedException;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.TierFailedException;
import org.mimir.error.TierUnavailableException;
import org.mimir.error.VerificationFailedException;
import org.mimir.store.DigestStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;

class TieredInstallerTest {

    private static final ArtifactReference REF = ArtifactReference.parse("r/tools/protoc:31.1-linux-x86_64");
    private static final byte[] CONTENT = "protoc-31.1".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private DigestStore store;

    @BeforeEach
    void setUp() {
        store = new DigestStore(root);
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    /** Tier whose behaviour is a lambda; counts attempts. */
    private static final class StubTier implements InstallerTier {
        final SourceTier tier;
        final BiFunction<ArtifactReference, Path, TierOutcome> behaviour;
        final AtomicInteger attempts = new AtomicInteger();

        StubTier(SourceTier tier, BiFunction<ArtifactReference, Path, TierOutcome> behaviour) {
            this.tier = tier;
            this.behaviour = behaviour;
        }

        @Override
        public SourceTier tier() {
            return tier;
        }

        @Override
        public TierOutcome attempt(ArtifactReference reference, Path workDir) {
            attempts.incrementAndGet();
            return behaviour.apply(reference, workDir);
        }
    }

    private static TierOutcome write(Path workDir, byte[] bytes, Digest declared) {
        try {
            Path f = workDir.resolve("artifact.bin");
            Files.write(f, bytes);
            return TierOutcome.fetched(f, declared);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static StubTier skipping(SourceTier t) {
        return new StubTier(t, (r, w) -> TierOutcome.skipped("not installed"));
    }

    private static StubTier notFound(SourceTier t) {
        return new StubTier(t, (r, w) -> TierOutcome.failed(new ArtifactNotFoundException(r, "no such tag")));
    }

    private static StubTier serving(SourceTier t, byte[] bytes, Digest declared) {
        return new StubTier(t, (r, w) -> write(w, bytes, declared));
    }

    // ----------------------------------------------------------------------
    // Fallthrough
    // ----------------------------------------------------------------------

    @Test
    void install_nativeSkipped_registryNotFound_httpServes() {
        StubTier nat = skipping(SourceTier.NATIVE);
        StubTier reg = notFound(SourceTier.REGISTRY);
        StubTier http = serving(SourceTier.HTTP, CONTENT, Digest.of(CONTENT));
        TieredInstaller installer = new TieredInstaller(List.of(nat, reg, http), store);

        InstallResult result = installer.install(REF);

        assertThat(result.success()).isTrue();
        assertThat(result.tierId()).isEqualTo("http");
        assertThat(result.digest()).isEqualTo(Digest.of(CONTENT));
        assertThat(result.binaryPath()).isEqualTo(store.pathFor(Digest.of(CONTENT)));
        assertThat(store.lookup(REF).orElseThrow().sourceTier()).isEqualTo(SourceTier.HTTP);
        assertThat(List.of(nat.attempts.get(), reg.attempts.get(), http.attempts.get())).containsExactly(1, 1, 1);
    }

    @Test
    void install_firstTierSucceeds_laterTiersNotTried() {
        StubTier reg = serving(SourceTier.REGISTRY, CONTENT, Digest.of(CONTENT));
        StubTier http = serving(SourceTier.HTTP, CONTENT, Digest.of(CONTENT));
        TieredInstaller installer = new TieredInstaller(List.of(reg, http), store);

        InstallResult result = installer.install(REF);

        assertThat(result.tierUsed()).isEqualTo(SourceTier.REGISTRY);
        assertThat(http.attempts.get()).isZero();
    }

    @Test
    void install_tierThrowsUnexpectedly_isTreatedAsFailureAndFallsThrough() {
        StubTier broken = new StubTier(SourceTier.NATIVE, (r, w) -> { throw new IllegalStateException("boom"); });
        StubTier http = serving(SourceTier.HTTP, CONTENT, null);
        TieredInstaller installer = new TieredInstaller(List.of(broken, http), store);

        assertThat(installer.install(REF).tierUsed()).isEqualTo(SourceTier.HTTP);
    }

    @Test
    void install_tierUnavailable_isSkipNotFailure() {
        StubTier unavailable = new StubTier(SourceTier.REGISTRY,
                (r, w) -> { throw new TierUnavailableException(SourceTier.REGISTRY, r, "offline"); });
        TieredInstaller installer = new TieredInstaller(List.of(unavailable), store);

        InstallResult result = installer.install(REF);

        AggregateResolutionFailedException e = (AggregateResolutionFailedException) result.error();
        assertThat(e.getFailures()).isEmpty();
        assertThat(e.getSkippedTiers()).containsExactly("registry");
    }

    // ----------------------------------------------------------------------
    // Aggregate failure
    // ----------------------------------------------------------------------

    @Test
    void install_allTiersFail_aggregateListsEveryAttemptedTier() {
        StubTier nat = new StubTier(SourceTier.NATIVE,
                (r, w) -> TierOutcome.failed(new TierFailedException(SourceTier.NATIVE, r, "npm exited with 1")));
        StubTier reg = notFound(SourceTier.REGISTRY);
        StubTier http = new StubTier(SourceTier.HTTP,
                (r, w) -> TierOutcome.failed(new TierFailedException(SourceTier.HTTP, r, "timed out")));
        TieredInstaller installer = new TieredInstaller(List.of(nat, reg, http), store);

        InstallResult result = installer.install(REF);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isInstanceOf(AggregateResolutionFailedException.class);
        AggregateResolutionFailedException e = (AggregateResolutionFailedException) result.error();
        assertThat(e.getFailures()).extracting(f -> f.tier()).containsExactly("native", "registry", "http");
        assertThat(e.getMessage()).contains("npm exited with 1").contains("no such tag").contains("timed out");
        assertThat(e.isNotFound()).isFalse();
        assertThat(store.blobs()).isEmpty();
    }

    // ----------------------------------------------------------------------
    // Verification
    // ----------------------------------------------------------------------

    @Test
    void install_expectedDigestMismatch_isTerminal_andCachesNothing() {
        StubTier reg = serving(SourceTier.REGISTRY, "tampered".getBytes(StandardCharsets.UTF_8), null);
        StubTier http = serving(SourceTier.HTTP, CONTENT, null);
        TieredInstaller installer = new TieredInstaller(List.of(reg, http), store);

        InstallResult result = installer.install(REF, Digest.of(CONTENT));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isInstanceOf(VerificationFailedException.class);
        assertThat(((VerificationFailedException) result.error()).getTier()).isEqualTo(SourceTier.REGISTRY);
        assertThat(http.attempts.get()).isZero();
        assertThat(store.blobs()).isEmpty();
        assertThat(store.lookup(REF)).isEmpty();
    }

    @Test
    void install_tierDeclaredDigestMismatch_isTerminal() {
        StubTier http = serving(SourceTier.HTTP, "truncated".getBytes(StandardCharsets.UTF_8), Digest.of(CONTENT));
        TieredInstaller installer = new TieredInstaller(List.of(http), store);

        InstallResult result = installer.install(REF);

        assertThat(result.error()).isInstanceOf(VerificationFailedException.class);
        assertThat(store.blobs()).isEmpty();
    }

    @Test
    void install_cleansWorkDirectory() throws Exception {
        StubTier http = serving(SourceTier.HTTP, CONTENT, null);
        Path work = root.resolve("work-area");
        new TieredInstaller(List.of(http), store, work).install(REF);

        try (var left = Files.list(work)) {
            assertThat(left.count()).isZero();
        }
    }
}
