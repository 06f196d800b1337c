package org.mimir.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mimir.MutableClock;
import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.artifact.SourceTier;
import org.mimir.error.AggregateResolutionFailedException;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.TierFailedException;
import org.mimir.error.VerificationFailedException;
import org.mimir.install.InstallerTier;
import org.mimir.install.TierOutcome;
import org.mimir.install.TieredInstaller;
import org.mimir.install.registry.ArtifactRegistry;
import org.mimir.report.ResolutionMetrics;
import org.mimir.store.DigestStore;
import org.mimir.team.TeamAnalysisOptions;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.UsageEvent;
import org.mimir.team.UsageEventLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ArtifactEngineTest {

    private static final ArtifactReference REF = ArtifactReference.parse("github/protocolbuffers/protoc:31.1-linux-x86_64");
    private static final ArtifactReference MISSING = ArtifactReference.parse("github/protocolbuffers/protoc:0.0.1");
    private static final byte[] CONTENT = "protoc 31.1".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private MutableClock clock;
    private DigestStore store;
    private ArtifactRegistry registry;
    private ResolutionMetrics metrics;
    private UsageEventLog log;
    private final AtomicInteger attempts = new AtomicInteger();
    private ArtifactEngine engine;

    /** Serves {@link #CONTENT} for {@link #REF}; anything else is not found. */
    private final InstallerTier httpTier = new InstallerTier() {
        @Override
        public SourceTier tier() {
            return SourceTier.HTTP;
        }

        @Override
        public TierOutcome attempt(ArtifactReference reference, Path workDir) {
            attempts.incrementAndGet();
            if (!reference.equals(REF)) {
                return TierOutcome.failed(new ArtifactNotFoundException(reference, "404"));
            }
            try {
                Path f = Files.write(workDir.resolve("protoc"), CONTENT);
                return TierOutcome.fetched(f, Digest.of(CONTENT));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    };

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-09T12:00:00Z"));
        store = new DigestStore(root.resolve("cache"), clock);
        registry = mock(ArtifactRegistry.class);
        metrics = new ResolutionMetrics(1000, clock);
        log = new UsageEventLog();
        TeamCacheCoordinator teams = new TeamCacheCoordinator(log, store, registry, Runnable::run,
                TeamAnalysisOptions.defaults(), new ObjectMapper(), clock);
        TieredInstaller installer = new TieredInstaller(List.of(httpTier), store, root.resolve("work"));
        engine = new ArtifactEngine(store, installer, Runnable::run, registry, teams, metrics, true, clock);
    }

    // ---- Pull ----

    @Test
    void pull_miss_installs_thenServesFromCacheWithoutTierAttempts() throws Exception {
        Path first = engine.pull(REF);
        Path second = engine.pull(REF);

        assertEquals(first, second);
        assertArrayEquals(CONTENT, Files.readAllBytes(second));
        assertEquals(1, attempts.get());
        assertEquals(1, metrics.hits());
        assertEquals(1, metrics.misses());
    }

    @Test
    void resolve_cacheHit_reportsCacheTier() {
        engine.pull(REF);

        InstallResult hit = engine.resolve(PullRequest.of(REF));

        assertTrue(hit.success());
        assertEquals(SourceTier.CACHE, hit.tierUsed());
        assertEquals(Duration.ZERO, hit.duration());
        assertEquals(Digest.of(CONTENT), hit.digest());
    }

    @Test
    void pull_corruptedCacheEntry_isHealedAndReinstalled() throws Exception {
        Path path = engine.pull(REF);
        Files.write(path, "bit rot".getBytes(StandardCharsets.UTF_8));

        Path healed = engine.pull(REF);

        assertArrayEquals(CONTENT, Files.readAllBytes(healed));
        assertEquals(2, attempts.get());
        assertEquals(1, metrics.corruptionsHealed());
    }

    @Test
    void pull_unknownReference_throwsAggregateNotFound() {
        assertThatThrownBy(() -> engine.pull(MISSING))
                .isInstanceOfSatisfying(AggregateResolutionFailedException.class,
                        e -> assertTrue(e.isNotFound()));
        assertEquals(1, metrics.failures());
        assertThat(store.lookup(MISSING)).isEmpty();
    }

    @Test
    void pull_pinnedDigestMismatch_failsVerification_andCachesNothing() {
        Digest pin = Digest.of("something else");

        assertThatThrownBy(() -> engine.pull(REF, pin)).isInstanceOf(VerificationFailedException.class);
        assertThat(store.lookup(REF)).isEmpty();
    }

    @Test
    void pull_pinnedDigestDiffersFromCache_reResolves() {
        engine.pull(REF);

        assertThatThrownBy(() -> engine.pull(REF, Digest.of("other pin"))).isInstanceOf(VerificationFailedException.class);
        assertEquals(2, attempts.get());
        assertThat(store.lookup(REF)).isPresent();
    }

    @Test
    void resolve_withTeam_recordsUsage() {
        engine.resolve(new PullRequest(REF, null, "platform", "ana"));
        engine.resolve(new PullRequest(MISSING, null, "platform", "ana"));

        List<UsageEvent> events = log.events("platform", null);
        assertEquals(1, events.size());
        assertEquals(REF, events.get(0).reference());
        assertEquals("ana", events.get(0).actor());
    }

    // ---- Inspection ----

    @Test
    void list_mergesLocalAndRegistryTags() {
        engine.pull(REF);
        when(registry.isConfigured()).thenReturn(true);
        when(registry.listTags(REF.repository())).thenReturn(List.of("30.0", REF.tag()));

        assertThat(engine.list(REF.repository())).containsExactly("30.0", REF.tag());
    }

    @Test
    void list_registryFailure_degradesToLocalTags() {
        engine.pull(REF);
        when(registry.isConfigured()).thenReturn(true);
        when(registry.listTags(REF.repository()))
                .thenThrow(new TierFailedException(SourceTier.REGISTRY, null, "unreachable"));

        assertThat(engine.list(REF.repository())).containsExactly(REF.tag());
    }

    @Test
    void info_cached_returnsEntry_otherwiseNotFound() {
        engine.pull(REF);

        CacheEntry entry = engine.info(REF);

        assertEquals(Digest.of(CONTENT), entry.digest());
        assertEquals(CONTENT.length, entry.sizeBytes());
        assertEquals(SourceTier.HTTP, entry.sourceTier());
        assertThatThrownBy(() -> engine.info(MISSING)).isInstanceOf(ArtifactNotFoundException.class);
    }

    // ---- Maintenance ----

    @Test
    void clear_all_forgetsEverything() {
        engine.pull(REF);

        assertEquals(1, engine.clear(null));
        assertThatThrownBy(() -> engine.info(REF)).isInstanceOf(ArtifactNotFoundException.class);
    }

    @Test
    void prewarm_countsSuccesses_andKeepsGoingOnFailure() {
        int ok = engine.prewarm(List.of(MISSING, REF));

        assertEquals(1, ok);
        assertThat(store.lookup(REF)).isPresent();
    }

    @Test
    void prewarm_team_noDueSlot_doesNothing() {
        assertEquals(0, engine.prewarm("platform"));
        assertEquals(0, attempts.get());
    }

    @Test
    void prewarm_team_dueSlot_pullsScheduledReferences() {
        log.append(new UsageEvent("platform", REF, "ana", Instant.parse("2026-03-08T12:10:00Z")));
        clock.set(Instant.parse("2026-03-09T11:40:00Z"));

        assertEquals(1, engine.prewarm("platform"));
        assertThat(store.lookup(REF)).isPresent();
    }
}
