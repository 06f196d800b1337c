package org.mimir.api;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.artifact.SourceTier;
import org.mimir.engine.ArtifactEngine;
import org.mimir.engine.PullRequest;
import org.mimir.error.AggregateResolutionFailedException;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.TierFailedException;
import org.mimir.error.TierFailure;
import org.mimir.error.VerificationFailedException;
import org.mimir.store.EvictionPolicy;
import org.mimir.store.EvictionReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class ArtifactControllerTest {

    private static final String REF_TEXT = "github/protocolbuffers/protoc:31.1-linux-x86_64";
    private static final ArtifactReference REF = ArtifactReference.parse(REF_TEXT);
    private static final Digest DIGEST = Digest.of("protoc");

    private ArtifactEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        engine = mock(ArtifactEngine.class);
        ArtifactController controller = new ArtifactController(engine, EvictionPolicy.bySize(1024));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    /* ---------- GET /api/artifacts/pull ---------- */

    @Test
    void pull_success_returnsPathAndTier() throws Exception {
        when(engine.resolve(any())).thenReturn(
                InstallResult.installed(SourceTier.HTTP, Path.of("/cache/blobs/ab/abc"), DIGEST, 6, Duration.ofMillis(120)));

        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT).param("team", "platform").param("actor", "ana"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reference").value(REF_TEXT))
                .andExpect(jsonPath("$.tier").value("http"))
                .andExpect(jsonPath("$.digest").value(DIGEST.toString()))
                .andExpect(jsonPath("$.durationMillis").value(120));

        ArgumentCaptor<PullRequest> req = ArgumentCaptor.forClass(PullRequest.class);
        verify(engine).resolve(req.capture());
        assertEquals(REF, req.getValue().reference());
        assertEquals("platform", req.getValue().team());
        assertEquals("ana", req.getValue().actor());
    }

    @Test
    void pull_withDigest_passesPin() throws Exception {
        when(engine.resolve(any())).thenReturn(
                InstallResult.installed(SourceTier.REGISTRY, Path.of("/b"), DIGEST, 6, Duration.ZERO));

        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT).param("digest", DIGEST.toString()))
                .andExpect(status().isOk());

        ArgumentCaptor<PullRequest> req = ArgumentCaptor.forClass(PullRequest.class);
        verify(engine).resolve(req.capture());
        assertEquals(DIGEST, req.getValue().expectedDigest());
    }

    @Test
    void pull_invalidReference_returns400() throws Exception {
        mockMvc.perform(get("/api/artifacts/pull").param("ref", "protoc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_REFERENCE"));
        verifyNoInteractions(engine);
    }

    @Test
    void pull_malformedDigest_returns400() throws Exception {
        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT).param("digest", "sha256:xyz"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void pull_notFoundEverywhere_returns404() throws Exception {
        AggregateResolutionFailedException e = new AggregateResolutionFailedException(REF,
                List.of(new TierFailure("registry", new ArtifactNotFoundException(REF, "no tag"))), List.of("native"));
        when(engine.resolve(any())).thenReturn(InstallResult.failed(e, null, Duration.ZERO));

        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.failures[0].tier").value("registry"))
                .andExpect(jsonPath("$.skippedTiers[0]").value("native"));
    }

    @Test
    void pull_tierErrors_returns502() throws Exception {
        AggregateResolutionFailedException e = new AggregateResolutionFailedException(REF,
                List.of(new TierFailure("http", new TierFailedException(SourceTier.HTTP, REF, "HTTP 503"))), List.of());
        when(engine.resolve(any())).thenReturn(InstallResult.failed(e, null, Duration.ZERO));

        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.errorCode").value("ALL_TIERS_FAILED"))
                .andExpect(jsonPath("$.reference").value(REF_TEXT));
    }

    @Test
    void pull_digestMismatch_returns422() throws Exception {
        VerificationFailedException e = new VerificationFailedException(REF, SourceTier.HTTP, DIGEST, Digest.of("other"));
        when(engine.resolve(any())).thenReturn(InstallResult.failed(e, SourceTier.HTTP, Duration.ZERO));

        mockMvc.perform(get("/api/artifacts/pull").param("ref", REF_TEXT))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode").value("VERIFICATION_FAILED"));
    }

    /* ---------- versions / info ---------- */

    @Test
    void versions_listsTags() throws Exception {
        when(engine.list("github/protocolbuffers/protoc")).thenReturn(List.of("30.0", "31.1-linux-x86_64"));

        mockMvc.perform(get("/api/artifacts/versions").param("repository", "github/protocolbuffers/protoc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.versions.length()").value(2))
                .andExpect(jsonPath("$.versions[1]").value("31.1-linux-x86_64"));
    }

    @Test
    void info_cached_returnsEntry() throws Exception {
        Instant t = Instant.parse("2026-03-09T12:00:00Z");
        when(engine.info(REF)).thenReturn(new CacheEntry(REF, DIGEST, 6, t, t, SourceTier.REGISTRY));

        mockMvc.perform(get("/api/artifacts/info").param("ref", REF_TEXT))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceTier").value("registry"))
                .andExpect(jsonPath("$.sizeBytes").value(6));
    }

    @Test
    void info_notCached_returns404() throws Exception {
        when(engine.info(REF)).thenThrow(new ArtifactNotFoundException(REF, REF + " is not cached"));

        mockMvc.perform(get("/api/artifacts/info").param("ref", REF_TEXT))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    /* ---------- maintenance ---------- */

    @Test
    void clear_olderThan_parsesDuration() throws Exception {
        when(engine.clear(Duration.ofDays(7))).thenReturn(3);

        mockMvc.perform(delete("/api/artifacts/cache").param("olderThan", "7d"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(3));
    }

    @Test
    void clear_withoutAge_clearsAll() throws Exception {
        when(engine.clear(null)).thenReturn(5);

        mockMvc.perform(delete("/api/artifacts/cache"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(5));
    }

    @Test
    void clear_badDuration_returns400() throws Exception {
        mockMvc.perform(delete("/api/artifacts/cache").param("olderThan", "soon"))
                .andExpect(status().isBadRequest());
        verify(engine, never()).clear(any());
    }

    @Test
    void evict_appliesConfiguredPolicy() throws Exception {
        when(engine.evict(EvictionPolicy.bySize(1024))).thenReturn(new EvictionReport(2, 4096, List.of()));

        mockMvc.perform(post("/api/artifacts/evict"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2))
                .andExpect(jsonPath("$.bytesFreed").value(4096));
    }
}
