package org.mimir.api;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.engine.ArtifactEngine;
import org.mimir.report.OptimizationRecommendation;
import org.mimir.report.PerformanceReporter;
import org.mimir.report.RecommendationKind;
import org.mimir.team.Bundle;
import org.mimir.team.CacheStrategy;
import org.mimir.team.CoOccurrencePair;
import org.mimir.team.TeamAnalysisOptions;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.TeamConfig;
import org.mimir.team.UsageEvent;
import org.mimir.team.WarmSlot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class TeamControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-09T12:00:00Z");
    private static final ArtifactReference X = ArtifactReference.parse("npm/acme/eslint:9.0.0");
    private static final ArtifactReference Y = ArtifactReference.parse("npm/acme/prettier:3.3.0");

    private TeamCacheCoordinator teams;
    private PerformanceReporter reporter;
    private ArtifactEngine engine;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        teams = mock(TeamCacheCoordinator.class);
        reporter = mock(PerformanceReporter.class);
        engine = mock(ArtifactEngine.class);
        when(teams.options()).thenReturn(TeamAnalysisOptions.defaults());
        TeamController controller = new TeamController(teams, reporter, engine, Clock.fixed(NOW, ZoneOffset.UTC));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private static Bundle bundle() {
        return new Bundle("platform-bundle-1a2b3c4d", List.of(Y, X), Digest.of("manifest"), "Used together", NOW);
    }

    @Test
    void list_returnsRegisteredTeams() throws Exception {
        when(teams.teams()).thenReturn(List.of(
                new TeamConfig("platform", List.of("ana"), CacheStrategy.AGGRESSIVE, List.of(X))));

        mockMvc.perform(get("/api/teams"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("platform"))
                .andExpect(jsonPath("$[0].strategy").value("AGGRESSIVE"))
                .andExpect(jsonPath("$[0].bundleDependencies[0]").value(X.canonical()));
    }

    @Test
    void recordEvent_defaultsTimestampToNow_andReturns202() throws Exception {
        mockMvc.perform(post("/api/teams/platform/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reference\":\"npm/acme/eslint:9.0.0\",\"actor\":\"ana\"}"))
                .andExpect(status().isAccepted());

        ArgumentCaptor<UsageEvent> ev = ArgumentCaptor.forClass(UsageEvent.class);
        verify(teams).record(ev.capture());
        assertEquals("platform", ev.getValue().team());
        assertEquals(X, ev.getValue().reference());
        assertEquals(NOW, ev.getValue().timestamp());
    }

    @Test
    void recordEvent_invalidReference_returns400() throws Exception {
        mockMvc.perform(post("/api/teams/platform/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reference\":\"eslint\"}"))
                .andExpect(status().isBadRequest());
        verify(teams, never()).record(any());
    }

    @Test
    void coOccurrence_usesWindowParameter() throws Exception {
        when(teams.coOccurrence("platform", Duration.ofHours(12)))
                .thenReturn(List.of(CoOccurrencePair.of(Y, X, 0.9, 45)));

        mockMvc.perform(get("/api/teams/platform/co-occurrence").param("windowHours", "12"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].referenceA").value(X.canonical()))
                .andExpect(jsonPath("$[0].score").value(0.9))
                .andExpect(jsonPath("$[0].usageCount").value(45));
    }

    @Test
    void proposal_none_returns204() throws Exception {
        when(teams.proposeBundle("platform")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/teams/platform/bundle-proposal"))
                .andExpect(status().isNoContent());
    }

    @Test
    void proposal_present_returnsMembers() throws Exception {
        when(teams.proposeBundle("platform")).thenReturn(Optional.of(bundle()));

        mockMvc.perform(get("/api/teams/platform/bundle-proposal"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.members.length()").value(2))
                .andExpect(jsonPath("$.reference").value(
                        "bundle/platform/platform-bundle-1a2b3c4d:" + Digest.of("manifest").shortHex()));
    }

    @Test
    void publish_withProposal_returns201() throws Exception {
        Bundle b = bundle();
        when(teams.proposeBundle("platform")).thenReturn(Optional.of(b));
        when(teams.publishBundle(eq("platform"), any())).thenReturn(b);

        mockMvc.perform(post("/api/teams/platform/bundles"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.name").value("platform-bundle-1a2b3c4d"));
    }

    @Test
    void publish_nothingToBundle_returns409() throws Exception {
        when(teams.proposeBundle("platform")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/teams/platform/bundles"))
                .andExpect(status().isConflict());
        verify(teams, never()).publishBundle(any(), any());
    }

    @Test
    void warmSchedule_rendersSlots() throws Exception {
        when(teams.warmSchedule("platform")).thenReturn(List.of(new WarmSlot(LocalTime.of(8, 30), 9, 12, List.of(X))));

        mockMvc.perform(get("/api/teams/platform/warm-schedule"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].time").value("08:30"))
                .andExpect(jsonPath("$[0].hourOfDay").value(9))
                .andExpect(jsonPath("$[0].references[0]").value(X.canonical()));
    }

    @Test
    void prewarm_delegatesToEngine() throws Exception {
        when(engine.prewarm("platform")).thenReturn(4);

        mockMvc.perform(post("/api/teams/platform/prewarm"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.warmed").value(4));
    }

    @Test
    void recommendations_returnsReporterOutput() throws Exception {
        when(reporter.recommendations("platform")).thenReturn(List.of(
                OptimizationRecommendation.of(RecommendationKind.CREATE_BUNDLE, 0.5, "used together", "fewer pulls")));

        mockMvc.perform(get("/api/teams/platform/recommendations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].kind").value("CREATE_BUNDLE"))
                .andExpect(jsonPath("$[0].priority").value("HIGH"));
    }
}
