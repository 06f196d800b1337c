package org.mimir.api;

import org.mimir.artifact.ArtifactReference;
import org.mimir.engine.ArtifactEngine;
import org.mimir.report.OptimizationRecommendation;
import org.mimir.report.PerformanceReporter;
import org.mimir.team.Bundle;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.TeamConfig;
import org.mimir.team.UsageEvent;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@RestController
@RequestMapping("/api/teams")
public class TeamController {

    private final TeamCacheCoordinator teams;
    private final PerformanceReporter reporter;
    private final ArtifactEngine engine;
    private final Clock clock;

    public TeamController(TeamCacheCoordinator teams, PerformanceReporter reporter, ArtifactEngine engine, Clock clock) {
        this.teams = Objects.requireNonNull(teams);
        this.reporter = Objects.requireNonNull(reporter);
        this.engine = Objects.requireNonNull(engine);
        this.clock = Objects.requireNonNull(clock);
    }

    @GetMapping
    public List<ApiModels.TeamView> list() {
        return teams.teams().stream().map(TeamController::view).toList();
    }

    @PostMapping("/{team}/events")
    public ResponseEntity<Void> recordEvent(@PathVariable String team, @RequestBody ApiModels.UsageEventRequest req) {
        ArtifactReference ref = ArtifactReference.parse(req.reference());
        Instant at = req.timestamp() == null ? clock.instant() : req.timestamp();
        teams.record(new UsageEvent(team, ref, req.actor(), at));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/{team}/co-occurrence")
    public List<ApiModels.CoOccurrenceView> coOccurrence(@PathVariable String team,
                                                         @RequestParam(value = "windowHours", required = false) Long windowHours) {
        Duration window = windowHours == null ? teams.options().analysisWindow() : Duration.ofHours(windowHours);
        return teams.coOccurrence(team, window).stream().map(ApiModels.CoOccurrenceView::from).toList();
    }

    @GetMapping("/{team}/bundle-proposal")
    public ResponseEntity<ApiModels.BundleView> proposal(@PathVariable String team) {
        Optional<Bundle> bundle = teams.proposeBundle(team);
        if (bundle.isEmpty()) return ResponseEntity.noContent().build();
        return ResponseEntity.ok(ApiModels.BundleView.from(team, bundle.get()));
    }

    /** Publishes the current proposal; 409 when nothing qualifies. */
    @PostMapping("/{team}/bundles")
    public ResponseEntity<ApiModels.BundleView> publish(@PathVariable String team) {
        Optional<Bundle> proposal = teams.proposeBundle(team);
        if (proposal.isEmpty()) return ResponseEntity.status(HttpStatus.CONFLICT).build();
        Bundle published = teams.publishBundle(team, proposal.get());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiModels.BundleView.from(team, published));
    }

    @GetMapping("/{team}/bundles")
    public List<ApiModels.BundleView> bundles(@PathVariable String team) {
        return teams.publishedBundles(team).stream().map(b -> ApiModels.BundleView.from(team, b)).toList();
    }

    @GetMapping("/{team}/warm-schedule")
    public List<ApiModels.WarmSlotView> warmSchedule(@PathVariable String team) {
        return teams.warmSchedule(team).stream().map(ApiModels.WarmSlotView::from).toList();
    }

    @PostMapping("/{team}/prewarm")
    public ApiModels.PrewarmResponse prewarm(@PathVariable String team) {
        return new ApiModels.PrewarmResponse(team, engine.prewarm(team));
    }

    @GetMapping("/{team}/recommendations")
    public List<OptimizationRecommendation> recommendations(@PathVariable String team) {
        return reporter.recommendations(team);
    }

    private static ApiModels.TeamView view(TeamConfig c) {
        return new ApiModels.TeamView(c.teamName(), c.members(), c.cacheStrategy().name(),
                c.bundleDependencies().stream().map(ArtifactReference::canonical).toList());
    }
}
