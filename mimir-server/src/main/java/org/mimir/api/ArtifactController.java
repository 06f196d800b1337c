package org.mimir.api;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.InstallResult;
import org.mimir.engine.ArtifactEngine;
import org.mimir.engine.PullRequest;
import org.mimir.store.EvictionPolicy;
import org.mimir.store.EvictionReport;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.Objects;

@RestController
@RequestMapping("/api/artifacts")
public class ArtifactController {

    private final ArtifactEngine engine;
    private final EvictionPolicy evictionPolicy;

    public ArtifactController(ArtifactEngine engine, EvictionPolicy evictionPolicy) {
        this.engine = Objects.requireNonNull(engine);
        this.evictionPolicy = Objects.requireNonNull(evictionPolicy);
    }

    /** Resolution failures surface as exceptions and are mapped by {@link ApiExceptionHandler}. */
    @GetMapping("/pull")
    public ApiModels.PullResponse pull(@RequestParam("ref") String ref,
                                       @RequestParam(value = "digest", required = false) String digest,
                                       @RequestParam(value = "team", required = false) String team,
                                       @RequestParam(value = "actor", required = false) String actor) {
        ArtifactReference reference = ArtifactReference.parse(ref);
        Digest expected = digest == null || digest.isBlank() ? null : Digest.parse(digest);
        InstallResult result = engine.resolve(new PullRequest(reference, expected, team, actor));
        if (!result.success()) {
            throw result.error();
        }
        return ApiModels.PullResponse.from(reference, result);
    }

    @GetMapping("/versions")
    public ApiModels.VersionsResponse versions(@RequestParam("repository") String repository) {
        return new ApiModels.VersionsResponse(repository, engine.list(repository));
    }

    @GetMapping("/info")
    public ApiModels.CacheEntryView info(@RequestParam("ref") String ref) {
        return ApiModels.CacheEntryView.from(engine.info(ArtifactReference.parse(ref)));
    }

    /** {@code olderThan} accepts {@code 30m}, {@code 7d} or ISO-8601; absent clears everything. */
    @DeleteMapping("/cache")
    public ApiModels.ClearResponse clear(@RequestParam(value = "olderThan", required = false) String olderThan) {
        Duration d = olderThan == null || olderThan.isBlank() ? null : DurationStyle.detectAndParse(olderThan);
        return new ApiModels.ClearResponse(engine.clear(d));
    }

    @PostMapping("/evict")
    public ResponseEntity<ApiModels.EvictResponse> evict() {
        EvictionReport report = engine.evict(evictionPolicy);
        return ResponseEntity.ok(new ApiModels.EvictResponse(report.removedCount(), report.bytesFreed()));
    }
}
