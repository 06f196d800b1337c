package org.mimir.maintenance;

import org.mimir.config.MimirProperties;
import org.mimir.engine.ArtifactEngine;
import org.mimir.store.EvictionPolicy;
import org.mimir.store.EvictionReport;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.TeamConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Periodic upkeep: evicts by the configured policy, prunes old usage events and pre-warms each
 * team's due slot, at most once per the team strategy's sync frequency.
 */
@Component
public class CacheMaintenanceJob {
    private static final Logger logger = LoggerFactory.getLogger(CacheMaintenanceJob.class);

    private final ArtifactEngine engine;
    private final TeamCacheCoordinator teams;
    private final EvictionPolicy evictionPolicy;
    private final MimirProperties props;
    private final Clock clock;
    private final Map<String, Instant> lastWarm = new ConcurrentHashMap<>();

    public CacheMaintenanceJob(ArtifactEngine engine, TeamCacheCoordinator teams, EvictionPolicy evictionPolicy,
                               MimirProperties props, Clock clock) {
        this.engine = engine;
        this.teams = teams;
        this.evictionPolicy = evictionPolicy;
        this.props = props;
        this.clock = clock;
    }

    @Scheduled(initialDelayString = "${mimir.cache.maintenance-interval:PT10M}",
            fixedDelayString = "${mimir.cache.maintenance-interval:PT10M}")
    public void run() {
        runOnce();
    }

    /** @return number of teams pre-warmed in this run */
    public int runOnce() {
        try {
            EvictionReport report = engine.evict(evictionPolicy);
            if (report.removedCount() > 0) {
                logger.info("Maintenance evicted {} blobs ({} bytes)", report.removedCount(), report.bytesFreed());
            }
        } catch (RuntimeException e) {
            logger.warn("Eviction failed", e);
        }

        try {
            teams.pruneEvents(props.getTeam().getEventRetention());
        } catch (RuntimeException e) {
            logger.warn("Usage event pruning failed", e);
        }

        int warmed = 0;
        Instant now = clock.instant();
        for (TeamConfig team : teams.teams()) {
            Instant last = lastWarm.get(team.teamName());
            if (last != null && now.isBefore(last.plus(team.cacheStrategy().syncFrequency()))) {
                continue;
            }
            try {
                if (engine.prewarm(team.teamName()) > 0) {
                    lastWarm.put(team.teamName(), now);
                    warmed++;
                }
            } catch (RuntimeException e) {
                logger.warn("Pre-warm for team {} failed", team.teamName(), e);
            }
        }
        return warmed;
    }
}
