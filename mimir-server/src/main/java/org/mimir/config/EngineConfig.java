package org.mimir.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mimir.artifact.ArtifactReference;
import org.mimir.engine.ArtifactEngine;
import org.mimir.install.InstallerTier;
import org.mimir.install.TieredInstaller;
import org.mimir.install.ecosystem.CommandLinePackageManager;
import org.mimir.install.ecosystem.NativeEcosystemTier;
import org.mimir.install.ecosystem.PackageManager;
import org.mimir.install.ecosystem.ProcessRunner;
import org.mimir.install.http.HttpArtifactSource;
import org.mimir.install.http.HttpDownloadClient;
import org.mimir.install.http.HttpDownloadTier;
import org.mimir.install.registry.ArtifactRegistry;
import org.mimir.install.registry.RegistryTier;
import org.mimir.report.PerformanceReporter;
import org.mimir.report.ResolutionMetrics;
import org.mimir.store.DigestStore;
import org.mimir.store.EvictionPolicy;
import org.mimir.team.CacheStrategy;
import org.mimir.team.TeamAnalysisOptions;
import org.mimir.team.TeamCacheCoordinator;
import org.mimir.team.TeamConfig;
import org.mimir.team.UsageEventLog;
import org.mimir.util.DataSizes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExecutorService fetchExecutor(MimirProperties props) {
        int threads = Math.max(1, props.getCache().getFetchThreads());
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "mimir-fetch");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ExecutorService usageExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mimir-usage");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public DigestStore digestStore(MimirProperties props, Clock clock) {
        return new DigestStore(Path.of(props.getCache().getRootDir()), clock);
    }

    /**
     * Explicit {@code mimir.cache.max-size} / {@code retention} win. Otherwise the most generous
     * strategy among the configured teams decides, BALANCED when there are none.
     */
    @Bean
    public EvictionPolicy evictionPolicy(MimirProperties props) {
        MimirProperties.Cache c = props.getCache();
        EvictionPolicy.Mode mode = EvictionPolicy.Mode.valueOf(c.getEvictionMode().strip().toUpperCase(Locale.ROOT));
        List<CacheStrategy> strategies = props.getTeams().stream()
                .map(t -> CacheStrategy.fromName(t.getStrategy()))
                .toList();
        EvictionPolicy policy;
        if (mode == EvictionPolicy.Mode.AGE) {
            Duration retention = c.getRetention() != null ? c.getRetention()
                    : strategies.stream().map(CacheStrategy::retention).max(Comparator.naturalOrder())
                            .orElse(CacheStrategy.BALANCED.retention());
            policy = EvictionPolicy.byAge(retention);
        } else {
            long maxBytes = c.getMaxSize() != null && !c.getMaxSize().isBlank() ? DataSizes.parseBytes(c.getMaxSize())
                    : strategies.stream().mapToLong(CacheStrategy::maxCacheBytes).max()
                            .orElse(CacheStrategy.BALANCED.maxCacheBytes());
            policy = EvictionPolicy.bySize(maxBytes);
        }
        logger.info("Eviction policy: {}", policy);
        return policy;
    }

    @Bean
    public TieredInstaller tieredInstaller(MimirProperties props, DigestStore store, ArtifactRegistry registry,
                                           WebClient.Builder webClientBuilder) {
        List<InstallerTier> tiers = new ArrayList<>();

        MimirProperties.NativeTier nt = props.getNativeTier();
        if (nt.isEnabled()) {
            ProcessRunner runner = new ProcessRunner();
            List<PackageManager> managers = new ArrayList<>();
            for (String name : nt.getManagers()) {
                managers.add(CommandLinePackageManager.byName(name, nt.getTimeout(), runner));
            }
            tiers.add(new NativeEcosystemTier(managers));
        }

        tiers.add(new RegistryTier(registry));

        MimirProperties.Http http = props.getHttp();
        Map<String, HttpArtifactSource> sources = new LinkedHashMap<>();
        http.getSources().forEach((repository, s) ->
                sources.put(repository, new HttpArtifactSource(s.getUrl(), s.getChecksums())));
        tiers.add(new HttpDownloadTier(sources, new HttpDownloadClient(webClientBuilder), http.getTimeout(),
                http.isAllowUnverified()));

        logger.info("Installer tiers: {}", tiers.stream().map(InstallerTier::name).toList());
        return new TieredInstaller(tiers, store);
    }

    @Bean
    public ResolutionMetrics resolutionMetrics(Clock clock) {
        return new ResolutionMetrics(100_000, clock);
    }

    @Bean
    public UsageEventLog usageEventLog(MimirProperties props, ObjectMapper mapper) {
        String dir = props.getTeam().getEventLogDir();
        if (dir == null || dir.isBlank()) {
            return new UsageEventLog();
        }
        return new UsageEventLog(Path.of(dir), mapper);
    }

    @Bean
    public TeamAnalysisOptions teamAnalysisOptions(MimirProperties props) {
        MimirProperties.Team t = props.getTeam();
        return new TeamAnalysisOptions(t.getAnalysisWindow(), t.getPairWindow(), t.getBundleThreshold(),
                t.getMinPairUsage(), t.getWarmHours(), t.getWarmLeadTime(), ZoneId.of(t.getZone()));
    }

    @Bean
    public TeamCacheCoordinator teamCacheCoordinator(UsageEventLog log, DigestStore store, ArtifactRegistry registry,
                                                     @Qualifier("usageExecutor") ExecutorService usageExecutor,
                                                     TeamAnalysisOptions options, ObjectMapper mapper, Clock clock,
                                                     MimirProperties props) {
        TeamCacheCoordinator coordinator =
                new TeamCacheCoordinator(log, store, registry, usageExecutor, options, mapper, clock);
        for (MimirProperties.TeamEntry entry : props.getTeams()) {
            coordinator.register(toTeamConfig(entry));
        }
        logger.info("Registered {} teams", props.getTeams().size());
        return coordinator;
    }

    @Bean
    public ArtifactEngine artifactEngine(DigestStore store, TieredInstaller installer,
                                         @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                                         ArtifactRegistry registry, TeamCacheCoordinator teams,
                                         ResolutionMetrics metrics, MimirProperties props, Clock clock) {
        return new ArtifactEngine(store, installer, fetchExecutor, registry, teams, metrics,
                props.getCache().isVerifyOnHit(), clock);
    }

    @Bean
    public PerformanceReporter performanceReporter(ResolutionMetrics metrics, TeamCacheCoordinator teams, Clock clock) {
        return new PerformanceReporter(metrics, teams, clock);
    }

    static TeamConfig toTeamConfig(MimirProperties.TeamEntry entry) {
        List<ArtifactReference> deps = entry.getBundleDependencies().stream()
                .map(ArtifactReference::parse)
                .toList();
        return new TeamConfig(entry.getName(), entry.getMembers(), CacheStrategy.fromName(entry.getStrategy()), deps);
    }
}
