package org.mimir.team;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.ResolutionException;
import org.mimir.install.registry.ArtifactRegistry;
import org.mimir.store.DigestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Team-scoped usage analysis: records usage, finds references used together, proposes and
 * publishes bundles, and derives a cache warm schedule.
 */
public class TeamCacheCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(TeamCacheCoordinator.class);

    static final String BUNDLE_ECOSYSTEM = "bundle";

    private final UsageEventLog log;
    private final DigestStore store;
    private final ArtifactRegistry registry;
    private final Executor executor;
    private final TeamAnalysisOptions options;
    private final ObjectMapper mapper;
    private final Clock clock;

    private final Map<String, TeamConfig> teams = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<Bundle>> published = new ConcurrentHashMap<>();
    private final Map<String, Object> publishLocks = new ConcurrentHashMap<>();

    public TeamCacheCoordinator(UsageEventLog log, DigestStore store, ArtifactRegistry registry, Executor executor,
                                TeamAnalysisOptions options, ObjectMapper mapper, Clock clock) {
        this.log = log;
        this.store = store;
        this.registry = registry == null ? ArtifactRegistry.none() : registry;
        this.executor = executor;
        this.options = options;
        this.mapper = mapper;
        this.clock = clock;
        loadPublished();
    }

    // ----------------------------------------------------------------------
    // Teams
    // ----------------------------------------------------------------------

    public void register(TeamConfig config) {
        teams.put(config.teamName(), config);
    }

    public TeamConfig teamConfig(String team) {
        return teams.getOrDefault(team, TeamConfig.defaults(team));
    }

    public Collection<TeamConfig> teams() {
        return List.copyOf(teams.values());
    }

    public TeamAnalysisOptions options() {
        return options;
    }

    public UsageEventLog eventLog() {
        return log;
    }

    // ----------------------------------------------------------------------
    // Usage
    // ----------------------------------------------------------------------

    /**
     * Appends the event on the background executor. Never throws and never blocks on I/O.
     */
    public void record(UsageEvent event) {
        try {
            executor.execute(() -> {
                try {
                    log.append(event);
                } catch (RuntimeException e) {
                    logger.warn("Failed to record usage event {}", event, e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Usage event dropped, executor rejected it: {}", event);
        }
    }

    public int pruneEvents(Duration retention) {
        return log.prune(clock.instant().minus(retention));
    }

    public long eventCount(String team, Duration window) {
        return log.events(team, clock.instant().minus(window)).size();
    }

    // ----------------------------------------------------------------------
    // Co-occurrence and bundles
    // ----------------------------------------------------------------------

    public List<CoOccurrencePair> coOccurrence(String team) {
        return coOccurrence(team, options.analysisWindow());
    }

    public List<CoOccurrencePair> coOccurrence(String team, Duration window) {
        List<UsageEvent> events = log.events(team, clock.instant().minus(window));
        return CoOccurrenceAnalyzer.analyze(events, options.pairWindow());
    }

    /**
     * Pairs strong enough to bundle that no published bundle or configured bundle dependency
     * already covers, strongest first.
     */
    public List<CoOccurrencePair> unbundledPairs(String team) {
        TeamConfig config = teamConfig(team);
        List<Bundle> bundles = publishedBundles(team);
        return coOccurrence(team).stream()
                .filter(p -> p.score() > options.bundleThreshold())
                .filter(p -> p.usageCount() > options.minPairUsage())
                .filter(p -> bundles.stream().noneMatch(b -> b.covers(p.referenceA(), p.referenceB())))
                .filter(p -> !(config.bundleDependencies().contains(p.referenceA())
                        && config.bundleDependencies().contains(p.referenceB())))
                .toList();
    }

    /**
     * The strongest unbundled pair plus every reference linked to it through other qualifying
     * pairs, or empty when nothing qualifies.
     */
    public Optional<Bundle> proposeBundle(String team) {
        List<CoOccurrencePair> qualifying = unbundledPairs(team);
        if (qualifying.isEmpty()) return Optional.empty();

        CoOccurrencePair best = qualifying.get(0);
        Map<ArtifactReference, List<ArtifactReference>> edges = new HashMap<>();
        for (CoOccurrencePair p : qualifying) {
            edges.computeIfAbsent(p.referenceA(), k -> new ArrayList<>()).add(p.referenceB());
            edges.computeIfAbsent(p.referenceB(), k -> new ArrayList<>()).add(p.referenceA());
        }
        Set<ArtifactReference> members = new LinkedHashSet<>();
        Deque<ArtifactReference> todo = new ArrayDeque<>(List.of(best.referenceA(), best.referenceB()));
        while (!todo.isEmpty()) {
            ArtifactReference r = todo.poll();
            if (members.add(r)) {
                todo.addAll(edges.getOrDefault(r, List.of()));
            }
        }

        List<ArtifactReference> sorted = members.stream()
                .sorted(Comparator.comparing(ArtifactReference::canonical))
                .toList();
        String name = bundleName(team, sorted);
        String description = String.format(Locale.ROOT, "Used together by %s: %s (best score %.2f over %d joint uses)",
                team, sorted.stream().map(ArtifactReference::canonical).collect(Collectors.joining(", ")),
                best.score(), best.usageCount());
        Digest digest = Digest.of(manifestBytes(team, name, description, sorted));
        return Optional.of(new Bundle(name, sorted, digest, description, clock.instant()));
    }

    /**
     * Stores the bundle manifest as an artifact ({@code bundle/<team>/<name>:<digest prefix>}) and
     * pushes it to the registry when one is configured. Publishing the same member set twice
     * returns the existing bundle.
     */
    public Bundle publishBundle(String team, Bundle candidate) {
        synchronized (publishLocks.computeIfAbsent(team, t -> new Object())) {
            for (Bundle b : publishedBundles(team)) {
                if (b.members().equals(candidate.members())) {
                    logger.info("Bundle {} already published for team {}", b.name(), team);
                    return b;
                }
            }
            return doPublish(team, candidate);
        }
    }

    private Bundle doPublish(String team, Bundle candidate) {
        String name = bundleName(team, candidate.members());
        byte[] manifest = manifestBytes(team, name, candidate.description(), candidate.members());
        Bundle bundle = new Bundle(name, candidate.members(), Digest.of(manifest), candidate.description(), clock.instant());
        ArtifactReference ref = bundleReference(team, bundle);
        Digest digest = store.put(manifest);
        store.record(ref, digest, SourceTier.BUILT);

        if (registry.isConfigured()) {
            try {
                registry.push(ref, digest, store.pathFor(digest));
            } catch (ResolutionException e) {
                logger.warn("Bundle {} stored locally but registry push failed: {}", ref, e.getMessage());
            }
        }

        published.computeIfAbsent(team, t -> new CopyOnWriteArrayList<>()).add(bundle);
        logger.info("Published bundle {} for team {} with {} members ({})", ref, team, bundle.members().size(), digest);
        return bundle;
    }

    /** Rebuilds the published bundles from the {@code bundle/...} entries left in the cache index. */
    private void loadPublished() {
        int loaded = 0;
        for (CacheEntry entry : store.index().all()) {
            ArtifactReference ref = entry.reference();
            if (!BUNDLE_ECOSYSTEM.equals(ref.ecosystem())) continue;
            try {
                BundleManifest manifest = mapper.readValue(store.get(entry.digest()), BundleManifest.class);
                List<ArtifactReference> members = manifest.members().stream()
                        .map(m -> ArtifactReference.parse(m.reference()))
                        .toList();
                Bundle bundle = new Bundle(manifest.name(), members, entry.digest(), manifest.description(), entry.createdAt());
                published.computeIfAbsent(ref.namespace(), t -> new CopyOnWriteArrayList<>()).add(bundle);
                loaded++;
            } catch (IOException | RuntimeException e) {
                logger.warn("Skipping unreadable bundle manifest {} ({}): {}", ref, entry.digest(), e.getMessage());
            }
        }
        if (loaded > 0) {
            logger.info("Loaded {} published bundles from the cache index", loaded);
        }
    }

    public List<Bundle> publishedBundles(String team) {
        List<Bundle> list = published.get(team);
        return list == null ? List.of() : List.copyOf(list);
    }

    public static ArtifactReference bundleReference(String team, Bundle bundle) {
        return new ArtifactReference(BUNDLE_ECOSYSTEM, team, bundle.name(), bundle.digest().shortHex());
    }

    private static String bundleName(String team, List<ArtifactReference> members) {
        String joined = members.stream().map(ArtifactReference::canonical).sorted().collect(Collectors.joining("\n"));
        return team + "-bundle-" + Digest.of(joined).hex().substring(0, 8);
    }

    private byte[] manifestBytes(String team, String name, String description, List<ArtifactReference> members) {
        List<BundleManifest.Member> entries = new ArrayList<>(members.size());
        for (ArtifactReference m : members) {
            Optional<CacheEntry> cached = store.lookup(m);
            entries.add(new BundleManifest.Member(m.canonical(), cached.map(e -> e.digest().toString()).orElse(null)));
        }
        try {
            return mapper.writeValueAsString(new BundleManifest(name, team, description, entries))
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize bundle manifest " + name, e);
        }
    }

    // ----------------------------------------------------------------------
    // Warm schedule
    // ----------------------------------------------------------------------

    /**
     * Busiest hours of day first (ties go to the earlier hour), each with the team's most
     * requested references in that hour, scheduled the configured lead time ahead.
     */
    public List<WarmSlot> warmSchedule(String team) {
        List<UsageEvent> events = log.events(team, clock.instant().minus(options.analysisWindow()));
        long[] volume = new long[24];
        List<Map<ArtifactReference, Long>> perHour = new ArrayList<>(24);
        for (int h = 0; h < 24; h++) perHour.add(new HashMap<>());
        for (UsageEvent e : events) {
            int hour = e.timestamp().atZone(options.zone()).getHour();
            volume[hour]++;
            perHour.get(hour).merge(e.reference(), 1L, Long::sum);
        }

        List<Integer> hours = new ArrayList<>();
        for (int h = 0; h < 24; h++) {
            if (volume[h] > 0) hours.add(h);
        }
        hours.sort(Comparator.<Integer>comparingLong(h -> volume[h]).reversed().thenComparing(h -> h));

        int topK = teamConfig(team).cacheStrategy().preloadCount();
        List<WarmSlot> slots = new ArrayList<>();
        for (int hour : hours.subList(0, Math.min(options.warmHours(), hours.size()))) {
            List<ArtifactReference> refs = perHour.get(hour).entrySet().stream()
                    .sorted(Map.Entry.<ArtifactReference, Long>comparingByValue().reversed()
                            .thenComparing(e -> e.getKey().canonical()))
                    .limit(topK)
                    .map(Map.Entry::getKey)
                    .toList();
            LocalTime at = LocalTime.of(hour, 0).minus(options.warmLeadTime());
            slots.add(new WarmSlot(at, hour, volume[hour], refs));
        }
        return slots;
    }

    /**
     * The slot whose warm window (from its scheduled time up to the hour it prepares for) contains
     * the current time, if any.
     */
    public Optional<WarmSlot> dueSlot(String team) {
        LocalTime now = LocalTime.ofInstant(clock.instant(), options.zone());
        long window = Math.max(1, options.warmLeadTime().toMinutes());
        int nowMinute = now.getHour() * 60 + now.getMinute();
        for (WarmSlot slot : warmSchedule(team)) {
            int slotMinute = slot.time().getHour() * 60 + slot.time().getMinute();
            if (Math.floorMod(nowMinute - slotMinute, 24 * 60) < window) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
