package org.mimir.team;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mimir.artifact.ArtifactReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Append-only per-team log of {@link UsageEvent}s. Optionally persisted as one NDJSON file
 * per team ({@code {dir}/{team}.ndjson}) and reloaded on start. Events are only ever removed
 * by {@link #prune(Instant)}.
 */
public class UsageEventLog {
    private static final Logger logger = LoggerFactory.getLogger(UsageEventLog.class);

    /** On-disk shape of an event. */
    public record StoredEvent(String team, String reference, String actor, long timestamp) {}

    private final ConcurrentHashMap<String, ConcurrentLinkedDeque<UsageEvent>> byTeam = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<UsageEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Path dir;
    private final ObjectMapper mapper;

    /** In-memory only. */
    public UsageEventLog() {
        this(null, new ObjectMapper());
    }

    public UsageEventLog(Path dir, ObjectMapper mapper) {
        this.dir = dir;
        this.mapper = mapper;
        if (dir != null) {
            load();
        }
    }

    public void append(UsageEvent event) {
        if (dir == null) {
            queue(event.team()).addLast(event);
        } else {
            synchronized (this) {
                queue(event.team()).addLast(event);
                persist(event);
            }
        }
        for (UsageEventListener l : listeners) {
            try {
                l.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("Usage event listener {} failed", l, e);
            }
        }
    }

    /** Events of {@code team} at or after {@code from}, oldest first. */
    public List<UsageEvent> events(String team, Instant from) {
        ConcurrentLinkedDeque<UsageEvent> q = byTeam.get(team);
        if (q == null) return List.of();
        return q.stream()
                .filter(e -> from == null || !e.timestamp().isBefore(from))
                .sorted(Comparator.comparing(UsageEvent::timestamp))
                .toList();
    }

    public Set<String> teams() {
        return Set.copyOf(byTeam.keySet());
    }

    public void subscribe(UsageEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(UsageEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Drops events older than {@code cutoff}.
     *
     * @return number of events removed
     */
    public int prune(Instant cutoff) {
        int removed = 0;
        for (var e : byTeam.entrySet()) {
            if (dir == null) {
                removed += removeOlder(e.getValue(), cutoff);
                continue;
            }
            synchronized (this) {
                int n = removeOlder(e.getValue(), cutoff);
                if (n > 0) {
                    removed += n;
                    rewrite(e.getKey());
                }
            }
        }
        if (removed > 0) {
            logger.info("Pruned {} usage events older than {}", removed, cutoff);
        }
        return removed;
    }

    private ConcurrentLinkedDeque<UsageEvent> queue(String team) {
        return byTeam.computeIfAbsent(team, t -> new ConcurrentLinkedDeque<>());
    }

    private static int removeOlder(ConcurrentLinkedDeque<UsageEvent> q, Instant cutoff) {
        int before = q.size();
        q.removeIf(ev -> ev.timestamp().isBefore(cutoff));
        return before - q.size();
    }

    private Path fileFor(String team) {
        return dir.resolve(team.replaceAll("[^A-Za-z0-9._-]", "_") + ".ndjson");
    }

    // persist and rewrite run under the monitor, together with the deque change.
    private void persist(UsageEvent event) {
        try {
            Files.createDirectories(dir);
            Files.writeString(fileFor(event.team()), toLine(event) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            logger.warn("Failed to persist usage event for team {}", event.team(), e);
        }
    }

    private void rewrite(String team) {
        StringBuilder sb = new StringBuilder();
        for (UsageEvent ev : byTeam.getOrDefault(team, new ConcurrentLinkedDeque<>())) {
            sb.append(toLine(ev)).append('\n');
        }
        try {
            Path target = fileFor(team);
            Path tmp = Files.createTempFile(dir, "events-", ".tmp");
            Files.writeString(tmp, sb.toString(), StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            logger.warn("Failed to rewrite usage log for team {}", team, e);
        }
    }

    private String toLine(UsageEvent e) {
        try {
            return mapper.writeValueAsString(new StoredEvent(e.team(), e.reference().canonical(), e.actor(),
                    e.timestamp().toEpochMilli()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize usage event", ex);
        }
    }

    private void load() {
        if (!Files.isDirectory(dir)) return;
        int loaded = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path f : files.filter(p -> p.getFileName().toString().endsWith(".ndjson")).toList()) {
                try (BufferedReader r = Files.newBufferedReader(f, StandardCharsets.UTF_8)) {
                    String line;
                    while ((line = r.readLine()) != null) {
                        if (line.isBlank()) continue;
                        try {
                            StoredEvent s = mapper.readValue(line, StoredEvent.class);
                            UsageEvent ev = new UsageEvent(s.team(), ArtifactReference.parse(s.reference()), s.actor(),
                                    Instant.ofEpochMilli(s.timestamp()));
                            byTeam.computeIfAbsent(ev.team(), t -> new ConcurrentLinkedDeque<>()).addLast(ev);
                            loaded++;
                        } catch (JsonProcessingException | RuntimeException e) {
                            logger.warn("Skipping bad usage event line in {}: {}", f, e.getMessage());
                        }
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load usage events from " + dir, e);
        }
        logger.info("Loaded {} usage events from {}", loaded, dir);
    }
}
