package org.mimir.resolve;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.store.DigestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Optional;

/**
 * Local-only lookup of a reference. Never touches the network: a miss is simply reported.
 */
public class ReferenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    private final DigestStore store;
    private final Clock clock;

    public ReferenceResolver(DigestStore store) {
        this(store, Clock.systemUTC());
    }

    public ReferenceResolver(DigestStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * @return the cache entry with a refreshed access time, or empty on a miss
     */
    public Optional<CacheEntry> resolve(ArtifactReference ref) {
        Optional<CacheEntry> hit = store.lookup(ref);
        if (hit.isEmpty()) {
            logger.debug("Cache miss for {}", ref);
            return Optional.empty();
        }
        store.touch(hit.get().digest());
        logger.debug("Cache hit for {} -> {}", ref, hit.get().digest());
        return Optional.of(hit.get().withLastAccessedAt(clock.instant()));
    }
}
