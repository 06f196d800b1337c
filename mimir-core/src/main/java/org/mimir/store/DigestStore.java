package org.mimir.store;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.CacheCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Content-addressable blob store with its {@link CacheIndex}.
 * <p>
 * Layout:
 * <pre>
 *   {root}/blobs/{hex[0..2]}/{hex}
 *   {root}/index/...
 * </pre>
 * A blob's modification time is its last access time and drives LRU eviction.
 * Every write goes through a temp file and an atomic rename.
 */
public class DigestStore {
    private static final Logger logger = LoggerFactory.getLogger(DigestStore.class);

    private final Path rootDir;
    private final Path blobDir;
    private final CacheIndex index;
    private final Clock clock;
    // Open lease counts. Lease registration and blob deletion both decide inside compute() on
    // the digest's entry, so a blob with a live lease is never deleted.
    private final ConcurrentHashMap<Digest, Integer> readers = new ConcurrentHashMap<>();

    public DigestStore(Path rootDir) {
        this(rootDir, Clock.systemUTC());
    }

    public DigestStore(Path rootDir, Clock clock) {
        this.rootDir = rootDir.toAbsolutePath().normalize();
        this.blobDir = this.rootDir.resolve("blobs");
        this.clock = clock;
        try {
            Files.createDirectories(blobDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache root " + this.rootDir, e);
        }
        this.index = new CacheIndex(this.rootDir.resolve("index"));
        logger.info("Digest store initialized at {}", this.rootDir);
    }

    public Path rootDir() {
        return rootDir;
    }

    public CacheIndex index() {
        return index;
    }

    public Path pathFor(Digest digest) {
        return blobDir.resolve(digest.prefix()).resolve(digest.hex());
    }

    public boolean contains(Digest digest) {
        return Files.isRegularFile(pathFor(digest));
    }

    // ----------------------------------------------------------------------
    // Writes
    // ----------------------------------------------------------------------

    public Digest put(byte[] bytes) {
        Digest digest = Digest.of(bytes);
        Path dst = pathFor(digest);
        if (Files.exists(dst)) {
            touch(digest);
            return digest;
        }
        try {
            AtomicFiles.write(dst, bytes);
            touch(digest);
            logger.info("Stored blob {} ({} bytes)", digest, bytes.length);
            return digest;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store blob " + digest, e);
        }
    }

    public Digest put(Path source) {
        try {
            Digest digest = Digest.of(source);
            Path dst = pathFor(digest);
            if (Files.exists(dst)) {
                touch(digest);
                return digest;
            }
            AtomicFiles.copy(source, dst);
            touch(digest);
            logger.info("Stored blob {} ({} bytes) from {}", digest, Files.size(dst), source);
            return digest;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store blob from " + source, e);
        }
    }

    /** Records that {@code ref} resolves to the already stored blob {@code digest}. */
    public CacheEntry record(ArtifactReference ref, Digest digest, SourceTier tier) {
        Path blob = pathFor(digest);
        try {
            long size = Files.size(blob);
            Instant now = clock.instant();
            CacheEntry entry = new CacheEntry(ref, digest, size, now, now, tier);
            index.put(entry);
            return entry;
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(ref, "Blob " + digest + " is not in the store", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to record " + ref, e);
        }
    }

    // ----------------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------------

    /** Index lookup; drops records whose blob has disappeared. Does not touch. */
    public Optional<CacheEntry> lookup(ArtifactReference ref) {
        Optional<CacheEntry> entry = index.get(ref);
        if (entry.isEmpty()) return Optional.empty();
        Optional<Instant> accessed = lastAccessed(entry.get().digest());
        if (accessed.isEmpty()) {
            logger.warn("Index record for {} points at missing blob {}; dropping it", ref, entry.get().digest());
            index.remove(ref);
            return Optional.empty();
        }
        return Optional.of(entry.get().withLastAccessedAt(accessed.get()));
    }

    public byte[] get(Digest digest) {
        try (ReadLease lease = openRead(digest)) {
            byte[] bytes = Files.readAllBytes(lease.path());
            Digest actual = Digest.of(bytes);
            if (!actual.equals(digest)) {
                throw corrupted(digest, actual);
            }
            touch(digest);
            return bytes;
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(null, "Blob " + digest + " is not in the store", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read blob " + digest, e);
        }
    }

    /**
     * Re-hashes the blob and returns its path.
     *
     * @throws CacheCorruptionException after removing the blob and its index records
     */
    public Path verifiedPath(Digest digest) {
        try (ReadLease lease = openRead(digest); InputStream in = lease.newInputStream()) {
            Digest actual = Digest.of(in);
            if (!actual.equals(digest)) {
                throw corrupted(digest, actual);
            }
            touch(digest);
            return lease.path();
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(null, "Blob " + digest + " is not in the store", e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to verify blob " + digest, e);
        }
    }

    public boolean verify(Digest digest, byte[] bytes) {
        return digest.matches(bytes);
    }

    /**
     * Pins the blob against eviction until the lease is closed.
     */
    public ReadLease openRead(Digest digest) throws NoSuchFileException {
        Path p = pathFor(digest);
        AtomicBoolean present = new AtomicBoolean();
        readers.compute(digest, (d, n) -> {
            if (!Files.isRegularFile(p)) return n;
            present.set(true);
            return n == null ? 1 : n + 1;
        });
        if (!present.get()) {
            throw new NoSuchFileException(p.toString());
        }
        return new ReadLease(digest, p);
    }

    boolean isOpen(Digest digest) {
        return readers.getOrDefault(digest, 0) > 0;
    }

    private void release(Digest digest) {
        readers.computeIfPresent(digest, (d, n) -> n <= 1 ? null : n - 1);
    }

    public void touch(Digest digest) {
        try {
            Files.setLastModifiedTime(pathFor(digest), FileTime.from(clock.instant()));
        } catch (NoSuchFileException e) {
            logger.debug("Touch skipped, blob {} is gone", digest);
        } catch (IOException e) {
            logger.warn("Failed to update access time of {}", digest, e);
        }
    }

    public Optional<Instant> lastAccessed(Digest digest) {
        try {
            return Optional.of(Files.getLastModifiedTime(pathFor(digest)).toInstant());
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat blob " + digest, e);
        }
    }

    public List<BlobInfo> blobs() {
        List<BlobInfo> out = new ArrayList<>();
        try (Stream<Path> files = Files.walk(blobDir, 2)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> !AtomicFiles.isTemp(p))
                    .forEach(p -> {
                        try {
                            Digest d = Digest.parse(p.getFileName().toString());
                            out.add(new BlobInfo(d, Files.size(p), Files.getLastModifiedTime(p).toInstant()));
                        } catch (IllegalArgumentException e) {
                            logger.debug("Ignoring foreign file in blob dir: {}", p);
                        } catch (IOException e) {
                            logger.debug("Blob vanished while listing: {}", p);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list blobs under " + blobDir, e);
        }
        return out;
    }

    public long totalSize() {
        return blobs().stream().mapToLong(BlobInfo::sizeBytes).sum();
    }

    // ----------------------------------------------------------------------
    // Removal
    // ----------------------------------------------------------------------

    /**
     * Pure LRU: candidates are taken oldest access first. Blobs with an open lease are skipped.
     */
    public EvictionReport evict(EvictionPolicy policy) {
        List<BlobInfo> candidates = new ArrayList<>(blobs());
        candidates.sort(Comparator.comparing(BlobInfo::lastAccessedAt).thenComparing(BlobInfo::digest));

        long total = candidates.stream().mapToLong(BlobInfo::sizeBytes).sum();
        Instant cutoff = policy.mode() == EvictionPolicy.Mode.AGE ? clock.instant().minus(policy.retention()) : null;

        List<Digest> removed = new ArrayList<>();
        long freed = 0L;
        for (BlobInfo blob : candidates) {
            if (policy.mode() == EvictionPolicy.Mode.SIZE && total <= policy.maxBytes()) break;
            if (cutoff != null && !blob.lastAccessedAt().isBefore(cutoff)) break;
            if (isOpen(blob.digest())) {
                logger.debug("Not evicting {}: open for read", blob.digest());
                continue;
            }
            if (remove(blob.digest())) {
                removed.add(blob.digest());
                freed += blob.sizeBytes();
                total -= blob.sizeBytes();
                logger.info("Evicted blob {} (size: {} bytes, last access {})", blob.digest(), blob.sizeBytes(), blob.lastAccessedAt());
            }
        }
        if (policy.mode() == EvictionPolicy.Mode.SIZE && total > policy.maxBytes()) {
            logger.warn("Cache still over capacity after eviction: {} > {} bytes", total, policy.maxBytes());
        }
        return new EvictionReport(removed.size(), freed, List.copyOf(removed));
    }

    /**
     * Removes the blob and every index record pointing at it, unless it is open for read.
     */
    public boolean remove(Digest digest) {
        AtomicBoolean removed = new AtomicBoolean();
        readers.compute(digest, (d, n) -> {
            if (n != null && n > 0) return n;
            removed.set(delete(digest));
            return null;
        });
        return removed.get();
    }

    /**
     * Removes blobs not accessed within {@code olderThan} (all blobs when null), then drops
     * index records left without a blob.
     *
     * @return number of blobs removed
     */
    public int clear(Duration olderThan) {
        Instant cutoff = olderThan == null ? null : clock.instant().minus(olderThan);
        int count = 0;
        for (BlobInfo blob : blobs()) {
            if (cutoff != null && !blob.lastAccessedAt().isBefore(cutoff)) continue;
            if (remove(blob.digest())) {
                count++;
            } else {
                logger.info("Clear skipped {}: open for read", blob.digest());
            }
        }
        for (CacheEntry e : index.all()) {
            if (!contains(e.digest())) {
                index.remove(e.reference());
            }
        }
        logger.info("Cleared {} blobs (olderThan={})", count, olderThan);
        return count;
    }

    private CacheCorruptionException corrupted(Digest expected, Digest actual) {
        Path p = pathFor(expected);
        logger.warn("Blob {} hashed to {}; removing it and its index records", expected, actual);
        delete(expected);
        return new CacheCorruptionException(expected, actual, p);
    }

    private boolean delete(Digest digest) {
        try {
            boolean existed = Files.deleteIfExists(pathFor(digest));
            index.removeDigest(digest);
            return existed;
        } catch (IOException e) {
            logger.warn("Failed to delete blob {}", digest, e);
            return false;
        }
    }

    /**
     * Open-for-read handle; the blob is not evicted while any lease on it is open.
     */
    public final class ReadLease implements AutoCloseable {
        private final Digest digest;
        private final Path path;
        private boolean closed;

        private ReadLease(Digest digest, Path path) {
            this.digest = digest;
            this.path = path;
        }

        public Digest digest() {
            return digest;
        }

        public Path path() {
            return path;
        }

        public InputStream newInputStream() throws IOException {
            return Files.newInputStream(path);
        }

        @Override
        public synchronized void close() {
            if (closed) return;
            closed = true;
            release(digest);
        }
    }
}
