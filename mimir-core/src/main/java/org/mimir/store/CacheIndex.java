package org.mimir.store;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.CacheEntry;
import org.mimir.artifact.Digest;
import org.mimir.error.InvalidReferenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Index of {@link CacheEntry} records, reachable by reference and by digest:
 * <pre>
 *   {root}/refs/{ecosystem}/{namespace}/{name}/{tag}.entry
 *   {root}/digests/{hex[0..2]}/{hex}/{sha256(reference)}.entry
 * </pre>
 * Several references may point at one digest. Only {@link DigestStore} writes here.
 */
public class CacheIndex {
    private static final Logger logger = LoggerFactory.getLogger(CacheIndex.class);
    private static final String ENTRY_SUFFIX = ".entry";

    private final Path refsDir;
    private final Path digestsDir;

    public CacheIndex(Path root) {
        this.refsDir = root.resolve("refs");
        this.digestsDir = root.resolve("digests");
        try {
            Files.createDirectories(refsDir);
            Files.createDirectories(digestsDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create cache index under " + root, e);
        }
    }

    public void put(CacheEntry entry) {
        ArtifactReference ref = entry.reference();
        byte[] record = CacheEntryCodec.encode(entry).getBytes(StandardCharsets.UTF_8);
        try {
            Optional<CacheEntry> previous = get(ref);
            AtomicFiles.write(digestRecordPath(entry.digest(), ref), record);
            AtomicFiles.write(refRecordPath(ref), record);
            if (previous.isPresent() && !previous.get().digest().equals(entry.digest())) {
                Files.deleteIfExists(digestRecordPath(previous.get().digest(), ref));
                logger.info("Index: {} moved from {} to {}", ref, previous.get().digest(), entry.digest());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write index record for " + ref, e);
        }
    }

    public Optional<CacheEntry> get(ArtifactReference ref) {
        return read(refRecordPath(ref));
    }

    public List<CacheEntry> byDigest(Digest digest) {
        Path dir = digestDir(digest);
        if (!Files.isDirectory(dir)) return List.of();
        List<CacheEntry> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(CacheIndex::isRecord).forEach(p -> read(p).ifPresent(out::add));
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list index records for " + digest, e);
        }
        return out;
    }

    public void remove(ArtifactReference ref) {
        try {
            Optional<CacheEntry> existing = get(ref);
            Files.deleteIfExists(refRecordPath(ref));
            if (existing.isPresent()) {
                Files.deleteIfExists(digestRecordPath(existing.get().digest(), ref));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove index record for " + ref, e);
        }
    }

    /**
     * Drops every record that points at {@code digest}.
     *
     * @return number of references that were pointing at it
     */
    public int removeDigest(Digest digest) {
        int removed = 0;
        for (CacheEntry e : byDigest(digest)) {
            Optional<CacheEntry> current = get(e.reference());
            try {
                if (current.isPresent() && current.get().digest().equals(digest)) {
                    Files.deleteIfExists(refRecordPath(e.reference()));
                    removed++;
                }
                Files.deleteIfExists(digestRecordPath(digest, e.reference()));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to remove index record for " + e.reference(), ex);
            }
        }
        try {
            Files.deleteIfExists(digestDir(digest));
        } catch (IOException e) {
            logger.debug("Digest dir for {} not removed: {}", digest, e.toString());
        }
        return removed;
    }

    public List<CacheEntry> all() {
        List<CacheEntry> out = new ArrayList<>();
        try (Stream<Path> files = Files.walk(refsDir)) {
            files.filter(Files::isRegularFile).filter(CacheIndex::isRecord).forEach(p -> read(p).ifPresent(out::add));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk index " + refsDir, e);
        }
        return out;
    }

    /** Tags recorded locally for {@code ecosystem/namespace/name}. */
    public List<String> tags(String repository) {
        Path dir = repositoryDir(repository);
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(CacheIndex::isRecord)
                    .map(p -> {
                        String n = p.getFileName().toString();
                        return n.substring(0, n.length() - ENTRY_SUFFIX.length());
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list tags of " + repository, e);
        }
    }

    Path refRecordPath(ArtifactReference ref) {
        return refsDir.resolve(ref.ecosystem())
                .resolve(ref.namespace())
                .resolve(ref.name())
                .resolve(ref.tag() + ENTRY_SUFFIX);
    }

    private Path repositoryDir(String repository) {
        // Reuse reference validation so the repository cannot escape refsDir.
        ArtifactReference probe;
        try {
            probe = ArtifactReference.parse(repository + ":0");
        } catch (InvalidReferenceException e) {
            throw new InvalidReferenceException("Invalid repository '" + repository + "'");
        }
        return refsDir.resolve(probe.ecosystem()).resolve(probe.namespace()).resolve(probe.name());
    }

    private Path digestDir(Digest digest) {
        return digestsDir.resolve(digest.prefix()).resolve(digest.hex());
    }

    private Path digestRecordPath(Digest digest, ArtifactReference ref) {
        return digestDir(digest).resolve(Digest.of(ref.canonical()).hex() + ENTRY_SUFFIX);
    }

    private static boolean isRecord(Path p) {
        return p.getFileName().toString().endsWith(ENTRY_SUFFIX);
    }

    private Optional<CacheEntry> read(Path record) {
        try {
            String line = Files.readString(record, StandardCharsets.UTF_8);
            return Optional.of(CacheEntryCodec.decode(line));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read index record " + record, e);
        } catch (RuntimeException e) {
            logger.warn("Dropping unreadable index record {}: {}", record, e.getMessage());
            try {
                Files.deleteIfExists(record);
            } catch (IOException ex) {
                logger.debug("Could not delete unreadable index record {}", record, ex);
            }
            return Optional.empty();
        }
    }
}
