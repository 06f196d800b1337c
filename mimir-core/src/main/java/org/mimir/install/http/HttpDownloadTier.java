package org.mimir.install.http;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.TierFailedException;
import org.mimir.install.InstallerTier;
import org.mimir.install.TierOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Last-resort direct download. Sources are configured per repository
 * ({@code ecosystem/namespace/name}); the checksum comes from configuration, never from the
 * download itself. Without a checksum the download is refused unless unverified downloads
 * are explicitly allowed.
 */
public class HttpDownloadTier implements InstallerTier {
    private static final Logger logger = LoggerFactory.getLogger(HttpDownloadTier.class);

    private final Map<String, HttpArtifactSource> sources;
    private final HttpDownloadClient client;
    private final Duration timeout;
    private final boolean allowUnverified;

    public HttpDownloadTier(Map<String, HttpArtifactSource> sources, HttpDownloadClient client,
                            Duration timeout, boolean allowUnverified) {
        this.sources = Map.copyOf(sources);
        this.client = client;
        this.timeout = timeout;
        this.allowUnverified = allowUnverified;
    }

    @Override
    public SourceTier tier() {
        return SourceTier.HTTP;
    }

    @Override
    public TierOutcome attempt(ArtifactReference reference, Path workDir) {
        HttpArtifactSource source = sources.get(reference.repository());
        if (source == null) {
            return TierOutcome.skipped("no download source for " + reference.repository());
        }
        Optional<Digest> checksum = source.checksumFor(reference);
        if (checksum.isEmpty()) {
            if (!allowUnverified) {
                return TierOutcome.failed(new TierFailedException(SourceTier.HTTP, reference,
                        "No checksum configured for " + reference + "; refusing unverified download"));
            }
            logger.warn("Downloading {} without an independent checksum", reference);
        }
        String url = source.urlFor(reference);
        Path target = workDir.resolve("http").resolve(reference.name());
        client.download(reference, url, target, timeout);
        return TierOutcome.fetched(target, checksum.orElse(null));
    }
}
