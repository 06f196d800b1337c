package org.mimir.install.http;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.SourceTier;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.TierFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Streams an HTTP GET body straight to a file. Redirects are followed.
 */
public class HttpDownloadClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpDownloadClient.class);

    private final WebClient webClient;

    public HttpDownloadClient() {
        this(WebClient.builder());
    }

    public HttpDownloadClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create().followRedirect(true).compress(true);
        this.webClient = builder.clientConnector(new ReactorClientHttpConnector(httpClient)).build();
    }

    /**
     * @throws ArtifactNotFoundException on 404
     * @throws TierFailedException       on any other HTTP error, network error or timeout
     */
    public void download(ArtifactReference ref, String url, Path destination, Duration timeout) {
        try {
            Files.createDirectories(destination.getParent());
            Flux<DataBuffer> body = webClient.get()
                    .uri(URI.create(url))
                    .retrieve()
                    .bodyToFlux(DataBuffer.class)
                    .timeout(timeout);

            DataBufferUtils.write(body, destination).then().block(timeout);
            logger.info("Downloaded {} to {}", url, destination);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == 404) {
                throw new ArtifactNotFoundException(ref, "HTTP 404 for " + url, e);
            }
            throw new TierFailedException(SourceTier.HTTP, ref, "HTTP " + e.getStatusCode().value() + " for " + url, e);
        } catch (IOException e) {
            throw new TierFailedException(SourceTier.HTTP, ref, "Cannot write " + destination, e);
        } catch (RuntimeException e) {
            throw new TierFailedException(SourceTier.HTTP, ref, "Download failed for " + url + ": " + e.getMessage(), e);
        }
    }
}
