package org.mimir.install.registry;

import org.mimir.artifact.ArtifactReference;
import org.mimir.artifact.Digest;
import org.mimir.artifact.SourceTier;
import org.mimir.error.ArtifactNotFoundException;
import org.mimir.error.TierFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * {@link ArtifactRegistry} on an S3-compatible object store. See {@link RegistryLayout} for keys.
 * Call timeouts come from the client's override configuration.
 */
public class S3ArtifactRegistry implements ArtifactRegistry {
    private static final Logger logger = LoggerFactory.getLogger(S3ArtifactRegistry.class);

    private final S3Client s3;
    private final String bucket;
    private final RegistryLayout layout;

    public S3ArtifactRegistry(S3Client s3, String bucket, String prefix) {
        this.s3 = s3;
        this.bucket = bucket;
        this.layout = new RegistryLayout(prefix);
    }

    @Override
    public boolean isConfigured() {
        return bucket != null && !bucket.isBlank();
    }

    @Override
    public Optional<Digest> resolveTag(ArtifactReference ref) {
        String key = layout.tagKey(ref);
        try {
            ResponseBytes<GetObjectResponse> bytes = s3.getObjectAsBytes(
                    GetObjectRequest.builder().bucket(bucket).key(key).build());
            return Optional.of(Digest.parse(bytes.asString(StandardCharsets.UTF_8)));
        } catch (NoSuchKeyException e) {
            return Optional.empty();
        } catch (S3Exception e) {
            // Some S3-compatible APIs throw generic 404 as S3Exception
            if (e.statusCode() == 404) return Optional.empty();
            logger.warn("Registry tag lookup failed for s3://{}/{}", bucket, key, e);
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry tag lookup failed: s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry unreachable: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry tag s3://" + bucket + "/" + key + " is not a digest", e);
        }
    }

    @Override
    public void download(ArtifactReference ref, Digest digest, Path destination) {
        String key = layout.blobKey(digest);
        try {
            Files.createDirectories(destination.getParent());
            Files.deleteIfExists(destination);
            s3.getObject(GetObjectRequest.builder().bucket(bucket).key(key).build(), destination);
            logger.info("Downloaded s3://{}/{} to {}", bucket, key, destination);
        } catch (NoSuchKeyException e) {
            throw new ArtifactNotFoundException(ref, "Registry tag points at missing blob s3://" + bucket + "/" + key, e);
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                throw new ArtifactNotFoundException(ref, "Registry tag points at missing blob s3://" + bucket + "/" + key, e);
            }
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry download failed: s3://" + bucket + "/" + key, e);
        } catch (SdkException e) {
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry download failed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Cannot prepare " + destination, e);
        }
    }

    @Override
    public List<String> listTags(String repository) {
        String prefix = layout.tagsPrefix(repository);
        TreeSet<String> tags = new TreeSet<>();
        String token = null;
        try {
            do {
                ListObjectsV2Response r = s3.listObjectsV2(ListObjectsV2Request.builder()
                        .bucket(bucket)
                        .prefix(prefix)
                        .continuationToken(token)
                        .build());
                if (r.contents() != null) {
                    for (S3Object o : r.contents()) {
                        String tag = o.key().substring(prefix.length());
                        if (!tag.isEmpty() && !tag.contains("/")) tags.add(tag);
                    }
                }
                token = Boolean.TRUE.equals(r.isTruncated()) ? r.nextContinuationToken() : null;
            } while (token != null);
        } catch (SdkException e) {
            throw new TierFailedException(SourceTier.REGISTRY, null, "Registry list failed for " + repository + ": " + e.getMessage(), e);
        }
        return new ArrayList<>(tags);
    }

    @Override
    public void push(ArtifactReference ref, Digest digest, Path content) {
        String blobKey = layout.blobKey(digest);
        try {
            if (!exists(blobKey)) {
                s3.putObject(PutObjectRequest.builder().bucket(bucket).key(blobKey).build(), RequestBody.fromFile(content));
            }
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(layout.tagKey(ref))
                            .contentType("text/plain")
                            .build(),
                    RequestBody.fromString(digest.toString(), StandardCharsets.UTF_8));
            logger.info("Pushed {} ({}) to s3://{}/{}", ref, digest, bucket, layout.tagKey(ref));
        } catch (SdkException e) {
            logger.error("Registry push failed for {}", ref, e);
            throw new TierFailedException(SourceTier.REGISTRY, ref, "Registry push failed: " + e.getMessage(), e);
        }
    }

    private boolean exists(String key) {
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(bucket).key(key).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) return false;
            throw e;
        }
    }
}
