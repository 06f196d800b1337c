package org.mimir.config;

import org.mimir.install.registry.ArtifactRegistry;
import org.mimir.install.registry.S3ArtifactRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

/**
 * S3 client for the team registry. Works against AWS and S3-compatible stores through the
 * endpoint override and path-style access settings.
 */
@Configuration
public class RegistryClientConfig {
    private static final Logger logger = LoggerFactory.getLogger(RegistryClientConfig.class);

    @Bean
    public S3Client s3Client(MimirProperties props) {
        MimirProperties.Registry r = props.getRegistry();
        S3ClientBuilder b = S3Client.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .region(Region.of(r.getRegion()))
                .serviceConfiguration(
                        S3Configuration.builder()
                                .pathStyleAccessEnabled(r.isPathStyleAccess())
                                .build()
                )
                .overrideConfiguration(
                        ClientOverrideConfiguration.builder()
                                .apiCallTimeout(r.getApiCallTimeout())
                                .build()
                );

        if (r.getEndpoint() != null && !r.getEndpoint().isBlank()) {
            b = b.endpointOverride(URI.create(r.getEndpoint()));
        }

        return b.build();
    }

    @Bean
    public ArtifactRegistry artifactRegistry(S3Client s3Client, MimirProperties props) {
        MimirProperties.Registry r = props.getRegistry();
        if (r.getBucket() == null || r.getBucket().isBlank()) {
            logger.info("No registry bucket configured; registry tier disabled");
            return ArtifactRegistry.none();
        }
        logger.info("Registry tier using s3://{}/{}", r.getBucket(), r.getPrefix());
        return new S3ArtifactRegistry(s3Client, r.getBucket(), r.getPrefix());
    }
}
