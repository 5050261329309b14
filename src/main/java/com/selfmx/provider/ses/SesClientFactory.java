package com.selfmx.provider.ses;

import com.selfmx.config.server.AwsConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sesv2.SesV2Client;
import software.amazon.awssdk.services.sesv2.SesV2ClientBuilder;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the SES v2 client from configuration.
 *
 * <p>Example usage:
 * <pre>
 * SesV2Client ses = SesClientFactory.createFromConfig(Config.getServer().getAws());
 * IdentityProviderClient identities = new SesIdentityProviderClient(ses);
 * </pre>
 */
public final class SesClientFactory {
    private static final Logger log = LogManager.getLogger(SesClientFactory.class);

    private SesClientFactory() {
        // Utility class
    }

    /**
     * Creates an SES v2 client.
     *
     * @param config AWS configuration.
     * @return Client instance.
     */
    public static SesV2Client createFromConfig(AwsConfig config) {
        Duration timeout = Duration.ofSeconds(config.getCallTimeoutSeconds());
        SesV2ClientBuilder builder = SesV2Client.builder()
                .credentialsProvider(credentials(config))
                .httpClientBuilder(UrlConnectionHttpClient.builder()
                        .connectionTimeout(timeout)
                        .socketTimeout(timeout))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(timeout)
                        .build());

        if (!config.getRegion().isBlank()) {
            builder.region(Region.of(config.getRegion()));
        }
        if (!config.getEndpointOverride().isBlank()) {
            builder.endpointOverride(URI.create(config.getEndpointOverride()));
        }

        log.info("SES client created: region={}, endpointOverride={}, callTimeoutSeconds={}",
                config.getRegion(), config.getEndpointOverride(), config.getCallTimeoutSeconds());
        return builder.build();
    }

    private static AwsCredentialsProvider credentials(AwsConfig config) {
        if (!config.getAccessKeyId().isBlank() && !config.getSecretAccessKey().isBlank()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.getAccessKeyId(), config.getSecretAccessKey()));
        }
        log.debug("No static AWS credentials configured, using default provider chain");
        return DefaultCredentialsProvider.create();
    }
}
