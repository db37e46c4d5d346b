package com.cario.cert.app.config;

import java.net.URI;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * Storage configuration for the production profile.
 *
 * <p>Credentials come from {@code aws.accessKeyId}/{@code aws.secretAccessKey} when both are set
 * (R2 tokens), otherwise from the default AWS credential chain. The endpoint override is optional
 * so the same build can target AWS S3 directly.
 *
 * <p>Active only when the {@code production} Spring profile is enabled.
 */
@Log4j2
@Configuration
@Profile("production")
@Import({ServiceConfig.class, WebConfig.class})
public class StorageProdConfig {

  @Value("${aws.region}")
  private String region;

  @Value("${aws.accessKeyId:}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey:}")
  private String secretAccessKey;

  @Value("${aws.s3.endpoint:}")
  private String endpoint;

  @Value("${aws.s3.path-style-access:true}")
  private boolean pathStyleAccess;

  /**
   * Creates the S3 client.
   *
   * @return a configured {@link S3Client} for the specified region and endpoint
   */
  @Bean(destroyMethod = "close")
  public S3Client s3Client() {
    S3ClientBuilder builder =
        S3Client.builder()
            .region(Region.of(region))
            .forcePathStyle(pathStyleAccess)
            .credentialsProvider(credentials());
    if (!endpoint.isBlank()) {
      builder.endpointOverride(URI.create(endpoint));
    }
    log.info(
        "storage.client region={} endpoint={} pathStyle={}", region, endpoint, pathStyleAccess);
    return builder.build();
  }

  private AwsCredentialsProvider credentials() {
    if (!accessKeyId.isBlank() && !secretAccessKey.isBlank()) {
      return StaticCredentialsProvider.create(
          AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
    return DefaultCredentialsProvider.create();
  }
}
