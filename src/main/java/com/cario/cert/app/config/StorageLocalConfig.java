/**
 * Storage configuration package for the certificate service.
 *
 * <p>Contains Spring configuration classes for the S3 client bean.
 */
package com.cario.cert.app.config;

import java.net.URI;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Profile;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Storage configuration for the local environment.
 *
 * <p>Uses static credentials from the application properties and points the client at the
 * configured S3-compatible endpoint (Cloudflare R2, MinIO, ...). Defines a single {@link S3Client}
 * bean that is shared by every request.
 *
 * <p>Active only when the {@code local} Spring profile is enabled.
 */
@Configuration
@Profile("local")
@Import({ServiceConfig.class, WebConfig.class})
public class StorageLocalConfig {

  /** Region reported to the SDK; R2 expects {@code auto}. */
  @Value("${aws.region}")
  private String region;

  @Value("${aws.accessKeyId}")
  private String accessKeyId;

  @Value("${aws.secretAccessKey}")
  private String secretAccessKey;

  @Value("${aws.s3.endpoint}")
  private String endpoint;

  @Value("${aws.s3.path-style-access:true}")
  private boolean pathStyleAccess;

  @Bean
  StaticCredentialsProvider storageCredentials() {
    return StaticCredentialsProvider.create(
        AwsBasicCredentials.create(accessKeyId, secretAccessKey));
  }

  /**
   * Creates the S3 client using static credentials.
   *
   * @return a configured {@link S3Client} bound to the storage endpoint
   */
  @Bean(destroyMethod = "close")
  public S3Client s3Client(StaticCredentialsProvider storageCredentials) {
    return S3Client.builder()
        .region(Region.of(region))
        .endpointOverride(URI.create(endpoint))
        .forcePathStyle(pathStyleAccess)
        .credentialsProvider(storageCredentials)
        .build();
  }
}
