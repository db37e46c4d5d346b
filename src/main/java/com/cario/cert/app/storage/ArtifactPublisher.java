package com.cario.cert.app.storage;

import com.cario.cert.app.exception.PublishException;
import com.cario.cert.app.model.PublishResult;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

/** Writes finished certificates to the bucket. Existing objects are overwritten. */
@Log4j2
public class ArtifactPublisher {

  private final S3Client s3;
  private final String bucket;

  public ArtifactPublisher(S3Client s3, String bucket) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
  }

  // ------------------ Public API ------------------

  /**
   * Uploads {@code bytes} under {@code key}.
   *
   * @throws PublishException on any transport or auth failure; the upload is not retried
   */
  public PublishResult publish(String key, byte[] bytes, String contentType) {
    try {
      PutObjectRequest req =
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .contentLength((long) bytes.length)
              .build();

      PutObjectResponse resp = s3.putObject(req, RequestBody.fromBytes(bytes));

      PublishResult result =
          PublishResult.builder()
              .bucket(bucket)
              .key(key)
              .eTag(resp.eTag())
              .contentType(contentType)
              .size(bytes.length)
              .s3Uri("s3://" + bucket + "/" + key)
              .build();

      log.info(
          "s3.upload ok bucket={} key={} size={} eTag={}",
          result.getBucket(),
          logKey(result.getKey()),
          result.getSize(),
          result.getETag());
      return result;
    } catch (SdkException e) {
      log.error("s3.upload error bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
      throw new PublishException("Failed to upload to S3: " + e.getMessage(), e);
    }
  }

  // ------------------ Helpers ------------------

  private static String logKey(String key) {
    if (key == null) return null;
    return key.length() > 120 ? key.substring(0, 120) + "...(truncated)" : key;
  }
}
