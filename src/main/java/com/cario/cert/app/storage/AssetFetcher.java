package com.cario.cert.app.storage;

import com.cario.cert.app.exception.AssetNotFoundException;
import com.cario.cert.app.exception.AssetStoreUnavailableException;
import com.cario.cert.app.exception.ValidationException;
import com.cario.cert.app.model.AssetBlob;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * Reads templates and signature images from the certificate bucket.
 *
 * <p>One {@code GetObject} per call and no retries: a failed fetch aborts the request.
 */
@Log4j2
public class AssetFetcher {

  private final S3Client s3;
  private final String bucket;

  public AssetFetcher(S3Client s3, String bucket) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.bucket = Objects.requireNonNull(bucket, "bucket must not be null");
  }

  /**
   * Downloads the object stored under {@code key}.
   *
   * @param key storage key, must not be blank
   * @return the object bytes with the content type reported by the store
   * @throws ValidationException if the key is blank
   * @throws AssetNotFoundException if the store has no such object
   * @throws AssetStoreUnavailableException on any other transport or auth failure
   */
  public AssetBlob fetch(String key) {
    if (key == null || key.isBlank()) {
      throw new ValidationException("asset key must not be blank");
    }

    try {
      ResponseBytes<GetObjectResponse> bytes =
          s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build());
      String contentType = bytes.response().contentType();
      AssetBlob blob =
          new AssetBlob(
              key,
              bytes.asByteArray(),
              contentType == null ? "application/octet-stream" : contentType);
      log.info("s3.fetch ok bucket={} key={} size={}", bucket, key, blob.size());
      return blob;

    } catch (NoSuchKeyException e) {
      log.warn("s3.fetch missing bucket={} key={}", bucket, key);
      throw new AssetNotFoundException("Asset not found: s3://" + bucket + "/" + key, e);
    } catch (S3Exception e) {
      if (e.statusCode() == 404) {
        log.warn("s3.fetch missing bucket={} key={} status=404", bucket, key);
        throw new AssetNotFoundException("Asset not found: s3://" + bucket + "/" + key, e);
      }
      log.error(
          "s3.fetch error bucket={} key={} status={} msg={}",
          bucket,
          key,
          e.statusCode(),
          errorMessage(e),
          e);
      throw new AssetStoreUnavailableException(
          "Failed to read s3://" + bucket + "/" + key + ": " + errorMessage(e), e);
    } catch (SdkException e) {
      log.error("s3.fetch error bucket={} key={} msg={}", bucket, key, e.getMessage(), e);
      throw new AssetStoreUnavailableException(
          "Failed to read s3://" + bucket + "/" + key + ": " + e.getMessage(), e);
    }
  }

  private static String errorMessage(S3Exception e) {
    return e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
        ? e.awsErrorDetails().errorMessage()
        : e.getMessage();
  }
}
