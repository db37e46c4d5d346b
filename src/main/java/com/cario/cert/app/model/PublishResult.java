package com.cario.cert.app.model;

import lombok.Builder;
import lombok.Data;

/** Returned after an artifact has been written to object storage. */
@Data
@Builder
public class PublishResult {
  private String bucket;
  private String key;
  private String eTag; // ETag from PutObjectResponse
  private String contentType;
  private long size;
  private String s3Uri; // s3://bucket/key
}
