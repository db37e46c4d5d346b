package com.cario.cert.app.model;

import lombok.Value;

/** Final bytes of a certificate together with the key and content type they are stored under. */
@Value
public class OutputArtifact {
  String key;
  byte[] bytes;
  OutputFormat format;

  public String contentType() {
    return format.contentType();
  }
}
