package com.cario.cert.app.model;

import lombok.Value;

/** Raw object fetched from storage. The byte array is handed over to the consumer, not copied. */
@Value
public class AssetBlob {
  String key;
  byte[] bytes;
  String contentType;

  public int size() {
    return bytes.length;
  }
}
