package com.cario.cert.app.model;

/** Tag carried by every pipeline failure; the HTTP layer maps it to a status code. */
public enum ErrorKind {
  VALIDATION,
  INVALID_IDENTITY,
  ASSET_NOT_FOUND,
  ASSET_STORE_UNAVAILABLE,
  ENCODING,
  UNSUPPORTED_IMAGE_FORMAT,
  TEMPLATE_RENDER,
  CONVERSION_PROCESS,
  CONVERSION_OUTPUT_MISSING,
  PUBLISH,
  INTERNAL;

  /** True for failures caused by the caller's input rather than by a dependency. */
  public boolean isClientError() {
    return this == VALIDATION || this == INVALID_IDENTITY;
  }
}
