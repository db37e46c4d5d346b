package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** The object store has no object under the requested key. */
public class AssetNotFoundException extends CertificateException {

  public AssetNotFoundException(String message) {
    super(ErrorKind.ASSET_NOT_FOUND, message);
  }

  public AssetNotFoundException(String message, Throwable cause) {
    super(ErrorKind.ASSET_NOT_FOUND, message, cause);
  }
}
