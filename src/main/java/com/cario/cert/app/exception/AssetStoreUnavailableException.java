package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Transport or authorization failure while reading from the object store. */
public class AssetStoreUnavailableException extends CertificateException {

  public AssetStoreUnavailableException(String message) {
    super(ErrorKind.ASSET_STORE_UNAVAILABLE, message);
  }

  public AssetStoreUnavailableException(String message, Throwable cause) {
    super(ErrorKind.ASSET_STORE_UNAVAILABLE, message, cause);
  }
}
