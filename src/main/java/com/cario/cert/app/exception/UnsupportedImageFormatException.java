package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Raw bytes could not be decoded as a raster image. */
public class UnsupportedImageFormatException extends CertificateException {

  public UnsupportedImageFormatException(String message) {
    super(ErrorKind.UNSUPPORTED_IMAGE_FORMAT, message);
  }

  public UnsupportedImageFormatException(String message, Throwable cause) {
    super(ErrorKind.UNSUPPORTED_IMAGE_FORMAT, message, cause);
  }
}
