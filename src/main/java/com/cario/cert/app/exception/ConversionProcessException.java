package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** The external converter failed to start, exited non-zero or timed out. */
public class ConversionProcessException extends CertificateException {

  public ConversionProcessException(String message) {
    super(ErrorKind.CONVERSION_PROCESS, message);
  }

  public ConversionProcessException(String message, Throwable cause) {
    super(ErrorKind.CONVERSION_PROCESS, message, cause);
  }
}
