package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Request data is missing or malformed; reported to the caller as a client error. */
public class ValidationException extends CertificateException {

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }
}
