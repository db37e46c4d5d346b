package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Certificate number, first name or last name is empty after sanitization. */
public class InvalidIdentityException extends CertificateException {

  public InvalidIdentityException(String message) {
    super(ErrorKind.INVALID_IDENTITY, message);
  }
}
