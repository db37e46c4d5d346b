package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Transport or authorization failure while writing to the object store. */
public class PublishException extends CertificateException {

  public PublishException(String message) {
    super(ErrorKind.PUBLISH, message);
  }

  public PublishException(String message, Throwable cause) {
    super(ErrorKind.PUBLISH, message, cause);
  }
}
