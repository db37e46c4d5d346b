package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** QR payload could not be encoded. */
public class EncodingException extends CertificateException {

  public EncodingException(String message) {
    super(ErrorKind.ENCODING, message);
  }

  public EncodingException(String message, Throwable cause) {
    super(ErrorKind.ENCODING, message, cause);
  }
}
