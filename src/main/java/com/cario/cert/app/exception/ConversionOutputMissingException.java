package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** The external converter exited cleanly but left no output file. */
public class ConversionOutputMissingException extends CertificateException {

  public ConversionOutputMissingException(String message) {
    super(ErrorKind.CONVERSION_OUTPUT_MISSING, message);
  }
}
