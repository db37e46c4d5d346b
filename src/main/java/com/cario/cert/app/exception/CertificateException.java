package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;
import lombok.Getter;

/**
 * Base type for every failure raised by the certificate pipeline.
 *
 * <p>Each subclass carries a fixed {@link ErrorKind} so the pipeline can turn it into a tagged
 * {@link com.cario.cert.app.model.PipelineFailure} without inspecting exception classes.
 */
@Getter
public abstract class CertificateException extends RuntimeException {

  private final ErrorKind kind;

  protected CertificateException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected CertificateException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }
}
