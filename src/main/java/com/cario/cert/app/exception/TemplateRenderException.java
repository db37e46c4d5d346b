package com.cario.cert.app.exception;

import com.cario.cert.app.model.ErrorKind;

/** Template is not a readable docx or a placeholder cannot be bound. */
public class TemplateRenderException extends CertificateException {

  public TemplateRenderException(String message) {
    super(ErrorKind.TEMPLATE_RENDER, message);
  }

  public TemplateRenderException(String message, Throwable cause) {
    super(ErrorKind.TEMPLATE_RENDER, message, cause);
  }
}
