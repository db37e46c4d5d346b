package com.cario.cert.app.model;

import lombok.Value;

/** Image bound to a template placeholder, displayed at a fixed width. */
@Value
public class InlineImage {
  byte[] bytes;
  double widthMm;
}
