package com.cario.cert.app.api;

/** Error body returned by every failing endpoint: {@code {"detail": "..."}}. */
public record ErrorDetail(String detail) {}
