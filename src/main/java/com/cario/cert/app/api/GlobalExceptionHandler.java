package com.cario.cert.app.api;

import jakarta.servlet.http.HttpServletRequest;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures raised outside the pipeline (request binding, validation, unexpected errors) to
 * the same {@code {"detail": ...}} envelope the pipeline errors use.
 */
@Log4j2
@RestControllerAdvice
public class GlobalExceptionHandler {

  /** Bean validation failures on the request body map to 400. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorDetail> handleInvalid(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining(", "));
    return build(HttpStatus.BAD_REQUEST, detail.isEmpty() ? "Invalid request" : detail);
  }

  /** Missing or malformed JSON maps to 400. */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorDetail> handleUnreadable(HttpMessageNotReadableException ex) {
    return build(HttpStatus.BAD_REQUEST, "Malformed request body");
  }

  /**
   * Fallback. Spring MVC's own errors (unknown path, wrong method or media type) keep their
   * status; anything else is a 500.
   */
  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorDetail> handleGeneric(Exception ex, HttpServletRequest request) {
    if (ex instanceof ErrorResponse errorResponse) {
      return ResponseEntity.status(errorResponse.getStatusCode())
          .body(new ErrorDetail(ex.getMessage()));
    }
    log.error("api.error path={} msg={}", request.getRequestURI(), ex.getMessage(), ex);
    return build(HttpStatus.INTERNAL_SERVER_ERROR, String.valueOf(ex.getMessage()));
  }

  private static ResponseEntity<ErrorDetail> build(HttpStatus status, String detail) {
    return ResponseEntity.status(status).body(new ErrorDetail(detail));
  }
}
