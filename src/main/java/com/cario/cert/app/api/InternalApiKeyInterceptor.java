package com.cario.cert.app.api;

import com.cario.cert.app.config.CertificateProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Rejects generation requests whose {@code x-internal-api-key} header does not match the
 * configured key. Runs before the controller, so a rejected request never touches storage.
 *
 * <p>Does nothing when no key is configured.
 */
@Log4j2
@RequiredArgsConstructor
public class InternalApiKeyInterceptor implements HandlerInterceptor {

  public static final String HEADER = "x-internal-api-key";

  private final CertificateProperties.Security security;
  private final ObjectMapper objectMapper;

  @Override
  public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler)
      throws IOException {
    if (!security.isApiKeyRequired() || HttpMethod.OPTIONS.matches(req.getMethod())) {
      return true;
    }

    String supplied = req.getHeader(HEADER);
    if (supplied != null && matches(supplied, security.getInternalApiKey())) {
      return true;
    }

    log.warn(
        "auth.rejected path={} remote={} headerPresent={}",
        req.getRequestURI(),
        req.getRemoteAddr(),
        supplied != null);
    res.setStatus(HttpStatus.FORBIDDEN.value());
    res.setContentType(MediaType.APPLICATION_JSON_VALUE);
    res.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(res.getOutputStream(), new ErrorDetail("Forbidden"));
    return false;
  }

  /** Constant-time comparison. */
  private static boolean matches(String supplied, String expected) {
    return MessageDigest.isEqual(
        supplied.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8));
  }
}
