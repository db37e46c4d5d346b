package com.cario.cert.app.config;

import com.cario.cert.app.api.InternalApiKeyInterceptor;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/** CORS and internal API key enforcement for the HTTP surface. */
@Log4j2
@Configuration
@RequiredArgsConstructor
public class WebConfig implements WebMvcConfigurer {

  private final CertificateProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    List<String> origins =
        properties.getCors().getAllowedOrigins().stream()
            .map(String::trim)
            .filter(o -> !o.isEmpty())
            .toList();

    // no mapping at all means the browser gets no CORS headers, i.e. every origin is blocked
    if (origins.isEmpty()) {
      log.info("cors.disabled no allowed origins configured");
      return;
    }

    log.info("cors.enabled origins={}", origins);
    registry
        .addMapping("/**")
        .allowedOriginPatterns(origins.toArray(String[]::new))
        .allowedMethods("*")
        .allowedHeaders("*")
        .allowCredentials(true);
  }

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(new InternalApiKeyInterceptor(properties.getSecurity(), objectMapper))
        .addPathPatterns("/generate-*");
  }
}
