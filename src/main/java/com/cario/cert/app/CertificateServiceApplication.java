package com.cario.cert.app;

import com.cario.cert.app.config.CertificateProperties;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Entry point for the Certificate Generation Service Spring Boot application.
 *
 * <p>The service fills docx certificate templates with applicant data, a verification QR code and
 * the instructor's signature, optionally converts them to PDF and stores the result in
 * S3-compatible object storage.
 *
 * <p>Logging is provided via Lombok's {@code @Log4j2} annotation. Usage:
 *
 * <pre>
 *   mvn spring-boot:run
 * </pre>
 */
@Log4j2
@SpringBootApplication
@EnableConfigurationProperties(CertificateProperties.class)
public class CertificateServiceApplication {

  /**
   * Main entry point for the Spring Boot application.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    log.info("Starting Certificate Generation Service application...");
    SpringApplication.run(CertificateServiceApplication.class, args);
    log.info("Certificate Generation Service application started successfully.");
  }
}
