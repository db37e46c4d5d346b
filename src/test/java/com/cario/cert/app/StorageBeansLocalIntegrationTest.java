package com.cario.cert.app;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.cario.cert.app.config.CertificateProperties;
import com.cario.cert.app.service.CertificateGenerationService;
import com.cario.cert.app.service.convert.DocumentConverter;
import com.cario.cert.app.service.convert.LibreOfficeConverter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import software.amazon.awssdk.services.s3.S3Client;

/** Boots the full context with the local profile. No call reaches the object store. */
@SpringBootTest
@ActiveProfiles("local")
class StorageBeansLocalIntegrationTest {

  @Autowired private ApplicationContext context;

  @Autowired private S3Client s3Client;

  @Autowired private CertificateProperties properties;

  @Test
  void singleS3ClientIsShared() {
    assertEquals(1, context.getBeansOfType(S3Client.class).size());
    assertSame(s3Client, context.getBean(S3Client.class));
    assertEquals("auto", s3Client.serviceClientConfiguration().region().id());
  }

  @Test
  void pipelineIsWired() {
    assertNotNull(context.getBean(CertificateGenerationService.class));
    assertInstanceOf(LibreOfficeConverter.class, context.getBean(DocumentConverter.class));
  }

  @Test
  void certificatePropertiesAreBound() {
    assertEquals("https://verify.example.com/certificates/", properties.getVerifyBaseUrl());
    assertEquals("certificates/", properties.getOutputPrefix());
    assertEquals(800, properties.getSignature().getMaxWidth());
  }
}
