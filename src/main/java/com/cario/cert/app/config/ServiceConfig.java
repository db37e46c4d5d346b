package com.cario.cert.app.config;

import com.cario.cert.app.service.CertificateGenerationService;
import com.cario.cert.app.service.DateFormatter;
import com.cario.cert.app.service.DocxTemplateRenderer;
import com.cario.cert.app.service.FilenameDeriver;
import com.cario.cert.app.service.ImageNormalizer;
import com.cario.cert.app.service.QrCodeEncoder;
import com.cario.cert.app.service.convert.DocumentConverter;
import com.cario.cert.app.service.convert.LibreOfficeConverter;
import com.cario.cert.app.storage.ArtifactPublisher;
import com.cario.cert.app.storage.AssetFetcher;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.s3.S3Client;

@Configuration
@RequiredArgsConstructor
public class ServiceConfig {

  private final S3Client s3Client;
  private final CertificateProperties properties;

  @Value("${aws.s3.bucket}")
  private String bucket;

  // -------------------
  // Storage
  // -------------------

  @Bean
  public AssetFetcher assetFetcher() {
    return new AssetFetcher(s3Client, bucket);
  }

  @Bean
  public ArtifactPublisher artifactPublisher() {
    return new ArtifactPublisher(s3Client, bucket);
  }

  // -------------------
  // Assembly
  // -------------------

  @Bean
  public QrCodeEncoder qrCodeEncoder() {
    CertificateProperties.Qr qr = properties.getQr();
    return new QrCodeEncoder(qr.getModuleSize(), qr.getQuietZone());
  }

  @Bean
  public ImageNormalizer imageNormalizer() {
    return new ImageNormalizer();
  }

  @Bean
  public DocxTemplateRenderer docxTemplateRenderer() {
    return new DocxTemplateRenderer();
  }

  @Bean
  public FilenameDeriver filenameDeriver() {
    return new FilenameDeriver(properties.getOutputPrefix());
  }

  @Bean
  public DocumentConverter documentConverter() {
    CertificateProperties.Conversion conversion = properties.getConversion();
    Path workDir =
        conversion.getWorkDir() != null
            ? conversion.getWorkDir()
            : Path.of(System.getProperty("java.io.tmpdir"));
    return new LibreOfficeConverter(conversion.getExecutable(), workDir, conversion.getTimeout());
  }

  // -------------------
  // Pipeline
  // -------------------

  @Bean
  public CertificateGenerationService certificateGenerationService(
      AssetFetcher assetFetcher,
      ArtifactPublisher artifactPublisher,
      QrCodeEncoder qrCodeEncoder,
      ImageNormalizer imageNormalizer,
      DocxTemplateRenderer docxTemplateRenderer,
      FilenameDeriver filenameDeriver,
      DocumentConverter documentConverter) {
    return new CertificateGenerationService(
        assetFetcher,
        qrCodeEncoder,
        imageNormalizer,
        docxTemplateRenderer,
        new DateFormatter(),
        filenameDeriver,
        documentConverter,
        artifactPublisher,
        properties);
  }
}
