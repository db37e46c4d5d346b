package com.cario.cert.app.service;

import com.cario.cert.app.config.CertificateProperties;
import com.cario.cert.app.exception.CertificateException;
import com.cario.cert.app.exception.ValidationException;
import com.cario.cert.app.model.AssetBlob;
import com.cario.cert.app.model.CertificateField;
import com.cario.cert.app.model.ErrorKind;
import com.cario.cert.app.model.GenerationRequest;
import com.cario.cert.app.model.InlineImage;
import com.cario.cert.app.model.OutputArtifact;
import com.cario.cert.app.model.OutputFormat;
import com.cario.cert.app.model.PipelineFailure;
import com.cario.cert.app.model.PublishResult;
import com.cario.cert.app.model.RenderContext;
import com.cario.cert.app.model.StageResult;
import com.cario.cert.app.service.convert.DocumentConverter;
import com.cario.cert.app.storage.ArtifactPublisher;
import com.cario.cert.app.storage.AssetFetcher;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.log4j.Log4j2;

/**
 * CertificateGenerationService
 *
 * <ol>
 *   <li>Validate the applicant identity and derive the output key (no I/O yet).
 *   <li>Fetch the docx template from storage.
 *   <li>Encode the verification QR code.
 *   <li>Fetch the instructor signature and normalize it.
 *   <li>Render the template with text, dates, QR code and signature.
 *   <li>Optionally convert the document to PDF.
 *   <li>Publish the artifact under the derived key.
 * </ol>
 *
 * Each stage yields a {@link StageResult}; the first failure ends the run and nothing is
 * published. No state survives between calls, so one instance serves all request threads.
 */
@Log4j2
public class CertificateGenerationService {

  public static final String QR_CODE = "qr_code";
  public static final String INSTRUCTOR_SIGNATURE = "instructor_signature";

  private final AssetFetcher assetFetcher;
  private final QrCodeEncoder qrCodeEncoder;
  private final ImageNormalizer imageNormalizer;
  private final DocxTemplateRenderer templateRenderer;
  private final DateFormatter dateFormatter;
  private final FilenameDeriver filenameDeriver;
  private final DocumentConverter documentConverter;
  private final ArtifactPublisher artifactPublisher;
  private final CertificateProperties properties;

  public CertificateGenerationService(
      AssetFetcher assetFetcher,
      QrCodeEncoder qrCodeEncoder,
      ImageNormalizer imageNormalizer,
      DocxTemplateRenderer templateRenderer,
      DateFormatter dateFormatter,
      FilenameDeriver filenameDeriver,
      DocumentConverter documentConverter,
      ArtifactPublisher artifactPublisher,
      CertificateProperties properties) {
    this.assetFetcher = Objects.requireNonNull(assetFetcher);
    this.qrCodeEncoder = Objects.requireNonNull(qrCodeEncoder);
    this.imageNormalizer = Objects.requireNonNull(imageNormalizer);
    this.templateRenderer = Objects.requireNonNull(templateRenderer);
    this.dateFormatter = Objects.requireNonNull(dateFormatter);
    this.filenameDeriver = Objects.requireNonNull(filenameDeriver);
    this.documentConverter = Objects.requireNonNull(documentConverter);
    this.artifactPublisher = Objects.requireNonNull(artifactPublisher);
    this.properties = Objects.requireNonNull(properties);
  }

  /**
   * Runs the whole pipeline for one request.
   *
   * @param request applicant data and asset keys
   * @param format {@link OutputFormat#DOCX} to publish the rendered document, or the converter's
   *     target format to publish the converted one
   * @return the published artifact's key, or the failure of the first stage that failed
   */
  public StageResult<String> generate(GenerationRequest request, OutputFormat format) {
    String reqId = UUID.randomUUID().toString();
    long t0 = System.nanoTime();
    log.info(
        "certificate.pipeline.start id={} template={} signature={} format={}",
        reqId,
        request.getTemplateKey(),
        request.getSignatureKey(),
        format);

    StageResult<String> result = run(request, format);

    long ms = (System.nanoTime() - t0) / 1_000_000;
    if (result.isSuccess()) {
      log.info(
          "certificate.pipeline.success id={} key={} durationMs={}", reqId, result.getValue(), ms);
    } else {
      PipelineFailure f = result.getFailure();
      log.error(
          "certificate.pipeline.error id={} stage={} kind={} durationMs={} msg={}",
          reqId,
          f.stage(),
          f.kind(),
          ms,
          f.message());
    }
    return result;
  }

  private StageResult<String> run(GenerationRequest request, OutputFormat format) {
    if (format != OutputFormat.DOCX && format != documentConverter.targetFormat()) {
      return StageResult.failure(
          new PipelineFailure(
              "validate", ErrorKind.VALIDATION, "Unsupported output format: " + format));
    }

    // 1) Identity checks and key derivation happen before any external call
    StageResult<String> docxKey = stage("validate", () -> deriveKey(request));
    if (docxKey.isFailure()) return docxKey.propagate();

    // 2) Template
    StageResult<AssetBlob> template =
        stage("fetch-template", () -> assetFetcher.fetch(request.getTemplateKey()));
    if (template.isFailure()) return template.propagate();

    // 3) QR code
    String certNo = request.field(CertificateField.CERTIFICATE_NUMBER);
    StageResult<byte[]> qr = stage("encode-qr", () -> qrCodeEncoder.encode(qrPayload(certNo)));
    if (qr.isFailure()) return qr.propagate();

    // 4) Signature
    StageResult<AssetBlob> signature =
        stage("fetch-signature", () -> assetFetcher.fetch(request.getSignatureKey()));
    if (signature.isFailure()) return signature.propagate();

    CertificateProperties.Signature bounds = properties.getSignature();
    StageResult<byte[]> normalizedSignature =
        stage(
            "normalize-signature",
            () ->
                imageNormalizer.normalize(
                    signature.getValue().getBytes(), bounds.getMaxWidth(), bounds.getMaxHeight()));
    if (normalizedSignature.isFailure()) return normalizedSignature.propagate();

    // 5) Render
    RenderContext context = buildContext(request, qr.getValue(), normalizedSignature.getValue());
    StageResult<byte[]> document =
        stage("render", () -> templateRenderer.render(template.getValue().getBytes(), context));
    if (document.isFailure()) return document.propagate();

    // 6) Optional conversion
    StageResult<OutputArtifact> artifact;
    if (format == OutputFormat.DOCX) {
      artifact =
          StageResult.success(
              new OutputArtifact(docxKey.getValue(), document.getValue(), OutputFormat.DOCX));
    } else {
      artifact =
          stage(
              "convert",
              () ->
                  new OutputArtifact(
                      FilenameDeriver.withExtension(docxKey.getValue(), format),
                      documentConverter.convert(document.getValue()),
                      format));
    }
    if (artifact.isFailure()) return artifact.propagate();

    // 7) Publish
    OutputArtifact out = artifact.getValue();
    StageResult<PublishResult> published =
        stage(
            "publish",
            () -> artifactPublisher.publish(out.getKey(), out.getBytes(), out.contentType()));
    return published.map(PublishResult::getKey);
  }

  // ------------------ Stages ------------------

  private String deriveKey(GenerationRequest request) {
    if (request.field(CertificateField.CERTIFICATE_NUMBER).isBlank()) {
      throw new ValidationException("certificate_number missing");
    }
    String key =
        filenameDeriver.derive(
            request.field(CertificateField.CERTIFICATE_NUMBER),
            request.field(CertificateField.FIRST_NAME),
            request.field(CertificateField.MIDDLE_NAME),
            request.field(CertificateField.LAST_NAME),
            OutputFormat.DOCX);
    if (request.getOutputKey() != null
        && !request.getOutputKey().isBlank()
        && !request.getOutputKey().equals(key)) {
      log.debug(
          "certificate.outputKey ignored requested={} derived={}", request.getOutputKey(), key);
    }
    return key;
  }

  private String qrPayload(String certNo) {
    return properties.getQr().isEmbedVerifyUrl()
        ? VerificationUrls.join(properties.getVerifyBaseUrl(), certNo)
        : certNo;
  }

  private RenderContext buildContext(GenerationRequest request, byte[] qr, byte[] signature) {
    RenderContext.RenderContextBuilder builder = RenderContext.builder();
    for (CertificateField field : CertificateField.values()) {
      String value = request.field(field);
      builder.text(field.key(), field.isDate() ? dateFormatter.toUsDate(value) : value);
    }
    double widthMm = properties.getImageWidthMm();
    return builder
        .image(QR_CODE, new InlineImage(qr, widthMm))
        .image(INSTRUCTOR_SIGNATURE, new InlineImage(signature, widthMm))
        .build();
  }

  /** Runs one stage, turning its exception into a tagged failure. */
  private static <T> StageResult<T> stage(String name, Supplier<T> body) {
    try {
      return StageResult.success(body.get());
    } catch (CertificateException e) {
      return StageResult.failure(new PipelineFailure(name, e.getKind(), e.getMessage()));
    } catch (RuntimeException e) {
      log.error("certificate.stage.unexpected stage={} msg={}", name, e.getMessage(), e);
      return StageResult.failure(
          new PipelineFailure(
              name,
              ErrorKind.INTERNAL,
              e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
    }
  }
}
