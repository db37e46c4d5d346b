package com.cario.cert.app.api;

import com.cario.cert.app.model.ErrorKind;
import com.cario.cert.app.model.OutputFormat;
import com.cario.cert.app.model.PipelineFailure;
import com.cario.cert.app.model.StageResult;
import com.cario.cert.app.service.CertificateGenerationService;
import jakarta.validation.Valid;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Log4j2
@RestController
@RequiredArgsConstructor
public class CertificateController {

  private final CertificateGenerationService generationService;

  // ------------------------------------------------------------
  // /health
  // ------------------------------------------------------------
  @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, String> health() {
    return Map.of("status", "ok");
  }

  // ------------------------------------------------------------
  // /generate-docx
  // ------------------------------------------------------------
  @PostMapping(
      path = "/generate-docx",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> generateDocx(@RequestBody @Valid GenerateCertificateRequest req) {
    log.info(
        "certificate.generate-docx template={} signature={}",
        req.getTemplateKey(),
        req.getSignatureKey());
    return respond(generationService.generate(req.toGenerationRequest(), OutputFormat.DOCX));
  }

  // ------------------------------------------------------------
  // /generate-pdf
  // ------------------------------------------------------------
  @PostMapping(
      path = "/generate-pdf",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<?> generatePdf(@RequestBody @Valid GenerateCertificateRequest req) {
    log.info(
        "certificate.generate-pdf template={} signature={}",
        req.getTemplateKey(),
        req.getSignatureKey());
    return respond(generationService.generate(req.toGenerationRequest(), OutputFormat.PDF));
  }

  // ============================================================
  // Helpers
  // ============================================================
  private static ResponseEntity<?> respond(StageResult<String> result) {
    if (result.isSuccess()) {
      return ResponseEntity.ok(Map.of("key", result.getValue()));
    }
    PipelineFailure failure = result.getFailure();
    return ResponseEntity.status(statusFor(failure.kind()))
        .body(new ErrorDetail(failure.message()));
  }

  static HttpStatus statusFor(ErrorKind kind) {
    return kind.isClientError() ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
  }
}
