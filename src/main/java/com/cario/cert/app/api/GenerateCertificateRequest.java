package com.cario.cert.app.api;

import com.cario.cert.app.model.GenerationRequest;
import jakarta.validation.constraints.NotBlank;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;

/**
 * JSON body of {@code POST /generate-docx} and {@code POST /generate-pdf}.
 *
 * <pre>
 * {
 *   "templateKey": "templates/cpr.docx",
 *   "signatureKey": "signatures/instructor-7.png",
 *   "outputKey": "ignored/any.docx",
 *   "data": { "certificate_number": "CERT-001", "first_name": "Jane", "last_name": "Doe" }
 * }
 * </pre>
 */
@Data
public class GenerateCertificateRequest {

  @NotBlank private String templateKey;

  @NotBlank private String signatureKey;

  /** Accepted for compatibility; the stored key is always derived from the applicant data. */
  private String outputKey;

  private Map<String, Object> data = new HashMap<>();

  public GenerationRequest toGenerationRequest() {
    return GenerationRequest.builder()
        .templateKey(templateKey)
        .signatureKey(signatureKey)
        .outputKey(outputKey)
        .data(data)
        .build();
  }
}
