package com.cario.cert.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the certificate pipeline, bound from the {@code certificate.*} keys of
 * application.yml.
 *
 * <p>{@code verify-base-url} has no default: the application refuses to start without it.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "certificate")
public class CertificateProperties {

  /** Base of the verification link encoded in the QR code, e.g. https://verify.example.com/c. */
  @NotBlank private String verifyBaseUrl;

  /** Folder prepended to every derived artifact key. */
  @NotBlank private String outputPrefix = "certificates/";

  /** Display width of the QR code and the signature in the rendered document. */
  @Positive private double imageWidthMm = 30.0;

  @Valid private Qr qr = new Qr();

  @Valid private Signature signature = new Signature();

  @Valid private Conversion conversion = new Conversion();

  @Valid private Security security = new Security();

  @Valid private Cors cors = new Cors();

  @Data
  public static class Qr {
    /** Encode the full verification URL; when false only the certificate number is encoded. */
    private boolean embedVerifyUrl = true;

    @Positive private int moduleSize = 10;

    private int quietZone = 4;
  }

  @Data
  public static class Signature {
    @Positive private int maxWidth = 800;

    @Positive private int maxHeight = 300;
  }

  @Data
  public static class Conversion {
    /** LibreOffice executable (name on PATH or absolute path). */
    @NotBlank private String executable = "soffice";

    /** Parent of the per-call private working directories; defaults to the JVM temp dir. */
    private Path workDir;

    private Duration timeout = Duration.ofSeconds(120);
  }

  @Data
  public static class Security {
    /** When set, generation endpoints require a matching {@code x-internal-api-key} header. */
    private String internalApiKey;

    public boolean isApiKeyRequired() {
      return internalApiKey != null && !internalApiKey.isBlank();
    }
  }

  @Data
  public static class Cors {
    /** Browser origins allowed to call the API. Empty blocks all cross-origin requests. */
    private List<String> allowedOrigins = new ArrayList<>();
  }
}
