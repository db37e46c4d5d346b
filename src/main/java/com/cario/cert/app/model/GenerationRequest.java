package com.cario.cert.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable input of one certificate generation.
 *
 * <ul>
 *   <li>{@code templateKey} – storage key of the docx template
 *   <li>{@code signatureKey} – storage key of the instructor signature image
 *   <li>{@code outputKey} – caller's suggestion; always replaced by the derived key
 *   <li>{@code fields} – applicant data; unknown lookups read as empty strings
 * </ul>
 */
@Getter
@ToString
public final class GenerationRequest {

  private final String templateKey;
  private final String signatureKey;
  private final String outputKey;
  private final Map<String, String> fields;

  @Builder
  private GenerationRequest(
      String templateKey, String signatureKey, String outputKey, Map<String, ?> data) {
    this.templateKey = templateKey;
    this.signatureKey = signatureKey;
    this.outputKey = outputKey;
    this.fields = Collections.unmodifiableMap(stringify(data));
  }

  /** Value of the given field, or {@code ""} when the caller did not supply it. */
  public String field(CertificateField field) {
    return fields.getOrDefault(field.key(), "");
  }

  private static Map<String, String> stringify(Map<String, ?> data) {
    Map<String, String> out = new LinkedHashMap<>();
    if (data == null) {
      return out;
    }
    for (Map.Entry<String, ?> e : data.entrySet()) {
      if (e.getKey() != null) {
        out.put(e.getKey(), Objects.toString(e.getValue(), ""));
      }
    }
    return out;
  }
}
