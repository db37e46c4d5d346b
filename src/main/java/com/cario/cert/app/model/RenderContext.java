package com.cario.cert.app.model;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

/**
 * Placeholder bindings for a single render call: literal text and inline images.
 *
 * <p>Built per request and discarded once the document has been rendered.
 */
@Builder
@Getter
@ToString(exclude = "images")
public final class RenderContext {

  @Singular private final Map<String, String> texts;
  @Singular private final Map<String, InlineImage> images;

  public Optional<InlineImage> image(String name) {
    return Optional.ofNullable(images.get(name));
  }

  /** Text bound to {@code name}; unbound names render as an empty string. */
  public String text(String name) {
    return texts.getOrDefault(name, "");
  }
}
