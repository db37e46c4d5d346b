package com.cario.cert.app.service;

import com.cario.cert.app.exception.InvalidIdentityException;
import com.cario.cert.app.model.OutputFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import org.apache.commons.io.FilenameUtils;

/**
 * Builds the storage key of a certificate from the applicant's identity.
 *
 * <p>Key layout: {@code <prefix>{certNo}_{first}[_{middle}]_{last}.<ext>}. The derived key is
 * authoritative; callers cannot choose their own.
 */
public class FilenameDeriver {

  // Unicode-aware, so no-break and ideographic spaces count as whitespace too.
  private static final Pattern EDGE_WHITESPACE =
      Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern WHITESPACE =
      Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");

  private final String prefix;

  public FilenameDeriver(String prefix) {
    String p = prefix == null ? "" : prefix;
    if (!p.isEmpty() && !p.endsWith("/")) p = p + "/";
    this.prefix = p;
  }

  /**
   * Makes a free-text value safe for use in a file name: trims, turns whitespace runs into a
   * single underscore and drops every character outside {@code [A-Za-z0-9_]}.
   */
  public static String sanitize(String value) {
    if (value == null) return "";
    String trimmed = EDGE_WHITESPACE.matcher(value).replaceAll("");
    String s = WHITESPACE.matcher(trimmed).replaceAll("_");
    return UNSAFE.matcher(s).replaceAll("");
  }

  /**
   * @throws InvalidIdentityException if certificate number, first or last name sanitize to empty
   */
  public String derive(
      String certNo, String first, String middle, String last, OutputFormat format) {
    String c = sanitize(certNo);
    String f = sanitize(first);
    String m = sanitize(middle);
    String l = sanitize(last);

    if (c.isEmpty() || f.isEmpty() || l.isEmpty()) {
      throw new InvalidIdentityException(
          "certificate_number, first_name and last_name are required");
    }

    List<String> parts = new ArrayList<>(4);
    parts.add(c);
    parts.add(f);
    if (!m.isEmpty()) {
      parts.add(m);
    }
    parts.add(l);

    return prefix + String.join("_", parts) + "." + format.extension();
  }

  /** Replaces the extension of {@code key}, e.g. {@code a/b.docx} to {@code a/b.pdf}. */
  public static String withExtension(String key, OutputFormat format) {
    return FilenameUtils.removeExtension(key) + "." + format.extension();
  }
}
