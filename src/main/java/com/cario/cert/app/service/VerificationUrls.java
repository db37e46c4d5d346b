package com.cario.cert.app.service;

/** Builds the verification link printed as a QR code on each certificate. */
public final class VerificationUrls {

  private VerificationUrls() {}

  /**
   * Joins base URL and certificate number with exactly one slash, whatever slashes either side
   * already carries: {@code join("https://x/verify/", "/C1")} gives {@code https://x/verify/C1}.
   */
  public static String join(String baseUrl, String certificateNumber) {
    return stripTrailingSlashes(baseUrl) + "/" + stripLeadingSlashes(certificateNumber);
  }

  private static String stripTrailingSlashes(String s) {
    int end = s.length();
    while (end > 0 && s.charAt(end - 1) == '/') end--;
    return s.substring(0, end);
  }

  private static String stripLeadingSlashes(String s) {
    int start = 0;
    while (start < s.length() && s.charAt(start) == '/') start++;
    return s.substring(start);
  }
}
