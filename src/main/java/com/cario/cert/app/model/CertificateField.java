package com.cario.cert.app.model;

/** Applicant fields recognised in the request {@code data} map and bound into the template. */
public enum CertificateField {
  FIRST_NAME("first_name", false),
  MIDDLE_NAME("middle_name", false),
  LAST_NAME("last_name", false),
  TRAINING_DATE("training_date", true),
  ISSUE_DATE("issue_date", true),
  CERTIFICATE_NUMBER("certificate_number", false),
  INSTRUCTOR_NAME("instructor_name", false);

  private final String key;
  private final boolean date;

  CertificateField(String key, boolean date) {
    this.key = key;
    this.date = date;
  }

  /** Name used both in the request payload and as the template placeholder. */
  public String key() {
    return key;
  }

  /** Date fields are rendered as {@code MM/DD/YYYY}. */
  public boolean isDate() {
    return date;
  }
}
