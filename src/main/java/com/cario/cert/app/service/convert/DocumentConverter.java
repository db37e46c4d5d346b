package com.cario.cert.app.service.convert;

import com.cario.cert.app.model.OutputFormat;

/**
 * Strategy interface for transcoding a rendered docx into a fixed-layout format.
 *
 * <p>Implementations:
 *
 * <ul>
 *   <li>{@link LibreOfficeConverter} - headless LibreOffice in an isolated process (default)
 * </ul>
 */
public interface DocumentConverter {

  /**
   * Converts a Word document (.docx).
   *
   * @param docx the document content
   * @return the converted document
   * @throws com.cario.cert.app.exception.ConversionProcessException if the converter fails or
   *     times out
   * @throws com.cario.cert.app.exception.ConversionOutputMissingException if it reports success
   *     but produces nothing
   */
  byte[] convert(byte[] docx);

  /** Format produced by {@link #convert(byte[])}. */
  OutputFormat targetFormat();
}
