package com.cario.cert.app.service;

import com.cario.cert.app.exception.EncodingException;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.qrcode.decoder.ErrorCorrectionLevel;
import com.google.zxing.qrcode.encoder.ByteMatrix;
import com.google.zxing.qrcode.encoder.Encoder;
import com.google.zxing.qrcode.encoder.QRCode;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;

/**
 * Renders QR codes as PNG images.
 *
 * <p>Error correction level M, {@code moduleSize} pixels per module and a {@code quietZone}-module
 * white border. Output is a pure function of the payload: the same string always yields the same
 * bytes.
 */
@Log4j2
public class QrCodeEncoder {

  private static final Map<EncodeHintType, Object> HINTS =
      Map.of(EncodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());

  private final int moduleSize;
  private final int quietZone;

  public QrCodeEncoder(int moduleSize, int quietZone) {
    if (moduleSize <= 0) throw new IllegalArgumentException("moduleSize must be positive");
    if (quietZone < 0) throw new IllegalArgumentException("quietZone must not be negative");
    this.moduleSize = moduleSize;
    this.quietZone = quietZone;
  }

  /**
   * @throws EncodingException if the payload is blank or too long for a QR code
   */
  public byte[] encode(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new EncodingException("QR payload must not be empty");
    }

    QRCode code;
    try {
      code = Encoder.encode(payload, ErrorCorrectionLevel.M, HINTS);
    } catch (WriterException e) {
      throw new EncodingException("Failed to encode QR payload: " + e.getMessage(), e);
    }

    BufferedImage image = paint(code.getMatrix());
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(image, "png", out);
      log.debug(
          "qr.encode version={} modules={} px={}",
          code.getVersion().getVersionNumber(),
          code.getMatrix().getWidth(),
          image.getWidth());
      return out.toByteArray();
    } catch (IOException e) {
      throw new EncodingException("Failed to write QR image: " + e.getMessage(), e);
    }
  }

  private BufferedImage paint(ByteMatrix matrix) {
    int modules = matrix.getWidth();
    int px = (modules + 2 * quietZone) * moduleSize;

    BufferedImage image = new BufferedImage(px, px, BufferedImage.TYPE_BYTE_GRAY);
    Graphics2D g = image.createGraphics();
    try {
      g.setColor(Color.WHITE);
      g.fillRect(0, 0, px, px);
      g.setColor(Color.BLACK);
      for (int y = 0; y < modules; y++) {
        for (int x = 0; x < modules; x++) {
          if (matrix.get(x, y) == 1) {
            g.fillRect(
                (x + quietZone) * moduleSize, (y + quietZone) * moduleSize, moduleSize, moduleSize);
          }
        }
      }
    } finally {
      g.dispose();
    }
    return image;
  }
}
