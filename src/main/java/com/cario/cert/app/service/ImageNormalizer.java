package com.cario.cert.app.service;

import com.cario.cert.app.exception.UnsupportedImageFormatException;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import lombok.extern.log4j.Log4j2;

/**
 * Prepares uploaded signature images for embedding: decodes any format ImageIO can read, converts
 * to ARGB, shrinks to fit a bounding box and re-encodes as PNG.
 */
@Log4j2
public class ImageNormalizer {

  /**
   * @param raw encoded image (PNG, JPEG, GIF, BMP, ...)
   * @param maxWidth bounding box width in pixels
   * @param maxHeight bounding box height in pixels
   * @return PNG bytes with an alpha channel, never larger than the bounding box
   * @throws UnsupportedImageFormatException if {@code raw} cannot be decoded
   */
  public byte[] normalize(byte[] raw, int maxWidth, int maxHeight) {
    if (maxWidth <= 0 || maxHeight <= 0) {
      throw new IllegalArgumentException("bounds must be positive: " + maxWidth + "x" + maxHeight);
    }

    BufferedImage source = decode(raw);
    Dimension target = fit(source.getWidth(), source.getHeight(), maxWidth, maxHeight);

    // 1) Halve while at least twice the target, then one final draw into ARGB
    BufferedImage argb = source;
    int w = source.getWidth();
    int h = source.getHeight();
    while (w / 2 >= target.width && h / 2 >= target.height) {
      w /= 2;
      h /= 2;
      argb = draw(argb, w, h);
    }
    argb = draw(argb, target.width, target.height);

    // 2) Lossless re-encode
    try {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      ImageIO.write(argb, "png", out);
      log.debug(
          "image.normalize source={}x{} target={}x{}",
          source.getWidth(),
          source.getHeight(),
          target.width,
          target.height);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UnsupportedImageFormatException("Failed to encode image as PNG", e);
    }
  }

  /** Bicubic redraw into a new ARGB image; a single step only samples, so big shrinks alias. */
  private static BufferedImage draw(BufferedImage source, int width, int height) {
    BufferedImage argb = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    Graphics2D g = argb.createGraphics();
    try {
      g.setRenderingHint(
          RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
      g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
      g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
      g.drawImage(source, 0, 0, width, height, null);
    } finally {
      g.dispose();
    }
    return argb;
  }

  /**
   * Largest size with the source's aspect ratio that fits the box. Sources that already fit are
   * left as they are.
   */
  static Dimension fit(int width, int height, int maxWidth, int maxHeight) {
    double ratio = Math.min((double) maxWidth / width, (double) maxHeight / height);
    if (ratio >= 1.0) {
      return new Dimension(width, height);
    }
    int w = (int) Math.max(1, Math.min(maxWidth, Math.round(width * ratio)));
    int h = (int) Math.max(1, Math.min(maxHeight, Math.round(height * ratio)));
    return new Dimension(w, h);
  }

  private static BufferedImage decode(byte[] raw) {
    if (raw == null || raw.length == 0) {
      throw new UnsupportedImageFormatException("Image is empty");
    }
    try {
      BufferedImage image = ImageIO.read(new ByteArrayInputStream(raw));
      if (image == null) {
        throw new UnsupportedImageFormatException("Unsupported or unrecognised image format");
      }
      return image;
    } catch (IOException e) {
      throw new UnsupportedImageFormatException("Failed to decode image: " + e.getMessage(), e);
    }
  }
}
