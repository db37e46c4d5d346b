package com.cario.cert.app.service;

import com.cario.cert.app.exception.TemplateRenderException;
import com.cario.cert.app.model.InlineImage;
import com.cario.cert.app.model.RenderContext;
import com.deepoove.poi.XWPFTemplate;
import com.deepoove.poi.config.Configure;
import com.deepoove.poi.config.ConfigureBuilder;
import com.deepoove.poi.data.PictureRenderData;
import com.deepoove.poi.data.PictureType;
import com.deepoove.poi.data.Pictures;
import com.deepoove.poi.policy.PictureRenderPolicy;
import com.deepoove.poi.policy.RenderPolicy;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import lombok.extern.log4j.Log4j2;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;

/**
 * Fills {@code {{ name }}} placeholders of a docx template with poi-tl.
 *
 * <p>poi-tl finds placeholders in body paragraphs, tables, headers and footers, also when Word
 * split one over several runs, and the filled text keeps the formatting of the first of them.
 *
 * <ul>
 *   <li>names bound to an {@link InlineImage} become inline pictures of the requested width
 *   <li>every other name is replaced by its text binding, or by nothing when unbound
 * </ul>
 *
 * Only plain names are supported; any other {@code {{ ... }}} expression is rejected.
 */
@Log4j2
public class DocxTemplateRenderer {

  private static final String TAG_NAME = "\\s*[A-Za-z_][A-Za-z0-9_]*\\s*";
  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{" + TAG_NAME + "\\}\\}");

  private static final double PX_PER_MM = 96 / 25.4;

  private static final RenderPolicy PICTURE_POLICY = new PictureRenderPolicy();

  /**
   * @param template docx bytes
   * @param context bindings for this render
   * @return the rendered docx
   * @throws TemplateRenderException if the template cannot be read or a placeholder cannot be bound
   */
  public byte[] render(byte[] template, RenderContext context) {
    if (template == null || template.length == 0) {
      throw new TemplateRenderException("Template is empty");
    }

    Map<String, Object> model = new HashMap<>(context.getTexts());
    ConfigureBuilder config = Configure.builder().buildGrammerRegex(TAG_NAME);
    context
        .getImages()
        .forEach(
            (name, image) -> {
              model.put(name, picture(name, image));
              config.bind(name, PICTURE_POLICY);
            });

    try (XWPFTemplate doc =
        XWPFTemplate.compile(new ByteArrayInputStream(template), config.build())) {
      checkPlaceholders(doc.getXWPFDocument());
      int tags = doc.getElementTemplates().size();
      doc.render(model);

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      doc.write(out);
      log.info(
          "template.render ok tags={} images={} size={}",
          tags,
          context.getImages().size(),
          out.size());
      return out.toByteArray();

    } catch (TemplateRenderException e) {
      throw e;
    } catch (IOException | RuntimeException e) {
      // poi-tl and POI report non-zip / non-docx input with unchecked exceptions
      throw new TemplateRenderException("Failed to render template: " + e.getMessage(), e);
    }
  }

  /** poi-tl leaves text it cannot parse as a tag alone; such leftovers fail the render. */
  private static void checkPlaceholders(XWPFDocument doc) throws IOException {
    try (XWPFWordExtractor extractor = new XWPFWordExtractor(doc)) {
      extractor.setCloseFilesystem(false);
      for (String line : extractor.getText().split("\n")) {
        if (PLACEHOLDER.matcher(line).replaceAll("").contains("{{")) {
          throw new TemplateRenderException(
              "Malformed placeholder in template text: " + abbreviate(line.strip()));
        }
      }
    }
  }

  private static PictureRenderData picture(String name, InlineImage image) {
    PictureInfo info = inspect(name, image.getBytes());
    int width = (int) Math.max(1, Math.round(image.getWidthMm() * PX_PER_MM));
    int height = (int) Math.max(1, Math.round((double) width * info.height() / info.width()));
    return Pictures.ofBytes(image.getBytes(), info.type()).size(width, height).create();
  }

  // ------------------ Helpers ------------------

  private record PictureInfo(PictureType type, int width, int height) {}

  private static PictureInfo inspect(String name, byte[] bytes) {
    if (bytes == null || bytes.length == 0) {
      throw new TemplateRenderException("Placeholder '" + name + "' is bound to an empty image");
    }
    try (ImageInputStream in = ImageIO.createImageInputStream(new ByteArrayInputStream(bytes))) {
      Iterator<ImageReader> readers = in == null ? null : ImageIO.getImageReaders(in);
      if (readers == null || !readers.hasNext()) {
        throw new TemplateRenderException("Placeholder '" + name + "' is bound to non-image data");
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(in);
        String format = reader.getFormatName().toLowerCase(Locale.ROOT);
        return new PictureInfo(pictureType(name, format), reader.getWidth(0), reader.getHeight(0));
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      throw new TemplateRenderException(
          "Placeholder '" + name + "' is bound to unreadable image data", e);
    }
  }

  private static PictureType pictureType(String name, String format) {
    switch (format) {
      case "png":
        return PictureType.PNG;
      case "jpeg":
      case "jpg":
        return PictureType.JPEG;
      case "gif":
        return PictureType.GIF;
      case "bmp":
        return PictureType.BMP;
      default:
        throw new TemplateRenderException(
            "Placeholder '" + name + "' is bound to an unsupported image format: " + format);
    }
  }

  private static String abbreviate(String text) {
    return text.length() > 80 ? text.substring(0, 80) + "..." : text;
  }
}
