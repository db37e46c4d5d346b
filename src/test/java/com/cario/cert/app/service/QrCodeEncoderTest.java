package com.cario.cert.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.cert.app.exception.EncodingException;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class QrCodeEncoderTest {

  private final QrCodeEncoder encoder = new QrCodeEncoder(10, 4);

  @Test
  void sameInputGivesSameBytes() {
    String payload = "https://verify.example.com/certificates/CERT-001";
    assertThat(encoder.encode(payload)).isEqualTo(encoder.encode(payload));
  }

  @Test
  void differentInputsGiveDifferentBytes() {
    assertThat(encoder.encode("CERT-001")).isNotEqualTo(encoder.encode("CERT-002"));
  }

  @Test
  void producesDecodablePngWithQuietZone() throws Exception {
    String payload = "https://verify.example.com/certificates/CERT-001";

    BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoder.encode(payload)));

    assertThat(image).isNotNull();
    assertThat(image.getWidth()).isEqualTo(image.getHeight());
    // modules plus a 4-module border on each side, 10 px per module
    assertThat(image.getWidth() % 10).isZero();
    assertThat(image.getRGB(0, 0) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    assertThat(image.getRGB(39, 39) & 0xFFFFFF).isEqualTo(0xFFFFFF);
    assertThat(image.getRGB(40, 40) & 0xFFFFFF).isZero();

    BinaryBitmap bitmap =
        new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
    Result decoded = new QRCodeReader().decode(bitmap);
    assertThat(decoded.getText()).isEqualTo(payload);
  }

  @Test
  void encodesNonAsciiPayload() throws Exception {
    String payload = "Zoë Ångström";
    BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoder.encode(payload)));

    BinaryBitmap bitmap =
        new BinaryBitmap(new HybridBinarizer(new BufferedImageLuminanceSource(image)));
    assertThat(new QRCodeReader().decode(bitmap).getText()).isEqualTo(payload);
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"   "})
  void rejectsBlankPayload(String payload) {
    assertThatThrownBy(() -> encoder.encode(payload))
        .isInstanceOf(EncodingException.class)
        .hasMessageContaining("empty");
  }

  @Test
  void rejectsPayloadTooLongForQrCode() {
    String tooLong = "x".repeat(5000);
    assertThatThrownBy(() -> encoder.encode(tooLong)).isInstanceOf(EncodingException.class);
  }
}
