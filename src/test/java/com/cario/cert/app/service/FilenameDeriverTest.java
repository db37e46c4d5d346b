package com.cario.cert.app.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.cert.app.exception.InvalidIdentityException;
import com.cario.cert.app.model.OutputFormat;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class FilenameDeriverTest {

  private final FilenameDeriver deriver = new FilenameDeriver("certificates/");

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "Jane|Jane",
        "'  Jane  '|Jane",
        "Mary  Ann|Mary_Ann",
        "'O''Brien'|OBrien",
        "José|Jos",
        "CERT-001|CERT001",
        "'a \t b'|a_b",
        "'Mary\u00A0Ann'|Mary_Ann",
        "'Mary\u2003Ann'|Mary_Ann",
        "'Mary\u3000Ann'|Mary_Ann",
        "'Ann\u00A0'|Ann",
        "'\u00A0\u00A0Ann'|Ann",
        "__x__|__x__",
        "'!!!'|''"
      })
  void sanitizeTrimsCollapsesWhitespaceAndStripsUnsafeCharacters(String input, String expected) {
    assertThat(FilenameDeriver.sanitize(input)).isEqualTo(expected);
  }

  @Test
  void sanitizeIsIdempotent() {
    List<String> inputs =
        List.of("  Mary  Ann ", "O'Brien-Smith", "a\tb\nc", "", "___", "Ünïcødé");
    for (String s : inputs) {
      String once = FilenameDeriver.sanitize(s);
      assertThat(FilenameDeriver.sanitize(once)).isEqualTo(once);
    }
  }

  @Test
  void sanitizeTreatsNullAsEmpty() {
    assertThat(FilenameDeriver.sanitize(null)).isEmpty();
  }

  @Test
  void derivesKeyWithoutMiddleName() {
    assertThat(deriver.derive("CERT-001", "Jane", "", "Doe", OutputFormat.DOCX))
        .isEqualTo("certificates/CERT001_Jane_Doe.docx");
  }

  @Test
  void derivesKeyWithMiddleName() {
    assertThat(deriver.derive("C42", " Jane ", "Mary Ann", "Doe", OutputFormat.DOCX))
        .isEqualTo("certificates/C42_Jane_Mary_Ann_Doe.docx");
  }

  @Test
  @DisplayName("middle name that sanitizes to nothing leaves no stray separator")
  void omitsMiddleNameThatSanitizesToEmpty() {
    assertThat(deriver.derive("C42", "Jane", " ?! ", "Doe", OutputFormat.DOCX))
        .isEqualTo("certificates/C42_Jane_Doe.docx");
  }

  @Test
  void usesPdfExtensionForPdfFormat() {
    assertThat(deriver.derive("C42", "Jane", null, "Doe", OutputFormat.PDF))
        .isEqualTo("certificates/C42_Jane_Doe.pdf");
  }

  @Test
  void rejectsEmptyIdentityParts() {
    assertThatThrownBy(() -> deriver.derive("", "Jane", "", "Doe", OutputFormat.DOCX))
        .isInstanceOf(InvalidIdentityException.class)
        .hasMessage("certificate_number, first_name and last_name are required");
    assertThatThrownBy(() -> deriver.derive("C1", "***", "", "Doe", OutputFormat.DOCX))
        .isInstanceOf(InvalidIdentityException.class);
    assertThatThrownBy(() -> deriver.derive("C1", "Jane", "Mid", "  ", OutputFormat.DOCX))
        .isInstanceOf(InvalidIdentityException.class);
  }

  @Test
  void normalizesPrefixSlash() {
    FilenameDeriver bare = new FilenameDeriver("issued");
    assertThat(bare.derive("C1", "A", "", "B", OutputFormat.DOCX)).isEqualTo("issued/C1_A_B.docx");
  }

  @Test
  void rewritesExtension() {
    assertThat(FilenameDeriver.withExtension("certificates/C1_A_B.docx", OutputFormat.PDF))
        .isEqualTo("certificates/C1_A_B.pdf");
  }
}
