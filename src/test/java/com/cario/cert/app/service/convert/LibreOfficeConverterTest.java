package com.cario.cert.app.service.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cario.cert.app.exception.ConversionOutputMissingException;
import com.cario.cert.app.exception.ConversionProcessException;
import com.cario.cert.app.model.OutputFormat;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Runs the converter against small shell scripts standing in for soffice. */
@DisabledOnOs(OS.WINDOWS)
class LibreOfficeConverterTest {

  private static final byte[] DOCX = "PK fake docx".getBytes(StandardCharsets.UTF_8);

  @TempDir Path tmp;

  private Path workRoot;

  @BeforeEach
  void setUp() {
    workRoot = tmp.resolve("work");
  }

  @Test
  void returnsPdfWrittenToOutdir() throws IOException {
    Path exe =
        script(
            "out=''",
            "while [ $# -gt 0 ]; do",
            "  if [ \"$1\" = \"--outdir\" ]; then out=\"$2\"; shift; fi",
            "  shift",
            "done",
            "printf '%%PDF-1.4 converted' > \"$out/document.pdf\"",
            "echo 'convert document.docx -> document.pdf'");

    byte[] pdf = converter(exe, Duration.ofSeconds(20)).convert(DOCX);

    assertThat(new String(pdf, StandardCharsets.US_ASCII)).isEqualTo("%PDF-1.4 converted");
    assertWorkRootEmpty();
  }

  @Test
  void nonZeroExitIncludesProcessOutput() throws IOException {
    Path exe = script("echo 'Error: source file could not be loaded' >&2", "exit 1");

    assertThatThrownBy(() -> converter(exe, Duration.ofSeconds(20)).convert(DOCX))
        .isInstanceOf(ConversionProcessException.class)
        .hasMessageContaining("exited with code 1")
        .hasMessageContaining("source file could not be loaded");
    assertWorkRootEmpty();
  }

  @Test
  void successWithoutOutputFileIsReported() throws IOException {
    Path exe = script("exit 0");

    assertThatThrownBy(() -> converter(exe, Duration.ofSeconds(20)).convert(DOCX))
        .isInstanceOf(ConversionOutputMissingException.class)
        .hasMessageContaining("document.pdf");
    assertWorkRootEmpty();
  }

  @Test
  void hungProcessIsKilledAfterTimeout() throws IOException {
    Path exe = script("exec sleep 30");

    long t0 = System.nanoTime();
    assertThatThrownBy(() -> converter(exe, Duration.ofMillis(300)).convert(DOCX))
        .isInstanceOf(ConversionProcessException.class)
        .hasMessageContaining("timed out");
    assertThat(Duration.ofNanos(System.nanoTime() - t0)).isLessThan(Duration.ofSeconds(15));
    assertWorkRootEmpty();
  }

  @Test
  void timeoutAlsoKillsBackgroundChildren() throws Exception {
    Path pidFile = tmp.resolve("child.pid");
    Path exe = script("sleep 30 &", "echo $! > '" + pidFile + "'", "wait");

    assertThatThrownBy(() -> converter(exe, Duration.ofMillis(500)).convert(DOCX))
        .isInstanceOf(ConversionProcessException.class)
        .hasMessageContaining("timed out");

    long childPid = Long.parseLong(Files.readString(pidFile).trim());
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    while (running(childPid) && System.nanoTime() < deadline) {
      Thread.sleep(50);
    }
    assertThat(running(childPid)).as("background child %d", childPid).isFalse();
    assertWorkRootEmpty();
  }

  @Test
  void missingExecutableFailsToStart() throws IOException {
    Path exe = tmp.resolve("no-such-soffice");

    assertThatThrownBy(() -> converter(exe, Duration.ofSeconds(5)).convert(DOCX))
        .isInstanceOf(ConversionProcessException.class)
        .hasMessageContaining("Failed to start");
    assertWorkRootEmpty();
  }

  @Test
  void commandIsolatesProfileAndOutput() {
    LibreOfficeConverter converter =
        new LibreOfficeConverter("soffice", workRoot, Duration.ofSeconds(5));
    Path dir = Path.of("/tmp/cert-convert-1");

    assertThat(
            converter.command(
                dir.resolve("document.docx"), dir.resolve("out"), dir.resolve("profile")))
        .startsWith("soffice", "--headless")
        .contains("--norestore", "--nolockcheck", "--convert-to", "pdf")
        .contains("-env:UserInstallation=" + dir.resolve("profile").toUri())
        .containsSequence("--outdir", dir.resolve("out").toString())
        .endsWith(dir.resolve("document.docx").toString());
    assertThat(converter.targetFormat()).isEqualTo(OutputFormat.PDF);
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThatThrownBy(() -> new LibreOfficeConverter("soffice", workRoot, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  // ------------------ Helpers ------------------

  private LibreOfficeConverter converter(Path exe, Duration timeout) {
    return new LibreOfficeConverter(exe.toString(), workRoot, timeout);
  }

  private Path script(String... lines) throws IOException {
    Path exe = tmp.resolve("fake-soffice-" + System.nanoTime() + ".sh");
    Files.writeString(exe, "#!/bin/sh\n" + String.join("\n", lines) + "\n");
    assertThat(exe.toFile().setExecutable(true)).isTrue();
    return exe;
  }

  /** A zombie waiting for its new parent to reap it counts as dead. */
  private static boolean running(long pid) {
    Path stat = Path.of("/proc", Long.toString(pid), "stat");
    if (Files.isReadable(stat)) {
      String line;
      try {
        line = Files.readString(stat);
      } catch (IOException e) {
        return false; // exited between the check and the read
      }
      return line.charAt(line.lastIndexOf(')') + 2) != 'Z';
    }
    return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
  }

  private void assertWorkRootEmpty() throws IOException {
    if (!Files.exists(workRoot)) {
      return;
    }
    try (Stream<Path> left = Files.list(workRoot)) {
      assertThat(left).isEmpty();
    }
  }
}
