package com.cario.cert.app.service.convert;

import com.cario.cert.app.exception.ConversionOutputMissingException;
import com.cario.cert.app.exception.ConversionProcessException;
import com.cario.cert.app.model.OutputFormat;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FileUtils;

/**
 * Converts docx to PDF with {@code soffice --headless --convert-to pdf}.
 *
 * <p>Every call runs in its own temporary directory holding the input, the output and a private
 * LibreOffice user profile. Concurrent conversions therefore never share profile lock files, and
 * the directory is deleted whether the process succeeds, fails or times out.
 */
@Log4j2
public class LibreOfficeConverter implements DocumentConverter {

  private static final String INPUT_NAME = "document.docx";
  private static final String OUTPUT_NAME = "document.pdf";
  private static final String LOG_NAME = "soffice.log";
  private static final int LOG_TAIL_CHARS = 2000;
  private static final Duration KILL_WAIT = Duration.ofSeconds(5);

  private final String executable;
  private final Path workRoot;
  private final Duration timeout;

  public LibreOfficeConverter(String executable, Path workRoot, Duration timeout) {
    this.executable = Objects.requireNonNull(executable, "executable must not be null");
    this.workRoot = Objects.requireNonNull(workRoot, "workRoot must not be null");
    this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive: " + timeout);
    }
  }

  @Override
  public OutputFormat targetFormat() {
    return OutputFormat.PDF;
  }

  @Override
  public byte[] convert(byte[] docx) {
    long t0 = System.nanoTime();
    Path workDir = createWorkDir();
    try {
      Path input = workDir.resolve(INPUT_NAME);
      Path outDir = Files.createDirectory(workDir.resolve("out"));
      Path profileDir = Files.createDirectory(workDir.resolve("profile"));
      Path logFile = workDir.resolve(LOG_NAME);
      Files.write(input, docx);

      int exit = run(command(input, outDir, profileDir), logFile);
      if (exit != 0) {
        throw new ConversionProcessException(
            "LibreOffice exited with code " + exit + ": " + tail(logFile));
      }

      Path output = outDir.resolve(OUTPUT_NAME);
      if (!Files.isRegularFile(output) || Files.size(output) == 0) {
        throw new ConversionOutputMissingException(
            "LibreOffice reported success but produced no " + OUTPUT_NAME + ": " + tail(logFile));
      }

      byte[] pdf = Files.readAllBytes(output);
      log.info(
          "convert.ok executable={} inputSize={} outputSize={} durationMs={}",
          executable,
          docx.length,
          pdf.length,
          (System.nanoTime() - t0) / 1_000_000);
      return pdf;

    } catch (IOException e) {
      throw new ConversionProcessException("Conversion I/O failure: " + e.getMessage(), e);
    } finally {
      deleteWorkDir(workDir);
    }
  }

  /** Command line for one conversion; every path points into the private directory. */
  List<String> command(Path input, Path outDir, Path profileDir) {
    return List.of(
        executable,
        "--headless",
        "--invisible",
        "--nologo",
        "--nodefault",
        "--norestore",
        "--nolockcheck",
        "--nofirststartwizard",
        "-env:UserInstallation=" + profileDir.toUri(),
        "--convert-to",
        "pdf",
        "--outdir",
        outDir.toString(),
        input.toString());
  }

  // ------------------ Helpers ------------------

  private int run(List<String> command, Path logFile) {
    Process process;
    try {
      process =
          new ProcessBuilder(command)
              .directory(logFile.getParent().toFile())
              .redirectErrorStream(true)
              .redirectOutput(logFile.toFile())
              .start();
    } catch (IOException e) {
      throw new ConversionProcessException(
          "Failed to start converter '" + executable + "': " + e.getMessage(), e);
    }

    try {
      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        killTree(process);
        log.error("convert.timeout executable={} timeout={}", executable, timeout);
        throw new ConversionProcessException("LibreOffice timed out after " + timeout);
      }
      return process.exitValue();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      killTree(process);
      throw new ConversionProcessException("Interrupted while waiting for LibreOffice", e);
    }
  }

  /** The soffice launcher starts oosplash and soffice.bin, so the whole tree is killed. */
  private void killTree(Process process) {
    List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
    descendants.forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();

    CompletableFuture<?>[] exits =
        Stream.concat(Stream.of(process.toHandle()), descendants.stream())
            .map(ProcessHandle::onExit)
            .toArray(CompletableFuture[]::new);
    try {
      CompletableFuture.allOf(exits).get(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("convert.kill interrupted executable={} pid={}", executable, process.pid());
    } catch (ExecutionException | TimeoutException e) {
      log.warn(
          "convert.kill incomplete executable={} pid={} descendants={}",
          executable,
          process.pid(),
          descendants.size());
    }
  }

  private Path createWorkDir() {
    try {
      Files.createDirectories(workRoot);
      return Files.createTempDirectory(workRoot, "cert-convert-");
    } catch (IOException e) {
      throw new ConversionProcessException(
          "Failed to create conversion directory under " + workRoot + ": " + e.getMessage(), e);
    }
  }

  private static void deleteWorkDir(Path workDir) {
    try {
      FileUtils.deleteDirectory(workDir.toFile());
    } catch (IOException e) {
      log.warn("convert.cleanup failed dir={} msg={}", workDir, e.getMessage(), e);
    }
  }

  private static String tail(Path logFile) {
    File file = logFile.toFile();
    if (!file.isFile()) return "(no output)";
    try {
      String text = FileUtils.readFileToString(file, StandardCharsets.UTF_8).strip();
      if (text.isEmpty()) return "(no output)";
      return text.length() > LOG_TAIL_CHARS
          ? text.substring(text.length() - LOG_TAIL_CHARS)
          : text;
    } catch (IOException e) {
      return "(output unreadable: " + e.getMessage() + ")";
    }
  }
}
