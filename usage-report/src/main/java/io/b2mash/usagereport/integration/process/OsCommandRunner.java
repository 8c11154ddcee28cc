package io.b2mash.usagereport.integration.process;

import io.b2mash.usagereport.config.UsageReportProperties;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs short-lived external commands (directory and accounting queries) and captures their output.
 *
 * <p>Output goes to temporary files. A command still running after {@code
 * usage-report.command-timeout} is killed. A non-zero exit code is not an error at this level;
 * callers decide what it means.
 */
@Component
public class OsCommandRunner {

  private static final Logger log = LoggerFactory.getLogger(OsCommandRunner.class);

  private final Duration timeout;

  public OsCommandRunner(UsageReportProperties properties) {
    this.timeout = properties.commandTimeout();
  }

  public CommandOutput run(List<String> command) throws CommandExecutionException {
    Path stdoutFile = null;
    Path stderrFile = null;
    try {
      stdoutFile = createTempFile(".out");
      stderrFile = createTempFile(".err");

      log.debug("Running command: {}", command);
      Process process;
      try {
        process =
            new ProcessBuilder(command)
                .redirectOutput(stdoutFile.toFile())
                .redirectError(stderrFile.toFile())
                .start();
      } catch (IOException e) {
        throw new CommandExecutionException("Error launching " + command.get(0), e);
      }

      if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
        process.destroyForcibly();
        throw new CommandExecutionException(
            "Command timed out after " + timeout.toSeconds() + "s: " + command.get(0));
      }

      var stdout = readOutput(stdoutFile, command).lines().toList();
      var stderr = readOutput(stderrFile, command).strip();
      return new CommandOutput(process.exitValue(), stdout, stderr);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CommandExecutionException("Interrupted while running " + command.get(0), e);
    } finally {
      deleteQuietly(stdoutFile);
      deleteQuietly(stderrFile);
    }
  }

  /**
   * Decodes captured output as UTF-8. Malformed bytes, such as Latin-1 text in a directory comment
   * field, become U+FFFD instead of failing the whole command.
   */
  static String decode(byte[] output) {
    try {
      return StandardCharsets.UTF_8
          .newDecoder()
          .onMalformedInput(CodingErrorAction.REPLACE)
          .onUnmappableCharacter(CodingErrorAction.REPLACE)
          .decode(ByteBuffer.wrap(output))
          .toString();
    } catch (CharacterCodingException e) {
      // unreachable with REPLACE
      throw new IllegalStateException(e);
    }
  }

  private static String readOutput(Path file, List<String> command)
      throws CommandExecutionException {
    try {
      return decode(Files.readAllBytes(file));
    } catch (IOException e) {
      throw new CommandExecutionException("Error reading output of " + command.get(0), e);
    }
  }

  private static Path createTempFile(String suffix) throws CommandExecutionException {
    try {
      return Files.createTempFile("usage-report-cmd", suffix);
    } catch (IOException e) {
      throw new CommandExecutionException("Cannot create temporary command output file", e);
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.debug("Could not delete temporary command output {}", file, e);
    }
  }
}
