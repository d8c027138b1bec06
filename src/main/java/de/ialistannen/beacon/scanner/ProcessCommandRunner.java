package de.ialistannen.beacon.scanner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs commands as local processes. Output is redirected to files, as scanner reports easily exceed the pipe buffer.
 */
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);
  private static final int MAX_STDERR_LENGTH = 4000;

  @Override
  public CommandResult run(List<String> command, Duration timeout, Path workDirectory)
    throws ToolNotFoundException, CommandTimeoutException, IOException {
    String executable = command.get(0);
    Path stdout = Files.createTempFile(workDirectory, "stdout-", ".log");
    Path stderr = Files.createTempFile(workDirectory, "stderr-", ".log");

    try {
      LOGGER.debug("Running {} with timeout {}s", command, timeout.toSeconds());
      Process process;
      try {
        process = new ProcessBuilder(command)
          .directory(workDirectory.toFile())
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .start();
      } catch (IOException e) {
        throw new ToolNotFoundException(executable, e);
      }

      try {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          process.destroyForcibly();
          throw new CommandTimeoutException(executable, timeout);
        }
      } catch (InterruptedException e) {
        process.destroyForcibly();
        Thread.currentThread().interrupt();
        throw new IOException("Interrupted while waiting for '" + executable + "'", e);
      }

      return new CommandResult(
        process.exitValue(),
        Files.readString(stdout, StandardCharsets.UTF_8),
        truncate(Files.readString(stderr, StandardCharsets.UTF_8))
      );
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }

  private static String truncate(String input) {
    if (input.length() > MAX_STDERR_LENGTH) {
      return input.substring(0, MAX_STDERR_LENGTH);
    }
    return input;
  }
}
