package de.ialistannen.beacon.scanner;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.AdapterFailure.MalformedOutput;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolNonZeroExit;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolNotInstalled;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolTimeout;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import de.ialistannen.beacon.scanner.output.ScanResult;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for adapters running a command line tool that prints a JSON report to stdout.
 */
public abstract class SubprocessScannerAdapter implements ScannerAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubprocessScannerAdapter.class);

  protected final CommandRunner commandRunner;
  protected final String executable;

  protected SubprocessScannerAdapter(CommandRunner commandRunner, String executable) {
    this.commandRunner = commandRunner;
    this.executable = executable;
  }

  /**
   * @param reference the image to scan
   * @return the full command line
   */
  protected abstract List<String> command(ImageReference reference);

  /**
   * Decodes and validates the tool output.
   *
   * @param stdout the standard output of the tool
   * @return the decoded result
   * @throws MalformedOutputException if the output does not match the expected schema
   */
  protected abstract ScanResult parse(String stdout) throws MalformedOutputException;

  @Override
  public AdapterOutcome analyze(ImageReference reference, Duration timeout, ScanWorkspace workspace) {
    if (timeout.isZero() || timeout.isNegative()) {
      return new ToolTimeout(toolName(), timeout);
    }

    CommandResult result;
    try {
      result = commandRunner.run(command(reference), timeout, workspace.directory());
    } catch (ToolNotFoundException e) {
      LOGGER.warn("{} is not installed, skipping it for {}", toolName(), reference);
      return new ToolNotInstalled(toolName(), e.getMessage());
    } catch (CommandTimeoutException e) {
      LOGGER.warn("{} timed out for {}", toolName(), reference);
      return new ToolTimeout(toolName(), timeout);
    } catch (IOException e) {
      LOGGER.warn("Running {} for {} failed", toolName(), reference, e);
      return new ToolNonZeroExit(toolName(), -1, e.getMessage());
    }

    if (result.exitCode() != 0) {
      LOGGER.warn("{} exited with {} for {}", toolName(), result.exitCode(), reference);
      return new ToolNonZeroExit(toolName(), result.exitCode(), result.stderr());
    }

    try {
      return new AdapterOutcome.Success(parse(result.stdout()));
    } catch (MalformedOutputException e) {
      LOGGER.warn("Discarding output of {} for {}: {}", toolName(), reference, e.getMessage());
      return new MalformedOutput(toolName(), e.getMessage());
    }
  }
}
