package de.ialistannen.beacon.scanner;

import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.model.ToolProvenance.Status;
import java.time.Duration;

/**
 * The ways running an external tool can fail. {@link ToolNotInstalled} and {@link ToolTimeout} only reduce the number
 * of data sources, {@link MalformedOutput} drops the contribution of the tool.
 */
public sealed interface AdapterFailure extends AdapterOutcome {

  /**
   * @return a human readable description of the failure
   */
  String describe();

  /**
   * @return the provenance entry recording this failure
   */
  ToolProvenance toProvenance();

  record ToolNotInstalled(String toolName, String detail) implements AdapterFailure {

    @Override
    public String describe() {
      return toolName + " is not available: " + detail;
    }

    @Override
    public ToolProvenance toProvenance() {
      return new ToolProvenance(toolName, "", Status.NOT_INSTALLED, describe());
    }
  }

  record ToolTimeout(String toolName, Duration timeout) implements AdapterFailure {

    @Override
    public String describe() {
      return toolName + " did not finish within " + timeout.toSeconds() + "s";
    }

    @Override
    public ToolProvenance toProvenance() {
      return new ToolProvenance(toolName, "", Status.TIMED_OUT, describe());
    }
  }

  record ToolNonZeroExit(String toolName, int exitCode, String stderr) implements AdapterFailure {

    @Override
    public String describe() {
      String message = toolName + " exited with code " + exitCode;
      if (stderr != null && !stderr.isBlank()) {
        message += ": " + stderr.strip();
      }
      return message;
    }

    @Override
    public ToolProvenance toProvenance() {
      return new ToolProvenance(toolName, "", Status.FAILED, describe());
    }
  }

  record MalformedOutput(String toolName, String detail) implements AdapterFailure {

    @Override
    public String describe() {
      return detail;
    }

    @Override
    public ToolProvenance toProvenance() {
      return new ToolProvenance(toolName, "", Status.MALFORMED_OUTPUT, describe());
    }
  }
}
