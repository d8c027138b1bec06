package de.ialistannen.beacon.model;

/**
 * Records how one data source contributed to an image record.
 *
 * @param toolName the name of the tool
 * @param toolVersion the version of the tool, empty if it did not run
 * @param status the outcome
 * @param detail a human readable explanation for failures, empty on success
 */
public record ToolProvenance(String toolName, String toolVersion, Status status, String detail) {

  public enum Status {
    SUCCEEDED,
    NOT_INSTALLED,
    TIMED_OUT,
    FAILED,
    MALFORMED_OUTPUT
  }

  public boolean succeeded() {
    return status == Status.SUCCEEDED;
  }
}
