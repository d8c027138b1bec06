package de.ialistannen.beacon.scanner.output;

/**
 * Thrown if the output of a tool does not match the schema expected for it.
 */
public class MalformedOutputException extends Exception {

  public MalformedOutputException(String message) {
    super(message);
  }

  public MalformedOutputException(String message, Throwable cause) {
    super(message, cause);
  }
}
