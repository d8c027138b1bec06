package de.ialistannen.beacon.scanner;

/**
 * Thrown if an external executable could not be started.
 */
public class ToolNotFoundException extends Exception {

  public ToolNotFoundException(String executable, Throwable cause) {
    super("Could not start '" + executable + "': " + cause.getMessage(), cause);
  }
}
