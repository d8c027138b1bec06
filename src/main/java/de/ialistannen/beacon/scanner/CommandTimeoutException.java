package de.ialistannen.beacon.scanner;

import java.time.Duration;

/**
 * Thrown if an external command did not finish in time. The process has been killed when this is thrown.
 */
public class CommandTimeoutException extends Exception {

  public CommandTimeoutException(String executable, Duration timeout) {
    super("'" + executable + "' did not finish within " + timeout.toSeconds() + "s");
  }
}
