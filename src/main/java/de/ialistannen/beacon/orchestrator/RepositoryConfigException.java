package de.ialistannen.beacon.orchestrator;

/**
 * Thrown if a repository configuration file can not be read or contains an invalid entry.
 */
public class RepositoryConfigException extends RuntimeException {

  public RepositoryConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
