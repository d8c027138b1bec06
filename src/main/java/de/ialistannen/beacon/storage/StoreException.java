package de.ialistannen.beacon.storage;

/**
 * Thrown if the store could not be read or written.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
