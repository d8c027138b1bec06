package de.ialistannen.beacon.registry;

public class TagEnumerationException extends Exception {

  public TagEnumerationException(String message) {
    super(message);
  }

  public TagEnumerationException(String message, Throwable cause) {
    super(message, cause);
  }
}
