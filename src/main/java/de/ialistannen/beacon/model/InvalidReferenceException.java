package de.ialistannen.beacon.model;

/**
 * Thrown when an image or repository reference can not be parsed.
 */
public class InvalidReferenceException extends RuntimeException {

  public InvalidReferenceException(String message) {
    super(message);
  }
}
