package de.ialistannen.beacon.normalize;

/**
 * Thrown if the scan results of an image do not allow building a record, e.g. because no source reported the
 * image digest.
 */
public class NormalizationException extends RuntimeException {

  public NormalizationException(String message) {
    super(message);
  }
}
