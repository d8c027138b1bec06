package de.ialistannen.beacon.orchestrator;

import de.ialistannen.beacon.model.ImageReference;

/**
 * Thrown if scanning one image failed as a whole, e.g. because no content source succeeded or the record could not
 * be stored.
 */
public class ImageScanException extends RuntimeException {

  private final ImageReference reference;

  public ImageScanException(ImageReference reference, String message) {
    super(message);
    this.reference = reference;
  }

  public ImageScanException(ImageReference reference, String message, Throwable cause) {
    super(message, cause);
    this.reference = reference;
  }

  public ImageReference getReference() {
    return reference;
  }
}
