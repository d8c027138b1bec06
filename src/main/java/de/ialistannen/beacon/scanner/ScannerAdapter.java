package de.ialistannen.beacon.scanner;

import de.ialistannen.beacon.model.ImageReference;
import java.time.Duration;

/**
 * Wraps exactly one external analysis tool.
 */
public interface ScannerAdapter {

  /**
   * @return the name of the wrapped tool
   */
  String toolName();

  /**
   * @return what kind of data the tool contributes
   */
  Kind kind();

  /**
   * Runs the tool against an image. Implementations must not throw for tool failures, those are reported as an
   * {@link AdapterFailure}.
   *
   * @param reference the image to analyze
   * @param timeout the wall-clock time the tool may take
   * @param workspace the workspace of the current image scan, any created artifacts must be released through it
   * @return the outcome
   */
  AdapterOutcome analyze(ImageReference reference, Duration timeout, ScanWorkspace workspace);

  enum Kind {
    /**
     * Metadata about the image itself, like its digest and size.
     */
    INSPECTION,
    /**
     * A software bill of materials.
     */
    SBOM,
    /**
     * Vulnerability findings.
     */
    VULNERABILITY
  }
}
