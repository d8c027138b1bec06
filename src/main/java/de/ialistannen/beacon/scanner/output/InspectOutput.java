package de.ialistannen.beacon.scanner.output;

import java.time.Instant;
import java.util.Optional;

/**
 * The image metadata reported by the docker daemon.
 *
 * @param toolVersion the docker daemon version
 * @param imageId the image id (config digest)
 * @param sizeBytes the image size
 * @param createdAt the creation time, if the daemon reported a parseable one
 * @param layerCount the number of root file system layers
 */
public record InspectOutput(
  String toolVersion,
  String imageId,
  long sizeBytes,
  Optional<Instant> createdAt,
  int layerCount
) implements ScanResult {

  public static final String TOOL_NAME = "docker";

  @Override
  public String toolName() {
    return TOOL_NAME;
  }

  /**
   * Validates the inspection data.
   *
   * @return the validated output
   * @throws MalformedOutputException if required values are missing
   */
  public static InspectOutput validated(
    String toolVersion,
    String imageId,
    Long sizeBytes,
    Optional<Instant> createdAt,
    int layerCount
  ) throws MalformedOutputException {
    OutputSchema.require(OutputSchema.isPresent(imageId), TOOL_NAME, "has no image id");
    OutputSchema.require(sizeBytes == null || sizeBytes >= 0, TOOL_NAME, "has a negative size");

    return new InspectOutput(
      toolVersion,
      imageId,
      sizeBytes == null ? 0 : sizeBytes,
      createdAt,
      layerCount
    );
  }
}
