package de.ialistannen.beacon.recommend;

import java.util.Optional;

/**
 * The raw values used for each ranking key, in ranking order.
 *
 * @param critical the number of critical vulnerabilities
 * @param high the number of high vulnerabilities
 * @param total the total number of vulnerabilities
 * @param sizeCategory the size category of the image, empty if its size is unknown
 * @param sizeDistance the distance between the requested and the actual size category
 * @param sizeBytes the image size in bytes
 * @param packageCoverage the share of required packages installed in the image, 1 if none were required
 */
public record ScoreBreakdown(
  int critical,
  int high,
  int total,
  Optional<SizePreference> sizeCategory,
  int sizeDistance,
  long sizeBytes,
  double packageCoverage
) {

}
