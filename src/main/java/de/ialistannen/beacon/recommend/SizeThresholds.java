package de.ialistannen.beacon.recommend;

import java.util.Optional;

/**
 * Absolute size limits of the size categories.
 *
 * @param minimalMaxBytes images smaller than this are {@link SizePreference#MINIMAL}
 * @param balancedMaxBytes images smaller than this (and not minimal) are {@link SizePreference#BALANCED}, larger
 *   ones {@link SizePreference#FULL}
 */
public record SizeThresholds(long minimalMaxBytes, long balancedMaxBytes) {

  private static final long MIB = 1024L * 1024L;

  public SizeThresholds {
    if (minimalMaxBytes <= 0 || balancedMaxBytes <= minimalMaxBytes) {
      throw new IllegalArgumentException(
        "Thresholds must be positive and increasing, got " + minimalMaxBytes + " and " + balancedMaxBytes
      );
    }
  }

  public static SizeThresholds defaults() {
    return new SizeThresholds(50 * MIB, 200 * MIB);
  }

  public static SizeThresholds ofMebibytes(long minimalMaxMib, long balancedMaxMib) {
    return new SizeThresholds(minimalMaxMib * MIB, balancedMaxMib * MIB);
  }

  /**
   * @param sizeBytes the image size, 0 or less if unknown
   * @return the category, empty if the size is unknown
   */
  public Optional<SizePreference> categorize(long sizeBytes) {
    if (sizeBytes <= 0) {
      return Optional.empty();
    }
    if (sizeBytes < minimalMaxBytes) {
      return Optional.of(SizePreference.MINIMAL);
    }
    if (sizeBytes < balancedMaxBytes) {
      return Optional.of(SizePreference.BALANCED);
    }
    return Optional.of(SizePreference.FULL);
  }
}
