package de.ialistannen.beacon.storage;

import java.util.List;
import java.util.Map;

/**
 * Summary statistics over all stored images.
 *
 * @param totalImages the number of stored images
 * @param totalPackages the number of distinct packages installed in any image
 * @param avgVulnerabilitiesPerImage the average number of vulnerabilities per image
 * @param languageDistribution the number of images per detected language
 * @param zeroVulnerabilityCount the number of images without any vulnerability
 * @param safeImageCount the number of images without critical and high vulnerabilities
 * @param languages per language details, sorted by language
 */
public record StoreStatistics(
  long totalImages,
  long totalPackages,
  double avgVulnerabilitiesPerImage,
  Map<String, Long> languageDistribution,
  long zeroVulnerabilityCount,
  long safeImageCount,
  List<LanguageSummary> languages
) {

  public record LanguageSummary(
    String language,
    long imageCount,
    double averageVulnerabilities,
    double averageSizeBytes
  ) {

  }
}
