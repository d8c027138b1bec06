package de.ialistannen.beacon.model;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One scanned image. All collections are stored in their canonical order, so two records built from the same
 * data are equal.
 *
 * @param reference the reference the image was scanned under
 * @param digest the immutable content digest, the identity of the record
 * @param sizeBytes the image size in bytes, 0 if unknown
 * @param layerCount the number of layers, 0 if unknown
 * @param createdAt the creation time from the image metadata
 * @param scannedAt the time of the scan producing this record
 * @param comprehensive whether vulnerability analysis was performed
 * @param operatingSystem the detected distribution
 * @param packages the installed packages
 * @param vulnerabilities the deduplicated findings
 * @param runtimes the detected language runtimes
 * @param provenance one entry per attempted data source
 */
public record ImageRecord(
  ImageReference reference,
  String digest,
  long sizeBytes,
  int layerCount,
  Optional<Instant> createdAt,
  Instant scannedAt,
  boolean comprehensive,
  Optional<OperatingSystem> operatingSystem,
  List<ImagePackage> packages,
  List<Vulnerability> vulnerabilities,
  List<LanguageRuntime> runtimes,
  List<ToolProvenance> provenance
) {

  public ImageRecord {
    packages = sorted(packages, Comparator.naturalOrder());
    vulnerabilities = sorted(vulnerabilities, Comparator.naturalOrder());
    runtimes = sorted(runtimes, Comparator.naturalOrder());
    provenance = sorted(provenance, Comparator.comparing(ToolProvenance::toolName));
  }

  public VulnerabilityCounts counts() {
    return VulnerabilityCounts.of(vulnerabilities);
  }

  /**
   * @return the lower case names of all installed packages
   */
  public Set<String> packageNames() {
    return packages.stream()
      .map(it -> it.name().toLowerCase(Locale.ROOT))
      .collect(Collectors.toSet());
  }

  /**
   * @param language the language to look for, case-insensitive
   * @return all runtimes of the given language family
   */
  public List<LanguageRuntime> runtimesFor(String language) {
    return runtimes.stream()
      .filter(it -> it.language().equalsIgnoreCase(language))
      .toList();
  }

  /**
   * @param scannedAt the new scan time
   * @return a copy of this record with a different scan time
   */
  public ImageRecord withScannedAt(Instant scannedAt) {
    return new ImageRecord(
      reference, digest, sizeBytes, layerCount, createdAt, scannedAt, comprehensive, operatingSystem,
      packages, vulnerabilities, runtimes, provenance
    );
  }

  /**
   * @param reference the new reference
   * @return a copy of this record that was scanned under a different reference
   */
  public ImageRecord withReference(ImageReference reference) {
    return new ImageRecord(
      reference, digest, sizeBytes, layerCount, createdAt, scannedAt, comprehensive, operatingSystem,
      packages, vulnerabilities, runtimes, provenance
    );
  }

  private static <T> List<T> sorted(Collection<T> input, Comparator<? super T> order) {
    return input.stream().sorted(order).toList();
  }
}
