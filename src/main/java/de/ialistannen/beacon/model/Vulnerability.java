package de.ialistannen.beacon.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One finding, deduplicated across scanners.
 *
 * @param id the CVE or advisory identifier
 * @param severity the merged severity
 * @param affectedPackage the package the finding was reported against
 * @param sourceTools the tools that reported the finding
 * @param fixedVersion the version fixing the finding, if known
 * @param cvssScore the highest reported CVSS score, if any
 */
public record Vulnerability(
  String id,
  Severity severity,
  PackageKey affectedPackage,
  SortedSet<String> sourceTools,
  Optional<String> fixedVersion,
  Optional<Double> cvssScore
) implements Comparable<Vulnerability> {

  private static final Comparator<Vulnerability> ORDER = Comparator
    .comparing(Vulnerability::severity, Comparator.reverseOrder())
    .thenComparing(Vulnerability::id)
    .thenComparing(Vulnerability::affectedPackage);

  public Vulnerability {
    sourceTools = Collections.unmodifiableSortedSet(new TreeSet<>(sourceTools));
  }

  @Override
  public int compareTo(Vulnerability other) {
    return ORDER.compare(this, other);
  }
}
