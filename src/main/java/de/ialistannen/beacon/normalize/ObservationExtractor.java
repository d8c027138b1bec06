package de.ialistannen.beacon.normalize;

import de.ialistannen.beacon.model.Severity;
import de.ialistannen.beacon.scanner.output.GrypeOutput;
import de.ialistannen.beacon.scanner.output.InspectOutput;
import de.ialistannen.beacon.scanner.output.ScanResult;
import de.ialistannen.beacon.scanner.output.SyftOutput;
import de.ialistannen.beacon.scanner.output.TrivyOutput;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps the tool specific result variants to package and finding observations.
 */
final class ObservationExtractor {

  private ObservationExtractor() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param result the tool result
   * @return true if the result enumerates installed packages
   */
  static boolean isSbomCapable(ScanResult result) {
    if (result instanceof SyftOutput) {
      return true;
    }
    return result instanceof TrivyOutput trivy && trivy.hasPackageInventory();
  }

  /**
   * @param result the tool result
   * @return true if the result contains vulnerability analysis
   */
  static boolean isVulnerabilityScan(ScanResult result) {
    return result instanceof TrivyOutput || result instanceof GrypeOutput;
  }

  static List<PackageObservation> packages(ScanResult result) {
    if (result instanceof SyftOutput syft) {
      return syftPackages(syft);
    }
    if (result instanceof TrivyOutput trivy) {
      return trivyPackages(trivy);
    }
    if (result instanceof GrypeOutput || result instanceof InspectOutput) {
      return List.of();
    }
    throw new IllegalArgumentException("Unknown result type " + result.getClass());
  }

  static List<FindingObservation> findings(ScanResult result) {
    if (result instanceof TrivyOutput trivy) {
      return trivyFindings(trivy);
    }
    if (result instanceof GrypeOutput grype) {
      return grypeFindings(grype);
    }
    if (result instanceof SyftOutput || result instanceof InspectOutput) {
      return List.of();
    }
    throw new IllegalArgumentException("Unknown result type " + result.getClass());
  }

  private static List<PackageObservation> syftPackages(SyftOutput syft) {
    List<PackageObservation> observations = new ArrayList<>();
    for (SyftOutput.Artifact artifact : syft.artifacts()) {
      Optional<String> purl = nonEmpty(artifact.purl());
      observations.add(new PackageObservation(
        artifact.name(),
        Objects.requireNonNullElse(artifact.version(), ""),
        Ecosystems.resolve(purl, artifact.type()),
        purl
      ));
    }
    return observations;
  }

  private static List<PackageObservation> trivyPackages(TrivyOutput trivy) {
    List<PackageObservation> observations = new ArrayList<>();
    for (TrivyOutput.Result result : trivy.results()) {
      if (result.packages() == null) {
        continue;
      }
      for (TrivyOutput.InstalledPackage pkg : result.packages()) {
        observations.add(new PackageObservation(
          pkg.name(),
          pkg.fullVersion(),
          Ecosystems.resolve(pkg.purl(), result.type()),
          pkg.purl()
        ));
      }
    }
    return observations;
  }

  private static List<FindingObservation> trivyFindings(TrivyOutput trivy) {
    List<FindingObservation> observations = new ArrayList<>();
    for (TrivyOutput.Result result : trivy.results()) {
      if (result.vulnerabilities() == null) {
        continue;
      }
      for (TrivyOutput.Vulnerability vulnerability : result.vulnerabilities()) {
        observations.add(new FindingObservation(
          trivy.toolName(),
          vulnerability.vulnerabilityId(),
          List.of(),
          Severity.parse(vulnerability.severity()),
          vulnerability.pkgName(),
          Objects.requireNonNullElse(vulnerability.installedVersion(), ""),
          Ecosystems.resolve(vulnerability.purl(), result.type()),
          nonEmpty(vulnerability.fixedVersion()),
          vulnerability.maxCvssScore()
        ));
      }
    }
    return observations;
  }

  private static List<FindingObservation> grypeFindings(GrypeOutput grype) {
    List<FindingObservation> observations = new ArrayList<>();
    for (GrypeOutput.Match match : grype.matches()) {
      GrypeOutput.Artifact artifact = match.artifact();
      Optional<String> purl = nonEmpty(artifact.purl());
      observations.add(new FindingObservation(
        grype.toolName(),
        match.vulnerability().id(),
        match.relatedIds(),
        Severity.parse(match.vulnerability().severity()),
        artifact.name(),
        Objects.requireNonNullElse(artifact.version(), ""),
        Ecosystems.resolve(purl, artifact.type()),
        match.vulnerability().firstFixedVersion(),
        match.vulnerability().maxCvssScore()
      ));
    }
    return observations;
  }

  private static Optional<String> nonEmpty(String value) {
    return Optional.ofNullable(value).filter(it -> !it.isBlank());
  }
}
