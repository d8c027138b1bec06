package de.ialistannen.beacon.normalize;

import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.OperatingSystem;
import de.ialistannen.beacon.model.PackageKey;
import de.ialistannen.beacon.model.Severity;
import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.model.ToolProvenance.Status;
import de.ialistannen.beacon.model.Vulnerability;
import de.ialistannen.beacon.scanner.output.InspectOutput;
import de.ialistannen.beacon.scanner.output.ScanResult;
import de.ialistannen.beacon.scanner.output.SyftOutput;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Merges the results of all tools run against one image into a single {@link ImageRecord}.
 * <p>
 * Results are processed in a canonical order, so the record only depends on the set of results and not on the order
 * the tools finished in.
 */
public class ResultNormalizer {

  private static final Comparator<ScanResult> CANONICAL_ORDER = Comparator
    .comparing(ScanResult::toolName)
    .thenComparing(ScanResult::toolVersion)
    .thenComparing(it -> it.getClass().getName());

  private final LanguageDetector languageDetector;
  private final Clock clock;

  public ResultNormalizer(LanguageDetector languageDetector, Clock clock) {
    this.languageDetector = languageDetector;
    this.clock = clock;
  }

  /**
   * Normalizes the results of an image scan.
   *
   * @param reference the scanned image
   * @param results the successful tool results
   * @return the merged record
   * @throws NormalizationException if no result reported the image digest
   */
  public ImageRecord normalize(ImageReference reference, Collection<ScanResult> results) {
    return normalize(reference, results, List.of());
  }

  /**
   * Normalizes the results of an image scan.
   *
   * @param reference the scanned image
   * @param results the successful tool results
   * @param failures provenance entries of tools that did not contribute
   * @return the merged record
   * @throws NormalizationException if no result reported the image digest
   */
  public ImageRecord normalize(
    ImageReference reference,
    Collection<ScanResult> results,
    Collection<ToolProvenance> failures
  ) {
    List<ScanResult> ordered = results.stream().sorted(CANONICAL_ORDER).toList();

    Optional<InspectOutput> inspection = ordered.stream()
      .filter(InspectOutput.class::isInstance)
      .map(InspectOutput.class::cast)
      .findFirst();
    Optional<SyftOutput> sbom = ordered.stream()
      .filter(SyftOutput.class::isInstance)
      .map(SyftOutput.class::cast)
      .findFirst();

    String digest = inspection.map(InspectOutput::imageId)
      .or(() -> sbom.flatMap(SyftOutput::imageId))
      .orElseThrow(() -> new NormalizationException("No source reported a digest for " + reference));

    List<ImagePackage> packages = mergePackages(ordered);
    List<Vulnerability> vulnerabilities = mergeFindings(ordered, packages);
    List<LanguageRuntime> runtimes = languageDetector.detect(reference, packages);

    List<ToolProvenance> provenance = new ArrayList<>(failures);
    for (ScanResult result : ordered) {
      provenance.add(new ToolProvenance(result.toolName(), result.toolVersion(), Status.SUCCEEDED, ""));
    }

    return new ImageRecord(
      reference,
      digest,
      inspection.map(InspectOutput::sizeBytes).or(() -> sbom.flatMap(ResultNormalizer::sbomImageSize)).orElse(0L),
      inspection.map(InspectOutput::layerCount).orElse(0),
      inspection.flatMap(InspectOutput::createdAt),
      Instant.now(clock),
      ordered.stream().anyMatch(ObservationExtractor::isVulnerabilityScan),
      sbom.flatMap(ResultNormalizer::operatingSystem),
      packages,
      vulnerabilities,
      runtimes,
      provenance
    );
  }

  private static List<ImagePackage> mergePackages(List<ScanResult> ordered) {
    Map<PackageKey, TreeSet<String>> purlsByKey = new TreeMap<>();

    for (ScanResult result : ordered) {
      if (!ObservationExtractor.isSbomCapable(result)) {
        continue;
      }
      for (PackageObservation observation : ObservationExtractor.packages(result)) {
        TreeSet<String> purls = purlsByKey.computeIfAbsent(observation.key(), key -> new TreeSet<>());
        observation.purl().ifPresent(purls::add);
      }
    }

    List<ImagePackage> packages = new ArrayList<>();
    for (Map.Entry<PackageKey, TreeSet<String>> entry : purlsByKey.entrySet()) {
      PackageKey key = entry.getKey();
      String purl = entry.getValue().isEmpty()
        ? Ecosystems.buildPurl(key.name(), key.version(), key.ecosystem())
        : entry.getValue().first();
      packages.add(new ImagePackage(key.name(), key.version(), key.ecosystem(), purl));
    }
    return packages;
  }

  private static List<Vulnerability> mergeFindings(List<ScanResult> ordered, List<ImagePackage> packages) {
    Map<String, List<PackageKey>> packagesByNameAndVersion = new HashMap<>();
    for (ImagePackage pkg : packages) {
      packagesByNameAndVersion.computeIfAbsent(pkg.name() + "@" + pkg.version(), key -> new ArrayList<>())
        .add(pkg.key());
    }

    Map<FindingKey, MergedFinding> merged = new TreeMap<>();
    for (ScanResult result : ordered) {
      for (FindingObservation finding : ObservationExtractor.findings(result)) {
        PackageKey affected = correlate(finding, packagesByNameAndVersion);
        String id = AdvisoryIds.canonical(finding.advisoryId(), finding.relatedIds());

        merged.computeIfAbsent(new FindingKey(id, affected), MergedFinding::new).add(finding);
      }
    }

    return merged.values().stream().map(MergedFinding::toVulnerability).toList();
  }

  private static PackageKey correlate(FindingObservation finding, Map<String, List<PackageKey>> packageIndex) {
    List<PackageKey> candidates = packageIndex.getOrDefault(
      finding.packageName() + "@" + finding.packageVersion(),
      List.of()
    );
    return candidates.stream()
      .filter(it -> it.ecosystem() == finding.ecosystem())
      .findFirst()
      .or(() -> candidates.stream().findFirst())
      .orElseGet(() -> new PackageKey(finding.packageName(), finding.packageVersion(), finding.ecosystem()));
  }

  private static Optional<OperatingSystem> operatingSystem(SyftOutput sbom) {
    return sbom.distro()
      .filter(it -> it.name() != null && !it.name().isBlank())
      .map(it -> new OperatingSystem(it.name(), it.bestVersion()));
  }

  private static Optional<Long> sbomImageSize(SyftOutput sbom) {
    return Optional.ofNullable(sbom.document().source())
      .map(SyftOutput.Source::metadata)
      .map(SyftOutput.SourceMetadata::imageSize);
  }

  private record FindingKey(String id, PackageKey affectedPackage) implements Comparable<FindingKey> {

    private static final Comparator<FindingKey> ORDER = Comparator
      .comparing(FindingKey::id)
      .thenComparing(FindingKey::affectedPackage);

    @Override
    public int compareTo(FindingKey other) {
      return ORDER.compare(this, other);
    }
  }

  private static final class MergedFinding {

    private final FindingKey key;
    private final TreeSet<String> tools;
    private Severity severity;
    private Optional<String> fixedVersion;
    private Optional<Double> cvssScore;

    private MergedFinding(FindingKey key) {
      this.key = key;
      this.tools = new TreeSet<>();
      this.severity = Severity.UNKNOWN;
      this.fixedVersion = Optional.empty();
      this.cvssScore = Optional.empty();
    }

    private void add(FindingObservation finding) {
      tools.add(finding.toolName());
      severity = severity.max(finding.severity());
      if (fixedVersion.isEmpty()) {
        fixedVersion = finding.fixedVersion();
      }
      if (finding.cvssScore().isPresent()) {
        double score = finding.cvssScore().get();
        cvssScore = Optional.of(cvssScore.map(it -> Math.max(it, score)).orElse(score));
      }
    }

    private Vulnerability toVulnerability() {
      return new Vulnerability(key.id(), severity, key.affectedPackage(), tools, fixedVersion, cvssScore);
    }
  }
}
