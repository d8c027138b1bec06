package de.ialistannen.beacon.scanner.output;

import static de.ialistannen.beacon.scanner.output.OutputSchema.isPresent;
import static de.ialistannen.beacon.scanner.output.OutputSchema.require;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The report produced by {@code trivy image --format json}.
 *
 * @param toolVersion the trivy version, trivy does not include it in its report
 * @param report the decoded report
 */
public record TrivyOutput(String toolVersion, Report report) implements ScanResult {

  public static final String TOOL_NAME = "trivy";

  @Override
  public String toolName() {
    return TOOL_NAME;
  }

  public List<Result> results() {
    return report.results() == null ? List.of() : report.results();
  }

  /**
   * @return true if trivy listed all installed packages and not only the vulnerable ones
   */
  public boolean hasPackageInventory() {
    return results().stream().anyMatch(it -> it.packages() != null && !it.packages().isEmpty());
  }

  /**
   * Decodes and validates trivy JSON output.
   *
   * @param mapper the object mapper to use
   * @param json the raw output
   * @param toolVersion the version of the trivy binary that produced it
   * @return the validated output
   * @throws MalformedOutputException if the output is not a valid trivy report
   */
  public static TrivyOutput parse(ObjectMapper mapper, String json, String toolVersion)
    throws MalformedOutputException {
    Report report = OutputSchema.decode(mapper, TOOL_NAME, json, Report.class);

    require(report.schemaVersion() != null, TOOL_NAME, "has no SchemaVersion");
    if (report.results() != null) {
      for (Result result : report.results()) {
        require(result != null && isPresent(result.target()), TOOL_NAME, "contains a result without Target");
        List<Vulnerability> vulnerabilities = Objects.requireNonNullElse(result.vulnerabilities(), List.of());
        for (Vulnerability vulnerability : vulnerabilities) {
          require(
            vulnerability != null && isPresent(vulnerability.vulnerabilityId()),
            TOOL_NAME,
            "contains a vulnerability without VulnerabilityID"
          );
          require(isPresent(vulnerability.pkgName()), TOOL_NAME, "contains a vulnerability without PkgName");
        }
        for (InstalledPackage pkg : Objects.requireNonNullElse(result.packages(), List.<InstalledPackage>of())) {
          require(pkg != null && isPresent(pkg.name()), TOOL_NAME, "contains a package without Name");
        }
      }
    }

    return new TrivyOutput(toolVersion, report);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Report(
    @JsonProperty("SchemaVersion") Integer schemaVersion,
    @JsonProperty("ArtifactName") String artifactName,
    @JsonProperty("Results") List<Result> results
  ) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(
    @JsonProperty("Target") String target,
    @JsonProperty("Class") String resultClass,
    @JsonProperty("Type") String type,
    @JsonProperty("Packages") List<InstalledPackage> packages,
    @JsonProperty("Vulnerabilities") List<Vulnerability> vulnerabilities
  ) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record InstalledPackage(
    @JsonProperty("Name") String name,
    @JsonProperty("Version") String version,
    @JsonProperty("Release") String release,
    @JsonProperty("Epoch") Integer epoch,
    @JsonProperty("Identifier") Identifier identifier
  ) {

    /**
     * @return the version in the {@code [epoch:]version[-release]} form used by package managers
     */
    public String fullVersion() {
      String result = version == null ? "" : version;
      if (isPresent(release)) {
        result += "-" + release;
      }
      if (epoch != null && epoch > 0) {
        result = epoch + ":" + result;
      }
      return result;
    }

    public Optional<String> purl() {
      return Optional.ofNullable(identifier).map(Identifier::purl).filter(OutputSchema::isPresent);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Identifier(@JsonProperty("PURL") String purl) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Vulnerability(
    @JsonProperty("VulnerabilityID") String vulnerabilityId,
    @JsonProperty("PkgName") String pkgName,
    @JsonProperty("PkgIdentifier") Identifier pkgIdentifier,
    @JsonProperty("InstalledVersion") String installedVersion,
    @JsonProperty("FixedVersion") String fixedVersion,
    @JsonProperty("Severity") String severity,
    @JsonProperty("CVSS") Map<String, CvssEntry> cvss
  ) {

    /**
     * @return the highest score any CVSS source assigned
     */
    public Optional<Double> maxCvssScore() {
      if (cvss == null) {
        return Optional.empty();
      }
      return cvss.values().stream()
        .filter(Objects::nonNull)
        .flatMap(it -> it.scores().stream())
        .max(Double::compare);
    }

    public Optional<String> purl() {
      return Optional.ofNullable(pkgIdentifier).map(Identifier::purl).filter(OutputSchema::isPresent);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record CvssEntry(
    @JsonProperty("V2Score") Double v2Score,
    @JsonProperty("V3Score") Double v3Score
  ) {

    List<Double> scores() {
      return Stream.of(v2Score, v3Score).filter(Objects::nonNull).toList();
    }
  }
}
