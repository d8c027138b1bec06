package de.ialistannen.beacon.scanner.output;

import static de.ialistannen.beacon.scanner.output.OutputSchema.isPresent;
import static de.ialistannen.beacon.scanner.output.OutputSchema.require;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The report produced by {@code grype <image> -o json}.
 *
 * @param toolVersion the grype version from the document descriptor
 * @param document the decoded document
 */
public record GrypeOutput(String toolVersion, Document document) implements ScanResult {

  public static final String TOOL_NAME = "grype";

  @Override
  public String toolName() {
    return TOOL_NAME;
  }

  public List<Match> matches() {
    return document.matches();
  }

  /**
   * Decodes and validates grype JSON output.
   *
   * @param mapper the object mapper to use
   * @param json the raw output
   * @return the validated output
   * @throws MalformedOutputException if the output is not a valid grype document
   */
  public static GrypeOutput parse(ObjectMapper mapper, String json) throws MalformedOutputException {
    Document document = OutputSchema.decode(mapper, TOOL_NAME, json, Document.class);

    require(document.matches() != null, TOOL_NAME, "has no matches array");
    for (Match match : document.matches()) {
      require(match != null && match.vulnerability() != null, TOOL_NAME, "contains a match without vulnerability");
      require(isPresent(match.vulnerability().id()), TOOL_NAME, "contains a vulnerability without id");
      require(
        match.artifact() != null && isPresent(match.artifact().name()),
        TOOL_NAME,
        "contains a match without artifact name"
      );
    }

    String version = Optional.ofNullable(document.descriptor())
      .map(Descriptor::version)
      .filter(OutputSchema::isPresent)
      .orElse("unknown");

    return new GrypeOutput(version, document);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Document(List<Match> matches, Descriptor descriptor) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Match(
    VulnerabilityEntry vulnerability,
    List<RelatedVulnerability> relatedVulnerabilities,
    Artifact artifact
  ) {

    /**
     * @return the ids of all related advisories
     */
    public List<String> relatedIds() {
      if (relatedVulnerabilities == null) {
        return List.of();
      }
      return relatedVulnerabilities.stream()
        .filter(Objects::nonNull)
        .map(RelatedVulnerability::id)
        .filter(OutputSchema::isPresent)
        .toList();
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record VulnerabilityEntry(String id, String severity, Fix fix, List<Cvss> cvss) {

    public Optional<String> firstFixedVersion() {
      return Optional.ofNullable(fix)
        .map(Fix::versions)
        .flatMap(versions -> versions.stream().filter(OutputSchema::isPresent).findFirst());
    }

    public Optional<Double> maxCvssScore() {
      if (cvss == null) {
        return Optional.empty();
      }
      return cvss.stream()
        .filter(Objects::nonNull)
        .map(Cvss::metrics)
        .filter(Objects::nonNull)
        .map(Metrics::baseScore)
        .filter(Objects::nonNull)
        .max(Double::compare);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RelatedVulnerability(String id) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Fix(List<String> versions, String state) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Cvss(Metrics metrics) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Metrics(Double baseScore) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Artifact(String name, String version, String type, String purl) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Descriptor(String name, String version) {

  }
}
