package de.ialistannen.beacon.scanner.output;

import static de.ialistannen.beacon.scanner.output.OutputSchema.isPresent;
import static de.ialistannen.beacon.scanner.output.OutputSchema.require;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Optional;

/**
 * The SBOM produced by {@code syft <image> -o json}.
 *
 * @param toolVersion the syft version from the document descriptor
 * @param document the decoded document
 */
public record SyftOutput(String toolVersion, Document document) implements ScanResult {

  public static final String TOOL_NAME = "syft";

  @Override
  public String toolName() {
    return TOOL_NAME;
  }

  public List<Artifact> artifacts() {
    return document.artifacts();
  }

  public Optional<Distro> distro() {
    return Optional.ofNullable(document.distro());
  }

  /**
   * @return the image id of the scanned image, if syft reported one
   */
  public Optional<String> imageId() {
    return Optional.ofNullable(document.source())
      .map(Source::metadata)
      .map(SourceMetadata::imageID)
      .filter(OutputSchema::isPresent);
  }

  /**
   * Decodes and validates syft JSON output.
   *
   * @param mapper the object mapper to use
   * @param json the raw output
   * @return the validated output
   * @throws MalformedOutputException if the output is not a valid syft document
   */
  public static SyftOutput parse(ObjectMapper mapper, String json) throws MalformedOutputException {
    Document document = OutputSchema.decode(mapper, TOOL_NAME, json, Document.class);

    require(document.artifacts() != null, TOOL_NAME, "has no artifacts array");
    for (Artifact artifact : document.artifacts()) {
      require(artifact != null && isPresent(artifact.name()), TOOL_NAME, "contains an artifact without name");
    }

    String version = Optional.ofNullable(document.descriptor())
      .map(Descriptor::version)
      .filter(OutputSchema::isPresent)
      .orElse("unknown");

    return new SyftOutput(version, document);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Document(
    List<Artifact> artifacts,
    Source source,
    Distro distro,
    Descriptor descriptor
  ) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Artifact(String name, String version, String type, String purl) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Source(String type, SourceMetadata metadata) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SourceMetadata(String imageID, String manifestDigest, Long imageSize) {

  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Distro(String name, String version, String versionID, String prettyName) {

    /**
     * @return the most specific version syft reported
     */
    public String bestVersion() {
      if (isPresent(versionID)) {
        return versionID;
      }
      return version == null ? "" : version;
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Descriptor(String name, String version) {

  }
}
