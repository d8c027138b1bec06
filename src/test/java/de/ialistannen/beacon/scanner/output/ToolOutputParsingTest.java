package de.ialistannen.beacon.scanner.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ToolOutputParsingTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void parsesSyftDocument() throws MalformedOutputException {
    SyftOutput output = SyftOutput.parse(objectMapper, """
      {
        "artifacts": [
          {"name": "python3", "version": "3.12.3-1.azl3", "type": "rpm",
           "purl": "pkg:rpm/azurelinux/python3@3.12.3-1.azl3"},
          {"name": "pip", "version": "24.0", "type": "python", "foundBy": "python-installed-package-cataloger"}
        ],
        "source": {"type": "image", "metadata": {"imageID": "sha256:abc", "imageSize": 1234}},
        "distro": {"name": "azurelinux", "version": "3.0", "versionID": "3.0.20240501"},
        "descriptor": {"name": "syft", "version": "1.4.1"},
        "schema": {"version": "16.0.0"}
      }
      """);

    assertThat(output.toolName()).isEqualTo("syft");
    assertThat(output.toolVersion()).isEqualTo("1.4.1");
    assertThat(output.artifacts()).hasSize(2);
    assertThat(output.imageId()).contains("sha256:abc");
    assertThat(output.distro()).map(SyftOutput.Distro::bestVersion).contains("3.0.20240501");
  }

  @Test
  void syftWithoutArtifactsIsMalformed() {
    assertThatThrownBy(() -> SyftOutput.parse(objectMapper, "{\"source\": {}}"))
      .isInstanceOf(MalformedOutputException.class)
      .hasMessageContaining("artifacts");
  }

  @Test
  void syftArtifactWithoutNameIsMalformed() {
    assertThatThrownBy(() -> SyftOutput.parse(objectMapper, "{\"artifacts\": [{\"version\": \"1\"}]}"))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void invalidJsonIsMalformed() {
    assertThatThrownBy(() -> SyftOutput.parse(objectMapper, "{\"artifacts\": ["))
      .isInstanceOf(MalformedOutputException.class);
    assertThatThrownBy(() -> GrypeOutput.parse(objectMapper, ""))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void wronglyTypedFieldIsMalformed() {
    assertThatThrownBy(() -> SyftOutput.parse(objectMapper, "{\"artifacts\": {\"name\": \"x\"}}"))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void parsesTrivyReport() throws MalformedOutputException {
    TrivyOutput output = TrivyOutput.parse(objectMapper, """
      {
        "SchemaVersion": 2,
        "ArtifactName": "mcr.microsoft.com/azurelinux/base/python:3.12",
        "Results": [
          {
            "Target": "mcr.microsoft.com/azurelinux/base/python:3.12 (azurelinux 3.0)",
            "Class": "os-pkgs",
            "Type": "azurelinux",
            "Packages": [
              {"Name": "openssl", "Version": "3.3.0", "Release": "1.azl3", "Epoch": 1,
               "Identifier": {"PURL": "pkg:rpm/azurelinux/openssl@3.3.0-1.azl3?epoch=1"}}
            ],
            "Vulnerabilities": [
              {"VulnerabilityID": "CVE-2024-0001", "PkgName": "openssl", "InstalledVersion": "1:3.3.0-1.azl3",
               "FixedVersion": "1:3.3.1-1.azl3", "Severity": "HIGH",
               "CVSS": {"nvd": {"V2Score": 5.0, "V3Score": 7.5}, "redhat": {"V3Score": 7.0}}}
            ]
          }
        ]
      }
      """, "0.51.0");

    assertThat(output.toolVersion()).isEqualTo("0.51.0");
    assertThat(output.hasPackageInventory()).isTrue();
    TrivyOutput.Result result = output.results().get(0);
    assertThat(result.packages().get(0).fullVersion()).isEqualTo("1:3.3.0-1.azl3");
    assertThat(result.vulnerabilities().get(0).maxCvssScore()).contains(7.5);
  }

  @Test
  void trivyVulnerabilityWithoutIdIsMalformed() {
    assertThatThrownBy(() -> TrivyOutput.parse(objectMapper, """
      {"SchemaVersion": 2, "Results": [{"Target": "x", "Vulnerabilities": [{"PkgName": "openssl"}]}]}
      """, "0.51.0"))
      .isInstanceOf(MalformedOutputException.class)
      .hasMessageContaining("VulnerabilityID");
  }

  @Test
  void trivyWithoutSchemaVersionIsMalformed() {
    assertThatThrownBy(() -> TrivyOutput.parse(objectMapper, "{\"Results\": []}", "0.51.0"))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void parsesGrypeReport() throws MalformedOutputException {
    GrypeOutput output = GrypeOutput.parse(objectMapper, """
      {
        "matches": [
          {
            "vulnerability": {
              "id": "GHSA-xxxx-yyyy-zzzz",
              "severity": "Medium",
              "fix": {"versions": ["2.32.0"], "state": "fixed"},
              "cvss": [{"metrics": {"baseScore": 5.6}}, {"metrics": {"baseScore": 6.1}}]
            },
            "relatedVulnerabilities": [{"id": "CVE-2024-35195"}],
            "artifact": {"name": "requests", "version": "2.31.0", "type": "python", "purl": "pkg:pypi/requests@2.31.0"}
          }
        ],
        "descriptor": {"name": "grype", "version": "0.77.0"}
      }
      """);

    assertThat(output.toolVersion()).isEqualTo("0.77.0");
    GrypeOutput.Match match = output.matches().get(0);
    assertThat(match.relatedIds()).containsExactly("CVE-2024-35195");
    assertThat(match.vulnerability().firstFixedVersion()).contains("2.32.0");
    assertThat(match.vulnerability().maxCvssScore()).contains(6.1);
  }

  @Test
  void grypeMatchWithoutArtifactIsMalformed() {
    assertThatThrownBy(() -> GrypeOutput.parse(objectMapper, """
      {"matches": [{"vulnerability": {"id": "CVE-2024-1"}}]}
      """))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void inspectionRequiresImageId() {
    assertThatThrownBy(() -> InspectOutput.validated("24.0", "", 10L, Optional.empty(), 1))
      .isInstanceOf(MalformedOutputException.class);
  }

  @Test
  void inspectionWithoutSizeHasUnknownSize() throws MalformedOutputException {
    InspectOutput output = InspectOutput.validated(
      "24.0",
      "sha256:abc",
      null,
      Optional.of(Instant.parse("2024-04-01T00:00:00Z")),
      4
    );

    assertThat(output.sizeBytes()).isZero();
    assertThat(output.layerCount()).isEqualTo(4);
  }
}
