package de.ialistannen.beacon.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ImageReferenceTest {

  private static final String DEFAULT_REGISTRY = "mcr.microsoft.com";

  @Test
  void parsesBareRepositoryWithDefaultRegistryAndTag() {
    ImageReference reference = ImageReference.parse("azurelinux/base/python", DEFAULT_REGISTRY);

    assertThat(reference.registry()).isEqualTo(DEFAULT_REGISTRY);
    assertThat(reference.repository()).isEqualTo("azurelinux/base/python");
    assertThat(reference.tag()).isEqualTo("latest");
  }

  @Test
  void parsesQualifiedReference() {
    ImageReference reference = ImageReference.parse("docker.io/library/python:3.12-slim", DEFAULT_REGISTRY);

    assertThat(reference.registry()).isEqualTo("docker.io");
    assertThat(reference.repository()).isEqualTo("library/python");
    assertThat(reference.tag()).isEqualTo("3.12-slim");
    assertThat(reference.fullName()).isEqualTo("docker.io/library/python:3.12-slim");
  }

  @Test
  void registryWithPortIsNotMistakenForTag() {
    ImageReference reference = ImageReference.parse("localhost:5000/team/app", DEFAULT_REGISTRY);

    assertThat(reference.registry()).isEqualTo("localhost:5000");
    assertThat(reference.repository()).isEqualTo("team/app");
    assertThat(reference.tag()).isEqualTo("latest");
  }

  @Test
  void firstComponentWithoutDotIsANamespace() {
    ImageReference reference = ImageReference.parse("azurelinux/base/nodejs:20", DEFAULT_REGISTRY);

    assertThat(reference.registry()).isEqualTo(DEFAULT_REGISTRY);
    assertThat(reference.repository()).isEqualTo("azurelinux/base/nodejs");
    assertThat(reference.tag()).isEqualTo("20");
  }

  @Test
  void rejectsDigestReferences() {
    assertThatThrownBy(() -> ImageReference.parse("python@sha256:abcdef", DEFAULT_REGISTRY))
      .isInstanceOf(InvalidReferenceException.class);
  }

  @Test
  void rejectsEmptyAndUppercaseReferences() {
    assertThatThrownBy(() -> ImageReference.parse("  ", DEFAULT_REGISTRY))
      .isInstanceOf(InvalidReferenceException.class);
    assertThatThrownBy(() -> ImageReference.parse("Library/Python:3", DEFAULT_REGISTRY))
      .isInstanceOf(InvalidReferenceException.class);
  }

  @Test
  void repositoryPathParsesBareAndQualifiedForms() {
    assertThat(RepositoryPath.parse("azurelinux/base/python", DEFAULT_REGISTRY))
      .isEqualTo(new RepositoryPath(DEFAULT_REGISTRY, "azurelinux/base/python"));
    assertThat(RepositoryPath.parse("ghcr.io/org/image", DEFAULT_REGISTRY))
      .isEqualTo(new RepositoryPath("ghcr.io", "org/image"));
    assertThatThrownBy(() -> RepositoryPath.parse("org/image:1.0", DEFAULT_REGISTRY))
      .isInstanceOf(InvalidReferenceException.class);
  }
}
