package de.ialistannen.beacon.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.orchestrator.RepositoryConfig.ImageEntry;
import de.ialistannen.beacon.orchestrator.RepositoryConfig.RepositoryEntry;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RepositoryConfigTest {

  private static final String REGISTRY = "mcr.microsoft.com";

  @Test
  void parsesImagesAndRepositories() {
    RepositoryConfig config = RepositoryConfig.parse("""
      # Azure Linux base images
      azurelinux/base/python:3.12

        azurelinux/base/nodejs
      localhost:5000/team/app
      docker.io/library/python:3.12-slim
      """, REGISTRY);

    assertThat(config.entries()).containsExactly(
      new ImageEntry(new ImageReference(REGISTRY, "azurelinux/base/python", "3.12")),
      new RepositoryEntry(new RepositoryPath(REGISTRY, "azurelinux/base/nodejs")),
      new RepositoryEntry(new RepositoryPath("localhost:5000", "team/app")),
      new ImageEntry(new ImageReference("docker.io", "library/python", "3.12-slim"))
    );
  }

  @Test
  void emptyFileHasNoEntries() {
    assertThat(RepositoryConfig.parse("\n# nothing here\n", REGISTRY).entries()).isEmpty();
  }

  @Test
  void reportsLineOfInvalidEntry() {
    assertThatThrownBy(() -> RepositoryConfig.parse("azurelinux/base/python\nInvalid Entry\n", REGISTRY))
      .isInstanceOf(RepositoryConfigException.class)
      .hasMessageContaining("line 2");
  }

  @Test
  void rejectsDigestReferences() {
    assertThatThrownBy(() -> RepositoryConfig.parse("python@sha256:abcdef\n", REGISTRY))
      .isInstanceOf(RepositoryConfigException.class);
  }

  @Test
  void missingFileIsReported(@TempDir Path tempDir) {
    assertThatThrownBy(() -> RepositoryConfig.read(tempDir.resolve("missing.txt"), REGISTRY))
      .isInstanceOf(RepositoryConfigException.class)
      .hasMessageContaining("missing.txt");
  }
}
