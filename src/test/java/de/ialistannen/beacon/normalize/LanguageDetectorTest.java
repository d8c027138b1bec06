package de.ialistannen.beacon.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import de.ialistannen.beacon.model.Ecosystem;
import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.LanguageRuntime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LanguageDetectorTest {

  private static final ImageReference BASE = new ImageReference("mcr.microsoft.com", "azurelinux/base/core", "3.0");

  private final LanguageDetector detector = LanguageDetector.withDefaultRules();

  @Test
  void detectsPythonFromDistributionPackage() {
    List<LanguageRuntime> runtimes = detector.detect(BASE, List.of(
      rpm("python3", "3.12.3-1.azl3"),
      rpm("python3-pip", "24.0-1.azl3"),
      rpm("bash", "5.2.15-1.azl3")
    ));

    assertThat(runtimes).containsExactly(new LanguageRuntime("python", "3.12.3"));
  }

  @Test
  void prefersFullVersionOverVersionInName() {
    List<LanguageRuntime> runtimes = detector.detect(BASE, List.of(
      new ImagePackage("python3.11", "3.11.2-6", Ecosystem.DEB, "pkg:deb/debian/python3.11@3.11.2-6")
    ));

    assertThat(runtimes).containsExactly(new LanguageRuntime("python", "3.11.2"));
  }

  @Test
  void detectsSeveralLanguagesSortedByName() {
    List<LanguageRuntime> runtimes = detector.detect(BASE, List.of(
      rpm("nodejs", "20.14.0-1.azl3"),
      rpm("msopenjdk-17", "17.0.11-1"),
      rpm("python3", "3.12.3-1.azl3")
    ));

    assertThat(runtimes).containsExactly(
      new LanguageRuntime("java", "17.0.11"),
      new LanguageRuntime("node", "20.14.0"),
      new LanguageRuntime("python", "3.12.3")
    );
  }

  @Test
  void prefersDistributionPackages() {
    List<LanguageRuntime> runtimes = detector.detect(BASE, List.of(
      new ImagePackage("openjdk-tools", "1.0.0", Ecosystem.MAVEN, "pkg:maven/openjdk-tools@1.0.0"),
      rpm("msopenjdk-21", "21.0.3-1")
    ));

    assertThat(runtimes).containsExactly(new LanguageRuntime("java", "21.0.3"));
  }

  @Test
  void ignoresDevelopmentAndHelperPackages() {
    List<LanguageRuntime> runtimes = detector.detect(BASE, List.of(
      rpm("python3-devel", "3.12.3-1.azl3"),
      rpm("python-pip", "24.0-1.azl3"),
      rpm("java-common", "1.0-1")
    ));

    assertThat(runtimes).isEmpty();
  }

  @Test
  void derivesDotnetFromRepository() {
    ImageReference reference = new ImageReference("mcr.microsoft.com", "dotnet/aspnet", "8.0-azurelinux3.0");

    assertThat(detector.detect(reference, List.of()))
      .containsExactly(new LanguageRuntime("dotnet", "8.0"));
  }

  @Test
  void otherRepositoriesDoNotImplyDotnet() {
    ImageReference reference = new ImageReference("mcr.microsoft.com", "dotnet-tools/aspnet", "8.0");

    assertThat(detector.detect(reference, List.of())).isEmpty();
  }

  @ParameterizedTest
  @CsvSource({
    "'1:3.12.3-4.azl3', 3.12.3",
    "v20.1.0, 20.1.0",
    "17, 17",
    "'  8.0.5 ', 8.0.5",
    "abc, ''",
  })
  void extractsNumericVersion(String version, String expected) {
    assertThat(LanguageDetector.numericVersion(version)).isEqualTo(expected);
  }

  private static ImagePackage rpm(String name, String version) {
    return new ImagePackage(name, version, Ecosystem.RPM, "pkg:rpm/azurelinux/" + name + "@" + version);
  }
}
