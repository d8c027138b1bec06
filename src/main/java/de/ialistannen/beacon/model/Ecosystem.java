package de.ialistannen.beacon.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The package ecosystem, aligned with package-url types.
 */
public enum Ecosystem {
  RPM("rpm", true),
  DEB("deb", true),
  APK("apk", true),
  PYPI("pypi", false),
  NPM("npm", false),
  MAVEN("maven", false),
  GOLANG("golang", false),
  GEM("gem", false),
  NUGET("nuget", false),
  CARGO("cargo", false),
  COMPOSER("composer", false),
  GENERIC("generic", false);

  private final String purlType;
  private final boolean operatingSystem;

  Ecosystem(String purlType, boolean operatingSystem) {
    this.purlType = purlType;
    this.operatingSystem = operatingSystem;
  }

  public String purlType() {
    return purlType;
  }

  /**
   * @return true if packages of this ecosystem are installed by the distribution package manager
   */
  public boolean isOperatingSystem() {
    return operatingSystem;
  }

  /**
   * @param purlType the type of a package url
   * @return the matching ecosystem, if any
   */
  public static Optional<Ecosystem> fromPurlType(String purlType) {
    String normalized = purlType.toLowerCase(Locale.ROOT);
    for (Ecosystem ecosystem : values()) {
      if (ecosystem.purlType.equals(normalized)) {
        return Optional.of(ecosystem);
      }
    }
    return Optional.empty();
  }

  /**
   * Maps the artifact/package type names used by SBOM and vulnerability tools to an ecosystem.
   *
   * @param toolType the type as reported by the tool, e.g. {@code python}, {@code java-archive} or
   *   {@code azurelinux}
   * @return the ecosystem, {@link #GENERIC} if unknown
   */
  public static Ecosystem fromToolType(String toolType) {
    if (toolType == null) {
      return GENERIC;
    }
    return switch (toolType.strip().toLowerCase(Locale.ROOT)) {
      case "rpm", "redhat", "centos", "rocky", "alma", "amazon", "oracle", "azurelinux", "cbl-mariner",
        "photon", "fedora", "suse", "opensuse", "opensuse.leap", "opensuse.tumbleweed", "sles" -> RPM;
      case "deb", "debian", "ubuntu" -> DEB;
      case "apk", "alpine", "wolfi", "chainguard" -> APK;
      case "python", "python-pkg", "pip", "pipenv", "poetry", "pypi", "wheel", "egg" -> PYPI;
      case "npm", "node-pkg", "yarn", "pnpm" -> NPM;
      case "java-archive", "jenkins-plugin", "jar", "pom", "gradle", "maven" -> MAVEN;
      case "go-module", "gobinary", "gomod", "golang" -> GOLANG;
      case "gem", "gemspec", "bundler" -> GEM;
      case "dotnet", "nuget", "dotnet-core", "dotnet-deps" -> NUGET;
      case "rust-crate", "rust-binary", "cargo" -> CARGO;
      case "php-composer", "composer" -> COMPOSER;
      default -> GENERIC;
    };
  }
}
