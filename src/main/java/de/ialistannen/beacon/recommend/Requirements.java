package de.ialistannen.beacon.recommend;

import de.ialistannen.beacon.versioning.VersionConstraint;
import java.util.List;
import java.util.Optional;

/**
 * What a user needs from a base image.
 *
 * @param language the language runtime the image must provide
 * @param version an optional constraint on the runtime version
 * @param packages package names that must be installed, version-agnostic
 * @param sizePreference the preferred size category
 * @param securityLevel the requested security level
 * @param maxCritical the maximum number of critical vulnerabilities
 * @param maxHigh the maximum number of high vulnerabilities
 * @param maxTotal the maximum number of vulnerabilities
 * @param excludePlatformSpecific whether to drop images tagged for one specific platform
 */
public record Requirements(
  String language,
  Optional<VersionConstraint> version,
  List<String> packages,
  SizePreference sizePreference,
  SecurityLevel securityLevel,
  Optional<Integer> maxCritical,
  Optional<Integer> maxHigh,
  Optional<Integer> maxTotal,
  boolean excludePlatformSpecific
) {

  public Requirements {
    if (language == null || language.isBlank()) {
      throw new IllegalArgumentException("A language is required");
    }
    packages = packages.stream().map(String::strip).filter(it -> !it.isEmpty()).distinct().toList();
  }

  public static Builder forLanguage(String language) {
    return new Builder(language);
  }

  public static class Builder {

    private final String language;
    private Optional<VersionConstraint> version;
    private List<String> packages;
    private SizePreference sizePreference;
    private SecurityLevel securityLevel;
    private Optional<Integer> maxCritical;
    private Optional<Integer> maxHigh;
    private Optional<Integer> maxTotal;
    private boolean excludePlatformSpecific;

    private Builder(String language) {
      this.language = language;
      this.version = Optional.empty();
      this.packages = List.of();
      this.sizePreference = SizePreference.BALANCED;
      this.securityLevel = SecurityLevel.BASIC;
      this.maxCritical = Optional.empty();
      this.maxHigh = Optional.empty();
      this.maxTotal = Optional.empty();
    }

    public Builder version(String constraint) {
      this.version = Optional.of(VersionConstraint.parse(constraint));
      return this;
    }

    public Builder packages(List<String> packages) {
      this.packages = List.copyOf(packages);
      return this;
    }

    public Builder sizePreference(SizePreference sizePreference) {
      this.sizePreference = sizePreference;
      return this;
    }

    public Builder securityLevel(SecurityLevel securityLevel) {
      this.securityLevel = securityLevel;
      return this;
    }

    public Builder maxCritical(int maxCritical) {
      this.maxCritical = Optional.of(maxCritical);
      return this;
    }

    public Builder maxHigh(int maxHigh) {
      this.maxHigh = Optional.of(maxHigh);
      return this;
    }

    public Builder maxTotal(int maxTotal) {
      this.maxTotal = Optional.of(maxTotal);
      return this;
    }

    public Builder excludePlatformSpecific(boolean excludePlatformSpecific) {
      this.excludePlatformSpecific = excludePlatformSpecific;
      return this;
    }

    public Requirements build() {
      return new Requirements(
        language, version, packages, sizePreference, securityLevel, maxCritical, maxHigh, maxTotal,
        excludePlatformSpecific
      );
    }
  }
}
