package de.ialistannen.beacon.normalize;

import com.github.packageurl.MalformedPackageURLException;
import com.github.packageurl.PackageURL;
import com.github.packageurl.PackageURLBuilder;
import de.ialistannen.beacon.model.Ecosystem;
import java.util.Optional;

/**
 * Resolves ecosystems and package-url coordinates.
 */
final class Ecosystems {

  private Ecosystems() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * Resolves the ecosystem of a package. The purl type wins over the tool specific type, as it is standardized.
   *
   * @param purl the reported package url, may be empty
   * @param toolType the tool specific type, may be null
   * @return the ecosystem
   */
  static Ecosystem resolve(Optional<String> purl, String toolType) {
    return purl
      .flatMap(Ecosystems::purlType)
      .flatMap(Ecosystem::fromPurlType)
      .orElseGet(() -> Ecosystem.fromToolType(toolType));
  }

  /**
   * Builds a package url for a package no tool reported a coordinate for.
   *
   * @param name the package name
   * @param version the package version
   * @param ecosystem the ecosystem
   * @return the package url
   */
  static String buildPurl(String name, String version, Ecosystem ecosystem) {
    try {
      PackageURLBuilder builder = PackageURLBuilder.aPackageURL()
        .withType(ecosystem.purlType())
        .withName(name);
      if (!version.isEmpty()) {
        builder.withVersion(version);
      }
      return builder.build().canonicalize();
    } catch (MalformedPackageURLException e) {
      return "pkg:" + ecosystem.purlType() + "/" + name + (version.isEmpty() ? "" : "@" + version);
    }
  }

  private static Optional<String> purlType(String purl) {
    try {
      return Optional.of(new PackageURL(purl).getType());
    } catch (MalformedPackageURLException e) {
      return Optional.empty();
    }
  }
}
