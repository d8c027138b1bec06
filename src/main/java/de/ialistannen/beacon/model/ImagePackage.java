package de.ialistannen.beacon.model;

/**
 * One installed software component.
 *
 * @param name the package name
 * @param version the installed version
 * @param ecosystem the ecosystem the package belongs to
 * @param purl the package-url coordinate
 */
public record ImagePackage(String name, String version, Ecosystem ecosystem, String purl)
  implements Comparable<ImagePackage> {

  public PackageKey key() {
    return new PackageKey(name, version, ecosystem);
  }

  @Override
  public int compareTo(ImagePackage other) {
    return key().compareTo(other.key());
  }
}
