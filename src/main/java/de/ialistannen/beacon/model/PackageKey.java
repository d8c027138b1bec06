package de.ialistannen.beacon.model;

import java.util.Comparator;

/**
 * The identity of a package within one image.
 */
public record PackageKey(String name, String version, Ecosystem ecosystem) implements Comparable<PackageKey> {

  private static final Comparator<PackageKey> ORDER = Comparator
    .comparing(PackageKey::ecosystem)
    .thenComparing(PackageKey::name)
    .thenComparing(PackageKey::version);

  @Override
  public int compareTo(PackageKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return name + "@" + version + " (" + ecosystem.purlType() + ")";
  }
}
