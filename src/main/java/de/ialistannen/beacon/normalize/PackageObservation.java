package de.ialistannen.beacon.normalize;

import de.ialistannen.beacon.model.Ecosystem;
import de.ialistannen.beacon.model.PackageKey;
import java.util.Optional;

/**
 * A package as reported by one tool.
 */
record PackageObservation(String name, String version, Ecosystem ecosystem, Optional<String> purl) {

  PackageKey key() {
    return new PackageKey(name, version, ecosystem);
  }
}
