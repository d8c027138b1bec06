package de.ialistannen.beacon.model;

import java.util.Comparator;

/**
 * A detected language runtime.
 *
 * @param language the lower case language family, e.g. {@code python}
 * @param version the detected version, possibly partial (e.g. {@code 3.12}), empty if unknown
 */
public record LanguageRuntime(String language, String version) implements Comparable<LanguageRuntime> {

  private static final Comparator<LanguageRuntime> ORDER = Comparator
    .comparing(LanguageRuntime::language)
    .thenComparing(LanguageRuntime::version);

  @Override
  public int compareTo(LanguageRuntime other) {
    return ORDER.compare(this, other);
  }
}
