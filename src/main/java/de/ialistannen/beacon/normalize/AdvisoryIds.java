package de.ialistannen.beacon.normalize;

import java.util.Collection;
import java.util.Locale;

/**
 * Reconciles advisory identifiers between tools. Tools reporting a GHSA or distribution advisory usually list the
 * CVE it corresponds to, findings are keyed by that CVE so they merge with tools reporting the CVE directly.
 */
final class AdvisoryIds {

  private AdvisoryIds() {
    throw new UnsupportedOperationException("No instantiation");
  }

  static String canonical(String id, Collection<String> relatedIds) {
    String normalized = id.strip();
    if (isCve(normalized)) {
      return normalized.toUpperCase(Locale.ROOT);
    }
    return relatedIds.stream()
      .map(String::strip)
      .filter(AdvisoryIds::isCve)
      .map(it -> it.toUpperCase(Locale.ROOT))
      .sorted()
      .findFirst()
      .orElse(normalized);
  }

  private static boolean isCve(String id) {
    return id.regionMatches(true, 0, "CVE-", 0, 4);
  }
}
