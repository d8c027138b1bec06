package de.ialistannen.beacon.model;

import java.util.Locale;

/**
 * The normalized severity scale. Declaration order is ascending, so {@link #compareTo(Enum)} orders by impact.
 */
public enum Severity {
  UNKNOWN,
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Maps a tool specific severity label to the normalized scale.
   *
   * @param label the label reported by a tool, may be null
   * @return the severity, {@link #UNKNOWN} if the label is empty or not recognized
   */
  public static Severity parse(String label) {
    if (label == null) {
      return UNKNOWN;
    }
    return switch (label.strip().toLowerCase(Locale.ROOT)) {
      case "critical" -> CRITICAL;
      case "high", "important" -> HIGH;
      case "medium", "moderate" -> MEDIUM;
      case "low", "negligible", "minimal" -> LOW;
      default -> UNKNOWN;
    };
  }

  /**
   * @param other the other severity
   * @return the higher of the two
   */
  public Severity max(Severity other) {
    return compareTo(other) >= 0 ? this : other;
  }

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
