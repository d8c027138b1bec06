package de.ialistannen.beacon.recommend;

import java.util.Locale;

/**
 * Size categories, ordered from smallest to largest.
 */
public enum SizePreference {
  MINIMAL,
  BALANCED,
  FULL;

  /**
   * @param other the other category
   * @return the number of categories between this and the other one
   */
  public int distanceTo(SizePreference other) {
    return Math.abs(ordinal() - other.ordinal());
  }

  public static SizePreference fromString(String value) {
    return valueOf(value.strip().toUpperCase(Locale.ROOT));
  }
}
