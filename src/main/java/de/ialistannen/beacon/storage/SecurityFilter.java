package de.ialistannen.beacon.storage;

import java.util.Locale;

public enum SecurityFilter {
  /**
   * No restriction.
   */
  ANY,
  /**
   * No vulnerabilities at all.
   */
  SECURE,
  /**
   * No critical and no high vulnerabilities.
   */
  SAFE,
  /**
   * At least one vulnerability.
   */
  VULNERABLE;

  public static SecurityFilter fromString(String value) {
    return valueOf(value.strip().toUpperCase(Locale.ROOT));
  }
}
