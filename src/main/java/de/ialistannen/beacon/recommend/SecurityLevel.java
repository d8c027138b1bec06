package de.ialistannen.beacon.recommend;

import java.util.Locale;

public enum SecurityLevel {
  BASIC,
  HIGH,
  MAXIMUM;

  public static SecurityLevel fromString(String value) {
    return valueOf(value.strip().toUpperCase(Locale.ROOT));
  }
}
