package de.ialistannen.beacon.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes image names and tags that are specific to one CPU architecture or platform variant.
 */
public final class PlatformNames {

  private static final Pattern PLATFORM_PATTERN = Pattern.compile(
    "(^|[-_:/.])"
      + "(arm|amd|x86|x86_64|aarch64|arm64|armhf|armv6|armv7|i386|i686|x64|amd64|intel|apple|m1|m2|azl)"
      + "\\d*([-_:/.]|$)"
  );

  private PlatformNames() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param name an image name or tag
   * @return true if the name contains a platform keyword as a separate component
   */
  public static boolean isPlatformSpecific(String name) {
    return PLATFORM_PATTERN.matcher(name.toLowerCase(Locale.ROOT)).find();
  }
}
