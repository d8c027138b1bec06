package de.ialistannen.beacon.normalize;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One entry of the language detection table: a package name pattern implying a runtime of a language family.
 *
 * @param language the language family
 * @param namePattern the pattern a package name must fully match. An optional {@code version} group extracts a
 *   version from the name itself, e.g. {@code python3.12}.
 */
public record LanguageRule(String language, Pattern namePattern) {

  /**
   * @param language the language family
   * @param regex the name pattern
   * @return the rule
   */
  public static LanguageRule of(String language, String regex) {
    return new LanguageRule(language, Pattern.compile(regex));
  }

  public boolean matches(String packageName) {
    return namePattern.matcher(packageName).matches();
  }

  /**
   * @param packageName a package name matched by this rule
   * @return the version encoded in the name, if the pattern has a {@code version} group
   */
  public Optional<String> versionFromName(String packageName) {
    Matcher matcher = namePattern.matcher(packageName);
    if (!matcher.matches() || !namePattern.pattern().contains("(?<version>")) {
      return Optional.empty();
    }
    return Optional.ofNullable(matcher.group("version"));
  }
}
