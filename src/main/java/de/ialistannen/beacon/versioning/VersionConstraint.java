package de.ialistannen.beacon.versioning;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.semver4j.Semver;

public sealed interface VersionConstraint {

  /**
   * Checks whether a detected runtime version satisfies this constraint.
   *
   * @param version the detected version, possibly partial like {@code 3.12}
   * @return true if the version satisfies the constraint
   */
  boolean matches(String version);

  /**
   * Parses a constraint. Plain dotted numbers ({@code 3}, {@code 3.12}, {@code 3.12.4}) match exactly or by prefix,
   * anything else is treated as a semantic version range like {@code >=3.11 <3.13} or {@code ^20}.
   *
   * @param constraint the string representation of the constraint
   * @return the constraint
   * @throws IllegalArgumentException if the constraint is empty or not a valid range
   */
  static VersionConstraint parse(String constraint) {
    String trimmed = constraint == null ? "" : constraint.strip();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("Empty version constraint");
    }
    if (ComponentConstraint.PLAIN_VERSION.matcher(trimmed).matches()) {
      return new ComponentConstraint(components(trimmed));
    }
    try {
      new Semver("0.0.0").satisfies(trimmed);
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Invalid version range: " + trimmed, e);
    }
    return new RangeConstraint(trimmed);
  }

  /**
   * Matches if the requested components are a component-wise prefix of the detected version. {@code 3.12} thereby
   * matches {@code 3.12} and {@code 3.12.4}, but neither {@code 3.120} nor the less specific {@code 3}.
   *
   * @param components the numeric components of the requested version
   */
  record ComponentConstraint(List<Integer> components) implements VersionConstraint {

    private static final Pattern PLAIN_VERSION = Pattern.compile("\\d+(\\.\\d+)*");

    @Override
    public boolean matches(String version) {
      List<Integer> actual = VersionConstraint.components(version);
      if (actual.size() < components.size()) {
        return false;
      }
      return actual.subList(0, components.size()).equals(components);
    }

    @Override
    public String toString() {
      return components.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
  }

  record RangeConstraint(String range) implements VersionConstraint {

    @Override
    public boolean matches(String version) {
      Semver parsed = Semver.coerce(version);
      if (parsed == null) {
        return false;
      }
      return parsed.satisfies(range);
    }

    @Override
    public String toString() {
      return range;
    }
  }

  /**
   * @param version a version string
   * @return the leading numeric dot separated components
   */
  private static List<Integer> components(String version) {
    List<Integer> result = new ArrayList<>();
    for (String part : version.strip().split("\\.")) {
      if (part.isEmpty() || !part.chars().allMatch(Character::isDigit)) {
        break;
      }
      try {
        result.add(Integer.parseInt(part));
      } catch (NumberFormatException e) {
        break;
      }
    }
    return result;
  }
}
