package de.ialistannen.beacon.orchestrator;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.PlatformNames;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Selects the enumerated tags of a repository worth scanning: versioned release tags, newest first.
 */
public class TagFilter {

  private static final Set<String> SKIPPED_TAGS = Set.of("latest", "dev", "nightly", "edge", "rc", "beta", "alpha");
  private static final List<String> SKIPPED_KEYWORDS = List.of("debug", "test", "experimental");
  private static final Pattern NUMBER_OR_TEXT = Pattern.compile("\\d+|\\D+");

  private final int maxTags;

  /**
   * @param maxTags the maximum number of tags to keep, 0 for all
   */
  public TagFilter(int maxTags) {
    if (maxTags < 0) {
      throw new IllegalArgumentException("maxTags must not be negative, was " + maxTags);
    }
    this.maxTags = maxTags;
  }

  /**
   * @param references the enumerated references
   * @return the references to scan, ordered by descending version
   */
  public List<ImageReference> select(Collection<ImageReference> references) {
    List<ImageReference> selected = references.stream()
      .distinct()
      .filter(it -> isRelease(it.tag()))
      .sorted(
        Comparator.comparing(ImageReference::tag, TagFilter::compareNatural)
          .thenComparing(ImageReference::tag)
          .reversed()
      )
      .toList();

    if (maxTags > 0 && selected.size() > maxTags) {
      return selected.subList(0, maxTags);
    }
    return selected;
  }

  static boolean isRelease(String tag) {
    String lower = tag.toLowerCase(Locale.ROOT);
    if (SKIPPED_TAGS.contains(lower)) {
      return false;
    }
    if (SKIPPED_KEYWORDS.stream().anyMatch(lower::contains)) {
      return false;
    }
    if (PlatformNames.isPlatformSpecific(lower)) {
      return false;
    }
    return lower.chars().anyMatch(Character::isDigit);
  }

  /**
   * Compares tags so that numeric runs are compared by value: {@code 3.9 < 3.12}.
   */
  static int compareNatural(String first, String second) {
    Matcher left = NUMBER_OR_TEXT.matcher(first);
    Matcher right = NUMBER_OR_TEXT.matcher(second);

    while (true) {
      boolean hasLeft = left.find();
      boolean hasRight = right.find();
      if (!hasLeft || !hasRight) {
        return Boolean.compare(hasLeft, hasRight);
      }

      String leftPart = left.group();
      String rightPart = right.group();
      boolean leftNumeric = Character.isDigit(leftPart.charAt(0));
      boolean rightNumeric = Character.isDigit(rightPart.charAt(0));

      int result;
      if (leftNumeric && rightNumeric) {
        result = compareNumbers(leftPart, rightPart);
      } else {
        result = leftPart.compareTo(rightPart);
      }
      if (result != 0) {
        return result;
      }
    }
  }

  private static int compareNumbers(String first, String second) {
    String left = first.replaceFirst("^0+(?=\\d)", "");
    String right = second.replaceFirst("^0+(?=\\d)", "");
    if (left.length() != right.length()) {
      return Integer.compare(left.length(), right.length());
    }
    return left.compareTo(right);
  }
}
