package de.ialistannen.beacon.recommend;

import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.LanguageRuntime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds requirements describing an already scanned image, to find images similar to it.
 */
public class RequirementsDeriver {

  private static final int MAX_PACKAGES = 20;
  private static final Pattern MAJOR_MINOR = Pattern.compile("^(\\d+)\\.(\\d+)");

  /**
   * Derives requirements from an image: its primary language runtime, that runtime's version (if known) and up to
   * {@value #MAX_PACKAGES} of its language-ecosystem packages. The primary runtime is the first one with a known
   * version, or the first one if no version is known at all.
   *
   * @param record the image to describe
   * @param sizePreference the size preference to use
   * @param securityLevel the security level to use
   * @return the derived requirements
   * @throws IllegalArgumentException if the image has no detected language runtime
   */
  public Requirements fromImage(ImageRecord record, SizePreference sizePreference, SecurityLevel securityLevel) {
    return withVersion(record, primaryRuntime(record), sizePreference, securityLevel, Optional.empty());
  }

  /**
   * Derives increasingly relaxed requirements from an image. The first entry is {@link #fromImage}, followed by the
   * same requirements with the version cut to {@code major.minor} and finally without any version constraint.
   * Entries that would repeat the previous one are left out.
   *
   * @param record the image to describe
   * @param sizePreference the size preference to use
   * @param securityLevel the security level to use
   * @return the requirements to try in order, never empty
   * @throws IllegalArgumentException if the image has no detected language runtime
   */
  public List<Requirements> relaxedFromImage(
    ImageRecord record,
    SizePreference sizePreference,
    SecurityLevel securityLevel
  ) {
    LanguageRuntime primary = primaryRuntime(record);
    List<Requirements> attempts = new ArrayList<>();
    attempts.add(withVersion(record, primary, sizePreference, securityLevel, Optional.empty()));

    if (primary.version().isEmpty()) {
      return attempts;
    }

    Matcher matcher = MAJOR_MINOR.matcher(primary.version());
    if (matcher.find()) {
      String majorMinor = matcher.group(1) + "." + matcher.group(2);
      if (!majorMinor.equals(primary.version())) {
        attempts.add(withVersion(record, primary, sizePreference, securityLevel, Optional.of(majorMinor)));
      }
    }
    attempts.add(withVersion(record, new LanguageRuntime(primary.language(), ""), sizePreference, securityLevel,
      Optional.empty()));

    return attempts;
  }

  private static LanguageRuntime primaryRuntime(ImageRecord record) {
    if (record.runtimes().isEmpty()) {
      throw new IllegalArgumentException("Image " + record.reference() + " has no detected language runtime");
    }
    return record.runtimes().stream()
      .filter(it -> !it.version().isEmpty())
      .findFirst()
      .orElse(record.runtimes().get(0));
  }

  private static Requirements withVersion(
    ImageRecord record,
    LanguageRuntime runtime,
    SizePreference sizePreference,
    SecurityLevel securityLevel,
    Optional<String> versionOverride
  ) {
    List<String> packages = record.packages().stream()
      .filter(it -> !it.ecosystem().isOperatingSystem())
      .map(ImagePackage::name)
      .distinct()
      .limit(MAX_PACKAGES)
      .toList();

    Requirements.Builder builder = Requirements.forLanguage(runtime.language())
      .packages(packages)
      .sizePreference(sizePreference)
      .securityLevel(securityLevel);
    String version = versionOverride.orElse(runtime.version());
    if (!version.isEmpty()) {
      builder.version(version);
    }
    return builder.build();
  }
}
