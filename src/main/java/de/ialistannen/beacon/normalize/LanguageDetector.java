package de.ialistannen.beacon.normalize;

import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.LanguageRuntime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives language runtimes from installed packages using an ordered rule table. Rules are tried in table order,
 * the first rule of a language family matching any package decides the runtime of that family. OS packages are
 * preferred over packages of language package managers.
 */
public class LanguageDetector {

  private static final Pattern NUMERIC_VERSION = Pattern.compile("^(?:\\d+:)?v?(\\d+(?:\\.\\d+)*)");
  private static final Pattern DOTNET_REPOSITORY = Pattern.compile("(^|.*/)dotnet/(runtime|aspnet|sdk)$");
  private static final Pattern MAJOR_MINOR_TAG = Pattern.compile("^(\\d+\\.\\d+).*");
  private static final List<String> IGNORED_SUFFIXES = List.of("-dev", "-devel", "-doc", "-docs");

  private final List<LanguageRule> rules;
  private final Set<String> excludedNames;

  public LanguageDetector(List<LanguageRule> rules, Set<String> excludedNames) {
    this.rules = List.copyOf(rules);
    this.excludedNames = Set.copyOf(excludedNames);
  }

  /**
   * @return a detector using the built-in rule table
   */
  public static LanguageDetector withDefaultRules() {
    return new LanguageDetector(
      List.of(
        LanguageRule.of("python", "python(?<version>3\\.\\d+)"),
        LanguageRule.of("python", "python3"),
        LanguageRule.of("python", "python"),
        LanguageRule.of("python", "python(?<version>3\\.\\d+)-.*"),
        LanguageRule.of("node", "nodejs"),
        LanguageRule.of("node", "node"),
        LanguageRule.of("java", "(ms)?openjdk.*"),
        LanguageRule.of("java", "java"),
        LanguageRule.of("java", "jre.*"),
        LanguageRule.of("java", "jdk.*"),
        LanguageRule.of("go", "golang"),
        LanguageRule.of("go", "go"),
        LanguageRule.of("ruby", "ruby"),
        LanguageRule.of("ruby", "ruby\\d.*"),
        LanguageRule.of("php", "php"),
        LanguageRule.of("php", "php\\d.*"),
        LanguageRule.of("dotnet", "dotnet-runtime-\\d.*"),
        LanguageRule.of("dotnet", "aspnetcore-runtime-\\d.*"),
        LanguageRule.of("dotnet", "dotnet-sdk-\\d.*"),
        LanguageRule.of("dotnet", "microsoft\\.netcore\\.app.*"),
        LanguageRule.of("dotnet", "microsoft\\.aspnetcore\\.app.*"),
        LanguageRule.of("dotnet", "dotnet.*"),
        LanguageRule.of("dotnet", "aspnetcore.*"),
        LanguageRule.of("dotnet", "netstandard.*"),
        LanguageRule.of("rust", "rust"),
        LanguageRule.of("rust", "cargo"),
        LanguageRule.of("perl", "perl"),
        LanguageRule.of("lua", "lua"),
        LanguageRule.of("lua", "lua\\d.*")
      ),
      Set.of(
        "python-wheel", "python-pip", "python-setuptools", "python-distutils", "python-pkg-resources",
        "python-six", "python-urllib3", "python-requests", "python-chardet", "python-certifi", "python-idna",
        "python-pysocks", "nodejs-npm", "node-gyp", "java-common"
      )
    );
  }

  /**
   * Detects the language runtimes of an image.
   *
   * @param reference the image reference, used for images whose runtime is not visible as a package
   * @param packages the installed packages
   * @return the detected runtimes, at most one per language family, sorted by language
   */
  public List<LanguageRuntime> detect(ImageReference reference, Collection<ImagePackage> packages) {
    List<ImagePackage> candidates = packages.stream()
      .filter(it -> isCandidate(it.name()))
      .sorted(
        Comparator.comparing((ImagePackage it) -> !it.ecosystem().isOperatingSystem())
          .thenComparing(Comparator.naturalOrder())
      )
      .toList();

    Set<String> decidedLanguages = new LinkedHashSet<>();
    List<LanguageRuntime> runtimes = new ArrayList<>();

    for (LanguageRule rule : rules) {
      if (decidedLanguages.contains(rule.language())) {
        continue;
      }
      for (ImagePackage candidate : candidates) {
        String name = candidate.name().toLowerCase(Locale.ROOT);
        if (!rule.matches(name)) {
          continue;
        }
        runtimes.add(new LanguageRuntime(rule.language(), versionOf(rule, name, candidate.version())));
        decidedLanguages.add(rule.language());
        break;
      }
    }

    if (!decidedLanguages.contains("dotnet")) {
      dotnetFromReference(reference).ifPresent(runtimes::add);
    }

    runtimes.sort(Comparator.naturalOrder());
    return runtimes;
  }

  private boolean isCandidate(String packageName) {
    String name = packageName.toLowerCase(Locale.ROOT);
    if (excludedNames.contains(name)) {
      return false;
    }
    return IGNORED_SUFFIXES.stream().noneMatch(name::endsWith);
  }

  private static String versionOf(LanguageRule rule, String packageName, String packageVersion) {
    Optional<String> fromName = rule.versionFromName(packageName);
    String numeric = numericVersion(packageVersion);

    if (fromName.isPresent()) {
      String nameVersion = fromName.get();
      if (numeric.equals(nameVersion) || numeric.startsWith(nameVersion + ".")) {
        return numeric;
      }
      return nameVersion;
    }
    return numeric;
  }

  /**
   * @param version a package version like {@code 1:3.12.3-4.azl3}
   * @return the leading dotted numeric part, e.g. {@code 3.12.3}, or an empty string
   */
  static String numericVersion(String version) {
    Matcher matcher = NUMERIC_VERSION.matcher(version.strip());
    if (matcher.find()) {
      return matcher.group(1);
    }
    return "";
  }

  private static Optional<LanguageRuntime> dotnetFromReference(ImageReference reference) {
    if (!DOTNET_REPOSITORY.matcher(reference.repository()).matches()) {
      return Optional.empty();
    }
    Matcher matcher = MAJOR_MINOR_TAG.matcher(reference.tag());
    if (!matcher.matches()) {
      return Optional.empty();
    }
    return Optional.of(new LanguageRuntime("dotnet", matcher.group(1)));
  }
}
