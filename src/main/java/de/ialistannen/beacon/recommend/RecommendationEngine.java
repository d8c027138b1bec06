package de.ialistannen.beacon.recommend;

import com.google.common.collect.ComparisonChain;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.PlatformNames;
import de.ialistannen.beacon.model.VulnerabilityCounts;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Filters image records by hard requirements and ranks the survivors.
 * <p>
 * Ranking is a lexicographic comparison, ascending on: critical vulnerabilities, high vulnerabilities, total
 * vulnerabilities, distance to the requested size category and size in bytes. Remaining ties are broken by higher
 * package coverage, the reference and finally the digest, so the order never depends on the input order.
 */
public class RecommendationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecommendationEngine.class);
  private static final int UNKNOWN_SIZE_DISTANCE = SizePreference.values().length;

  private static final Comparator<Candidate> RANKING = (first, second) -> ComparisonChain.start()
    .compare(first.score().critical(), second.score().critical())
    .compare(first.score().high(), second.score().high())
    .compare(first.score().total(), second.score().total())
    .compare(first.score().sizeDistance(), second.score().sizeDistance())
    .compare(first.score().sizeBytes(), second.score().sizeBytes())
    .compare(second.score().packageCoverage(), first.score().packageCoverage())
    .compare(first.record().reference().fullName(), second.record().reference().fullName())
    .compare(first.record().digest(), second.record().digest())
    .result();

  private final SizeThresholds sizeThresholds;

  public RecommendationEngine(SizeThresholds sizeThresholds) {
    this.sizeThresholds = sizeThresholds;
  }

  /**
   * Recommends images for the given requirements.
   *
   * @param requirements the requirements
   * @param candidates the images to choose from
   * @param limit the maximum number of results
   * @return the ranked images, empty if no candidate qualifies
   * @throws IllegalArgumentException if the limit is not positive
   */
  public List<RankedImage> recommend(Requirements requirements, Collection<ImageRecord> candidates, int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("Limit must be positive, was " + limit);
    }

    Map<String, ImageRecord> byDigest = new LinkedHashMap<>();
    for (ImageRecord candidate : candidates) {
      byDigest.putIfAbsent(candidate.digest(), candidate);
    }

    List<Candidate> survivors = new ArrayList<>();
    for (ImageRecord record : byDigest.values()) {
      evaluate(requirements, record).ifPresent(survivors::add);
    }
    survivors.sort(RANKING);

    LOGGER.debug("{} of {} candidates satisfy the requirements", survivors.size(), byDigest.size());

    List<RankedImage> ranked = new ArrayList<>();
    for (int i = 0; i < Math.min(limit, survivors.size()); i++) {
      Candidate candidate = survivors.get(i);
      ranked.add(new RankedImage(
        i + 1,
        candidate.record().reference(),
        candidate.record().digest(),
        candidate.score(),
        candidate.reasoning()
      ));
    }
    return ranked;
  }

  /**
   * Recommends images for the first requirements in {@code attempts} that yields any result.
   *
   * @param attempts the requirements to try, strictest first
   * @param candidates the images to choose from
   * @param limit the maximum number of results
   * @return the result of the first successful attempt, or an empty result for the last one
   * @throws IllegalArgumentException if there are no attempts or the limit is not positive
   */
  public RelaxedRecommendation recommendRelaxing(
    List<Requirements> attempts,
    Collection<ImageRecord> candidates,
    int limit
  ) {
    if (attempts.isEmpty()) {
      throw new IllegalArgumentException("No requirements to try");
    }
    for (int i = 0; i < attempts.size(); i++) {
      List<RankedImage> ranked = recommend(attempts.get(i), candidates, limit);
      if (!ranked.isEmpty()) {
        if (i > 0) {
          LOGGER.info("Found {} images after relaxing the requirements {} time(s)", ranked.size(), i);
        }
        return new RelaxedRecommendation(attempts.get(i), i > 0, ranked);
      }
    }
    LOGGER.info("No image matched, even after relaxing the requirements");
    return new RelaxedRecommendation(attempts.get(attempts.size() - 1), attempts.size() > 1, List.of());
  }

  private Optional<Candidate> evaluate(Requirements requirements, ImageRecord record) {
    List<String> passed = new ArrayList<>();

    List<LanguageRuntime> runtimes = record.runtimesFor(requirements.language());
    if (runtimes.isEmpty()) {
      return reject(record, "no " + requirements.language() + " runtime");
    }
    passed.add("language: " + describe(runtimes));

    if (requirements.version().isPresent()) {
      List<LanguageRuntime> matching = runtimes.stream()
        .filter(it -> requirements.version().get().matches(it.version()))
        .toList();
      if (matching.isEmpty()) {
        return reject(record, "no runtime version satisfies " + requirements.version().get());
      }
      passed.add("version: " + describe(matching));
    }

    VulnerabilityCounts counts = record.counts();
    if (exceeds(counts.critical(), requirements.maxCritical())) {
      return reject(record, "too many critical vulnerabilities");
    }
    if (exceeds(counts.high(), requirements.maxHigh())) {
      return reject(record, "too many high vulnerabilities");
    }
    if (exceeds(counts.total(), requirements.maxTotal())) {
      return reject(record, "too many vulnerabilities");
    }
    if (requirements.maxCritical().isPresent()
      || requirements.maxHigh().isPresent()
      || requirements.maxTotal().isPresent()) {
      passed.add(
        "vulnerability ceilings: critical=" + counts.critical()
          + ", high=" + counts.high()
          + ", total=" + counts.total()
      );
    }

    Optional<SizePreference> sizeCategory = sizeThresholds.categorize(record.sizeBytes());
    boolean fullSize = sizeCategory.filter(it -> it == SizePreference.FULL).isPresent();

    List<String> missingPackages = missingPackages(requirements, record);
    double coverage = requirements.packages().isEmpty()
      ? 1.0
      : (double) (requirements.packages().size() - missingPackages.size()) / requirements.packages().size();
    if (!requirements.packages().isEmpty()) {
      if (!missingPackages.isEmpty() && !fullSize) {
        return reject(record, "missing packages " + missingPackages);
      }
      if (missingPackages.isEmpty()) {
        passed.add("packages: all " + requirements.packages().size() + " present");
      } else {
        passed.add("packages: exempt as full size image, coverage " + Math.round(coverage * 100) + "%");
      }
    }

    if (requirements.excludePlatformSpecific()) {
      String repository = record.reference().repository();
      String lastSegment = repository.substring(repository.lastIndexOf('/') + 1);
      if (PlatformNames.isPlatformSpecific(record.reference().tag())
        || PlatformNames.isPlatformSpecific(lastSegment)) {
        return reject(record, "platform specific tag");
      }
      passed.add("platform: generic tag");
    }

    int sizeDistance = sizeCategory
      .map(it -> it.distanceTo(requirements.sizePreference()))
      .orElse(UNKNOWN_SIZE_DISTANCE);

    ScoreBreakdown score = new ScoreBreakdown(
      counts.critical(),
      counts.high(),
      counts.total(),
      sizeCategory,
      sizeDistance,
      record.sizeBytes(),
      coverage
    );
    Optional<Boolean> meetsMaximumSecurity = Optional.empty();
    if (requirements.securityLevel() == SecurityLevel.MAXIMUM) {
      meetsMaximumSecurity = Optional.of(counts.critical() == 0 && counts.high() == 0);
    }

    return Optional.of(new Candidate(record, score, new Reasoning(passed, missingPackages, meetsMaximumSecurity)));
  }

  private static List<String> missingPackages(Requirements requirements, ImageRecord record) {
    Set<String> installed = record.packageNames();
    return requirements.packages().stream()
      .filter(it -> !installed.contains(it.toLowerCase(Locale.ROOT)))
      .toList();
  }

  private static boolean exceeds(int count, Optional<Integer> ceiling) {
    return ceiling.isPresent() && count > ceiling.get();
  }

  private static String describe(List<LanguageRuntime> runtimes) {
    return runtimes.stream()
      .map(it -> it.language() + (it.version().isEmpty() ? "" : " " + it.version()))
      .collect(Collectors.joining(", "));
  }

  private static Optional<Candidate> reject(ImageRecord record, String reason) {
    LOGGER.debug("Rejecting {}: {}", record.reference(), reason);
    return Optional.empty();
  }

  private record Candidate(ImageRecord record, ScoreBreakdown score, Reasoning reasoning) {

  }
}
