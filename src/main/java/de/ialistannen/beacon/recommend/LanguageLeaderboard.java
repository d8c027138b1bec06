package de.ialistannen.beacon.recommend;

import com.google.common.collect.ComparisonChain;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.VulnerabilityCounts;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Ranks the stored images of every detected language without further requirements: fewest critical, then high, then
 * total vulnerabilities, then the smallest known size.
 */
public class LanguageLeaderboard {

  private static final Comparator<ImageRecord> ORDER = (first, second) -> ComparisonChain.start()
    .compare(first.counts().critical(), second.counts().critical())
    .compare(first.counts().high(), second.counts().high())
    .compare(first.counts().total(), second.counts().total())
    .compareFalseFirst(first.sizeBytes() <= 0, second.sizeBytes() <= 0)
    .compare(first.sizeBytes(), second.sizeBytes())
    .compare(first.reference().fullName(), second.reference().fullName())
    .compare(first.digest(), second.digest())
    .result();

  /**
   * @param records the images to rank
   * @param topN the maximum number of images per language
   * @return one ranking per language, sorted by language
   * @throws IllegalArgumentException if {@code topN} is not positive
   */
  public List<LanguageRanking> rank(Collection<ImageRecord> records, int topN) {
    if (topN < 1) {
      throw new IllegalArgumentException("Top N must be positive, was " + topN);
    }

    Map<String, ImageRecord> byDigest = new LinkedHashMap<>();
    for (ImageRecord record : records) {
      byDigest.putIfAbsent(record.digest(), record);
    }

    TreeSet<String> languages = new TreeSet<>();
    byDigest.values().forEach(record -> record.runtimes().forEach(it -> languages.add(it.language())));

    List<LanguageRanking> result = new ArrayList<>();
    for (String language : languages) {
      List<ImageRecord> ranked = byDigest.values().stream()
        .filter(it -> !it.runtimesFor(language).isEmpty())
        .sorted(ORDER)
        .limit(topN)
        .toList();

      List<Entry> entries = new ArrayList<>();
      for (int i = 0; i < ranked.size(); i++) {
        ImageRecord record = ranked.get(i);
        String version = record.runtimesFor(language).stream()
          .map(LanguageRuntime::version)
          .filter(it -> !it.isEmpty())
          .findFirst()
          .orElse("");
        entries.add(new Entry(
          i + 1,
          record.reference(),
          record.digest(),
          version,
          record.counts(),
          record.sizeBytes()
        ));
      }
      result.add(new LanguageRanking(language, entries));
    }
    return result;
  }

  /**
   * @param language the language
   * @param entries the best images for it, best first
   */
  public record LanguageRanking(String language, List<Entry> entries) {

  }

  /**
   * @param rank the 1-based rank within the language
   * @param reference the image reference
   * @param digest the image digest
   * @param version the detected runtime version, empty if unknown
   * @param counts the vulnerability counts
   * @param sizeBytes the image size, 0 if unknown
   */
  public record Entry(
    int rank,
    ImageReference reference,
    String digest,
    String version,
    VulnerabilityCounts counts,
    long sizeBytes
  ) {

  }
}
