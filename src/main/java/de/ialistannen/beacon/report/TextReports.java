package de.ialistannen.beacon.report;

import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.VulnerabilityCounts;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.recommend.LanguageLeaderboard.Entry;
import de.ialistannen.beacon.recommend.LanguageLeaderboard.LanguageRanking;
import de.ialistannen.beacon.recommend.RankedImage;
import de.ialistannen.beacon.storage.ImagePage;
import de.ialistannen.beacon.storage.StoreStatistics;
import de.ialistannen.beacon.storage.StoreStatistics.LanguageSummary;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders results for humans.
 */
public final class TextReports {

  private TextReports() {
    throw new UnsupportedOperationException("No instantiation");
  }

  public static String recommendations(List<RankedImage> rankedImages) {
    if (rankedImages.isEmpty()) {
      return "No image matches the requirements.";
    }

    StringBuilder result = new StringBuilder();
    for (RankedImage image : rankedImages) {
      result.append("""
        #%d %s
           digest:   %s
           vulns:    %d critical, %d high, %d total
           size:     %s (%s, distance %d)
           coverage: %d%%
           passed:   %s
        """.formatted(
        image.rank(),
        image.reference().fullName(),
        image.digest(),
        image.score().critical(),
        image.score().high(),
        image.score().total(),
        formatBytes(image.score().sizeBytes()),
        image.score().sizeCategory().map(it -> it.name().toLowerCase(Locale.ROOT)).orElse("unknown"),
        image.score().sizeDistance(),
        Math.round(image.score().packageCoverage() * 100),
        String.join("; ", image.reasoning().passedFilters())
      ));
      if (!image.reasoning().missingPackages().isEmpty()) {
        result.append("   missing:  ").append(String.join(", ", image.reasoning().missingPackages())).append("\n");
      }
      image.reasoning().meetsMaximumSecurity().ifPresent(meets -> result.append(
        meets ? "   meets maximum security\n" : "   does NOT meet maximum security\n"
      ));
    }
    return result.toString().stripTrailing();
  }

  public static String image(ImageRecord record) {
    VulnerabilityCounts counts = record.counts();
    return "%s  %s  %s  [%s]  vulns %d/%d/%d (critical/high/total)%s".formatted(
      record.reference().fullName(),
      shortDigest(record.digest()),
      formatBytes(record.sizeBytes()),
      record.runtimes().stream().map(TextReports::runtime).collect(Collectors.joining(", ")),
      counts.critical(),
      counts.high(),
      counts.total(),
      record.comprehensive() ? "" : "  (packages only)"
    );
  }

  public static String page(ImagePage page) {
    if (page.records().isEmpty()) {
      return "No images found.";
    }
    String images = page.records().stream().map(TextReports::image).collect(Collectors.joining("\n"));
    return images + "\nPage %d of %d (%d images)".formatted(page.page(), page.pageCount(), page.totalCount());
  }

  public static String statistics(StoreStatistics statistics) {
    StringBuilder result = new StringBuilder(String.format(Locale.ROOT, """
      Images:                  %d
      Distinct packages:       %d
      Avg. vulnerabilities:    %.2f
      Without vulnerabilities: %d
      Without critical/high:   %d
      """,
      statistics.totalImages(),
      statistics.totalPackages(),
      statistics.avgVulnerabilitiesPerImage(),
      statistics.zeroVulnerabilityCount(),
      statistics.safeImageCount()
    ));
    for (LanguageSummary summary : statistics.languages()) {
      result.append(String.format(
        Locale.ROOT,
        "  %-10s %4d images, avg. %.1f vulnerabilities, avg. size %s%n",
        summary.language(),
        summary.imageCount(),
        summary.averageVulnerabilities(),
        formatBytes(Math.round(summary.averageSizeBytes()))
      ));
    }
    return result.toString().stripTrailing();
  }

  public static String scanReport(RepositoryScanReport report) {
    StringBuilder result = new StringBuilder();
    result.append("Scan of %s: %s%s%n".formatted(
      report.source(),
      report.status(),
      report.cancelled() ? " (cancelled)" : ""
    ));
    for (ImageStatus status : report.images()) {
      result.append("  %-8s %s".formatted(
        status.state(),
        status.reference().map(Object::toString).orElse(report.source())
      ));
      status.error().ifPresent(error -> result.append(": ").append(error));
      result.append("\n");
    }
    return result.toString().stripTrailing();
  }

  /**
   * Renders the per-language rankings as a markdown document with one table per language.
   *
   * @param rankings the rankings
   * @param generatedAt when the rankings were computed
   * @return the markdown
   */
  public static String leaderboard(List<LanguageRanking> rankings, Instant generatedAt) {
    StringBuilder result = new StringBuilder();
    result.append("# Recommended images by language\n\n");
    result.append("_Generated: ").append(generatedAt.truncatedTo(ChronoUnit.MINUTES)).append("_\n\n");
    result.append("Images are ranked by critical, then high, then total vulnerabilities, then image size.\n");

    if (rankings.isEmpty()) {
      return result.append("\nNo languages detected in the store.").toString();
    }
    for (LanguageRanking ranking : rankings) {
      result.append("\n## ").append(ranking.language()).append("\n\n");
      result.append("| Rank | Image | Version | Critical | High | Total | Size | Digest |\n");
      result.append("|------|-------|---------|----------|------|-------|------|--------|\n");
      for (Entry entry : ranking.entries()) {
        result.append("| %d | `%s` | %s | %d | %d | %d | %s | `%s` |\n".formatted(
          entry.rank(),
          entry.reference().fullName(),
          entry.version().isEmpty() ? "-" : entry.version(),
          entry.counts().critical(),
          entry.counts().high(),
          entry.counts().total(),
          entry.sizeBytes() <= 0 ? "-" : formatBytes(entry.sizeBytes()),
          shortDigest(entry.digest())
        ));
      }
    }
    return result.toString().stripTrailing();
  }

  static String formatBytes(long bytes) {
    if (bytes <= 0) {
      return "unknown size";
    }
    if (bytes < 1024 * 1024) {
      return String.format(Locale.ROOT, "%.1f KiB", bytes / 1024.0);
    }
    if (bytes < 1024L * 1024 * 1024) {
      return String.format(Locale.ROOT, "%.1f MiB", bytes / (1024.0 * 1024));
    }
    return String.format(Locale.ROOT, "%.2f GiB", bytes / (1024.0 * 1024 * 1024));
  }

  private static String shortDigest(String digest) {
    String hash = digest.substring(digest.indexOf(':') + 1);
    return hash.length() > 12 ? hash.substring(0, 12) : hash;
  }

  private static String runtime(LanguageRuntime runtime) {
    return runtime.version().isEmpty() ? runtime.language() : runtime.language() + " " + runtime.version();
  }
}
