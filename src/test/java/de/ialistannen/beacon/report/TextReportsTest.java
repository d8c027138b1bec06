package de.ialistannen.beacon.report;

import static org.assertj.core.api.Assertions.assertThat;

import de.ialistannen.beacon.TestRecords;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.Severity;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.recommend.LanguageLeaderboard;
import de.ialistannen.beacon.recommend.RankedImage;
import de.ialistannen.beacon.recommend.Reasoning;
import de.ialistannen.beacon.recommend.ScoreBreakdown;
import de.ialistannen.beacon.recommend.SizePreference;
import de.ialistannen.beacon.storage.ImagePage;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TextReportsTest {

  @ParameterizedTest
  @CsvSource({
    "0, unknown size",
    "-1, unknown size",
    "512, 0.5 KiB",
    "1536, 1.5 KiB",
    "83886080, 80.0 MiB",
    "1610612736, 1.50 GiB",
  })
  void formatsSizes(long bytes, String expected) {
    assertThat(TextReports.formatBytes(bytes)).isEqualTo(expected);
  }

  @Test
  void explainsEmptyResults() {
    assertThat(TextReports.recommendations(List.of())).isEqualTo("No image matches the requirements.");
    assertThat(TextReports.page(new ImagePage(List.of(), 0, 1, 20))).isEqualTo("No images found.");
  }

  @Test
  void rendersRecommendation() {
    RankedImage ranked = new RankedImage(
      1,
      new ImageReference("mcr.microsoft.com", "azurelinux/base/python", "3.12"),
      "sha256:0123456789abcdef",
      new ScoreBreakdown(0, 1, 4, Optional.of(SizePreference.BALANCED), 0, 80 * TestRecords.MIB, 0.5),
      new Reasoning(List.of("language: python 3.12.3"), List.of("numpy"), Optional.of(false))
    );

    String text = TextReports.recommendations(List.of(ranked));

    assertThat(text)
      .startsWith("#1 mcr.microsoft.com/azurelinux/base/python:3.12")
      .contains("0 critical, 1 high, 4 total")
      .contains("80.0 MiB (balanced, distance 0)")
      .contains("coverage: 50%")
      .contains("missing:  numpy")
      .endsWith("does NOT meet maximum security");
  }

  @Test
  void summarizesImage() {
    ImageRecord record = TestRecords.image("azurelinux/base/python", "3.12")
      .digest("sha256:0123456789abcdef")
      .runtime("python", "3.12.3")
      .vulnerabilities(Severity.CRITICAL, 1)
      .vulnerabilities(Severity.LOW, 2)
      .packagesOnly()
      .build();

    assertThat(TextReports.image(record)).isEqualTo(
      "mcr.microsoft.com/azurelinux/base/python:3.12  0123456789ab  100.0 MiB  [python 3.12.3]"
        + "  vulns 1/0/3 (critical/high/total)  (packages only)"
    );
  }

  @Test
  void listsFailuresOfScanReport() {
    ImageReference reference = new ImageReference("mcr.microsoft.com", "azurelinux/base/python", "3.12");
    RepositoryScanReport report = new RepositoryScanReport(
      "mcr.microsoft.com/azurelinux/base/python",
      List.of(
        ImageStatus.scanned(reference, TestRecords.image("azurelinux/base/python", "3.12").build()),
        ImageStatus.failed(reference.withTag("3.11"), "syft output is broken")
      ),
      false
    );

    assertThat(TextReports.scanReport(report))
      .startsWith("Scan of mcr.microsoft.com/azurelinux/base/python: PARTIAL")
      .contains("FAILED   mcr.microsoft.com/azurelinux/base/python:3.11: syft output is broken");
  }

  @Test
  void leaderboardRendersMarkdownTables() {
    ImageRecord record = TestRecords.image("python", "3.12")
      .digest("sha256:0123456789abcdef0123")
      .runtime("python", "3.12.3")
      .vulnerabilities(Severity.HIGH, 1)
      .sizeMib(80)
      .build();

    String text = TextReports.leaderboard(
      new LanguageLeaderboard().rank(List.of(record), 10),
      Instant.parse("2024-06-01T03:07:42Z")
    );

    assertThat(text)
      .startsWith("# Recommended images by language")
      .contains("_Generated: 2024-06-01T03:07:00Z_")
      .contains("## python")
      .contains("| 1 | `mcr.microsoft.com/python:3.12` | 3.12.3 | 0 | 1 | 1 | 80.0 MiB | `0123456789ab` |");
  }

  @Test
  void leaderboardWithoutLanguages() {
    assertThat(TextReports.leaderboard(List.of(), Instant.EPOCH)).endsWith("No languages detected in the store.");
  }
}
