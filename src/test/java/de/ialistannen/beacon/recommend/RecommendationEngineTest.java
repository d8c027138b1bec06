package de.ialistannen.beacon.recommend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.beacon.TestRecords;
import de.ialistannen.beacon.model.Ecosystem;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.Severity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class RecommendationEngineTest {

  private final RecommendationEngine engine = new RecommendationEngine(SizeThresholds.defaults());

  @Test
  void fewerHighVulnerabilitiesWinOverSize() {
    ImageRecord x = python("x", "3.12.3").sizeMib(80).vulnerabilities(Severity.HIGH, 1).build();
    ImageRecord y = python("y", "3.12.3").sizeMib(500).build();
    Requirements requirements = Requirements.forLanguage("python")
      .securityLevel(SecurityLevel.MAXIMUM)
      .build();

    List<RankedImage> ranked = engine.recommend(requirements, List.of(x, y), 5);

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(y.digest(), x.digest());
    assertThat(ranked).extracting(RankedImage::rank).containsExactly(1, 2);
    assertThat(ranked.get(0).reasoning().meetsMaximumSecurity()).contains(true);
    assertThat(ranked.get(1).reasoning().meetsMaximumSecurity()).contains(false);
  }

  @Test
  void criticalCountDecidesFirst() {
    ImageRecord manyHigh = python("many-high", "3.12.3").vulnerabilities(Severity.HIGH, 10).build();
    ImageRecord oneCritical = python("one-critical", "3.12.3").vulnerabilities(Severity.CRITICAL, 1).build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").build(),
      List.of(oneCritical, manyHigh),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(manyHigh.digest(), oneCritical.digest());
  }

  @Test
  void sizeCategoryBreaksVulnerabilityTies() {
    ImageRecord minimal = python("minimal", "3.12.3").sizeMib(30).build();
    ImageRecord balanced = python("balanced", "3.12.3").sizeMib(120).build();
    ImageRecord full = python("full", "3.12.3").sizeMib(900).build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").sizePreference(SizePreference.FULL).build(),
      List.of(minimal, balanced, full),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest)
      .containsExactly(full.digest(), balanced.digest(), minimal.digest());
    assertThat(ranked.get(0).score().sizeDistance()).isZero();
    assertThat(ranked.get(2).score().sizeDistance()).isEqualTo(2);
  }

  @Test
  void unknownSizeRanksBehindEveryCategory() {
    ImageRecord unknown = python("unknown", "3.12.3").sizeBytes(0).build();
    ImageRecord full = python("full", "3.12.3").sizeMib(900).build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").sizePreference(SizePreference.MINIMAL).build(),
      List.of(unknown, full),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(full.digest(), unknown.digest());
    assertThat(ranked.get(1).score().sizeCategory()).isEmpty();
  }

  @Test
  void neverReturnsImagesViolatingHardConstraints() {
    List<ImageRecord> candidates = List.of(
      python("ok", "3.12.3").vulnerabilities(Severity.HIGH, 1).vulnerabilities(Severity.LOW, 2).build(),
      python("old", "3.11.9").build(),
      python("critical", "3.12.1").vulnerabilities(Severity.CRITICAL, 1).build(),
      python("high", "3.12.2").vulnerabilities(Severity.HIGH, 2).build(),
      python("total", "3.12.0").vulnerabilities(Severity.MEDIUM, 4).build(),
      TestRecords.image("azurelinux/base/nodejs", "20").runtime("node", "20.14.0").build()
    );
    Requirements requirements = Requirements.forLanguage("python")
      .version("3.12")
      .maxCritical(0)
      .maxHigh(1)
      .maxTotal(3)
      .build();

    List<RankedImage> ranked = engine.recommend(requirements, candidates, 10);

    assertThat(ranked).singleElement()
      .satisfies(it -> assertThat(it.reference().repository()).isEqualTo("python/ok"));
    assertThat(ranked.get(0).reasoning().passedFilters())
      .anySatisfy(it -> assertThat(it).startsWith("version:"))
      .anySatisfy(it -> assertThat(it).startsWith("vulnerability ceilings:"));
    assertThat(ranked.get(0).reasoning().meetsMaximumSecurity()).isEmpty();
  }

  @Test
  void semverRangesSelectRuntimes() {
    ImageRecord node18 = TestRecords.image("node", "18").runtime("node", "18.20.3").build();
    ImageRecord node20 = TestRecords.image("node", "20").runtime("node", "20.14.0").build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("node").version(">=20").build(),
      List.of(node18, node20),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(node20.digest());
  }

  @Test
  void requiredPackagesFilterSmallerImages() {
    ImageRecord withRequests = python("with-requests", "3.12.3")
      .pkg("requests", "2.31.0", Ecosystem.PYPI)
      .sizeMib(120)
      .build();
    ImageRecord without = python("without", "3.12.3").sizeMib(60).build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").packages(List.of("Requests")).build(),
      List.of(without, withRequests),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(withRequests.digest());
    assertThat(ranked.get(0).score().packageCoverage()).isEqualTo(1.0);
  }

  @Test
  void fullSizeImagesAreExemptFromPackageRequirements() {
    ImageRecord full = python("full", "3.12.3").sizeMib(900).build();
    ImageRecord fullWithPackage = python("full-with-package", "3.12.3")
      .sizeMib(900)
      .pkg("numpy", "1.26.4", Ecosystem.PYPI)
      .build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").packages(List.of("numpy", "pandas")).build(),
      List.of(full, fullWithPackage),
      5
    );

    assertThat(ranked).extracting(RankedImage::digest).containsExactly(fullWithPackage.digest(), full.digest());
    assertThat(ranked.get(0).reasoning().missingPackages()).containsExactly("pandas");
    assertThat(ranked.get(0).score().packageCoverage()).isEqualTo(0.5);
    assertThat(ranked.get(1).reasoning().missingPackages()).containsExactly("numpy", "pandas");
  }

  @Test
  void excludesPlatformSpecificImagesOnRequest() {
    ImageRecord generic = python("python", "3.12.3").build();
    ImageRecord armTag = TestRecords.image("python/python", "3.12.3-arm64").runtime("python", "3.12.3").build();
    ImageRecord armRepository = TestRecords.image("python/amd64", "3.12.3").runtime("python", "3.12.3").build();
    List<ImageRecord> candidates = List.of(generic, armTag, armRepository);

    List<RankedImage> filtered = engine.recommend(
      Requirements.forLanguage("python").excludePlatformSpecific(true).build(),
      candidates,
      5
    );
    List<RankedImage> unfiltered = engine.recommend(Requirements.forLanguage("python").build(), candidates, 5);

    assertThat(filtered).extracting(RankedImage::digest).containsExactly(generic.digest());
    assertThat(unfiltered).hasSize(3);
  }

  @Test
  void orderDoesNotDependOnInputOrder() {
    List<ImageRecord> candidates = new ArrayList<>();
    for (int i = 0; i < 12; i++) {
      candidates.add(
        python("image-" + i, "3.12." + i)
          .vulnerabilities(Severity.HIGH, i % 3)
          .sizeMib(40 + (i % 4) * 60L)
          .build()
      );
    }
    Requirements requirements = Requirements.forLanguage("python").build();
    List<RankedImage> expected = engine.recommend(requirements, candidates, 12);

    Random random = new Random(42);
    for (int i = 0; i < 10; i++) {
      List<ImageRecord> shuffled = new ArrayList<>(candidates);
      Collections.shuffle(shuffled, random);

      assertThat(engine.recommend(requirements, shuffled, 12)).isEqualTo(expected);
    }
    assertThat(engine.recommend(requirements, candidates, 12)).isEqualTo(expected);
  }

  @Test
  void duplicateDigestsAreRankedOnce() {
    ImageRecord record = python("python", "3.12.3").build();

    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("python").build(),
      List.of(record, record.withReference(record.reference().withTag("3.12"))),
      5
    );

    assertThat(ranked).hasSize(1);
  }

  @Test
  void limitsResults() {
    List<ImageRecord> candidates = List.of(
      python("a", "3.12.3").build(),
      python("b", "3.12.3").build(),
      python("c", "3.12.3").build()
    );

    assertThat(engine.recommend(Requirements.forLanguage("python").build(), candidates, 2)).hasSize(2);
    assertThatThrownBy(() -> engine.recommend(Requirements.forLanguage("python").build(), candidates, 0))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void returnsEmptyListWithoutMatches() {
    List<RankedImage> ranked = engine.recommend(
      Requirements.forLanguage("rust").build(),
      List.of(python("python", "3.12.3").build()),
      5
    );

    assertThat(ranked).isEmpty();
  }

  private static TestRecords python(String name, String version) {
    return TestRecords.image("python/" + name, version).runtime("python", version);
  }
}
