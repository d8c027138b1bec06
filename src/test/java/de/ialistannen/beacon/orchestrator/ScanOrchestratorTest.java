package de.ialistannen.beacon.orchestrator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;
import de.ialistannen.beacon.TestRecords;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.model.ToolProvenance.Status;
import de.ialistannen.beacon.normalize.LanguageDetector;
import de.ialistannen.beacon.normalize.ResultNormalizer;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.registry.TagEnumerationException;
import de.ialistannen.beacon.registry.TagEnumerator;
import de.ialistannen.beacon.scanner.AdapterFailure.MalformedOutput;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolTimeout;
import de.ialistannen.beacon.scanner.AdapterOutcome;
import de.ialistannen.beacon.scanner.ScanWorkspace;
import de.ialistannen.beacon.scanner.ScannerAdapter;
import de.ialistannen.beacon.scanner.output.InspectOutput;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import de.ialistannen.beacon.scanner.output.SyftOutput;
import de.ialistannen.beacon.scanner.output.TrivyOutput;
import de.ialistannen.beacon.storage.JdbiImageStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScanOrchestratorTest {

  private static final String REGISTRY = "mcr.microsoft.com";
  private static final RepositoryPath REPOSITORY = new RepositoryPath(REGISTRY, "azurelinux/base/python");
  private static final Duration TOOL_TIMEOUT = Duration.ofMinutes(5);
  private static final Duration IMAGE_BUDGET = Duration.ofMinutes(10);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  @TempDir
  Path tempDir;

  private JdbiImageStore store;
  private FakeTicker ticker;
  private List<String> tags;

  @BeforeEach
  void setUp() {
    store = JdbiImageStore.open(tempDir.resolve("store"));
    ticker = new FakeTicker();
    tags = List.of("3.10", "3.11", "3.12", "3.13", "3.14", "latest", "3.12-arm64");
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void batchKeepsGoingWhenOneImageFails() {
    Set<String> broken = Set.of("3.12");
    FakeAdapter inspector = new FakeAdapter("docker", ScannerAdapter.Kind.INSPECTION, reference ->
      broken.contains(reference.tag()) ? malformed("docker") : inspection(reference)
    );
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, reference ->
      broken.contains(reference.tag()) ? malformed("syft") : sbom(reference)
    );
    FakeAdapter trivy = new FakeAdapter("trivy", ScannerAdapter.Kind.VULNERABILITY, reference ->
      broken.contains(reference.tag()) ? malformed("trivy") : vulnerabilities()
    );

    RepositoryScanReport report = orchestrator(List.of(trivy, syft, inspector))
      .scanRepository(REPOSITORY, 0, true, false);

    assertThat(report.images()).hasSize(5);
    assertThat(report.records()).hasSize(4);
    assertThat(report.failures()).singleElement()
      .satisfies(it -> assertThat(it.reference()).map(ImageReference::tag).contains("3.12"));
    assertThat(report.status()).isEqualTo(RepositoryScanReport.Status.PARTIAL);
    assertThat(store.findAll()).hasSize(4);
    assertThat(report.records()).allSatisfy(it -> assertThat(it.comprehensive()).isTrue());
  }

  @Test
  void selectsNewestReleaseTags() {
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);

    RepositoryScanReport report = orchestrator(List.of(syft)).scanRepository(REPOSITORY, 2, false, false);

    assertThat(syft.scanned).extracting(ImageReference::tag).containsExactly("3.14", "3.13");
    assertThat(report.status()).isEqualTo(RepositoryScanReport.Status.SUCCESS);
  }

  @Test
  void runsAdaptersInKindOrder() {
    List<String> order = new ArrayList<>();
    FakeAdapter inspector = new FakeAdapter("docker", ScannerAdapter.Kind.INSPECTION, reference -> {
      order.add("docker");
      return inspection(reference);
    });
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, reference -> {
      order.add("syft");
      return sbom(reference);
    });
    FakeAdapter trivy = new FakeAdapter("trivy", ScannerAdapter.Kind.VULNERABILITY, reference -> {
      order.add("trivy");
      return vulnerabilities();
    });

    orchestrator(List.of(trivy, syft, inspector)).scanImage(reference("3.12"), new ScanOptions(true, true));

    assertThat(order).containsExactly("docker", "syft", "trivy");
  }

  @Test
  void storesDegradedScan() {
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);
    FakeAdapter trivy = new FakeAdapter(
      "trivy",
      ScannerAdapter.Kind.VULNERABILITY,
      reference -> new ToolTimeout("trivy", TOOL_TIMEOUT)
    );

    ImageRecord record = orchestrator(List.of(syft, trivy)).scanImage(reference("3.12"), new ScanOptions(true, false));

    assertThat(record.comprehensive()).isFalse();
    assertThat(record.packages()).isNotEmpty();
    assertThat(record.vulnerabilities()).isEmpty();
    assertThat(record.provenance())
      .extracting(ToolProvenance::toolName, ToolProvenance::status)
      .contains(tuple("trivy", Status.TIMED_OUT));
    assertThat(store.findByReference(reference("3.12"))).contains(record);
  }

  @Test
  void packageScanSkipsVulnerabilityScanners() {
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);
    FakeAdapter trivy = new FakeAdapter(
      "trivy",
      ScannerAdapter.Kind.VULNERABILITY,
      reference -> vulnerabilities()
    );

    orchestrator(List.of(syft, trivy)).scanImage(reference("3.12"), new ScanOptions(false, false));

    assertThat(trivy.scanned).isEmpty();
    assertThat(syft.scanned).hasSize(1);
  }

  @Test
  void failsWhenNoContentSourceSucceeds() {
    FakeAdapter inspector = new FakeAdapter("docker", ScannerAdapter.Kind.INSPECTION, ScanOrchestratorTest::inspection);
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, reference -> malformed("syft"));

    assertThatThrownBy(
      () -> orchestrator(List.of(inspector, syft)).scanImage(reference("3.12"), new ScanOptions(false, false))
    )
      .isInstanceOf(ImageScanException.class)
      .hasMessageContaining("syft output is broken");
    assertThat(store.findAll()).isEmpty();
  }

  @Test
  void toolsShareThePerImageBudget() {
    FakeAdapter inspector = new FakeAdapter("docker", ScannerAdapter.Kind.INSPECTION, reference -> {
      ticker.advance(Duration.ofMinutes(7));
      return inspection(reference);
    });
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, reference -> {
      ticker.advance(Duration.ofMinutes(3));
      return sbom(reference);
    });
    FakeAdapter trivy = new FakeAdapter("trivy", ScannerAdapter.Kind.VULNERABILITY, reference -> vulnerabilities());

    ImageRecord record = orchestrator(List.of(inspector, syft, trivy))
      .scanImage(reference("3.12"), new ScanOptions(true, false));

    assertThat(inspector.timeouts).containsExactly(TOOL_TIMEOUT);
    assertThat(syft.timeouts).containsExactly(Duration.ofMinutes(3));
    assertThat(trivy.scanned).isEmpty();
    assertThat(record.comprehensive()).isFalse();
  }

  @Test
  void skipsStoredImagesUnlessUpdating() {
    store.upsert(TestRecords.image("azurelinux/base/python", "3.14").build(), false);
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);
    ScanOrchestrator orchestrator = orchestrator(List.of(syft));

    RepositoryScanReport report = orchestrator.scanRepository(REPOSITORY, 2, false, false);

    assertThat(report.images()).extracting(ImageStatus::state)
      .containsExactly(ImageStatus.State.SKIPPED, ImageStatus.State.SCANNED);
    assertThat(syft.scanned).extracting(ImageReference::tag).containsExactly("3.13");

    orchestrator.scanRepository(REPOSITORY, 2, false, true);

    assertThat(syft.scanned).extracting(ImageReference::tag).containsExactly("3.13", "3.14", "3.13");
  }

  @Test
  void stopsBetweenImagesWhenCancelled() {
    ScanCancellation cancellation = new ScanCancellation();
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, reference -> {
      cancellation.cancel();
      return sbom(reference);
    });

    RepositoryScanReport report = orchestrator(List.of(syft))
      .scanRepository(REPOSITORY, 0, new ScanOptions(false, false), cancellation);

    assertThat(report.cancelled()).isTrue();
    assertThat(report.records()).hasSize(1);
    assertThat(store.findAll()).hasSize(1);
  }

  @Test
  void reportsUnlistableRepository() {
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);
    TagEnumerator failing = repository -> {
      throw new TagEnumerationException("crane exited with 1");
    };
    ScanOrchestrator orchestrator = new ScanOrchestrator(
      List.of(syft),
      normalizer(),
      store,
      failing,
      TOOL_TIMEOUT,
      IMAGE_BUDGET,
      REGISTRY,
      ticker
    );

    RepositoryScanReport report = orchestrator.scanRepository(REPOSITORY, 0, true, false);

    assertThat(report.status()).isEqualTo(RepositoryScanReport.Status.FAILURE);
    assertThat(report.failures()).singleElement()
      .satisfies(it -> assertThat(it.error()).contains("crane exited with 1"));
  }

  @Test
  void scansConfiguredImagesAndRepositories() throws IOException {
    Path config = tempDir.resolve("repositories.txt");
    Files.writeString(config, """
      # single images
      azurelinux/base/nodejs:20

      azurelinux/base/python
      """);
    FakeAdapter syft = new FakeAdapter("syft", ScannerAdapter.Kind.SBOM, ScanOrchestratorTest::sbom);

    RepositoryScanReport report = orchestrator(List.of(syft))
      .scanConfiguration(config, new ScanOptions(false, false), 1, ScanCancellation.none());

    assertThat(report.records())
      .extracting(it -> it.reference().toString())
      .containsExactly("mcr.microsoft.com/azurelinux/base/nodejs:20", "mcr.microsoft.com/azurelinux/base/python:3.14");
    assertThat(report.status()).isEqualTo(RepositoryScanReport.Status.SUCCESS);
  }

  private ScanOrchestrator orchestrator(List<ScannerAdapter> adapters) {
    TagEnumerator enumerator = repository -> tags.stream().map(repository::withTag).toList();
    return new ScanOrchestrator(
      adapters,
      normalizer(),
      store,
      enumerator,
      TOOL_TIMEOUT,
      IMAGE_BUDGET,
      REGISTRY,
      ticker
    );
  }

  private static ResultNormalizer normalizer() {
    return new ResultNormalizer(
      LanguageDetector.withDefaultRules(),
      Clock.fixed(TestRecords.SCANNED_AT, ZoneOffset.UTC)
    );
  }

  private static ImageReference reference(String tag) {
    return REPOSITORY.withTag(tag);
  }

  private static AdapterOutcome malformed(String tool) {
    return new MalformedOutput(tool, tool + " output is broken");
  }

  private static AdapterOutcome inspection(ImageReference reference) {
    try {
      return new AdapterOutcome.Success(
        InspectOutput.validated("24.0.7", digest(reference), 80L * TestRecords.MIB, Optional.empty(), 3)
      );
    } catch (MalformedOutputException e) {
      throw new IllegalStateException(e);
    }
  }

  private static AdapterOutcome sbom(ImageReference reference) {
    try {
      return new AdapterOutcome.Success(SyftOutput.parse(OBJECT_MAPPER, """
        {
          "artifacts": [{"name": "python3", "version": "%s.0-1.azl3", "type": "rpm"}],
          "source": {"type": "image", "metadata": {"imageID": "%s"}},
          "descriptor": {"name": "syft", "version": "1.4.1"}
        }
        """.formatted(reference.tag(), digest(reference))));
    } catch (MalformedOutputException e) {
      throw new IllegalStateException(e);
    }
  }

  private static AdapterOutcome vulnerabilities() {
    try {
      return new AdapterOutcome.Success(TrivyOutput.parse(OBJECT_MAPPER, """
        {
          "SchemaVersion": 2,
          "Results": [
            {
              "Target": "image",
              "Type": "azurelinux",
              "Vulnerabilities": [
                {"VulnerabilityID": "CVE-2024-1234", "PkgName": "python3", "InstalledVersion": "3.12.0-1.azl3",
                 "Severity": "HIGH"}
              ]
            }
          ]
        }
        """, "0.51.0"));
    } catch (MalformedOutputException e) {
      throw new IllegalStateException(e);
    }
  }

  private static String digest(ImageReference reference) {
    return "sha256:" + reference.tag().replace(".", "");
  }

  private static class FakeAdapter implements ScannerAdapter {

    private final String toolName;
    private final Kind kind;
    private final Function<ImageReference, AdapterOutcome> behaviour;
    private final List<ImageReference> scanned;
    private final List<Duration> timeouts;

    private FakeAdapter(String toolName, Kind kind, Function<ImageReference, AdapterOutcome> behaviour) {
      this.toolName = toolName;
      this.kind = kind;
      this.behaviour = behaviour;
      this.scanned = new ArrayList<>();
      this.timeouts = new ArrayList<>();
    }

    @Override
    public String toolName() {
      return toolName;
    }

    @Override
    public Kind kind() {
      return kind;
    }

    @Override
    public AdapterOutcome analyze(ImageReference reference, Duration timeout, ScanWorkspace workspace) {
      scanned.add(reference);
      timeouts.add(timeout);
      return behaviour.apply(reference);
    }
  }

  private static class FakeTicker extends Ticker {

    private long nanos;

    void advance(Duration duration) {
      nanos += duration.toNanos();
    }

    @Override
    public long read() {
      return nanos;
    }
  }
}
