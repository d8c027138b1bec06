package de.ialistannen.beacon.orchestrator;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.normalize.NormalizationException;
import de.ialistannen.beacon.normalize.ResultNormalizer;
import de.ialistannen.beacon.orchestrator.RepositoryConfig.ImageEntry;
import de.ialistannen.beacon.orchestrator.RepositoryConfig.RepositoryEntry;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.registry.TagEnumerationException;
import de.ialistannen.beacon.registry.TagEnumerator;
import de.ialistannen.beacon.scanner.AdapterFailure;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolTimeout;
import de.ialistannen.beacon.scanner.AdapterOutcome;
import de.ialistannen.beacon.scanner.ScanWorkspace;
import de.ialistannen.beacon.scanner.ScannerAdapter;
import de.ialistannen.beacon.scanner.ScannerAdapter.Kind;
import de.ialistannen.beacon.scanner.output.ScanResult;
import de.ialistannen.beacon.storage.ImageStore;
import de.ialistannen.beacon.storage.StoreException;
import de.ialistannen.beacon.storage.UpsertResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequences the scanner adapters for single images and batches of images.
 * <p>
 * For one image the inspector runs first, then the SBOM generator and, for comprehensive scans, the vulnerability
 * scanners. Every adapter gets the smaller of the per-tool timeout and what is left of the per-image budget. All
 * artifacts created during the scan of an image are released when it finishes, successful or not.
 */
public class ScanOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanOrchestrator.class);

  private final List<ScannerAdapter> adapters;
  private final ResultNormalizer normalizer;
  private final ImageStore store;
  private final TagEnumerator tagEnumerator;
  private final Duration toolTimeout;
  private final Duration imageBudget;
  private final String defaultRegistry;
  private final Ticker ticker;

  public ScanOrchestrator(
    List<ScannerAdapter> adapters,
    ResultNormalizer normalizer,
    ImageStore store,
    TagEnumerator tagEnumerator,
    Duration toolTimeout,
    Duration imageBudget,
    String defaultRegistry
  ) {
    this(adapters, normalizer, store, tagEnumerator, toolTimeout, imageBudget, defaultRegistry, Ticker.systemTicker());
  }

  public ScanOrchestrator(
    List<ScannerAdapter> adapters,
    ResultNormalizer normalizer,
    ImageStore store,
    TagEnumerator tagEnumerator,
    Duration toolTimeout,
    Duration imageBudget,
    String defaultRegistry,
    Ticker ticker
  ) {
    this.adapters = adapters.stream().sorted(Comparator.comparing(ScannerAdapter::kind)).toList();
    this.normalizer = normalizer;
    this.store = store;
    this.tagEnumerator = tagEnumerator;
    this.toolTimeout = toolTimeout;
    this.imageBudget = imageBudget;
    this.defaultRegistry = defaultRegistry;
    this.ticker = ticker;
  }

  /**
   * Scans a single image and stores the result.
   *
   * @param reference the image to scan
   * @param options the scan options
   * @return the stored record
   * @throws ImageScanException if no content source succeeded or the record could not be built or stored
   */
  public ImageRecord scanImage(ImageReference reference, ScanOptions options) {
    LOGGER.info("Scanning {} ({})", reference, options.comprehensive() ? "comprehensive" : "packages only");
    Stopwatch stopwatch = Stopwatch.createStarted(ticker);

    List<ScanResult> results = new ArrayList<>();
    List<AdapterFailure> failures = new ArrayList<>();
    boolean contentSucceeded = false;

    try (ScanWorkspace workspace = ScanWorkspace.create()) {
      for (ScannerAdapter adapter : adapters) {
        if (adapter.kind() == Kind.VULNERABILITY && !options.comprehensive()) {
          continue;
        }

        AdapterOutcome outcome = runAdapter(adapter, reference, stopwatch, workspace);
        if (outcome instanceof AdapterOutcome.Success success) {
          results.add(success.result());
          contentSucceeded |= adapter.kind() != Kind.INSPECTION;
        } else if (outcome instanceof AdapterFailure failure) {
          LOGGER.warn("Source {} failed for {}: {}", adapter.toolName(), reference, failure.describe());
          failures.add(failure);
        }
      }
    } catch (IOException e) {
      throw new ImageScanException(reference, "Could not create a scan workspace for " + reference, e);
    }

    if (!contentSucceeded) {
      throw new ImageScanException(
        reference,
        "No package or vulnerability source succeeded for " + reference + ": " + describe(failures)
      );
    }

    ImageRecord record;
    try {
      List<ToolProvenance> failedSources = failures.stream().map(AdapterFailure::toProvenance).toList();
      record = normalizer.normalize(reference, results, failedSources);
    } catch (NormalizationException e) {
      throw new ImageScanException(reference, e.getMessage(), e);
    }

    try {
      UpsertResult result = store.upsert(record, options.updateExisting());
      LOGGER.info(
        "Finished {} in {}: {} packages, {} vulnerabilities ({})",
        reference,
        stopwatch,
        result.record().packages().size(),
        result.record().vulnerabilities().size(),
        result.outcome()
      );
      return result.record();
    } catch (StoreException e) {
      throw new ImageScanException(reference, "Could not store " + reference + ": " + e.getMessage(), e);
    }
  }

  private AdapterOutcome runAdapter(
    ScannerAdapter adapter,
    ImageReference reference,
    Stopwatch stopwatch,
    ScanWorkspace workspace
  ) {
    Duration remaining = imageBudget.minus(stopwatch.elapsed());
    if (remaining.isNegative() || remaining.isZero()) {
      return new ToolTimeout(adapter.toolName(), Duration.ZERO);
    }
    Duration timeout = remaining.compareTo(toolTimeout) < 0 ? remaining : toolTimeout;

    LOGGER.debug("Running {} on {} with timeout {}s", adapter.toolName(), reference, timeout.toSeconds());
    return adapter.analyze(reference, timeout, workspace);
  }

  /**
   * Scans tags of a repository. Failures of single images are collected in the report, they never abort the batch.
   *
   * @param repository the repository
   * @param maxTags the maximum number of tags to scan, 0 for all
   * @param comprehensive whether to run vulnerability scanners
   * @param updateExisting whether to rescan images that are already stored
   * @return the report of the batch
   */
  public RepositoryScanReport scanRepository(
    RepositoryPath repository,
    int maxTags,
    boolean comprehensive,
    boolean updateExisting
  ) {
    return scanRepository(
      repository,
      maxTags,
      new ScanOptions(comprehensive, updateExisting),
      ScanCancellation.none()
    );
  }

  /**
   * Scans tags of a repository until all selected tags are processed or the scan is cancelled.
   *
   * @param repository the repository
   * @param maxTags the maximum number of tags to scan, 0 for all
   * @param options the scan options
   * @param cancellation checked between images
   * @return the report of the batch
   */
  public RepositoryScanReport scanRepository(
    RepositoryPath repository,
    int maxTags,
    ScanOptions options,
    ScanCancellation cancellation
  ) {
    LOGGER.info("Scanning repository {}", repository);

    List<ImageReference> references;
    try {
      references = new TagFilter(maxTags).select(tagEnumerator.listTags(repository));
    } catch (TagEnumerationException e) {
      LOGGER.warn("Could not list tags of {}", repository, e);
      return RepositoryScanReport.failed(repository.fullName(), e.getMessage());
    }
    LOGGER.info("Selected {} tags of {}", references.size(), repository);

    return scanBatch(repository.fullName(), references, options, cancellation);
  }

  /**
   * Scans every entry of a repository configuration file.
   *
   * @param configFile the configuration file
   * @param options the scan options
   * @param maxTags the maximum number of tags to scan per repository, 0 for all
   * @param cancellation checked between images
   * @return the combined report of all entries
   * @throws RepositoryConfigException if the file can not be read
   */
  public RepositoryScanReport scanConfiguration(
    Path configFile,
    ScanOptions options,
    int maxTags,
    ScanCancellation cancellation
  ) {
    RepositoryConfig config = RepositoryConfig.read(configFile, defaultRegistry);
    LOGGER.info("Scanning {} entries from {}", config.entries().size(), configFile);

    List<RepositoryScanReport> reports = new ArrayList<>();
    for (RepositoryConfig.Entry entry : config.entries()) {
      if (cancellation.isCancelled()) {
        reports.add(new RepositoryScanReport(configFile.toString(), List.of(), true));
        break;
      }
      if (entry instanceof ImageEntry image) {
        reports.add(scanBatch(image.reference().fullName(), List.of(image.reference()), options, cancellation));
      } else if (entry instanceof RepositoryEntry repository) {
        reports.add(scanRepository(repository.repository(), maxTags, options, cancellation));
      }
    }

    RepositoryScanReport combined = RepositoryScanReport.combine(configFile.toString(), reports);
    logSummary(combined);
    return combined;
  }

  private RepositoryScanReport scanBatch(
    String source,
    List<ImageReference> references,
    ScanOptions options,
    ScanCancellation cancellation
  ) {
    List<ImageStatus> statuses = new ArrayList<>();
    boolean cancelled = false;

    for (ImageReference reference : references) {
      if (cancellation.isCancelled()) {
        LOGGER.info("Scan of {} cancelled, {} images left unprocessed", source, references.size() - statuses.size());
        cancelled = true;
        break;
      }
      statuses.add(scanBatchImage(reference, options));
    }

    RepositoryScanReport report = new RepositoryScanReport(source, statuses, cancelled);
    logSummary(report);
    return report;
  }

  private ImageStatus scanBatchImage(ImageReference reference, ScanOptions options) {
    try {
      if (!options.updateExisting()) {
        Optional<ImageRecord> existing = store.findByReference(reference);
        if (existing.isPresent()) {
          LOGGER.info("{} is already stored, skipping", reference);
          return ImageStatus.skipped(reference, existing.get());
        }
      }
      return ImageStatus.scanned(reference, scanImage(reference, options));
    } catch (ImageScanException e) {
      LOGGER.warn("Scan of {} failed: {}", reference, e.getMessage());
      return ImageStatus.failed(reference, e.getMessage());
    } catch (StoreException e) {
      LOGGER.warn("Store lookup for {} failed", reference, e);
      return ImageStatus.failed(reference, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.warn("Unexpected error scanning {}", reference, e);
      return ImageStatus.failed(reference, e.getClass().getSimpleName() + ": " + e.getMessage());
    }
  }

  private static void logSummary(RepositoryScanReport report) {
    long skipped = report.images().stream().filter(it -> it.state() == ImageStatus.State.SKIPPED).count();
    LOGGER.info(
      "Batch {} finished with {}: {} scanned, {} skipped, {} failed",
      report.source(),
      report.status(),
      report.records().size(),
      skipped,
      report.failures().size()
    );
  }

  private static String describe(List<AdapterFailure> failures) {
    if (failures.isEmpty()) {
      return "no sources configured";
    }
    return failures.stream().map(AdapterFailure::describe).collect(Collectors.joining("; "));
  }
}
