package de.ialistannen.beacon.orchestrator;

import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import java.util.List;
import java.util.Optional;

/**
 * The result of a batch of image scans.
 *
 * @param source the scanned repository or configuration entry
 * @param images the status of every image the batch considered, in processing order
 * @param cancelled whether the batch was cancelled before all images were processed
 */
public record RepositoryScanReport(String source, List<ImageStatus> images, boolean cancelled) {

  public RepositoryScanReport {
    images = List.copyOf(images);
  }

  /**
   * @param source the scanned repository
   * @param reason why the batch could not be started
   * @return a report for a batch that failed before scanning any image
   */
  public static RepositoryScanReport failed(String source, String reason) {
    return new RepositoryScanReport(
      source,
      List.of(new ImageStatus(Optional.empty(), ImageStatus.State.FAILED, Optional.empty(), Optional.of(reason))),
      false
    );
  }

  /**
   * @return {@link Status#FAILURE} if nothing succeeded but something failed, {@link Status#PARTIAL} if some images
   *   failed and {@link Status#SUCCESS} otherwise
   */
  public Status status() {
    long failed = images.stream().filter(it -> it.state() == ImageStatus.State.FAILED).count();
    if (failed == 0) {
      return Status.SUCCESS;
    }
    if (failed == images.size()) {
      return Status.FAILURE;
    }
    return Status.PARTIAL;
  }

  /**
   * @return the records of all successfully scanned images
   */
  public List<ImageRecord> records() {
    return images.stream()
      .filter(it -> it.state() == ImageStatus.State.SCANNED)
      .flatMap(it -> it.record().stream())
      .toList();
  }

  /**
   * @return the statuses of all failed images
   */
  public List<ImageStatus> failures() {
    return images.stream().filter(it -> it.state() == ImageStatus.State.FAILED).toList();
  }

  /**
   * Merges the reports of multiple batches into one.
   *
   * @param source the name of the combined batch
   * @param reports the reports to combine
   * @return the combined report
   */
  public static RepositoryScanReport combine(String source, List<RepositoryScanReport> reports) {
    return new RepositoryScanReport(
      source,
      reports.stream().flatMap(it -> it.images().stream()).toList(),
      reports.stream().anyMatch(RepositoryScanReport::cancelled)
    );
  }

  public enum Status {
    SUCCESS,
    PARTIAL,
    FAILURE
  }

  /**
   * @param reference the image, empty if the failure happened before any image was known
   * @param state what happened to the image
   * @param record the stored record for scanned and skipped images
   * @param error the failure reason for failed images
   */
  public record ImageStatus(
    Optional<ImageReference> reference,
    State state,
    Optional<ImageRecord> record,
    Optional<String> error
  ) {

    public static ImageStatus scanned(ImageReference reference, ImageRecord record) {
      return new ImageStatus(Optional.of(reference), State.SCANNED, Optional.of(record), Optional.empty());
    }

    public static ImageStatus skipped(ImageReference reference, ImageRecord record) {
      return new ImageStatus(Optional.of(reference), State.SKIPPED, Optional.of(record), Optional.empty());
    }

    public static ImageStatus failed(ImageReference reference, String error) {
      return new ImageStatus(Optional.of(reference), State.FAILED, Optional.empty(), Optional.of(error));
    }

    public enum State {
      SCANNED,
      SKIPPED,
      FAILED
    }
  }
}
