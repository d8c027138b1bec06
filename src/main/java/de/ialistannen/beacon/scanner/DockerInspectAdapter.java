package de.ialistannen.beacon.scanner;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.InspectImageResponse;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.google.common.base.Suppliers;
import com.google.common.base.Throwables;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.scanner.AdapterFailure.MalformedOutput;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolNonZeroExit;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolNotInstalled;
import de.ialistannen.beacon.scanner.AdapterFailure.ToolTimeout;
import de.ialistannen.beacon.scanner.output.InspectOutput;
import de.ialistannen.beacon.scanner.output.MalformedOutputException;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls an image into the local docker daemon and reads its metadata. Images pulled by this adapter are removed
 * again when the scan workspace closes, images that were already present are left alone.
 */
public class DockerInspectAdapter implements ScannerAdapter {

  private static final Logger LOGGER = LoggerFactory.getLogger(DockerInspectAdapter.class);

  private final DockerClient client;
  private final boolean removePulledImages;
  private final Supplier<String> daemonVersion;

  public DockerInspectAdapter(DockerClient client, boolean removePulledImages) {
    this.client = client;
    this.removePulledImages = removePulledImages;
    this.daemonVersion = Suppliers.memoize(() -> client.versionCmd().exec().getVersion());
  }

  @Override
  public String toolName() {
    return InspectOutput.TOOL_NAME;
  }

  @Override
  public Kind kind() {
    return Kind.INSPECTION;
  }

  @Override
  public AdapterOutcome analyze(ImageReference reference, Duration timeout, ScanWorkspace workspace) {
    String imageName = reference.fullName();

    try {
      boolean needsPull = client.listImagesCmd()
        .withReferenceFilter(imageName)
        .exec()
        .isEmpty();

      if (needsPull) {
        LOGGER.info("Image {} not present locally, pulling", imageName);
        if (removePulledImages) {
          workspace.onClose("remove pulled image " + imageName, () -> removeImage(imageName));
        }
        if (!pull(reference, timeout)) {
          return new ToolTimeout(toolName(), timeout);
        }
      }

      InspectImageResponse response = client.inspectImageCmd(imageName).exec();
      var rootFs = response.getRootFS();
      int layerCount = rootFs == null || rootFs.getLayers() == null ? 0 : rootFs.getLayers().size();

      return new AdapterOutcome.Success(InspectOutput.validated(
        daemonVersion.get(),
        response.getId(),
        response.getSize(),
        parseCreated(response.getCreated()),
        layerCount
      ));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return new ToolTimeout(toolName(), timeout);
    } catch (MalformedOutputException e) {
      return new MalformedOutput(toolName(), e.getMessage());
    } catch (NotFoundException e) {
      return new ToolNonZeroExit(toolName(), 404, e.getMessage());
    } catch (DockerException e) {
      return new ToolNonZeroExit(toolName(), e.getHttpStatus(), e.getMessage());
    } catch (RuntimeException e) {
      if (isDaemonUnreachable(e)) {
        LOGGER.warn("Docker daemon is not reachable, skipping inspection of {}", imageName);
        return new ToolNotInstalled(toolName(), Throwables.getRootCause(e).getMessage());
      }
      LOGGER.warn("Inspecting {} failed", imageName, e);
      return new ToolNonZeroExit(toolName(), -1, String.valueOf(e.getMessage()));
    }
  }

  /**
   * Pulls the image, aborting the pull if it does not finish in time.
   *
   * @return true if the pull finished in time
   */
  private boolean pull(ImageReference reference, Duration timeout) throws InterruptedException {
    PullImageResultCallback callback = client.pullImageCmd(reference.repositoryName())
      .withTag(reference.tag())
      .exec(new PullImageResultCallback());

    boolean finished = false;
    try {
      finished = callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return finished;
    } finally {
      if (!finished) {
        LOGGER.warn("Pulling {} did not finish within {}, aborting", reference, timeout);
        try {
          callback.close();
        } catch (IOException e) {
          LOGGER.warn("Could not abort pulling {}", reference, e);
        }
      }
    }
  }

  private void removeImage(String imageName) {
    try {
      client.removeImageCmd(imageName).withForce(true).exec();
      LOGGER.debug("Removed image {}", imageName);
    } catch (NotFoundException e) {
      LOGGER.debug("Image {} was already gone", imageName);
    }
  }

  private static boolean isDaemonUnreachable(RuntimeException e) {
    return Throwables.getCausalChain(e).stream().anyMatch(IOException.class::isInstance);
  }

  private static Optional<Instant> parseCreated(String created) {
    if (created == null || created.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Instant.parse(created));
    } catch (DateTimeParseException e) {
      LOGGER.debug("Unparseable creation date '{}'", created);
      return Optional.empty();
    }
  }
}
