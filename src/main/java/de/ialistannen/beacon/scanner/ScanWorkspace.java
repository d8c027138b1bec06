package de.ialistannen.beacon.scanner;

import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The scope of one image scan. Owns a temporary directory and every cleanup action registered by adapters. Closing
 * the workspace runs the cleanup actions in reverse order of registration and deletes the directory.
 */
public class ScanWorkspace implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScanWorkspace.class);

  private final Path directory;
  private final Deque<Cleanup> cleanups;
  private boolean closed;

  private ScanWorkspace(Path directory) {
    this.directory = directory;
    this.cleanups = new ArrayDeque<>();
  }

  /**
   * Creates a new workspace backed by a fresh temporary directory.
   *
   * @return the created workspace
   * @throws IOException if the directory could not be created
   */
  public static ScanWorkspace create() throws IOException {
    return new ScanWorkspace(Files.createTempDirectory("beacon-scan-"));
  }

  public Path directory() {
    return directory;
  }

  /**
   * Registers an action to run when this workspace is closed.
   *
   * @param description a description used for logging
   * @param action the action
   */
  public synchronized void onClose(String description, CleanupAction action) {
    if (closed) {
      throw new IllegalStateException("Workspace already closed");
    }
    cleanups.push(new Cleanup(description, action));
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;

    while (!cleanups.isEmpty()) {
      Cleanup cleanup = cleanups.pop();
      try {
        LOGGER.debug("Running cleanup '{}'", cleanup.description());
        cleanup.action().run();
      } catch (Exception e) {
        LOGGER.warn("Cleanup '{}' failed", cleanup.description(), e);
      }
    }

    try {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
    } catch (IOException e) {
      LOGGER.warn("Could not delete scan directory {}", directory, e);
    }
  }

  @FunctionalInterface
  public interface CleanupAction {

    void run() throws Exception;
  }

  private record Cleanup(String description, CleanupAction action) {

  }
}
