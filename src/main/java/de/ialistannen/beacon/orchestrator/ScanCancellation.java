package de.ialistannen.beacon.orchestrator;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Requests early termination of a running batch. The image in flight is completed, results of completed images stay
 * stored.
 */
public class ScanCancellation {

  private final AtomicBoolean cancelled = new AtomicBoolean();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /**
   * @return a token that is never cancelled
   */
  public static ScanCancellation none() {
    return new ScanCancellation();
  }
}
