package de.ialistannen.beacon.timing;

import com.cronutils.model.Cron;
import com.cronutils.model.time.ExecutionTime;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CronRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CronRunner.class);

  private final Cron cron;
  private final ExceptionalRunnable action;

  public CronRunner(Cron cron, ExceptionalRunnable action) {
    this.cron = cron;
    this.action = action;
  }

  /**
   * Runs the stored action on the cron schedule until the thread is interrupted. Failures of a single run are logged
   * and do not stop the schedule.
   */
  @SuppressWarnings("BusyWait")
  public void runUntilInterrupted() {
    while (!Thread.currentThread().isInterrupted()) {
      Instant nextExecution = nextExecution(ZonedDateTime.now());

      LOGGER.info(
        "Sleeping until {} ({})",
        nextExecution,
        formatDurationHuman(Duration.between(Instant.now(), nextExecution))
      );

      try {
        while (nextExecution.isAfter(Instant.now())) {
          Duration between = Duration.between(Instant.now(), nextExecution);
          Thread.sleep(Math.max(between.toMillis() / 4, 1000L));
        }

        action.run();
      } catch (InterruptedException e) {
        LOGGER.info("Schedule interrupted, stopping");
        Thread.currentThread().interrupt();
      } catch (Exception e) {
        LOGGER.error("Scheduled run failed", e);
      }
    }
  }

  /**
   * @param now the current time
   * @return the next time the action should run
   */
  Instant nextExecution(ZonedDateTime now) {
    return ExecutionTime.forCron(cron).nextExecution(now).orElseThrow().toInstant();
  }

  static String formatDurationHuman(Duration duration) {
    String result = "";
    if (duration.toHoursPart() > 0 || duration.toDaysPart() > 0) {
      result += duration.toHours() + " hours";
    }
    if (duration.toMinutesPart() > 0) {
      result += ", " + duration.toMinutesPart() + " minutes";
    }
    if (duration.toSecondsPart() > 0) {
      result += ", " + duration.toSecondsPart() + " seconds";
    }

    return result.replaceFirst("^, ", "");
  }

  @FunctionalInterface
  public interface ExceptionalRunnable {

    void run() throws Exception;
  }
}
