package de.ialistannen.beacon.scanner;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs blocking external commands.
 */
public interface CommandRunner {

  /**
   * Runs a command and waits for it to finish.
   *
   * @param command the executable and its arguments
   * @param timeout the maximum wall-clock time
   * @param workDirectory the working directory, also used for temporary output files
   * @return the exit code and output of the command
   * @throws ToolNotFoundException if the executable could not be started
   * @throws CommandTimeoutException if the command did not finish in time
   * @throws IOException if the output could not be read
   */
  CommandResult run(List<String> command, Duration timeout, Path workDirectory)
    throws ToolNotFoundException, CommandTimeoutException, IOException;
}
