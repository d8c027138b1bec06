package de.ialistannen.beacon.scanner;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds out the version of installed tools by running them with {@code --version}. Results are cached, as the
 * installed version rarely changes while the process runs.
 */
public class ToolVersionProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(ToolVersionProbe.class);
  private static final Pattern VERSION_PATTERN = Pattern.compile("(\\d+\\.\\d+(?:\\.\\d+)?[\\w.+-]*)");
  public static final String UNKNOWN_VERSION = "unknown";

  private final CommandRunner commandRunner;
  private final Duration timeout;
  private final Cache<String, String> versions;

  public ToolVersionProbe(CommandRunner commandRunner, Duration timeout) {
    this.commandRunner = commandRunner;
    this.timeout = timeout;
    this.versions = Caffeine.newBuilder()
      .expireAfterWrite(Duration.ofHours(1))
      .build();
  }

  /**
   * @param executable the executable to probe
   * @return the version it reports, {@link #UNKNOWN_VERSION} if it could not be determined
   */
  public String versionOf(String executable) {
    return versions.get(executable, this::probe);
  }

  private String probe(String executable) {
    Path directory = null;
    try {
      directory = Files.createTempDirectory("beacon-probe-");
      CommandResult result = commandRunner.run(List.of(executable, "--version"), timeout, directory);
      if (result.exitCode() != 0) {
        return UNKNOWN_VERSION;
      }
      return extractVersion(result.stdout());
    } catch (ToolNotFoundException | CommandTimeoutException | IOException e) {
      LOGGER.debug("Could not determine version of {}", executable, e);
      return UNKNOWN_VERSION;
    } finally {
      deleteQuietly(directory);
    }
  }

  /**
   * @param output the output of a {@code --version} call
   * @return the first version looking string in it
   */
  static String extractVersion(String output) {
    Matcher matcher = VERSION_PATTERN.matcher(output);
    if (matcher.find()) {
      return matcher.group(1);
    }
    return UNKNOWN_VERSION;
  }

  private static void deleteQuietly(Path directory) {
    if (directory == null) {
      return;
    }
    try {
      Files.deleteIfExists(directory);
    } catch (IOException e) {
      LOGGER.debug("Could not delete probe directory {}", directory, e);
    }
  }
}
