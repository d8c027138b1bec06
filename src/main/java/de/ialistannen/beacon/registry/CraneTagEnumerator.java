package de.ialistannen.beacon.registry;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.InvalidReferenceException;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.scanner.CommandResult;
import de.ialistannen.beacon.scanner.CommandRunner;
import de.ialistannen.beacon.scanner.CommandTimeoutException;
import de.ialistannen.beacon.scanner.ToolNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists tags with {@code crane ls}.
 */
public class CraneTagEnumerator implements TagEnumerator {

  private static final Logger LOGGER = LoggerFactory.getLogger(CraneTagEnumerator.class);

  private final CommandRunner commandRunner;
  private final String executable;
  private final Duration timeout;

  public CraneTagEnumerator(CommandRunner commandRunner, String executable, Duration timeout) {
    this.commandRunner = commandRunner;
    this.executable = executable;
    this.timeout = timeout;
  }

  @Override
  public List<ImageReference> listTags(RepositoryPath repository) throws TagEnumerationException {
    LOGGER.debug("Listing tags of {}", repository);

    CommandResult result = run(repository);
    if (result.exitCode() != 0) {
      throw new TagEnumerationException(
        "Listing tags of " + repository + " failed with code " + result.exitCode() + ": " + result.stderr().strip()
      );
    }

    List<ImageReference> references = new ArrayList<>();
    for (String line : result.stdout().split("\n")) {
      String tag = line.strip();
      if (tag.isEmpty()) {
        continue;
      }
      try {
        references.add(repository.withTag(tag));
      } catch (InvalidReferenceException e) {
        LOGGER.warn("Ignoring invalid tag '{}' of {}", tag, repository);
      }
    }
    return references;
  }

  private CommandResult run(RepositoryPath repository) throws TagEnumerationException {
    Path workDirectory = null;
    try {
      workDirectory = Files.createTempDirectory("beacon-tags-");
      return commandRunner.run(List.of(executable, "ls", repository.fullName()), timeout, workDirectory);
    } catch (ToolNotFoundException e) {
      throw new TagEnumerationException(executable + " is not installed", e);
    } catch (CommandTimeoutException e) {
      throw new TagEnumerationException("Listing tags of " + repository + " timed out", e);
    } catch (IOException e) {
      throw new TagEnumerationException("Listing tags of " + repository + " failed", e);
    } finally {
      deleteQuietly(workDirectory);
    }
  }

  private static void deleteQuietly(Path directory) {
    if (directory == null) {
      return;
    }
    try {
      Files.deleteIfExists(directory);
    } catch (IOException e) {
      LOGGER.debug("Could not delete {}", directory, e);
    }
  }
}
