package de.ialistannen.beacon.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.scanner.CommandResult;
import de.ialistannen.beacon.scanner.CommandRunner;
import de.ialistannen.beacon.scanner.CommandTimeoutException;
import de.ialistannen.beacon.scanner.ToolNotFoundException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CraneTagEnumeratorTest {

  private static final RepositoryPath REPOSITORY = new RepositoryPath("mcr.microsoft.com", "azurelinux/base/python");
  private static final Duration TIMEOUT = Duration.ofSeconds(30);

  @Test
  void listsTagsOfRepository() throws TagEnumerationException {
    List<List<String>> commands = new ArrayList<>();
    CommandRunner runner = (command, timeout, directory) -> {
      commands.add(command);
      return new CommandResult(0, "3.12\n3.12.3-1\n\n  latest  \n", "");
    };

    List<ImageReference> tags = new CraneTagEnumerator(runner, "crane", TIMEOUT).listTags(REPOSITORY);

    assertThat(tags).extracting(ImageReference::tag).containsExactly("3.12", "3.12.3-1", "latest");
    assertThat(tags).allSatisfy(it -> assertThat(it.repositoryPath()).isEqualTo(REPOSITORY));
    assertThat(commands).containsExactly(List.of("crane", "ls", "mcr.microsoft.com/azurelinux/base/python"));
  }

  @Test
  void failedListingKeepsStderr() {
    CommandRunner runner = (command, timeout, directory) -> new CommandResult(1, "", "UNAUTHORIZED\n");

    assertThatThrownBy(() -> new CraneTagEnumerator(runner, "crane", TIMEOUT).listTags(REPOSITORY))
      .isInstanceOf(TagEnumerationException.class)
      .hasMessageContaining("UNAUTHORIZED");
  }

  @Test
  void missingCraneIsReported() {
    CommandRunner runner = (command, timeout, directory) -> {
      throw new ToolNotFoundException("crane", new IOException("No such file"));
    };

    assertThatThrownBy(() -> new CraneTagEnumerator(runner, "crane", TIMEOUT).listTags(REPOSITORY))
      .isInstanceOf(TagEnumerationException.class)
      .hasMessageContaining("not installed");
  }

  @Test
  void timeoutIsReported() {
    CommandRunner runner = (command, timeout, directory) -> {
      throw new CommandTimeoutException("crane", timeout);
    };

    assertThatThrownBy(() -> new CraneTagEnumerator(runner, "crane", TIMEOUT).listTags(REPOSITORY))
      .isInstanceOf(TagEnumerationException.class)
      .hasCauseInstanceOf(CommandTimeoutException.class);
  }
}
