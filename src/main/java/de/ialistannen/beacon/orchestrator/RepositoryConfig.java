package de.ialistannen.beacon.orchestrator;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.InvalidReferenceException;
import de.ialistannen.beacon.model.RepositoryPath;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * The entries of a repository configuration file. One entry per line, blank lines and lines starting with {@code #}
 * are ignored. An entry with a tag is scanned as a single image, all other entries name a repository whose tags are
 * enumerated.
 *
 * @param entries the entries in file order
 */
public record RepositoryConfig(List<Entry> entries) {

  public RepositoryConfig {
    entries = List.copyOf(entries);
  }

  /**
   * Reads a configuration file.
   *
   * @param file the file
   * @param defaultRegistry the registry for entries that do not name one
   * @return the parsed configuration
   * @throws RepositoryConfigException if the file can not be read or contains an invalid entry
   */
  public static RepositoryConfig read(Path file, String defaultRegistry) {
    try {
      return parse(Files.readString(file, StandardCharsets.UTF_8), defaultRegistry);
    } catch (IOException e) {
      throw new RepositoryConfigException("Could not read repository configuration " + file, e);
    }
  }

  /**
   * Parses the contents of a configuration file.
   *
   * @param contents the file contents
   * @param defaultRegistry the registry for entries that do not name one
   * @return the parsed configuration
   * @throws RepositoryConfigException if an entry is invalid
   */
  public static RepositoryConfig parse(String contents, String defaultRegistry) {
    List<Entry> entries = new ArrayList<>();

    String[] lines = contents.split("\\R");
    for (int i = 0; i < lines.length; i++) {
      String line = lines[i].strip();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      try {
        entries.add(parseEntry(line, defaultRegistry));
      } catch (InvalidReferenceException e) {
        throw new RepositoryConfigException("Invalid entry in line " + (i + 1) + ": '" + line + "'", e);
      }
    }

    return new RepositoryConfig(entries);
  }

  private static Entry parseEntry(String line, String defaultRegistry) {
    int lastSlash = line.lastIndexOf('/');
    if (line.lastIndexOf(':') > lastSlash) {
      return new ImageEntry(ImageReference.parse(line, defaultRegistry));
    }
    return new RepositoryEntry(RepositoryPath.parse(line, defaultRegistry));
  }

  public sealed interface Entry permits ImageEntry, RepositoryEntry {

  }

  /**
   * A single image, scanned without enumerating tags.
   */
  public record ImageEntry(ImageReference reference) implements Entry {

  }

  /**
   * A repository whose tags are enumerated.
   */
  public record RepositoryEntry(RepositoryPath repository) implements Entry {

  }
}
