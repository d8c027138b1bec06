package de.ialistannen.beacon.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Inspects the database file before it is opened. Repositories distributing a prebuilt database via Git LFS check
 * out a small text pointer instead of the database when LFS is not set up.
 */
final class StoreFiles {

  static final String DATABASE_SUFFIX = ".mv.db";
  private static final String LFS_MARKER = "version https://git-lfs.github.com/spec/v1";
  private static final String H2_HEADER = "H:2";
  private static final int HEADER_BYTES = 1024;

  private StoreFiles() {
    throw new UnsupportedOperationException("No instantiation");
  }

  /**
   * @param databaseFile the database file
   * @return a description of why the file is not a usable database, empty if it is usable or absent
   * @throws IOException if the file could not be read
   */
  static Optional<String> findPlaceholderReason(Path databaseFile) throws IOException {
    if (!Files.exists(databaseFile)) {
      return Optional.empty();
    }
    if (Files.size(databaseFile) == 0) {
      return Optional.of("the database file is empty");
    }

    String head;
    try (InputStream inputStream = Files.newInputStream(databaseFile)) {
      head = new String(inputStream.readNBytes(HEADER_BYTES), StandardCharsets.ISO_8859_1);
    }

    if (head.contains(LFS_MARKER)) {
      return Optional.of("the database file is a Git LFS pointer");
    }
    if (!head.startsWith(H2_HEADER)) {
      return Optional.of("the database file is not an H2 database");
    }
    return Optional.empty();
  }

  /**
   * Moves an unusable database file out of the way, so a new one can be created in its place.
   *
   * @param databaseFile the database file
   * @return the new location of the file
   * @throws IOException if moving failed
   */
  static Path moveAside(Path databaseFile) throws IOException {
    Path target = databaseFile.resolveSibling(databaseFile.getFileName() + ".placeholder");
    int counter = 1;
    while (Files.exists(target)) {
      target = databaseFile.resolveSibling(databaseFile.getFileName() + ".placeholder." + counter++);
    }
    return Files.move(databaseFile, target, StandardCopyOption.ATOMIC_MOVE);
  }
}
