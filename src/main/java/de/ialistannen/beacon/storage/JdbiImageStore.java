package de.ialistannen.beacon.storage;

import com.google.common.base.Throwables;
import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.PackageKey;
import de.ialistannen.beacon.model.Vulnerability;
import de.ialistannen.beacon.storage.UpsertResult.Outcome;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.h2.api.ErrorCode;
import org.h2.jdbcx.JdbcConnectionPool;
import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link ImageStore} backed by an H2 database accessed through JDBI.
 */
public class JdbiImageStore implements ImageStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(JdbiImageStore.class);
  private static final String SCHEMA_RESOURCE = "/db/schema.sql";

  private final JdbcConnectionPool connectionPool;
  private final Jdbi jdbi;
  private final ReentrantLock writeLock;
  private final List<String> startupWarnings;

  private JdbiImageStore(JdbcConnectionPool connectionPool, List<String> startupWarnings) {
    this.connectionPool = connectionPool;
    this.jdbi = Jdbi.create(connectionPool).installPlugin(new SqlObjectPlugin());
    this.writeLock = new ReentrantLock();
    this.startupWarnings = List.copyOf(startupWarnings);
  }

  /**
   * Opens the store in the given file, creating it if it does not exist. A file that is a placeholder (like a Git
   * LFS pointer) or can not be opened as a database is moved aside and replaced by an empty store.
   *
   * @param basePath the database path without the {@code .mv.db} suffix
   * @return the opened store
   * @throws StoreException if the store could not be opened or created
   */
  public static JdbiImageStore open(Path basePath) {
    Path absoluteBase = basePath.toAbsolutePath();
    Path databaseFile = absoluteBase.resolveSibling(absoluteBase.getFileName() + StoreFiles.DATABASE_SUFFIX);
    List<String> warnings = new ArrayList<>();

    try {
      Files.createDirectories(absoluteBase.getParent());
      Optional<String> placeholderReason = StoreFiles.findPlaceholderReason(databaseFile);
      if (placeholderReason.isPresent()) {
        recover(databaseFile, placeholderReason.get(), warnings);
      } else if (!Files.exists(databaseFile)) {
        LOGGER.info("No store found at {}, creating an empty one", databaseFile);
      }
    } catch (IOException e) {
      throw new StoreException("Could not prepare store at " + databaseFile, e);
    }

    String url = "jdbc:h2:file:" + absoluteBase;
    try {
      return initialize(JdbcConnectionPool.create(url, "sa", ""), warnings);
    } catch (JdbiException e) {
      if (!isCorruptedFile(e)) {
        throw new StoreException("Could not open store at " + databaseFile, e);
      }
      try {
        recover(databaseFile, "the database could not be opened (" + e.getMessage() + ")", warnings);
      } catch (IOException moveException) {
        e.addSuppressed(moveException);
        throw new StoreException("Could not open store at " + databaseFile, e);
      }
      return initialize(JdbcConnectionPool.create(url, "sa", ""), warnings);
    }
  }

  /**
   * Opens a store that only lives in memory until it is closed.
   *
   * @param name the name of the database, stores with the same name share their data while open
   * @return the opened store
   */
  public static JdbiImageStore inMemory(String name) {
    return initialize(JdbcConnectionPool.create("jdbc:h2:mem:" + name, "sa", ""), List.of());
  }

  private static JdbiImageStore initialize(JdbcConnectionPool pool, List<String> warnings) {
    JdbiImageStore store = new JdbiImageStore(pool, warnings);
    try {
      store.jdbi.useTransaction(handle -> handle.createScript(readSchema()).execute());
    } catch (JdbiException e) {
      pool.dispose();
      throw e;
    }
    return store;
  }

  private static boolean isCorruptedFile(JdbiException e) {
    return Throwables.getCausalChain(e).stream()
      .filter(SQLException.class::isInstance)
      .map(SQLException.class::cast)
      .anyMatch(it -> it.getErrorCode() == ErrorCode.FILE_CORRUPTED_1
        || it.getErrorCode() == ErrorCode.FILE_VERSION_ERROR_1);
  }

  private static void recover(Path databaseFile, String reason, List<String> warnings) throws IOException {
    if (!Files.exists(databaseFile)) {
      return;
    }
    Path movedTo = StoreFiles.moveAside(databaseFile);
    String warning = "Store at " + databaseFile + " was unusable (" + reason + "), moved it to " + movedTo
      + " and started with an empty store";
    LOGGER.warn(warning);
    warnings.add(warning);
  }

  private static String readSchema() {
    try (InputStream inputStream = JdbiImageStore.class.getResourceAsStream(SCHEMA_RESOURCE)) {
      if (inputStream == null) {
        throw new StoreException("Schema resource " + SCHEMA_RESOURCE + " is missing");
      }
      return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public UpsertResult upsert(ImageRecord record, boolean updateExisting) {
    writeLock.lock();
    try {
      UpsertResult result = jdbi.inTransaction(handle -> upsertInTransaction(handle, record, updateExisting));
      LOGGER.debug("Upserted {} ({}): {}", record.reference(), record.digest(), result.outcome());
      return result;
    } catch (JdbiException e) {
      throw new StoreException("Could not store " + record.reference() + " (" + record.digest() + ")", e);
    } finally {
      writeLock.unlock();
    }
  }

  private static UpsertResult upsertInTransaction(Handle handle, ImageRecord record, boolean updateExisting) {
    ImageDao dao = handle.attach(ImageDao.class);
    Optional<Long> existingId = dao.findImageIdByDigest(record.digest());

    long imageId;
    Outcome outcome;
    if (existingId.isEmpty()) {
      imageId = dao.insertImage(record);
      writeOwnedEntities(dao, imageId, record);
      outcome = Outcome.INSERTED;
    } else if (updateExisting) {
      imageId = existingId.get();
      dao.updateImage(imageId, record);
      dao.deleteVulnerabilities(imageId);
      dao.deletePackageLinks(imageId);
      dao.deleteRuntimes(imageId);
      dao.deleteScanSources(imageId);
      writeOwnedEntities(dao, imageId, record);
      outcome = Outcome.UPDATED;
    } else {
      imageId = existingId.get();
      outcome = Outcome.UNCHANGED;
    }

    dao.pointTag(record.reference().registry(), record.reference().repository(), record.reference().tag(), imageId);

    ImageRecord stored = dao.loadRecord(imageId)
      .orElseThrow(() -> new StoreException("Image " + record.digest() + " vanished during upsert"));
    return new UpsertResult(stored, outcome);
  }

  private static void writeOwnedEntities(ImageDao dao, long imageId, ImageRecord record) {
    Map<PackageKey, Long> packageIds = new HashMap<>();
    List<Long> linkedIds = new ArrayList<>();
    List<String> purls = new ArrayList<>();
    for (ImagePackage pkg : record.packages()) {
      long packageId = dao.packageId(pkg.key());
      packageIds.put(pkg.key(), packageId);
      linkedIds.add(packageId);
      purls.add(pkg.purl());
    }
    if (!linkedIds.isEmpty()) {
      dao.linkPackages(imageId, linkedIds, purls);
    }

    for (Vulnerability vulnerability : record.vulnerabilities()) {
      Long packageId = packageIds.get(vulnerability.affectedPackage());
      if (packageId == null) {
        packageId = dao.packageId(vulnerability.affectedPackage());
      }
      dao.insertVulnerability(imageId, packageId, vulnerability);
    }

    dao.insertRuntimes(imageId, record.runtimes());
    dao.insertScanSources(imageId, record.provenance());
  }

  @Override
  public Optional<ImageRecord> findByReference(String registry, String repository, String tag) {
    return read(handle -> {
      ImageDao dao = handle.attach(ImageDao.class);
      return dao.findImageIdByTag(registry, repository, tag)
        .flatMap(dao::loadRecord)
        .map(it -> it.withReference(new ImageReference(registry, repository, tag)));
    });
  }

  @Override
  public Optional<ImageRecord> findByDigest(String digest) {
    return read(handle -> {
      ImageDao dao = handle.attach(ImageDao.class);
      return dao.findImageIdByDigest(digest).flatMap(dao::loadRecord);
    });
  }

  @Override
  public ImagePage query(ImageFilter filter, int page, int pageSize) {
    if (page < 1) {
      throw new IllegalArgumentException("Page must be at least 1, was " + page);
    }
    if (pageSize < 1) {
      throw new IllegalArgumentException("Page size must be at least 1, was " + pageSize);
    }

    List<String> conditions = new ArrayList<>();
    Map<String, Object> bindings = new HashMap<>();

    filter.language().ifPresent(language -> {
      conditions.add("""
        EXISTS (
          SELECT 1 FROM language_runtimes lr WHERE lr.image_id = i.id AND LOWER(lr.language) = :language
        )""");
      bindings.put("language", language.toLowerCase(Locale.ROOT));
    });
    switch (filter.securityFilter()) {
      case SECURE -> conditions.add("i.total_count = 0");
      case SAFE -> conditions.add("i.critical_count = 0 AND i.high_count = 0");
      case VULNERABLE -> conditions.add("i.total_count > 0");
      case ANY -> {
      }
    }
    filter.maxVulnerabilities().ifPresent(max -> {
      conditions.add("i.total_count <= :maxVulnerabilities");
      bindings.put("maxVulnerabilities", max);
    });
    filter.textSearch().ifPresent(text -> {
      conditions.add("(LOWER(i.repository) LIKE :text ESCAPE '\\' OR LOWER(i.tag) LIKE :text ESCAPE '\\')");
      bindings.put("text", "%" + escapeLike(text.toLowerCase(Locale.ROOT)) + "%");
    });

    String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

    return read(handle -> {
      long total = handle.createQuery("SELECT COUNT(*) FROM images i" + where)
        .bindMap(bindings)
        .mapTo(Long.class)
        .one();

      List<Long> ids = handle.createQuery(
          "SELECT i.id FROM images i" + where + " ORDER BY i.scanned_at DESC, i.id DESC LIMIT :limit OFFSET :offset"
        )
        .bindMap(bindings)
        .bind("limit", pageSize)
        .bind("offset", (long) (page - 1) * pageSize)
        .mapTo(Long.class)
        .list();

      ImageDao dao = handle.attach(ImageDao.class);
      List<ImageRecord> records = ids.stream()
        .map(dao::loadRecord)
        .flatMap(Optional::stream)
        .toList();

      return new ImagePage(records, total, page, pageSize);
    });
  }

  @Override
  public List<ImageRecord> findByLanguage(String language) {
    return read(handle -> {
      List<Long> ids = handle.createQuery("""
          SELECT DISTINCT image_id
            FROM language_runtimes
           WHERE LOWER(language) = :language
           ORDER BY image_id
          """)
        .bind("language", language.toLowerCase(Locale.ROOT))
        .mapTo(Long.class)
        .list();

      ImageDao dao = handle.attach(ImageDao.class);
      return ids.stream().map(dao::loadRecord).flatMap(Optional::stream).toList();
    });
  }

  @Override
  public List<ImageRecord> findAll() {
    return read(handle -> {
      ImageDao dao = handle.attach(ImageDao.class);
      return dao.findAllImageIds().stream().map(dao::loadRecord).flatMap(Optional::stream).toList();
    });
  }

  @Override
  public StoreStatistics aggregateStatistics() {
    return read(handle -> {
      ImageDao dao = handle.attach(ImageDao.class);
      return new StoreStatistics(
        dao.countImages(),
        dao.countDistinctPackages(),
        dao.averageVulnerabilities(),
        dao.languageDistribution(),
        dao.countWithoutVulnerabilities(),
        dao.countSafe(),
        dao.languageSummaries()
      );
    });
  }

  @Override
  public List<String> startupWarnings() {
    return startupWarnings;
  }

  @Override
  public void close() {
    connectionPool.dispose();
  }

  private <T> T read(ReadAction<T> action) {
    try {
      return jdbi.inTransaction(action::read);
    } catch (JdbiException e) {
      throw new StoreException("Could not read from store", e);
    }
  }

  private static String escapeLike(String input) {
    return input.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  @FunctionalInterface
  private interface ReadAction<T> {

    T read(Handle handle);
  }
}
