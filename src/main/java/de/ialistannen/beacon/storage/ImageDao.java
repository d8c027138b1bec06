package de.ialistannen.beacon.storage;

import de.ialistannen.beacon.model.Ecosystem;
import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.PackageKey;
import de.ialistannen.beacon.model.Severity;
import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.model.ToolProvenance.Status;
import de.ialistannen.beacon.model.Vulnerability;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jdbi.v3.sqlobject.SqlObject;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlBatch;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

/**
 * Data access for image records. Must be used from within a transaction for all writes.
 */
public interface ImageDao extends SqlObject {

  int MAX_DETAIL_LENGTH = 8000;

  @SqlQuery("SELECT id FROM images WHERE digest = :digest")
  Optional<Long> findImageIdByDigest(@Bind("digest") String digest);

  @SqlQuery("""
    SELECT image_id
      FROM image_tags
     WHERE registry = :registry
       AND repository = :repository
       AND tag = :tag
    """)
  Optional<Long> findImageIdByTag(
    @Bind("registry") String registry,
    @Bind("repository") String repository,
    @Bind("tag") String tag
  );

  @SqlUpdate("""
    MERGE INTO image_tags (registry, repository, tag, image_id)
      KEY (registry, repository, tag)
      VALUES (:registry, :repository, :tag, :imageId)
    """)
  void pointTag(
    @Bind("registry") String registry,
    @Bind("repository") String repository,
    @Bind("tag") String tag,
    @Bind("imageId") long imageId
  );

  @SqlUpdate("DELETE FROM image_packages WHERE image_id = :imageId")
  void deletePackageLinks(@Bind("imageId") long imageId);

  @SqlUpdate("DELETE FROM vulnerabilities WHERE image_id = :imageId")
  void deleteVulnerabilities(@Bind("imageId") long imageId);

  @SqlUpdate("DELETE FROM language_runtimes WHERE image_id = :imageId")
  void deleteRuntimes(@Bind("imageId") long imageId);

  @SqlUpdate("DELETE FROM scan_sources WHERE image_id = :imageId")
  void deleteScanSources(@Bind("imageId") long imageId);

  @SqlBatch("INSERT INTO image_packages (image_id, package_id, purl) VALUES (:imageId, :packageId, :purl)")
  void linkPackages(
    @Bind("imageId") long imageId,
    @Bind("packageId") List<Long> packageIds,
    @Bind("purl") List<String> purls
  );

  @SqlBatch("INSERT INTO vulnerability_sources (vulnerability_id, tool_name) VALUES (:vulnerabilityId, :toolName)")
  void insertVulnerabilitySources(
    @Bind("vulnerabilityId") long vulnerabilityId,
    @Bind("toolName") List<String> toolNames
  );

  @SqlQuery("SELECT id FROM images ORDER BY id")
  List<Long> findAllImageIds();

  @SqlQuery("SELECT COUNT(*) FROM images")
  long countImages();

  @SqlQuery("SELECT COUNT(DISTINCT package_id) FROM image_packages")
  long countDistinctPackages();

  @SqlQuery("SELECT COALESCE(AVG(CAST(total_count AS DOUBLE PRECISION)), 0) FROM images")
  double averageVulnerabilities();

  @SqlQuery("SELECT COUNT(*) FROM images WHERE total_count = 0")
  long countWithoutVulnerabilities();

  @SqlQuery("SELECT COUNT(*) FROM images WHERE critical_count = 0 AND high_count = 0")
  long countSafe();

  default long insertImage(ImageRecord record) {
    return ImageRows.bindImageColumns(
      getHandle().createUpdate("""
        INSERT INTO images (
          digest, registry, repository, tag, size_bytes, layer_count, created_at, scanned_at, comprehensive,
          os_name, os_version, critical_count, high_count, medium_count, low_count, unknown_count, total_count
        ) VALUES (
          :digest, :registry, :repository, :tag, :sizeBytes, :layerCount, :createdAt, :scannedAt, :comprehensive,
          :osName, :osVersion, :critical, :high, :medium, :low, :unknown, :total
        )
        """),
      record
    )
      .executeAndReturnGeneratedKeys()
      .mapTo(Long.class)
      .one();
  }

  default void updateImage(long imageId, ImageRecord record) {
    ImageRows.bindImageColumns(
      getHandle().createUpdate("""
        UPDATE images
           SET registry = :registry,
               repository = :repository,
               tag = :tag,
               size_bytes = :sizeBytes,
               layer_count = :layerCount,
               created_at = :createdAt,
               scanned_at = :scannedAt,
               comprehensive = :comprehensive,
               os_name = :osName,
               os_version = :osVersion,
               critical_count = :critical,
               high_count = :high,
               medium_count = :medium,
               low_count = :low,
               unknown_count = :unknown,
               total_count = :total
         WHERE id = :id AND digest = :digest
        """),
      record
    )
      .bind("id", imageId)
      .execute();
  }

  /**
   * Finds or creates the catalog entry of a package.
   *
   * @param key the package key
   * @return the id of the catalog entry
   */
  default long packageId(PackageKey key) {
    Optional<Long> existing = getHandle().createQuery("""
        SELECT id
          FROM packages
         WHERE name = :name AND version = :version AND ecosystem = :ecosystem
        """)
      .bind("name", key.name())
      .bind("version", key.version())
      .bind("ecosystem", key.ecosystem().name())
      .mapTo(Long.class)
      .findOne();

    if (existing.isPresent()) {
      return existing.get();
    }

    return getHandle().createUpdate("""
        INSERT INTO packages (name, version, ecosystem)
        VALUES (:name, :version, :ecosystem)
        """)
      .bind("name", key.name())
      .bind("version", key.version())
      .bind("ecosystem", key.ecosystem().name())
      .executeAndReturnGeneratedKeys()
      .mapTo(Long.class)
      .one();
  }

  default void insertVulnerability(long imageId, long packageId, Vulnerability vulnerability) {
    long vulnerabilityId = getHandle().createUpdate("""
        INSERT INTO vulnerabilities (image_id, advisory_id, severity, package_id, fixed_version, cvss_score)
        VALUES (:imageId, :advisoryId, :severity, :packageId, :fixedVersion, :cvssScore)
        """)
      .bind("imageId", imageId)
      .bind("advisoryId", vulnerability.id())
      .bind("severity", vulnerability.severity().name())
      .bind("packageId", packageId)
      .bind("fixedVersion", vulnerability.fixedVersion().orElse(null))
      .bind("cvssScore", vulnerability.cvssScore().orElse(null))
      .executeAndReturnGeneratedKeys()
      .mapTo(Long.class)
      .one();

    if (!vulnerability.sourceTools().isEmpty()) {
      insertVulnerabilitySources(vulnerabilityId, List.copyOf(vulnerability.sourceTools()));
    }
  }

  default void insertRuntimes(long imageId, List<LanguageRuntime> runtimes) {
    for (LanguageRuntime runtime : runtimes) {
      getHandle().createUpdate("""
          INSERT INTO language_runtimes (image_id, language, version)
          VALUES (:imageId, :language, :version)
          """)
        .bind("imageId", imageId)
        .bind("language", runtime.language())
        .bind("version", runtime.version())
        .execute();
    }
  }

  default void insertScanSources(long imageId, List<ToolProvenance> provenance) {
    for (ToolProvenance source : provenance) {
      String detail = source.detail();
      if (detail.length() > MAX_DETAIL_LENGTH) {
        detail = detail.substring(0, MAX_DETAIL_LENGTH);
      }
      getHandle().createUpdate("""
          INSERT INTO scan_sources (image_id, tool_name, tool_version, status, detail)
          VALUES (:imageId, :toolName, :toolVersion, :status, :detail)
          """)
        .bind("imageId", imageId)
        .bind("toolName", source.toolName())
        .bind("toolVersion", source.toolVersion())
        .bind("status", source.status().name())
        .bind("detail", detail)
        .execute();
    }
  }

  /**
   * Loads a full record.
   *
   * @param imageId the id of the image row
   * @return the record, if the image exists
   */
  default Optional<ImageRecord> loadRecord(long imageId) {
    return getHandle().createQuery("SELECT * FROM images WHERE id = :id")
      .bind("id", imageId)
      .map((rs, ctx) -> new ImageRecord(
        new ImageReference(rs.getString("registry"), rs.getString("repository"), rs.getString("tag")),
        rs.getString("digest"),
        rs.getLong("size_bytes"),
        rs.getInt("layer_count"),
        ImageRows.readInstant(rs, "created_at"),
        ImageRows.readInstant(rs, "scanned_at").orElseThrow(),
        rs.getBoolean("comprehensive"),
        ImageRows.readOperatingSystem(rs),
        loadPackages(imageId),
        loadVulnerabilities(imageId),
        loadRuntimes(imageId),
        loadScanSources(imageId)
      ))
      .findOne();
  }

  default List<ImagePackage> loadPackages(long imageId) {
    return getHandle().createQuery("""
        SELECT p.name, p.version, p.ecosystem, ip.purl
          FROM image_packages ip
          JOIN packages p ON p.id = ip.package_id
         WHERE ip.image_id = :imageId
        """)
      .bind("imageId", imageId)
      .map((rs, ctx) -> new ImagePackage(
        rs.getString("name"),
        rs.getString("version"),
        Ecosystem.valueOf(rs.getString("ecosystem")),
        rs.getString("purl")
      ))
      .list();
  }

  default List<Vulnerability> loadVulnerabilities(long imageId) {
    Map<Long, TreeSet<String>> toolsByVulnerability = new HashMap<>();
    getHandle().createQuery("""
        SELECT vs.vulnerability_id, vs.tool_name
          FROM vulnerability_sources vs
          JOIN vulnerabilities v ON v.id = vs.vulnerability_id
         WHERE v.image_id = :imageId
        """)
      .bind("imageId", imageId)
      .map((rs, ctx) -> Map.entry(rs.getLong("vulnerability_id"), rs.getString("tool_name")))
      .forEach(entry -> toolsByVulnerability.computeIfAbsent(entry.getKey(), key -> new TreeSet<>())
        .add(entry.getValue()));

    return getHandle().createQuery("""
        SELECT v.id, v.advisory_id, v.severity, v.fixed_version, v.cvss_score, p.name, p.version, p.ecosystem
          FROM vulnerabilities v
          JOIN packages p ON p.id = v.package_id
         WHERE v.image_id = :imageId
        """)
      .bind("imageId", imageId)
      .map((rs, ctx) -> {
        double score = rs.getDouble("cvss_score");
        Optional<Double> cvssScore = rs.wasNull() ? Optional.empty() : Optional.of(score);
        return new Vulnerability(
          rs.getString("advisory_id"),
          Severity.valueOf(rs.getString("severity")),
          new PackageKey(rs.getString("name"), rs.getString("version"), Ecosystem.valueOf(rs.getString("ecosystem"))),
          toolsByVulnerability.getOrDefault(rs.getLong("id"), new TreeSet<>()),
          Optional.ofNullable(rs.getString("fixed_version")),
          cvssScore
        );
      })
      .list();
  }

  default List<LanguageRuntime> loadRuntimes(long imageId) {
    return getHandle().createQuery("SELECT language, version FROM language_runtimes WHERE image_id = :imageId")
      .bind("imageId", imageId)
      .map((rs, ctx) -> new LanguageRuntime(rs.getString("language"), rs.getString("version")))
      .list();
  }

  default List<ToolProvenance> loadScanSources(long imageId) {
    return getHandle().createQuery("""
        SELECT tool_name, tool_version, status, detail
          FROM scan_sources
         WHERE image_id = :imageId
        """)
      .bind("imageId", imageId)
      .map((rs, ctx) -> new ToolProvenance(
        rs.getString("tool_name"),
        rs.getString("tool_version"),
        Status.valueOf(rs.getString("status")),
        rs.getString("detail")
      ))
      .list();
  }

  default Map<String, Long> languageDistribution() {
    Map<String, Long> distribution = new TreeMap<>();
    getHandle().createQuery("""
        SELECT language, COUNT(DISTINCT image_id) AS image_count
          FROM language_runtimes
         GROUP BY language
        """)
      .map((rs, ctx) -> Map.entry(rs.getString("language"), rs.getLong("image_count")))
      .forEach(entry -> distribution.put(entry.getKey(), entry.getValue()));
    return distribution;
  }

  default List<StoreStatistics.LanguageSummary> languageSummaries() {
    return getHandle().createQuery("""
        SELECT lr.language,
               COUNT(DISTINCT i.id) AS image_count,
               AVG(CAST(i.total_count AS DOUBLE PRECISION)) AS avg_vulnerabilities,
               AVG(CAST(i.size_bytes AS DOUBLE PRECISION)) AS avg_size
          FROM language_runtimes lr
          JOIN images i ON i.id = lr.image_id
         GROUP BY lr.language
         ORDER BY lr.language
        """)
      .map((rs, ctx) -> new StoreStatistics.LanguageSummary(
        rs.getString("language"),
        rs.getLong("image_count"),
        rs.getDouble("avg_vulnerabilities"),
        rs.getDouble("avg_size")
      ))
      .list();
  }
}
