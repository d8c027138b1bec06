package de.ialistannen.beacon.storage;

import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.OperatingSystem;
import de.ialistannen.beacon.model.VulnerabilityCounts;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.jdbi.v3.core.statement.Update;

/**
 * Conversions between image rows and the model.
 */
final class ImageRows {

  private ImageRows() {
    throw new UnsupportedOperationException("No instantiation");
  }

  static Update bindImageColumns(Update update, ImageRecord record) {
    VulnerabilityCounts counts = record.counts();
    return update
      .bind("digest", record.digest())
      .bind("registry", record.reference().registry())
      .bind("repository", record.reference().repository())
      .bind("tag", record.reference().tag())
      .bind("sizeBytes", record.sizeBytes())
      .bind("layerCount", record.layerCount())
      .bindByType("createdAt", record.createdAt().map(ImageRows::toUtc).orElse(null), OffsetDateTime.class)
      .bindByType("scannedAt", toUtc(record.scannedAt()), OffsetDateTime.class)
      .bind("comprehensive", record.comprehensive())
      .bind("osName", record.operatingSystem().map(OperatingSystem::name).orElse(null))
      .bind("osVersion", record.operatingSystem().map(OperatingSystem::version).orElse(null))
      .bind("critical", counts.critical())
      .bind("high", counts.high())
      .bind("medium", counts.medium())
      .bind("low", counts.low())
      .bind("unknown", counts.unknown())
      .bind("total", counts.total());
  }

  static Optional<OperatingSystem> readOperatingSystem(ResultSet rs) throws SQLException {
    String name = rs.getString("os_name");
    if (name == null) {
      return Optional.empty();
    }
    String version = rs.getString("os_version");
    return Optional.of(new OperatingSystem(name, version == null ? "" : version));
  }

  static Optional<Instant> readInstant(ResultSet rs, String column) throws SQLException {
    return Optional.ofNullable(rs.getObject(column, OffsetDateTime.class)).map(OffsetDateTime::toInstant);
  }

  static OffsetDateTime toUtc(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC);
  }
}
