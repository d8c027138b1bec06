package de.ialistannen.beacon.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.ialistannen.beacon.model.ImagePackage;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.LanguageRuntime;
import de.ialistannen.beacon.model.ToolProvenance;
import de.ialistannen.beacon.model.Vulnerability;
import de.ialistannen.beacon.model.VulnerabilityCounts;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.recommend.LanguageLeaderboard.Entry;
import de.ialistannen.beacon.recommend.LanguageLeaderboard.LanguageRanking;
import de.ialistannen.beacon.recommend.RankedImage;
import de.ialistannen.beacon.recommend.Reasoning;
import de.ialistannen.beacon.recommend.ScoreBreakdown;
import de.ialistannen.beacon.storage.ImagePage;
import de.ialistannen.beacon.storage.StoreStatistics;
import de.ialistannen.beacon.storage.StoreStatistics.LanguageSummary;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Renders results as machine-parseable JSON.
 */
public class JsonReports {

  private final ObjectMapper objectMapper;

  public JsonReports(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public ArrayNode recommendations(List<RankedImage> rankedImages) {
    ArrayNode result = objectMapper.createArrayNode();
    for (RankedImage rankedImage : rankedImages) {
      ObjectNode node = result.addObject();
      node.put("rank", rankedImage.rank());
      node.put("image", rankedImage.reference().fullName());
      node.put("digest", rankedImage.digest());
      node.set("score", score(rankedImage.score()));
      node.set("reasoning", reasoning(rankedImage.reasoning()));
    }
    return result;
  }

  private ObjectNode score(ScoreBreakdown score) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("critical", score.critical());
    node.put("high", score.high());
    node.put("total", score.total());
    node.put("sizeCategory", score.sizeCategory().map(it -> it.name().toLowerCase(Locale.ROOT)).orElse(null));
    node.put("sizeDistance", score.sizeDistance());
    node.put("sizeBytes", score.sizeBytes());
    node.put("packageCoverage", score.packageCoverage());
    return node;
  }

  private ObjectNode reasoning(Reasoning reasoning) {
    ObjectNode node = objectMapper.createObjectNode();
    ArrayNode passed = node.putArray("passedFilters");
    reasoning.passedFilters().forEach(passed::add);
    ArrayNode missing = node.putArray("missingPackages");
    reasoning.missingPackages().forEach(missing::add);
    reasoning.meetsMaximumSecurity().ifPresent(it -> node.put("meetsMaximumSecurity", it));
    return node;
  }

  public ObjectNode image(ImageRecord record) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("image", record.reference().fullName());
    node.put("registry", record.reference().registry());
    node.put("repository", record.reference().repository());
    node.put("tag", record.reference().tag());
    node.put("digest", record.digest());
    node.put("sizeBytes", record.sizeBytes());
    node.put("layerCount", record.layerCount());
    node.put("createdAt", record.createdAt().map(Object::toString).orElse(null));
    node.put("scannedAt", record.scannedAt().toString());
    node.put("comprehensive", record.comprehensive());
    record.operatingSystem().ifPresent(os -> {
      ObjectNode osNode = node.putObject("operatingSystem");
      osNode.put("name", os.name());
      osNode.put("version", os.version());
    });
    node.put("packageCount", record.packages().size());

    ArrayNode runtimes = node.putArray("languages");
    for (LanguageRuntime runtime : record.runtimes()) {
      ObjectNode runtimeNode = runtimes.addObject();
      runtimeNode.put("language", runtime.language());
      runtimeNode.put("version", runtime.version());
    }

    node.set("vulnerabilities", counts(record.counts()));

    ArrayNode sources = node.putArray("sources");
    for (ToolProvenance provenance : record.provenance()) {
      ObjectNode sourceNode = sources.addObject();
      sourceNode.put("tool", provenance.toolName());
      sourceNode.put("version", provenance.toolVersion());
      sourceNode.put("status", provenance.status().name());
      if (!provenance.detail().isEmpty()) {
        sourceNode.put("detail", provenance.detail());
      }
    }
    return node;
  }

  private ObjectNode counts(VulnerabilityCounts counts) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("critical", counts.critical());
    node.put("high", counts.high());
    node.put("medium", counts.medium());
    node.put("low", counts.low());
    node.put("unknown", counts.unknown());
    node.put("total", counts.total());
    return node;
  }

  /**
   * Builds a full dump of the store: statistics plus every image with its packages and vulnerabilities.
   *
   * @param records the images, in the order to export them
   * @param statistics the store statistics
   * @param exportedAt the export time
   * @return the export document
   */
  public ObjectNode export(List<ImageRecord> records, StoreStatistics statistics, Instant exportedAt) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("exportedAt", exportedAt.toString());
    node.set("statistics", statistics(statistics));

    ArrayNode images = node.putArray("images");
    for (ImageRecord record : records) {
      ObjectNode imageNode = image(record);

      ArrayNode packages = imageNode.putArray("packages");
      for (ImagePackage pkg : record.packages()) {
        ObjectNode packageNode = packages.addObject();
        packageNode.put("name", pkg.name());
        packageNode.put("version", pkg.version());
        packageNode.put("ecosystem", pkg.ecosystem().name().toLowerCase(Locale.ROOT));
        packageNode.put("purl", pkg.purl());
      }

      ArrayNode findings = imageNode.putArray("findings");
      for (Vulnerability vulnerability : record.vulnerabilities()) {
        ObjectNode findingNode = findings.addObject();
        findingNode.put("id", vulnerability.id());
        findingNode.put("severity", vulnerability.severity().name());
        findingNode.put("package", vulnerability.affectedPackage().name());
        findingNode.put("packageVersion", vulnerability.affectedPackage().version());
        ArrayNode tools = findingNode.putArray("tools");
        vulnerability.sourceTools().forEach(tools::add);
        vulnerability.fixedVersion().ifPresent(it -> findingNode.put("fixedVersion", it));
        vulnerability.cvssScore().ifPresent(it -> findingNode.put("cvssScore", it));
      }
      images.add(imageNode);
    }
    return node;
  }

  public ArrayNode leaderboard(List<LanguageRanking> rankings) {
    ArrayNode result = objectMapper.createArrayNode();
    for (LanguageRanking ranking : rankings) {
      ObjectNode rankingNode = result.addObject();
      rankingNode.put("language", ranking.language());
      ArrayNode entries = rankingNode.putArray("images");
      for (Entry entry : ranking.entries()) {
        ObjectNode entryNode = entries.addObject();
        entryNode.put("rank", entry.rank());
        entryNode.put("image", entry.reference().fullName());
        entryNode.put("digest", entry.digest());
        entryNode.put("version", entry.version().isEmpty() ? null : entry.version());
        entryNode.set("vulnerabilities", counts(entry.counts()));
        entryNode.put("sizeBytes", entry.sizeBytes());
      }
    }
    return result;
  }

  public ObjectNode page(ImagePage page) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("page", page.page());
    node.put("pageSize", page.pageSize());
    node.put("pageCount", page.pageCount());
    node.put("totalCount", page.totalCount());
    ArrayNode images = node.putArray("images");
    page.records().forEach(it -> images.add(image(it)));
    return node;
  }

  public ObjectNode statistics(StoreStatistics statistics) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("totalImages", statistics.totalImages());
    node.put("totalPackages", statistics.totalPackages());
    node.put("avgVulnerabilitiesPerImage", statistics.avgVulnerabilitiesPerImage());
    node.put("zeroVulnerabilityCount", statistics.zeroVulnerabilityCount());
    node.put("safeImageCount", statistics.safeImageCount());

    ObjectNode distribution = node.putObject("languageDistribution");
    statistics.languageDistribution().forEach(distribution::put);

    ArrayNode languages = node.putArray("languages");
    for (LanguageSummary summary : statistics.languages()) {
      ObjectNode summaryNode = languages.addObject();
      summaryNode.put("language", summary.language());
      summaryNode.put("imageCount", summary.imageCount());
      summaryNode.put("averageVulnerabilities", summary.averageVulnerabilities());
      summaryNode.put("averageSizeBytes", summary.averageSizeBytes());
    }
    return node;
  }

  public ObjectNode scanReport(RepositoryScanReport report) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("source", report.source());
    node.put("status", report.status().name());
    node.put("cancelled", report.cancelled());

    ArrayNode images = node.putArray("images");
    for (ImageStatus status : report.images()) {
      ObjectNode statusNode = images.addObject();
      statusNode.put("image", status.reference().map(Object::toString).orElse(null));
      statusNode.put("state", status.state().name());
      status.record().ifPresent(it -> statusNode.put("digest", it.digest()));
      status.error().ifPresent(it -> statusNode.put("error", it));
    }
    return node;
  }

  /**
   * @param node the node to render
   * @return the pretty printed JSON
   */
  public String render(Object node) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not serialize report", e);
    }
  }
}
