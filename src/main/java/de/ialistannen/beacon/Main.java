package de.ialistannen.beacon;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.parser.CronParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientBuilder;
import de.ialistannen.beacon.cli.Action;
import de.ialistannen.beacon.cli.CliArguments;
import de.ialistannen.beacon.cli.CliArgumentsParser;
import de.ialistannen.beacon.config.BeaconConfig;
import de.ialistannen.beacon.config.BeaconConfig.Executables;
import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.InvalidReferenceException;
import de.ialistannen.beacon.model.RepositoryPath;
import de.ialistannen.beacon.normalize.LanguageDetector;
import de.ialistannen.beacon.normalize.ResultNormalizer;
import de.ialistannen.beacon.orchestrator.ImageScanException;
import de.ialistannen.beacon.orchestrator.RepositoryConfigException;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport;
import de.ialistannen.beacon.orchestrator.RepositoryScanReport.ImageStatus;
import de.ialistannen.beacon.orchestrator.ScanCancellation;
import de.ialistannen.beacon.orchestrator.ScanOptions;
import de.ialistannen.beacon.orchestrator.ScanOrchestrator;
import de.ialistannen.beacon.recommend.LanguageLeaderboard;
import de.ialistannen.beacon.recommend.LanguageLeaderboard.LanguageRanking;
import de.ialistannen.beacon.recommend.RankedImage;
import de.ialistannen.beacon.recommend.RecommendationEngine;
import de.ialistannen.beacon.recommend.RelaxedRecommendation;
import de.ialistannen.beacon.recommend.Requirements;
import de.ialistannen.beacon.recommend.RequirementsDeriver;
import de.ialistannen.beacon.recommend.SecurityLevel;
import de.ialistannen.beacon.recommend.SizePreference;
import de.ialistannen.beacon.recommend.SizeThresholds;
import de.ialistannen.beacon.registry.CraneTagEnumerator;
import de.ialistannen.beacon.report.JsonReports;
import de.ialistannen.beacon.report.TextReports;
import de.ialistannen.beacon.scanner.CommandRunner;
import de.ialistannen.beacon.scanner.DockerInspectAdapter;
import de.ialistannen.beacon.scanner.GrypeAdapter;
import de.ialistannen.beacon.scanner.ProcessCommandRunner;
import de.ialistannen.beacon.scanner.ScannerAdapter;
import de.ialistannen.beacon.scanner.SyftAdapter;
import de.ialistannen.beacon.scanner.ToolVersionProbe;
import de.ialistannen.beacon.scanner.TrivyAdapter;
import de.ialistannen.beacon.storage.ImageFilter;
import de.ialistannen.beacon.storage.ImageStore;
import de.ialistannen.beacon.storage.JdbiImageStore;
import de.ialistannen.beacon.storage.SecurityFilter;
import de.ialistannen.beacon.storage.StoreException;
import de.ialistannen.beacon.storage.StoreStatistics;
import de.ialistannen.beacon.timing.CronRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  private static final int EXIT_SUCCESS = 0;
  private static final int EXIT_FAILURE = 1;
  private static final int EXIT_PARTIAL = 2;

  private static final int DEFAULT_LIMIT = 5;
  private static final int DEFAULT_PAGE_SIZE = 20;
  private static final int DEFAULT_TOP_PER_LANGUAGE = 10;

  public static void main(String[] args) {
    CliArguments arguments = new CliArgumentsParser().parseOrExit(args);
    System.exit(run(arguments));
  }

  private static int run(CliArguments arguments) {
    Action action;
    BeaconConfig config;
    try {
      action = Action.fromCommand(arguments.action());
      config = configFromArgs(arguments);
    } catch (IllegalArgumentException e) {
      LOGGER.error(e.getMessage());
      return EXIT_FAILURE;
    }

    ObjectMapper objectMapper = new ObjectMapper();
    JsonReports jsonReports = new JsonReports(objectMapper);

    try (ImageStore store = JdbiImageStore.open(config.storePath())) {
      store.startupWarnings().forEach(warning -> LOGGER.warn("Store: {}", warning));

      if (action.isScan()) {
        return runScan(action, arguments, config, objectMapper, store, jsonReports);
      }
      return switch (action) {
        case RECOMMEND -> recommend(arguments, config, store, jsonReports);
        case RECOMMEND_LIKE -> recommendLike(arguments, config, store, jsonReports);
        case LIST -> list(arguments, store, jsonReports);
        case STATS -> {
          StoreStatistics statistics = store.aggregateStatistics();
          print(
            arguments,
            () -> jsonReports.render(jsonReports.statistics(statistics)),
            () -> TextReports.statistics(statistics)
          );
          yield EXIT_SUCCESS;
        }
        case TOP_PER_LANGUAGE -> {
          List<LanguageRanking> rankings = new LanguageLeaderboard()
            .rank(store.findAll(), arguments.topPerLanguage().orElse(DEFAULT_TOP_PER_LANGUAGE));
          write(
            arguments,
            () -> jsonReports.render(jsonReports.leaderboard(rankings)),
            () -> TextReports.leaderboard(rankings, Instant.now())
          );
          yield EXIT_SUCCESS;
        }
        case EXPORT -> {
          ObjectNode export = jsonReports.export(store.findAll(), store.aggregateStatistics(), Instant.now());
          write(arguments, () -> jsonReports.render(export), () -> jsonReports.render(export));
          yield EXIT_SUCCESS;
        }
        default -> throw new IllegalStateException("Unhandled action " + action);
      };
    } catch (InvalidReferenceException | RepositoryConfigException | IllegalArgumentException e) {
      LOGGER.error(e.getMessage());
      return EXIT_FAILURE;
    } catch (StoreException e) {
      LOGGER.error("Store failure", e);
      return EXIT_FAILURE;
    } catch (IOException e) {
      LOGGER.error("Could not write output", e);
      return EXIT_FAILURE;
    }
  }

  private static int runScan(
    Action action,
    CliArguments arguments,
    BeaconConfig config,
    ObjectMapper objectMapper,
    ImageStore store,
    JsonReports jsonReports
  ) {
    ScanOptions options = new ScanOptions(arguments.comprehensive(), arguments.updateExisting());
    int maxTags = arguments.maxTags().orElse(0);
    ScanCancellation cancellation = new ScanCancellation();
    Runtime.getRuntime().addShutdownHook(new Thread(cancellation::cancel));

    DefaultDockerClientConfig.Builder dockerConfig = DefaultDockerClientConfig.createDefaultConfigBuilder();
    try (DockerClient dockerClient = DockerClientBuilder.getInstance(dockerConfig.build()).build()) {
      ScanOrchestrator orchestrator = buildOrchestrator(config, objectMapper, store, dockerClient);

      ScanJob job = switch (action) {
        case SCAN_IMAGE -> {
          ImageReference reference = ImageReference.parse(
            required(arguments.image(), "--image"),
            config.defaultRegistry()
          );
          yield () -> scanSingleImage(orchestrator, reference, options);
        }
        case SCAN_REPOSITORY -> {
          RepositoryPath repository = RepositoryPath.parse(
            required(arguments.repository(), "--repository"),
            config.defaultRegistry()
          );
          yield () -> orchestrator.scanRepository(repository, maxTags, options, cancellation);
        }
        case SCAN_CONFIG -> {
          Path configFile = Path.of(required(arguments.configFile(), "--config"));
          yield () -> orchestrator.scanConfiguration(configFile, options, maxTags, cancellation);
        }
        default -> throw new IllegalStateException("Not a scan action: " + action);
      };

      if (arguments.schedule().isPresent()) {
        Cron cron = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX))
          .parse(arguments.schedule().get())
          .validate();
        new CronRunner(cron, () -> printScanReport(arguments, jsonReports, job.run())).runUntilInterrupted();
        return EXIT_SUCCESS;
      }

      RepositoryScanReport report = job.run();
      printScanReport(arguments, jsonReports, report);
      return switch (report.status()) {
        case SUCCESS -> EXIT_SUCCESS;
        case PARTIAL -> EXIT_PARTIAL;
        case FAILURE -> EXIT_FAILURE;
      };
    } catch (IOException e) {
      LOGGER.error("Could not close the docker client", e);
      return EXIT_FAILURE;
    }
  }

  private static RepositoryScanReport scanSingleImage(
    ScanOrchestrator orchestrator,
    ImageReference reference,
    ScanOptions options
  ) {
    try {
      ImageRecord record = orchestrator.scanImage(reference, options);
      return new RepositoryScanReport(reference.fullName(), List.of(ImageStatus.scanned(reference, record)), false);
    } catch (ImageScanException e) {
      LOGGER.error("Scan of {} failed: {}", reference, e.getMessage());
      return new RepositoryScanReport(
        reference.fullName(),
        List.of(ImageStatus.failed(reference, e.getMessage())),
        false
      );
    }
  }

  private static ScanOrchestrator buildOrchestrator(
    BeaconConfig config,
    ObjectMapper objectMapper,
    ImageStore store,
    DockerClient dockerClient
  ) {
    CommandRunner commandRunner = new ProcessCommandRunner();
    ToolVersionProbe versionProbe = new ToolVersionProbe(commandRunner, config.helperTimeout());
    Executables executables = config.executables();

    List<ScannerAdapter> adapters = List.of(
      new DockerInspectAdapter(dockerClient, config.cleanupImages()),
      new SyftAdapter(commandRunner, executables.syft(), objectMapper),
      new TrivyAdapter(commandRunner, executables.trivy(), objectMapper, versionProbe),
      new GrypeAdapter(commandRunner, executables.grype(), objectMapper)
    );

    return new ScanOrchestrator(
      adapters,
      new ResultNormalizer(LanguageDetector.withDefaultRules(), Clock.systemUTC()),
      store,
      new CraneTagEnumerator(commandRunner, executables.crane(), config.helperTimeout()),
      config.toolTimeout(),
      config.imageBudget(),
      config.defaultRegistry()
    );
  }

  private static int recommend(
    CliArguments arguments,
    BeaconConfig config,
    ImageStore store,
    JsonReports jsonReports
  ) {
    Requirements.Builder builder = Requirements.forLanguage(required(arguments.language(), "--language"))
      .packages(arguments.packages())
      .sizePreference(arguments.sizePreference().map(SizePreference::fromString).orElse(SizePreference.BALANCED))
      .securityLevel(arguments.securityLevel().map(SecurityLevel::fromString).orElse(SecurityLevel.BASIC))
      .excludePlatformSpecific(arguments.excludePlatformSpecific());
    arguments.version().ifPresent(builder::version);
    arguments.maxCritical().ifPresent(builder::maxCritical);
    arguments.maxHigh().ifPresent(builder::maxHigh);
    arguments.maxTotal().ifPresent(builder::maxTotal);
    Requirements requirements = builder.build();

    List<ImageRecord> candidates = store.findByLanguage(requirements.language());
    return printRecommendations(arguments, config, jsonReports, requirements, candidates);
  }

  private static int recommendLike(
    CliArguments arguments,
    BeaconConfig config,
    ImageStore store,
    JsonReports jsonReports
  ) {
    ImageReference reference = ImageReference.parse(required(arguments.image(), "--image"), config.defaultRegistry());
    Optional<ImageRecord> record = store.findByReference(reference);
    if (record.isEmpty()) {
      LOGGER.error("{} has not been scanned yet", reference);
      return EXIT_FAILURE;
    }

    List<Requirements> attempts = new RequirementsDeriver().relaxedFromImage(
      record.get(),
      arguments.sizePreference().map(SizePreference::fromString).orElse(SizePreference.BALANCED),
      arguments.securityLevel().map(SecurityLevel::fromString).orElse(SecurityLevel.BASIC)
    );
    Requirements strictest = attempts.get(0);
    LOGGER.info(
      "Looking for images like {}: {} {} with {} packages",
      reference,
      strictest.language(),
      strictest.version().map(Object::toString).orElse("(any version)"),
      strictest.packages().size()
    );

    List<ImageRecord> candidates = store.findByLanguage(strictest.language()).stream()
      .filter(it -> !it.digest().equals(record.get().digest()))
      .toList();
    RelaxedRecommendation result = new RecommendationEngine(config.sizeThresholds())
      .recommendRelaxing(attempts, candidates, arguments.limit().orElse(DEFAULT_LIMIT));
    if (result.relaxed() && !result.ranked().isEmpty()) {
      LOGGER.info(
        "Relaxed version constraint to {}",
        result.requirements().version().map(Object::toString).orElse("(any version)")
      );
    }
    print(
      arguments,
      () -> jsonReports.render(jsonReports.recommendations(result.ranked())),
      () -> TextReports.recommendations(result.ranked())
    );
    return EXIT_SUCCESS;
  }

  private static int printRecommendations(
    CliArguments arguments,
    BeaconConfig config,
    JsonReports jsonReports,
    Requirements requirements,
    List<ImageRecord> candidates
  ) {
    List<RankedImage> ranked = new RecommendationEngine(config.sizeThresholds())
      .recommend(requirements, candidates, arguments.limit().orElse(DEFAULT_LIMIT));
    print(
      arguments,
      () -> jsonReports.render(jsonReports.recommendations(ranked)),
      () -> TextReports.recommendations(ranked)
    );
    return EXIT_SUCCESS;
  }

  private static int list(CliArguments arguments, ImageStore store, JsonReports jsonReports) {
    ImageFilter filter = ImageFilter.all()
      .withSecurityFilter(arguments.securityFilter().map(SecurityFilter::fromString).orElse(SecurityFilter.ANY));
    if (arguments.language().isPresent()) {
      filter = filter.withLanguage(arguments.language().get());
    }
    if (arguments.maxVulnerabilities().isPresent()) {
      filter = filter.withMaxVulnerabilities(arguments.maxVulnerabilities().get());
    }
    if (arguments.search().isPresent()) {
      filter = filter.withTextSearch(arguments.search().get());
    }

    var page = store.query(filter, arguments.page().orElse(1), arguments.pageSize().orElse(DEFAULT_PAGE_SIZE));
    print(arguments, () -> jsonReports.render(jsonReports.page(page)), () -> TextReports.page(page));
    return EXIT_SUCCESS;
  }

  private static void printScanReport(CliArguments arguments, JsonReports jsonReports, RepositoryScanReport report) {
    print(arguments, () -> jsonReports.render(jsonReports.scanReport(report)), () -> TextReports.scanReport(report));
  }

  private static void print(CliArguments arguments, Renderer json, Renderer text) {
    System.out.println(arguments.json() ? json.render() : text.render());
  }

  private static void write(CliArguments arguments, Renderer json, Renderer text) throws IOException {
    if (arguments.outputFile().isEmpty()) {
      print(arguments, json, text);
      return;
    }
    Path target = Path.of(arguments.outputFile().get());
    if (target.toAbsolutePath().getParent() != null) {
      Files.createDirectories(target.toAbsolutePath().getParent());
    }
    Files.writeString(target, (arguments.json() ? json.render() : text.render()) + "\n", StandardCharsets.UTF_8);
    LOGGER.info("Wrote {}", target);
  }

  private static BeaconConfig configFromArgs(CliArguments arguments) {
    BeaconConfig defaults = BeaconConfig.defaults();
    Executables defaultExecutables = defaults.executables();

    SizeThresholds sizeThresholds = defaults.sizeThresholds();
    if (arguments.minimalMaxMib().isPresent() || arguments.balancedMaxMib().isPresent()) {
      sizeThresholds = SizeThresholds.ofMebibytes(
        arguments.minimalMaxMib().orElse(50),
        arguments.balancedMaxMib().orElse(200)
      );
    }

    return new BeaconConfig(
      arguments.defaultRegistry().orElse(defaults.defaultRegistry()),
      arguments.storePath().map(Path::of).orElse(defaults.storePath()),
      arguments.toolTimeoutSeconds().map(Duration::ofSeconds).orElse(defaults.toolTimeout()),
      arguments.imageBudgetSeconds().map(Duration::ofSeconds).orElse(defaults.imageBudget()),
      defaults.helperTimeout(),
      !arguments.noCleanup(),
      sizeThresholds,
      new Executables(
        arguments.syftExecutable().orElse(defaultExecutables.syft()),
        arguments.trivyExecutable().orElse(defaultExecutables.trivy()),
        arguments.grypeExecutable().orElse(defaultExecutables.grype()),
        arguments.craneExecutable().orElse(defaultExecutables.crane())
      )
    );
  }

  private static String required(Optional<String> value, String option) {
    return value.orElseThrow(() -> new IllegalArgumentException("Missing required option " + option));
  }

  @FunctionalInterface
  private interface ScanJob {

    RepositoryScanReport run();
  }

  @FunctionalInterface
  private interface Renderer {

    String render();
  }
}
