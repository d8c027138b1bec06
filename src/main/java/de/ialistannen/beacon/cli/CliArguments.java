package de.ialistannen.beacon.cli;

import java.util.List;
import java.util.Optional;
import net.jbock.Command;
import net.jbock.Option;
import net.jbock.Parameter;

@Command(name = "beacon", description = "Scans and recommends container base images", publicParser = true)
public interface CliArguments {

  @Parameter(
    index = 0,
    description = "One of scan-image, scan-repo, scan-config, recommend, recommend-like, list, stats, "
      + "top-per-language, export",
    paramLabel = "ACTION"
  )
  String action();

  // Scan targets

  @Option(names = "--image", description = "The image to scan or to find similar images for", paramLabel = "IMAGE")
  Optional<String> image();

  @Option(names = "--repository", description = "The repository whose tags to scan", paramLabel = "REPOSITORY")
  Optional<String> repository();

  @Option(names = "--config", description = "The repository configuration file to scan", paramLabel = "PATH")
  Optional<String> configFile();

  // Scanning

  @Option(names = "--comprehensive", description = "Run vulnerability scanners, not only the SBOM generator")
  boolean comprehensive();

  @Option(names = "--update-existing", description = "Rescan images that are already stored. Default: false")
  boolean updateExisting();

  @Option(names = "--max-tags", description = "Maximum tags per repository, 0 for all. Default: 0", paramLabel = "N")
  Optional<Integer> maxTags();

  @Option(
    names = "--schedule",
    description = "Repeat the scan in cron syntax (https://crontab.guru) instead of running once",
    paramLabel = "CRONTAB"
  )
  Optional<String> schedule();

  @Option(names = "--no-cleanup", description = "Keep images pulled for a scan")
  boolean noCleanup();

  @Option(names = "--tool-timeout", description = "Timeout per tool in seconds. Default: 300", paramLabel = "SECONDS")
  Optional<Integer> toolTimeoutSeconds();

  @Option(
    names = "--image-budget",
    description = "Timeout for all tools of one image in seconds. Default: 900",
    paramLabel = "SECONDS"
  )
  Optional<Integer> imageBudgetSeconds();

  @Option(names = "--syft", description = "The syft executable. Default: syft", paramLabel = "PATH")
  Optional<String> syftExecutable();

  @Option(names = "--trivy", description = "The trivy executable. Default: trivy", paramLabel = "PATH")
  Optional<String> trivyExecutable();

  @Option(names = "--grype", description = "The grype executable. Default: grype", paramLabel = "PATH")
  Optional<String> grypeExecutable();

  @Option(names = "--crane", description = "The crane executable. Default: crane", paramLabel = "PATH")
  Optional<String> craneExecutable();

  // Store

  @Option(
    names = "--store",
    description = "Path of the database, without the .mv.db suffix. Default: data/beacon",
    paramLabel = "PATH"
  )
  Optional<String> storePath();

  @Option(
    names = "--registry",
    description = "Registry for references without one. Default: mcr.microsoft.com",
    paramLabel = "HOST"
  )
  Optional<String> defaultRegistry();

  // Recommendation

  @Option(names = "--language", description = "The required language runtime", paramLabel = "LANGUAGE")
  Optional<String> language();

  @Option(
    names = "--runtime-version",
    description = "The required runtime version, e.g. '3.12' or '>=3.11 <3.13'",
    paramLabel = "CONSTRAINT"
  )
  Optional<String> version();

  @Option(names = "--package", description = "A package that must be installed", paramLabel = "NAME")
  List<String> packages();

  @Option(
    names = "--size",
    description = "Preferred size: minimal, balanced or full. Default: balanced",
    paramLabel = "SIZE"
  )
  Optional<String> sizePreference();

  @Option(
    names = "--security",
    description = "Security level: basic, high or maximum. Default: basic",
    paramLabel = "LEVEL"
  )
  Optional<String> securityLevel();

  @Option(names = "--max-critical", description = "Maximum critical vulnerabilities", paramLabel = "N")
  Optional<Integer> maxCritical();

  @Option(names = "--max-high", description = "Maximum high vulnerabilities", paramLabel = "N")
  Optional<Integer> maxHigh();

  @Option(names = "--max-total", description = "Maximum vulnerabilities", paramLabel = "N")
  Optional<Integer> maxTotal();

  @Option(names = "--exclude-platform-specific", description = "Ignore images tagged for one specific platform")
  boolean excludePlatformSpecific();

  @Option(names = "--limit", description = "Maximum number of recommendations. Default: 5", paramLabel = "N")
  Optional<Integer> limit();

  @Option(
    names = "--minimal-max-mib",
    description = "Images below this size are minimal. Default: 50",
    paramLabel = "MIB"
  )
  Optional<Integer> minimalMaxMib();

  @Option(
    names = "--balanced-max-mib",
    description = "Images below this size are balanced, larger ones full. Default: 200",
    paramLabel = "MIB"
  )
  Optional<Integer> balancedMaxMib();

  // Listing

  @Option(
    names = "--security-filter",
    description = "any, secure (no vulnerabilities), safe (no critical/high) or vulnerable. Default: any",
    paramLabel = "FILTER"
  )
  Optional<String> securityFilter();

  @Option(names = "--max-vulnerabilities", description = "Maximum total vulnerabilities", paramLabel = "N")
  Optional<Integer> maxVulnerabilities();

  @Option(names = "--search", description = "Case-insensitive repository or tag substring", paramLabel = "TEXT")
  Optional<String> search();

  @Option(names = "--page", description = "The page to show, starting at 1. Default: 1", paramLabel = "N")
  Optional<Integer> page();

  @Option(names = "--page-size", description = "Images per page. Default: 20", paramLabel = "N")
  Optional<Integer> pageSize();

  @Option(names = "--top", description = "Images per language for top-per-language. Default: 10", paramLabel = "N")
  Optional<Integer> topPerLanguage();

  // Output

  @Option(
    names = "--output",
    description = "File to write top-per-language or export output to instead of printing it",
    paramLabel = "PATH"
  )
  Optional<String> outputFile();

  @Option(names = "--json", description = "Print machine-parseable JSON")
  boolean json();
}
