package de.ialistannen.beacon.config;

import de.ialistannen.beacon.recommend.SizeThresholds;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Runtime configuration.
 *
 * @param defaultRegistry the registry used for references that do not name one
 * @param storePath the base path of the H2 database file, without the {@code .mv.db} suffix
 * @param toolTimeout the maximum time one scanner may take
 * @param imageBudget the maximum time all scanners together may take for one image
 * @param helperTimeout the timeout for short helper commands like version probes and tag listing
 * @param cleanupImages whether to remove images pulled for a scan afterwards
 * @param sizeThresholds the size category limits
 * @param executables the names or paths of the external tools
 */
public record BeaconConfig(
  String defaultRegistry,
  Path storePath,
  Duration toolTimeout,
  Duration imageBudget,
  Duration helperTimeout,
  boolean cleanupImages,
  SizeThresholds sizeThresholds,
  Executables executables
) {

  public static final String DEFAULT_REGISTRY = "mcr.microsoft.com";
  public static final Path DEFAULT_STORE_PATH = Path.of("data/beacon");
  public static final Duration DEFAULT_TOOL_TIMEOUT = Duration.ofSeconds(300);
  public static final Duration DEFAULT_IMAGE_BUDGET = Duration.ofSeconds(900);
  public static final Duration DEFAULT_HELPER_TIMEOUT = Duration.ofSeconds(30);

  public BeaconConfig {
    if (toolTimeout.isNegative() || toolTimeout.isZero()) {
      throw new IllegalArgumentException("Tool timeout must be positive");
    }
    if (imageBudget.isNegative() || imageBudget.isZero()) {
      throw new IllegalArgumentException("Image budget must be positive");
    }
  }

  public static BeaconConfig defaults() {
    return new BeaconConfig(
      DEFAULT_REGISTRY,
      DEFAULT_STORE_PATH,
      DEFAULT_TOOL_TIMEOUT,
      DEFAULT_IMAGE_BUDGET,
      DEFAULT_HELPER_TIMEOUT,
      true,
      SizeThresholds.defaults(),
      Executables.defaults()
    );
  }

  /**
   * @param syft the SBOM generator
   * @param trivy the first vulnerability scanner
   * @param grype the second vulnerability scanner
   * @param crane the tag lister
   */
  public record Executables(String syft, String trivy, String grype, String crane) {

    public static Executables defaults() {
      return new Executables("syft", "trivy", "grype", "crane");
    }
  }
}
