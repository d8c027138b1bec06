package de.ialistannen.beacon.recommend;

import java.util.List;
import java.util.Optional;

/**
 * Explains why an image was recommended.
 *
 * @param passedFilters the filter stages the image passed, with details
 * @param missingPackages required packages the image does not contain (only possible for full size images)
 * @param meetsMaximumSecurity for maximum security requests, whether the image has neither critical nor high
 *   vulnerabilities. Empty for other security levels.
 */
public record Reasoning(
  List<String> passedFilters,
  List<String> missingPackages,
  Optional<Boolean> meetsMaximumSecurity
) {

}
