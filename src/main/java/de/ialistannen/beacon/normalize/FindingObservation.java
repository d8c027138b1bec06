package de.ialistannen.beacon.normalize;

import de.ialistannen.beacon.model.Ecosystem;
import de.ialistannen.beacon.model.Severity;
import java.util.List;
import java.util.Optional;

/**
 * A vulnerability finding as reported by one tool.
 */
record FindingObservation(
  String toolName,
  String advisoryId,
  List<String> relatedIds,
  Severity severity,
  String packageName,
  String packageVersion,
  Ecosystem ecosystem,
  Optional<String> fixedVersion,
  Optional<Double> cvssScore
) {

}
