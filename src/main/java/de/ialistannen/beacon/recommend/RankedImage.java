package de.ialistannen.beacon.recommend;

import de.ialistannen.beacon.model.ImageReference;

/**
 * One entry of a recommendation.
 *
 * @param rank the 1-based rank
 * @param reference the image reference
 * @param digest the image digest
 * @param score the values of the ranking keys
 * @param reasoning why the image qualified
 */
public record RankedImage(
  int rank,
  ImageReference reference,
  String digest,
  ScoreBreakdown score,
  Reasoning reasoning
) {

}
