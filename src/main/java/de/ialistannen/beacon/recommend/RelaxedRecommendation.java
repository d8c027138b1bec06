package de.ialistannen.beacon.recommend;

import java.util.List;

/**
 * The outcome of trying several requirement sets in turn.
 *
 * @param requirements the requirements that produced the result, the last attempted ones if nothing matched
 * @param relaxed whether the first requirements had to be relaxed
 * @param ranked the ranked images, empty if no attempt matched
 */
public record RelaxedRecommendation(Requirements requirements, boolean relaxed, List<RankedImage> ranked) {

}
