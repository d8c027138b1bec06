package de.ialistannen.beacon.storage;

import java.util.Optional;

/**
 * Conjunctive filters for {@link ImageStore#query(ImageFilter, int, int)}.
 *
 * @param language a language runtime the image must have, case-insensitive
 * @param securityFilter the security preset
 * @param maxVulnerabilities the maximum total number of vulnerabilities
 * @param textSearch a case-insensitive substring of the repository or tag
 */
public record ImageFilter(
  Optional<String> language,
  SecurityFilter securityFilter,
  Optional<Integer> maxVulnerabilities,
  Optional<String> textSearch
) {

  public ImageFilter {
    language = language.filter(it -> !it.isBlank());
    textSearch = textSearch.filter(it -> !it.isBlank());
  }

  public static ImageFilter all() {
    return new ImageFilter(Optional.empty(), SecurityFilter.ANY, Optional.empty(), Optional.empty());
  }

  public ImageFilter withLanguage(String language) {
    return new ImageFilter(Optional.of(language), securityFilter, maxVulnerabilities, textSearch);
  }

  public ImageFilter withSecurityFilter(SecurityFilter securityFilter) {
    return new ImageFilter(language, securityFilter, maxVulnerabilities, textSearch);
  }

  public ImageFilter withMaxVulnerabilities(int maxVulnerabilities) {
    return new ImageFilter(language, securityFilter, Optional.of(maxVulnerabilities), textSearch);
  }

  public ImageFilter withTextSearch(String textSearch) {
    return new ImageFilter(language, securityFilter, maxVulnerabilities, Optional.of(textSearch));
  }
}
