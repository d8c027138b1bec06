package de.ialistannen.beacon.model;

import java.util.Locale;

/**
 * A fully qualified image reference. The {@code (registry, repository, tag)} triple is a mutable pointer, the
 * digest of the image it points to is stored separately.
 *
 * @param registry the registry host, e.g. {@code mcr.microsoft.com}
 * @param repository the repository path inside the registry, e.g. {@code azurelinux/base/python}
 * @param tag the tag
 */
public record ImageReference(String registry, String repository, String tag) {

  public static final String DEFAULT_TAG = "latest";

  public ImageReference {
    if (registry == null || registry.isBlank()) {
      throw new InvalidReferenceException("Registry must not be empty");
    }
    if (repository == null || repository.isBlank()) {
      throw new InvalidReferenceException("Repository must not be empty");
    }
    if (tag == null || tag.isBlank()) {
      throw new InvalidReferenceException("Tag must not be empty");
    }
  }

  /**
   * @return the reference in the form {@code registry/repository:tag}
   */
  public String fullName() {
    return registry() + "/" + repository() + ":" + tag();
  }

  /**
   * @return the repository including its registry, without a tag
   */
  public String repositoryName() {
    return registry() + "/" + repository();
  }

  /**
   * @return the repository this reference points into
   */
  public RepositoryPath repositoryPath() {
    return new RepositoryPath(registry(), repository());
  }

  /**
   * @param newTag the tag to point to
   * @return a reference to the same repository with a different tag
   */
  public ImageReference withTag(String newTag) {
    return new ImageReference(registry(), repository(), newTag);
  }

  @Override
  public String toString() {
    return fullName();
  }

  /**
   * Converts a string of the form {@code [registry/]repository[:tag]} to an {@link ImageReference}.
   *
   * @param asString the image string
   * @param defaultRegistry the registry to use if the string does not name one
   * @return the parsed reference
   * @throws InvalidReferenceException if the string is not a valid reference
   */
  public static ImageReference parse(String asString, String defaultRegistry) {
    String trimmed = asString == null ? "" : asString.strip();
    if (trimmed.isEmpty()) {
      throw new InvalidReferenceException("Empty image reference");
    }
    if (trimmed.contains("@")) {
      throw new InvalidReferenceException("Digest references are not supported: " + trimmed);
    }

    int imageStart = trimmed.lastIndexOf('/');
    int tagStart = trimmed.lastIndexOf(':');

    String tag = DEFAULT_TAG;
    String name = trimmed;
    if (tagStart > imageStart) {
      tag = trimmed.substring(tagStart + 1);
      name = trimmed.substring(0, tagStart);
    }

    String registry = defaultRegistry;
    String repository = name;
    int firstSlash = name.indexOf('/');
    if (firstSlash > 0 && isRegistryHost(name.substring(0, firstSlash))) {
      registry = name.substring(0, firstSlash);
      repository = name.substring(firstSlash + 1);
    }
    repository = stripSlashes(repository);

    if (repository.isEmpty() || !repository.equals(repository.toLowerCase(Locale.ROOT))) {
      throw new InvalidReferenceException("Invalid repository in reference: " + trimmed);
    }

    return new ImageReference(registry, repository, tag);
  }

  /**
   * @param component the first path component of a reference
   * @return true if the component names a registry host and not a repository namespace
   */
  public static boolean isRegistryHost(String component) {
    return component.contains(".") || component.contains(":") || component.equals("localhost");
  }

  private static String stripSlashes(String input) {
    String result = input;
    while (result.startsWith("/")) {
      result = result.substring(1);
    }
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
