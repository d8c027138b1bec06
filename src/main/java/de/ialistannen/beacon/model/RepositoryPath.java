package de.ialistannen.beacon.model;

import java.util.Locale;

/**
 * A repository inside a registry, without a tag.
 *
 * @param registry the registry host
 * @param repository the repository path inside the registry
 */
public record RepositoryPath(String registry, String repository) {

  public RepositoryPath {
    if (registry == null || registry.isBlank()) {
      throw new InvalidReferenceException("Registry must not be empty");
    }
    if (repository == null || repository.isBlank()) {
      throw new InvalidReferenceException("Repository must not be empty");
    }
  }

  /**
   * @param tag the tag
   * @return a reference to the given tag in this repository
   */
  public ImageReference withTag(String tag) {
    return new ImageReference(registry, repository, tag);
  }

  /**
   * @return the repository in the form {@code registry/repository}
   */
  public String fullName() {
    return registry + "/" + repository;
  }

  @Override
  public String toString() {
    return fullName();
  }

  /**
   * Parses a repository path, either bare ({@code azurelinux/base/python}) or qualified with its registry
   * ({@code mcr.microsoft.com/azurelinux/base/python}).
   *
   * @param asString the repository string
   * @param defaultRegistry the registry to use if the string does not name one
   * @return the parsed path
   * @throws InvalidReferenceException if the string contains a tag or digest or is otherwise invalid
   */
  public static RepositoryPath parse(String asString, String defaultRegistry) {
    String trimmed = asString == null ? "" : asString.strip();
    if (trimmed.isEmpty()) {
      throw new InvalidReferenceException("Empty repository");
    }
    if (trimmed.contains("@") || trimmed.lastIndexOf(':') > trimmed.lastIndexOf('/')) {
      throw new InvalidReferenceException("Repository must not contain a tag or digest: " + trimmed);
    }

    String registry = defaultRegistry;
    String repository = trimmed;
    int firstSlash = trimmed.indexOf('/');
    if (firstSlash > 0 && ImageReference.isRegistryHost(trimmed.substring(0, firstSlash))) {
      registry = trimmed.substring(0, firstSlash);
      repository = trimmed.substring(firstSlash + 1);
    }
    repository = repository.replaceAll("^/+|/+$", "");

    if (repository.isEmpty() || !repository.equals(repository.toLowerCase(Locale.ROOT))) {
      throw new InvalidReferenceException("Invalid repository: " + trimmed);
    }
    return new RepositoryPath(registry, repository);
  }
}
