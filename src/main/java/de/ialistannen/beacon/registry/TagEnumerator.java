package de.ialistannen.beacon.registry;

import de.ialistannen.beacon.model.ImageReference;
import de.ialistannen.beacon.model.RepositoryPath;
import java.util.List;

/**
 * Lists the tags of a repository.
 */
public interface TagEnumerator {

  /**
   * @param repository the repository to list
   * @return a reference for every tag of the repository, in no particular order
   * @throws TagEnumerationException if the tags could not be listed
   */
  List<ImageReference> listTags(RepositoryPath repository) throws TagEnumerationException;
}
