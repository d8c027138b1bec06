package de.ialistannen.beacon.storage;

import de.ialistannen.beacon.model.ImageRecord;
import de.ialistannen.beacon.model.ImageReference;
import java.util.List;
import java.util.Optional;

/**
 * Persists {@link ImageRecord image records}, keyed by their digest. Implementations serialize all writes
 * themselves, callers never need external locking.
 */
public interface ImageStore extends AutoCloseable {

  /**
   * Stores a record. If no record with the same digest exists it is inserted. If one exists it is replaced when
   * {@code updateExisting} is set and left untouched otherwise. The tag pointer of the record's reference is moved
   * to the record's digest in all cases.
   *
   * @param record the record to store
   * @param updateExisting whether to replace an existing record with the same digest
   * @return the stored record and what happened
   * @throws StoreException if the record could not be stored. Nothing was changed in that case.
   */
  UpsertResult upsert(ImageRecord record, boolean updateExisting);

  /**
   * @param registry the registry
   * @param repository the repository
   * @param tag the tag
   * @return the record the tag currently points to, carrying the looked up reference even if the image was first
   *   stored under a different tag
   * @throws StoreException if the store could not be read
   */
  Optional<ImageRecord> findByReference(String registry, String repository, String tag);

  /**
   * @param reference the reference
   * @return the record the reference currently points to
   * @throws StoreException if the store could not be read
   */
  default Optional<ImageRecord> findByReference(ImageReference reference) {
    return findByReference(reference.registry(), reference.repository(), reference.tag());
  }

  /**
   * @param digest the image digest
   * @return the record with the given digest
   * @throws StoreException if the store could not be read
   */
  Optional<ImageRecord> findByDigest(String digest);

  /**
   * Finds records matching all given filters, newest scan first.
   *
   * @param filter the filter
   * @param page the 1-based page
   * @param pageSize the maximum number of records per page
   * @return the records of the page and the total number of matches
   * @throws StoreException if the store could not be read
   */
  ImagePage query(ImageFilter filter, int page, int pageSize);

  /**
   * @param language the language, case-insensitive
   * @return all records with a runtime of the given language
   * @throws StoreException if the store could not be read
   */
  List<ImageRecord> findByLanguage(String language);

  /**
   * @return every stored record, oldest first
   * @throws StoreException if the store could not be read
   */
  List<ImageRecord> findAll();

  /**
   * @return summary statistics over all stored records
   * @throws StoreException if the store could not be read
   */
  StoreStatistics aggregateStatistics();

  /**
   * @return warnings about problems the store recovered from while opening
   */
  List<String> startupWarnings();

  @Override
  void close();
}
