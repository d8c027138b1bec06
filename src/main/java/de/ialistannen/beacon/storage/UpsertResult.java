package de.ialistannen.beacon.storage;

import de.ialistannen.beacon.model.ImageRecord;

/**
 * @param record the record as stored after the upsert
 * @param outcome what the upsert did
 */
public record UpsertResult(ImageRecord record, Outcome outcome) {

  public enum Outcome {
    INSERTED,
    UPDATED,
    UNCHANGED
  }
}
