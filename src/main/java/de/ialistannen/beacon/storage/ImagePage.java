package de.ialistannen.beacon.storage;

import de.ialistannen.beacon.model.ImageRecord;
import java.util.List;

public record ImagePage(List<ImageRecord> records, long totalCount, int page, int pageSize) {

  public long pageCount() {
    if (pageSize <= 0) {
      return 0;
    }
    return (totalCount + pageSize - 1) / pageSize;
  }
}
