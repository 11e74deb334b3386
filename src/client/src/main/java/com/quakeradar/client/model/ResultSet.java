package com.quakeradar.client.model;

import com.quakeradar.client.query.QueryDescriptor;
import java.util.List;

/**
 * Immutable, ordered result of one query.
 *
 * @param records events in feed order
 * @param query descriptor that produced the records
 * @param metadata feed metadata, {@code null} when the feed sent none
 */
public record ResultSet(List<EarthquakeRecord> records, QueryDescriptor query, FeedMetadata metadata) {

  public ResultSet {
    records = records == null ? List.of() : List.copyOf(records);
  }

  public int count() {
    return records.size();
  }

  public boolean isEmpty() {
    return records.isEmpty();
  }

  /** Returns a new result set with the same query echo; the metadata count follows the new records. */
  public ResultSet withRecords(List<EarthquakeRecord> filtered) {
    List<EarthquakeRecord> kept = filtered == null ? List.of() : filtered;
    return new ResultSet(kept, query, metadata == null ? null : metadata.withCount(kept.size()));
  }
}
