package com.quakeradar.client.query;

import java.time.Instant;
import java.util.Locale;

/**
 * Immutable set of filter criteria for one feed request. Every slot is optional.
 *
 * <p>Construction does not enforce range invariants; {@link ParameterValidator} reports them as
 * values instead.
 *
 * @param startTime inclusive lower time bound (UTC)
 * @param endTime inclusive upper time bound (UTC)
 * @param minMagnitude lower magnitude bound
 * @param maxMagnitude upper magnitude bound
 * @param alertLevel PAGER alert filter
 * @param orderBy result ordering
 * @param countryCode ISO-3166 alpha-2 code applied client-side, upper case
 */
public record QueryDescriptor(
    Instant startTime,
    Instant endTime,
    Double minMagnitude,
    Double maxMagnitude,
    AlertLevel alertLevel,
    OrderBy orderBy,
    String countryCode) {

  public QueryDescriptor {
    if (countryCode != null) {
      countryCode = countryCode.isBlank() ? null : countryCode.trim().toUpperCase(Locale.ROOT);
    }
  }

  public static QueryDescriptor empty() {
    return new QueryDescriptor(null, null, null, null, null, null, null);
  }

  public QueryDescriptor withStartTime(Instant value) {
    return new QueryDescriptor(value, endTime, minMagnitude, maxMagnitude, alertLevel, orderBy, countryCode);
  }

  public QueryDescriptor withEndTime(Instant value) {
    return new QueryDescriptor(startTime, value, minMagnitude, maxMagnitude, alertLevel, orderBy, countryCode);
  }

  public QueryDescriptor withMinMagnitude(Double value) {
    return new QueryDescriptor(startTime, endTime, value, maxMagnitude, alertLevel, orderBy, countryCode);
  }

  public QueryDescriptor withMaxMagnitude(Double value) {
    return new QueryDescriptor(startTime, endTime, minMagnitude, value, alertLevel, orderBy, countryCode);
  }

  public QueryDescriptor withAlertLevel(AlertLevel value) {
    return new QueryDescriptor(startTime, endTime, minMagnitude, maxMagnitude, value, orderBy, countryCode);
  }

  public QueryDescriptor withOrderBy(OrderBy value) {
    return new QueryDescriptor(startTime, endTime, minMagnitude, maxMagnitude, alertLevel, value, countryCode);
  }

  public QueryDescriptor withCountryCode(String value) {
    return new QueryDescriptor(startTime, endTime, minMagnitude, maxMagnitude, alertLevel, orderBy, value);
  }

  public boolean hasCountryCode() {
    return countryCode != null;
  }
}
