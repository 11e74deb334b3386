package com.quakeradar.client.usgs;

import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.error.QueryError;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.query.AlertLevel;
import com.quakeradar.client.query.OrderBy;
import com.quakeradar.client.query.QueryDescriptor;
import com.quakeradar.client.time.TimeNormalizer;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Immutable query under construction. Every {@code with*} call returns a new instance; setting a
 * slot twice keeps the last value.
 *
 * <p>Nothing is validated until {@link #build()} or {@link #fetch()}. A time given as invalid
 * calendar components is remembered as a pending {@code INVALID_TIME} failure for its slot.
 */
public final class UsgsQuery {
  private final UsgsClient client;
  private final TimeNormalizer timeNormalizer;
  private final QueryDescriptor descriptor;
  private final QueryError startTimeError;
  private final QueryError endTimeError;

  UsgsQuery(UsgsClient client, TimeNormalizer timeNormalizer, QueryDescriptor descriptor) {
    this(client, timeNormalizer, descriptor, null, null);
  }

  private UsgsQuery(
      UsgsClient client,
      TimeNormalizer timeNormalizer,
      QueryDescriptor descriptor,
      QueryError startTimeError,
      QueryError endTimeError) {
    this.client = client;
    this.timeNormalizer = timeNormalizer;
    this.descriptor = descriptor;
    this.startTimeError = startTimeError;
    this.endTimeError = endTimeError;
  }

  /** Start time in the local zone. */
  public UsgsQuery withStartTime(int year, int month, int day, int hour, int minute) {
    return withStart(timeNormalizer.normalize(year, month, day, hour, minute));
  }

  public UsgsQuery withStartTime(int year, int month, int day, int hour, int minute, ZoneOffset offset) {
    return withStart(timeNormalizer.normalize(year, month, day, hour, minute, offset));
  }

  public UsgsQuery withStartTime(Instant startTime) {
    return new UsgsQuery(client, timeNormalizer, descriptor.withStartTime(startTime), null, endTimeError);
  }

  /** End time in the local zone. */
  public UsgsQuery withEndTime(int year, int month, int day, int hour, int minute) {
    return withEnd(timeNormalizer.normalize(year, month, day, hour, minute));
  }

  public UsgsQuery withEndTime(int year, int month, int day, int hour, int minute, ZoneOffset offset) {
    return withEnd(timeNormalizer.normalize(year, month, day, hour, minute, offset));
  }

  public UsgsQuery withEndTime(Instant endTime) {
    return new UsgsQuery(client, timeNormalizer, descriptor.withEndTime(endTime), startTimeError, null);
  }

  public UsgsQuery withMinMagnitude(double minMagnitude) {
    return with(descriptor.withMinMagnitude(minMagnitude));
  }

  public UsgsQuery withMaxMagnitude(double maxMagnitude) {
    return with(descriptor.withMaxMagnitude(maxMagnitude));
  }

  public UsgsQuery withMagnitudeRange(double minMagnitude, double maxMagnitude) {
    return with(descriptor.withMinMagnitude(minMagnitude).withMaxMagnitude(maxMagnitude));
  }

  public UsgsQuery withAlertLevel(AlertLevel alertLevel) {
    return with(descriptor.withAlertLevel(alertLevel));
  }

  public UsgsQuery withOrderBy(OrderBy orderBy) {
    return with(descriptor.withOrderBy(orderBy));
  }

  /** Restricts results to a country (ISO-3166 alpha-2), applied after the feed responds. */
  public UsgsQuery withCountryCode(String countryCode) {
    return with(descriptor.withCountryCode(countryCode));
  }

  /** Current criteria, not yet validated. */
  public QueryDescriptor descriptor() {
    return descriptor;
  }

  /** Validates the criteria without touching the network. */
  public Outcome<QueryDescriptor> build() {
    QueryError pending = pendingTimeError();
    if (pending != null) {
      return Outcome.failure(pending);
    }
    return client.validate(descriptor);
  }

  public Outcome<ResultSet> fetch() {
    return fetch(client.defaultTimeout());
  }

  /**
   * Validates and executes the query.
   *
   * @param timeout network timeout for this call
   * @return results, or the first validation, transport or decode failure
   */
  public Outcome<ResultSet> fetch(Duration timeout) {
    QueryError pending = pendingTimeError();
    if (pending != null) {
      return Outcome.failure(pending);
    }
    return client.execute(descriptor, timeout);
  }

  private QueryError pendingTimeError() {
    return startTimeError != null ? startTimeError : endTimeError;
  }

  private UsgsQuery with(QueryDescriptor updated) {
    return new UsgsQuery(client, timeNormalizer, updated, startTimeError, endTimeError);
  }

  private UsgsQuery withStart(Outcome<Instant> normalized) {
    if (normalized.isSuccess()) {
      return withStartTime(normalized.value());
    }
    return new UsgsQuery(client, timeNormalizer, descriptor.withStartTime(null), normalized.error(), endTimeError);
  }

  private UsgsQuery withEnd(Outcome<Instant> normalized) {
    if (normalized.isSuccess()) {
      return withEndTime(normalized.value());
    }
    return new UsgsQuery(client, timeNormalizer, descriptor.withEndTime(null), startTimeError, normalized.error());
  }
}
