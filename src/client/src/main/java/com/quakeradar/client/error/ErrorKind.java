package com.quakeradar.client.error;

/** Failure categories reported by the query pipeline. */
public enum ErrorKind {
  /** Date/time components do not form a calendar-valid local date/time. */
  INVALID_TIME,
  /** Start time is after end time. */
  TIME_RANGE,
  /** Magnitude bounds are reversed or outside [0, 10]. */
  MAGNITUDE_RANGE,
  /** Country code is not present in the boundary dataset. */
  UNKNOWN_COUNTRY,
  /** The feed could not be reached or answered with an HTTP error. */
  TRANSPORT,
  /** The request exceeded its timeout and was cancelled. */
  TIMEOUT,
  /** The feed answered with a payload that is not a usable GeoJSON collection. */
  DECODE,
  /** The country boundary dataset is missing or unreadable. */
  BOUNDARY_DATA;

  public boolean isValidation() {
    return this == INVALID_TIME || this == TIME_RANGE || this == MAGNITUDE_RANGE || this == UNKNOWN_COUNTRY;
  }
}
