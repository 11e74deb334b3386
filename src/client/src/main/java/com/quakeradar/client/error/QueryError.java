package com.quakeradar.client.error;

/**
 * Immutable description of a failed query step.
 *
 * @param kind failure category
 * @param message human-readable description
 * @param httpStatus HTTP status when the feed answered with an error, otherwise {@code null}
 * @param cause underlying exception, if any
 */
public record QueryError(ErrorKind kind, String message, Integer httpStatus, Throwable cause) {

  public static QueryError of(ErrorKind kind, String message) {
    return new QueryError(kind, message, null, null);
  }

  public static QueryError of(ErrorKind kind, String message, Throwable cause) {
    return new QueryError(kind, message, null, cause);
  }

  public static QueryError httpStatus(int status) {
    return new QueryError(ErrorKind.TRANSPORT, "USGS feed answered with HTTP " + status, status, null);
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
