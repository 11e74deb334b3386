package com.quakeradar.client.error;

/**
 * Thrown by {@link Outcome#orElseThrow()} for callers that prefer exceptions over values.
 */
public class QueryFailedException extends RuntimeException {
  private final QueryError error;

  public QueryFailedException(QueryError error) {
    super(error.toString(), error.cause());
    this.error = error;
  }

  public QueryError getError() {
    return error;
  }
}
