package com.quakeradar.client.error;

import java.util.Objects;
import java.util.function.Function;

/**
 * Success-or-failure value returned by every fallible operation of the client.
 *
 * @param <T> success payload type
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

  static <T> Outcome<T> success(T value) {
    return new Success<>(value);
  }

  static <T> Outcome<T> failure(QueryError error) {
    return new Failure<>(error);
  }

  static <T> Outcome<T> failure(ErrorKind kind, String message) {
    return new Failure<>(QueryError.of(kind, message));
  }

  boolean isSuccess();

  /**
   * Returns the payload.
   *
   * @throws IllegalStateException when this is a failure
   */
  T value();

  /**
   * Returns the error.
   *
   * @throws IllegalStateException when this is a success
   */
  QueryError error();

  <R> Outcome<R> map(Function<? super T, ? extends R> mapper);

  <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper);

  /** Returns the payload or throws {@link QueryFailedException} carrying the error. */
  T orElseThrow();

  record Success<T>(T value) implements Outcome<T> {
    public Success {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public QueryError error() {
      throw new IllegalStateException("Outcome is a success");
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
      return new Success<>(mapper.apply(value));
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
      return mapper.apply(value);
    }

    @Override
    public T orElseThrow() {
      return value;
    }
  }

  record Failure<T>(QueryError error) implements Outcome<T> {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("Outcome is a failure: " + error);
    }

    @Override
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
      return new Failure<>(error);
    }

    @Override
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
      return new Failure<>(error);
    }

    @Override
    public T orElseThrow() {
      throw new QueryFailedException(error);
    }
  }
}
