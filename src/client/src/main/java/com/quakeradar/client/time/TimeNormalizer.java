package com.quakeradar.client.time;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Converts caller-supplied local date/time components into UTC instants.
 *
 * <p>When no offset is given, the offset of the configured zone at that local date/time is used
 * (the JVM default zone unless another one is injected).
 */
public final class TimeNormalizer {
  private final ZoneId localZone;

  public TimeNormalizer() {
    this(ZoneId.systemDefault());
  }

  public TimeNormalizer(ZoneId localZone) {
    this.localZone = localZone;
  }

  /**
   * Normalizes local components using the local zone.
   *
   * @return UTC instant, or an {@code INVALID_TIME} failure
   */
  public Outcome<Instant> normalize(int year, int month, int day, int hour, int minute) {
    return toLocalDateTime(year, month, day, hour, minute)
        .map(local -> local.atZone(localZone).toInstant());
  }

  /**
   * Normalizes local components interpreted at a fixed UTC offset.
   *
   * @return UTC instant, or an {@code INVALID_TIME} failure
   */
  public Outcome<Instant> normalize(int year, int month, int day, int hour, int minute, ZoneOffset offset) {
    if (offset == null) {
      return normalize(year, month, day, hour, minute);
    }
    return toLocalDateTime(year, month, day, hour, minute)
        .map(local -> local.toInstant(offset));
  }

  /** Formats an instant back to local components at the given offset. */
  public static LocalDateTime toLocal(Instant instant, ZoneOffset offset) {
    return LocalDateTime.ofInstant(instant, offset);
  }

  private static Outcome<LocalDateTime> toLocalDateTime(int year, int month, int day, int hour, int minute) {
    try {
      return Outcome.success(LocalDateTime.of(year, month, day, hour, minute));
    } catch (DateTimeException ex) {
      return Outcome.failure(
          ErrorKind.INVALID_TIME,
          String.format("%04d-%02d-%02d %02d:%02d is not a valid date/time: %s",
              year, month, day, hour, minute, ex.getMessage()));
    }
  }
}
