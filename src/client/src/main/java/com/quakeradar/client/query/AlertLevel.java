package com.quakeradar.client.query;

import java.util.Locale;

/** PAGER alert levels attached to some USGS events. */
public enum AlertLevel {
  /** No alert filter. Not sent to the feed. */
  NONE(null),
  GREEN("green"),
  YELLOW("yellow"),
  ORANGE("orange"),
  RED("red"),
  /** Every alert level. Not sent to the feed. */
  ALL(null);

  private final String wireValue;

  AlertLevel(String wireValue) {
    this.wireValue = wireValue;
  }

  /** Value of the {@code alertlevel} parameter, or {@code null} when the parameter is omitted. */
  public String wireValue() {
    return wireValue;
  }

  /**
   * Maps a feed {@code alert} property to a level.
   *
   * @return matching level, or {@code null} for absent or unrecognized values
   */
  public static AlertLevel fromWire(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (AlertLevel level : values()) {
      if (normalized.equals(level.wireValue)) {
        return level;
      }
    }
    return null;
  }
}
