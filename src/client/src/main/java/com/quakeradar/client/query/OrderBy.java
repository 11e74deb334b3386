package com.quakeradar.client.query;

/** Result ordering supported by the USGS feed. */
public enum OrderBy {
  /** Newest first. */
  TIME("time"),
  /** Oldest first. */
  TIME_ASC("time-asc"),
  /** Largest first. */
  MAGNITUDE("magnitude"),
  /** Smallest first. */
  MAGNITUDE_ASC("magnitude-asc");

  private final String wireValue;

  OrderBy(String wireValue) {
    this.wireValue = wireValue;
  }

  public String wireValue() {
    return wireValue;
  }
}
