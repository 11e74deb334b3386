package com.quakeradar.client.geo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Closed vertex ring approximating part of a country's territory.
 *
 * <p>Instances are immutable; the unwrapped longitudes used for membership tests are computed once
 * at construction.
 */
public final class BoundaryPolygon {
  private final String countryCode;
  private final List<GeoPoint> vertices;
  private final double[] latitudes;
  private final double[] unwrappedLongitudes;

  /**
   * @param countryCode ISO-3166 alpha-2 code (case-insensitive)
   * @param vertices ring vertices; the closing vertex may be repeated or omitted
   */
  public BoundaryPolygon(String countryCode, List<GeoPoint> vertices) {
    if (countryCode == null || countryCode.isBlank()) {
      throw new IllegalArgumentException("Boundary polygon requires a country code");
    }
    if (vertices == null || vertices.size() < 3) {
      throw new IllegalArgumentException("Boundary polygon for " + countryCode + " needs at least 3 vertices");
    }
    this.countryCode = countryCode.trim().toUpperCase(Locale.ROOT);
    this.vertices = Collections.unmodifiableList(new ArrayList<>(vertices));

    int n = vertices.size();
    this.latitudes = new double[n];
    double[] longitudes = new double[n];
    for (int i = 0; i < n; i++) {
      latitudes[i] = vertices.get(i).latitude();
      longitudes[i] = vertices.get(i).longitude();
    }
    this.unwrappedLongitudes = PointInPolygon.unwrapLongitudes(longitudes);
  }

  public String countryCode() {
    return countryCode;
  }

  public List<GeoPoint> vertices() {
    return vertices;
  }

  public boolean contains(GeoPoint point) {
    return PointInPolygon.contains(latitudes, unwrappedLongitudes, point.latitude(), point.longitude());
  }

  @Override
  public String toString() {
    return "BoundaryPolygon[" + countryCode + ", " + vertices.size() + " vertices]";
  }
}
