package com.quakeradar.client.geo;

import com.quakeradar.client.error.Outcome;
import java.util.List;
import java.util.Set;

/** Read-only lookup of country boundary polygons. */
public interface BoundaryIndex {
  /**
   * Returns every polygon owned by a country.
   *
   * @param countryCode ISO-3166 alpha-2 code, case-insensitive
   * @return polygons, an {@code UNKNOWN_COUNTRY} failure, or {@code BOUNDARY_DATA} when the
   *     dataset cannot be loaded
   */
  Outcome<List<BoundaryPolygon>> polygonsFor(String countryCode);

  /**
   * Tests whether a point lies inside any polygon of the country (boundary inclusive).
   *
   * @return {@code false} for unknown codes or an unavailable dataset
   */
  boolean contains(GeoPoint point, String countryCode);

  boolean isKnown(String countryCode);

  Set<String> countryCodes();
}
