package com.quakeradar.client.geo;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Immutable in-memory {@link BoundaryIndex}. */
public final class PolygonBoundaryIndex implements BoundaryIndex {
  private final Map<String, List<BoundaryPolygon>> polygonsByCountry;

  public PolygonBoundaryIndex(Collection<BoundaryPolygon> polygons) {
    Map<String, List<BoundaryPolygon>> grouped = new LinkedHashMap<>();
    for (BoundaryPolygon polygon : polygons) {
      grouped.computeIfAbsent(polygon.countryCode(), code -> new ArrayList<>()).add(polygon);
    }
    Map<String, List<BoundaryPolygon>> frozen = new LinkedHashMap<>();
    grouped.forEach((code, list) -> frozen.put(code, List.copyOf(list)));
    this.polygonsByCountry = Map.copyOf(frozen);
  }

  @Override
  public Outcome<List<BoundaryPolygon>> polygonsFor(String countryCode) {
    List<BoundaryPolygon> polygons = lookup(countryCode);
    if (polygons == null) {
      return Outcome.failure(ErrorKind.UNKNOWN_COUNTRY, "Unknown country code: " + countryCode);
    }
    return Outcome.success(polygons);
  }

  @Override
  public boolean contains(GeoPoint point, String countryCode) {
    List<BoundaryPolygon> polygons = lookup(countryCode);
    if (polygons == null || point == null) {
      return false;
    }
    for (BoundaryPolygon polygon : polygons) {
      if (polygon.contains(point)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isKnown(String countryCode) {
    return lookup(countryCode) != null;
  }

  @Override
  public Set<String> countryCodes() {
    return polygonsByCountry.keySet();
  }

  private List<BoundaryPolygon> lookup(String countryCode) {
    if (countryCode == null || countryCode.isBlank()) {
      return null;
    }
    return polygonsByCountry.get(countryCode.trim().toUpperCase(Locale.ROOT));
  }
}
