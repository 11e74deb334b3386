package com.quakeradar.client.model;

import com.quakeradar.client.geo.GeoPoint;
import com.quakeradar.client.query.AlertLevel;
import java.time.Instant;
import java.util.Map;

/**
 * One event reported by the USGS feed.
 *
 * <p>Nullable fields reflect what the feed leaves out. {@code extras} keeps every other scalar
 * property of the GeoJSON feature (felt, cdi, mmi, net, ...) under its feed name.
 */
public record EarthquakeRecord(
    String id,
    Double magnitude,
    String place,
    GeoPoint epicenter,
    Double depthKm,
    Instant time,
    Instant updated,
    AlertLevel alertLevel,
    String status,
    Boolean tsunami,
    Integer significance,
    String magnitudeType,
    String eventType,
    String title,
    String url,
    Map<String, Object> extras) {

  public EarthquakeRecord {
    extras = extras == null ? Map.of() : Map.copyOf(extras);
  }
}
