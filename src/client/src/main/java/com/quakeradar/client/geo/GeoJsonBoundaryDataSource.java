package com.quakeradar.client.geo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

/**
 * Reads country outlines from a GeoJSON FeatureCollection.
 *
 * <p>Each feature needs a country code in {@code properties.code} (or {@code iso_a2}) and a
 * {@code Polygon} or {@code MultiPolygon} geometry in {@code [lon, lat]} order. Only outer rings
 * are used; holes are ignored.
 */
public class GeoJsonBoundaryDataSource implements BoundaryDataSource {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonBoundaryDataSource.class);

  private final String location;
  private final ObjectMapper objectMapper;
  private final ResourceLoader resourceLoader;

  public GeoJsonBoundaryDataSource(String location, ObjectMapper objectMapper) {
    this(location, objectMapper, new DefaultResourceLoader());
  }

  GeoJsonBoundaryDataSource(String location, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    this.location = location;
    this.objectMapper = objectMapper;
    this.resourceLoader = resourceLoader;
  }

  @Override
  public List<BoundaryPolygon> load() {
    if (location == null || location.isBlank()) {
      throw new IllegalStateException("Boundary dataset location is empty (usgs.boundaries.location)");
    }
    Resource resource = resourceLoader.getResource(location.trim());
    if (!resource.exists()) {
      throw new IllegalStateException("Boundary dataset not found at " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      return parse(objectMapper.readTree(in));
    } catch (IOException ex) {
      throw new IllegalStateException("Failed to read boundary dataset " + location, ex);
    }
  }

  List<BoundaryPolygon> parse(JsonNode root) {
    JsonNode features = root.path("features");
    if (!features.isArray()) {
      throw new IllegalStateException("Boundary dataset " + location + " is not a GeoJSON FeatureCollection");
    }

    List<BoundaryPolygon> polygons = new ArrayList<>();
    for (JsonNode feature : features) {
      String code = countryCode(feature.path("properties"));
      if (code == null) {
        log.debug("Skipping boundary feature without a country code");
        continue;
      }
      JsonNode geometry = feature.path("geometry");
      JsonNode coordinates = geometry.path("coordinates");
      switch (geometry.path("type").asText("")) {
        case "Polygon" -> addOuterRing(polygons, code, coordinates);
        case "MultiPolygon" -> {
          for (JsonNode polygon : coordinates) {
            addOuterRing(polygons, code, polygon);
          }
        }
        default -> log.debug("Skipping boundary feature {} with unsupported geometry", code);
      }
    }
    return polygons;
  }

  private void addOuterRing(List<BoundaryPolygon> polygons, String code, JsonNode rings) {
    JsonNode outer = rings.path(0);
    if (!outer.isArray()) {
      return;
    }
    List<GeoPoint> vertices = new ArrayList<>(outer.size());
    for (JsonNode position : outer) {
      if (position.size() < 2) {
        continue;
      }
      vertices.add(new GeoPoint(position.get(1).asDouble(), position.get(0).asDouble()));
    }
    if (vertices.size() < 3) {
      log.debug("Skipping degenerate ring for {} ({} vertices)", code, vertices.size());
      return;
    }
    polygons.add(new BoundaryPolygon(code, vertices));
  }

  private static String countryCode(JsonNode properties) {
    for (String field : new String[] {"code", "iso_a2", "ISO_A2"}) {
      String value = properties.path(field).asText(null);
      if (value != null && !value.isBlank() && !"-99".equals(value)) {
        return value.trim();
      }
    }
    return null;
  }
}
