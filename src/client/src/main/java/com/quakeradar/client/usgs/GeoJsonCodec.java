package com.quakeradar.client.usgs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.error.QueryError;
import com.quakeradar.client.geo.GeoPoint;
import com.quakeradar.client.model.EarthquakeRecord;
import com.quakeradar.client.model.FeedMetadata;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.query.AlertLevel;
import com.quakeradar.client.query.QueryDescriptor;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link Codec} for the USGS FDSN event service with GeoJSON output. */
@Component
public class GeoJsonCodec implements Codec {
  private static final Logger log = LoggerFactory.getLogger(GeoJsonCodec.class);
  private static final DateTimeFormatter WIRE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss").withZone(ZoneOffset.UTC);
  private static final Set<String> TYPED_PROPERTIES = Set.of(
      "mag", "place", "time", "updated", "alert", "status", "tsunami", "sig", "magType", "type", "title", "url");

  private final ObjectMapper objectMapper;

  public GeoJsonCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public String encode(QueryDescriptor descriptor) {
    // Country is applied client-side and never sent.
    StringJoiner query = new StringJoiner("&");
    if (descriptor.startTime() != null) {
      query.add("starttime=" + WIRE_TIME.format(descriptor.startTime()));
    }
    if (descriptor.endTime() != null) {
      query.add("endtime=" + WIRE_TIME.format(descriptor.endTime()));
    }
    if (descriptor.minMagnitude() != null) {
      query.add("minmagnitude=" + decimal(descriptor.minMagnitude()));
    }
    if (descriptor.maxMagnitude() != null) {
      query.add("maxmagnitude=" + decimal(descriptor.maxMagnitude()));
    }
    if (descriptor.alertLevel() != null && descriptor.alertLevel().wireValue() != null) {
      query.add("alertlevel=" + descriptor.alertLevel().wireValue());
    }
    if (descriptor.orderBy() != null) {
      query.add("orderby=" + descriptor.orderBy().wireValue());
    }
    return query.toString();
  }

  @Override
  public Outcome<ResultSet> decode(byte[] body, QueryDescriptor query) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (IOException ex) {
      log.warn("USGS response is not valid JSON: {}", ex.getMessage());
      return Outcome.failure(QueryError.of(ErrorKind.DECODE, "Response is not valid JSON: " + ex.getMessage(), ex));
    }
    if (root == null || root.isMissingNode()) {
      return Outcome.failure(ErrorKind.DECODE, "Response body is empty");
    }

    JsonNode features = root.path("features");
    if (!features.isArray()) {
      log.warn("USGS response has no features array");
      return Outcome.failure(ErrorKind.DECODE, "Response is not a GeoJSON FeatureCollection");
    }

    List<EarthquakeRecord> records = new ArrayList<>(features.size());
    for (JsonNode feature : features) {
      EarthquakeRecord record = parseFeature(feature);
      if (record != null) {
        records.add(record);
      }
    }
    return Outcome.success(new ResultSet(records, query, parseMetadata(root.path("metadata"), root.path("bbox"))));
  }

  private EarthquakeRecord parseFeature(JsonNode feature) {
    String id = text(feature, "id");
    JsonNode coordinates = feature.path("geometry").path("coordinates");
    if (!coordinates.isArray() || coordinates.size() < 2
        || !coordinates.get(0).isNumber() || !coordinates.get(1).isNumber()) {
      log.debug("Skipping feature {} without point coordinates", id);
      return null;
    }
    JsonNode properties = feature.path("properties");
    Instant time = epochMillis(properties, "time");
    if (time == null) {
      log.debug("Skipping feature {} without event time", id);
      return null;
    }

    // GeoJSON order is [longitude, latitude, depth].
    GeoPoint epicenter = new GeoPoint(coordinates.get(1).asDouble(), coordinates.get(0).asDouble());
    Double depth = coordinates.size() > 2 && coordinates.get(2).isNumber() ? coordinates.get(2).asDouble() : null;
    Integer tsunami = integer(properties, "tsunami");

    return new EarthquakeRecord(
        id,
        number(properties, "mag"),
        text(properties, "place"),
        epicenter,
        depth,
        time,
        epochMillis(properties, "updated"),
        AlertLevel.fromWire(text(properties, "alert")),
        text(properties, "status"),
        tsunami == null ? null : tsunami != 0,
        integer(properties, "sig"),
        text(properties, "magType"),
        text(properties, "type"),
        text(properties, "title"),
        text(properties, "url"),
        extras(properties));
  }

  private Map<String, Object> extras(JsonNode properties) {
    Map<String, Object> extras = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (TYPED_PROPERTIES.contains(field.getKey())) {
        continue;
      }
      JsonNode value = field.getValue();
      if (value.isTextual()) {
        extras.put(field.getKey(), value.asText());
      } else if (value.isNumber()) {
        extras.put(field.getKey(), value.numberValue());
      } else if (value.isBoolean()) {
        extras.put(field.getKey(), value.asBoolean());
      }
    }
    return extras;
  }

  private FeedMetadata parseMetadata(JsonNode metadata, JsonNode bbox) {
    if (!metadata.isObject()) {
      return null;
    }
    return new FeedMetadata(
        epochMillis(metadata, "generated"),
        text(metadata, "url"),
        text(metadata, "title"),
        integer(metadata, "status"),
        text(metadata, "api"),
        integer(metadata, "count"),
        parseBbox(bbox));
  }

  private static List<Double> parseBbox(JsonNode bbox) {
    if (!bbox.isArray()) {
      return null;
    }
    List<Double> values = new ArrayList<>();
    for (JsonNode value : bbox) {
      if (!value.isNumber()) {
        return null;
      }
      values.add(value.asDouble());
    }
    return values;
  }

  private static String decimal(double value) {
    return BigDecimal.valueOf(value).toPlainString();
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static Double number(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isNumber() ? null : value.asDouble();
  }

  private static Integer integer(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isNumber() ? null : value.asInt();
  }

  private static Instant epochMillis(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || !value.isNumber() ? null : Instant.ofEpochMilli(value.asLong());
  }
}
