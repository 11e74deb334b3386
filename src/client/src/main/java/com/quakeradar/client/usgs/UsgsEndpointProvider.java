package com.quakeradar.client.usgs;

import com.quakeradar.client.config.UsgsProperties;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Resolves the feed query URL from configuration; GeoJSON output is always requested. */
@Component
public class UsgsEndpointProvider {
  private static final Logger log = LoggerFactory.getLogger(UsgsEndpointProvider.class);
  static final String DEFAULT_BASE_URL = "https://earthquake.usgs.gov/fdsnws/event/1/query";
  private static final String FORMAT_PARAM = "format=geojson";

  private final UsgsProperties properties;
  private String queryBaseUrl;

  public UsgsEndpointProvider(UsgsProperties properties) {
    this.properties = properties;
  }

  /**
   * Builds the full request URL.
   *
   * @param encodedQuery query string without leading separator, may be empty
   * @return absolute URL including {@code format=geojson}
   */
  public String queryUrl(String encodedQuery) {
    String base = baseUrl();
    if (encodedQuery == null || encodedQuery.isBlank()) {
      return base;
    }
    return base + "&" + encodedQuery;
  }

  public synchronized String baseUrl() {
    if (queryBaseUrl != null) {
      return queryBaseUrl;
    }

    String configured = properties.baseUrl();
    String base = isPresent(configured) ? configured.trim() : DEFAULT_BASE_URL;
    if (!base.toLowerCase(Locale.ROOT).startsWith("http://") && !base.toLowerCase(Locale.ROOT).startsWith("https://")) {
      throw new IllegalStateException("USGS configuration invalid: usgs.base-url must be an http(s) URL, got '" + base + "'");
    }

    int query = base.indexOf('?');
    if (query < 0) {
      base = base + "?" + FORMAT_PARAM;
    } else if (!base.substring(query + 1).toLowerCase(Locale.ROOT).contains("format=")) {
      base = base.endsWith("?") || base.endsWith("&") ? base + FORMAT_PARAM : base + "&" + FORMAT_PARAM;
    }
    queryBaseUrl = base;
    log.info("USGS feed endpoint: {}", queryBaseUrl);
    return queryBaseUrl;
  }

  private boolean isPresent(String value) {
    return value != null && !value.isBlank();
  }
}
