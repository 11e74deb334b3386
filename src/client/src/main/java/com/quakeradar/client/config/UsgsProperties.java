package com.quakeradar.client.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "usgs")
public record UsgsProperties(String baseUrl, long timeoutMs, Boundaries boundaries) {
  public record Boundaries(String location) {}
}
