package com.quakeradar.client.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakeradar.client.filter.CountryFilter;
import com.quakeradar.client.geo.BoundaryIndex;
import com.quakeradar.client.geo.GeoJsonBoundaryDataSource;
import com.quakeradar.client.geo.LazyBoundaryIndex;
import com.quakeradar.client.query.ParameterValidator;
import com.quakeradar.client.time.TimeNormalizer;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {
  static final String DEFAULT_BOUNDARIES = "classpath:boundaries/countries.geojson";

  @Bean
  public HttpClient httpClient(UsgsProperties properties) {
    return HttpClient.newBuilder()
        .connectTimeout(Duration.ofMillis(Math.max(300, properties.timeoutMs())))
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
  }

  @Bean
  public BoundaryIndex boundaryIndex(UsgsProperties properties, ObjectMapper objectMapper) {
    // Polygons are read on first lookup, not at startup.
    String location = properties.boundaries() == null ? null : properties.boundaries().location();
    if (location == null || location.isBlank()) {
      location = DEFAULT_BOUNDARIES;
    }
    return new LazyBoundaryIndex(new GeoJsonBoundaryDataSource(location, objectMapper));
  }

  @Bean
  public ParameterValidator parameterValidator(BoundaryIndex boundaryIndex) {
    return new ParameterValidator(boundaryIndex);
  }

  @Bean
  public CountryFilter countryFilter(BoundaryIndex boundaryIndex) {
    return new CountryFilter(boundaryIndex);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TimeNormalizer timeNormalizer() {
    return new TimeNormalizer();
  }
}
