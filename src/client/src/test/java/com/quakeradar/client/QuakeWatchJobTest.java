package com.quakeradar.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakeradar.client.config.UsgsProperties;
import com.quakeradar.client.config.WatchProperties;
import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.error.QueryError;
import com.quakeradar.client.filter.CountryFilter;
import com.quakeradar.client.geo.BoundaryIndex;
import com.quakeradar.client.geo.GeoJsonBoundaryDataSource;
import com.quakeradar.client.geo.LazyBoundaryIndex;
import com.quakeradar.client.model.EarthquakeRecord;
import com.quakeradar.client.query.OrderBy;
import com.quakeradar.client.query.ParameterValidator;
import com.quakeradar.client.query.QueryDescriptor;
import com.quakeradar.client.time.TimeNormalizer;
import com.quakeradar.client.usgs.GeoJsonCodec;
import com.quakeradar.client.usgs.RequestExecutor;
import com.quakeradar.client.usgs.Transport;
import com.quakeradar.client.usgs.UsgsClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QuakeWatchJobTest {
  private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
  private static final BoundaryIndex BOUNDARIES = new LazyBoundaryIndex(
      new GeoJsonBoundaryDataSource("classpath:boundaries/countries.geojson", new ObjectMapper()));

  private Transport transport;
  private UsgsClient client;
  private SimpleMeterRegistry meterRegistry;

  @BeforeEach
  void setUp() {
    transport = mock(Transport.class);
    client = new UsgsClient(
        new ParameterValidator(BOUNDARIES),
        new RequestExecutor(new GeoJsonCodec(new ObjectMapper()), transport),
        new CountryFilter(BOUNDARIES),
        new TimeNormalizer(ZoneOffset.UTC),
        new UsgsProperties(null, 5_000L, null));
    meterRegistry = new SimpleMeterRegistry();
  }

  @Test
  void buildsQueryOverTheLookbackWindow() {
    QuakeWatchJob job = job(new WatchProperties(true, 60_000L, 6L, 4.5, "tr", OrderBy.MAGNITUDE));

    QueryDescriptor descriptor = job.buildQuery().descriptor();

    assertThat(descriptor.startTime()).isEqualTo(Instant.parse("2024-12-31T18:00:00Z"));
    assertThat(descriptor.endTime()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    assertThat(descriptor.minMagnitude()).isEqualTo(4.5);
    assertThat(descriptor.countryCode()).isEqualTo("TR");
    assertThat(descriptor.orderBy()).isEqualTo(OrderBy.MAGNITUDE);
  }

  @Test
  void defaultsToADayWithoutOptionalFilters() {
    QuakeWatchJob job = job(new WatchProperties(true, 60_000L, 0L, null, " ", null));

    QueryDescriptor descriptor = job.buildQuery().descriptor();

    assertThat(descriptor.startTime()).isEqualTo(Instant.parse("2024-12-31T00:00:00Z"));
    assertThat(descriptor.minMagnitude()).isNull();
    assertThat(descriptor.hasCountryCode()).isFalse();
    assertThat(descriptor.orderBy()).isNull();
  }

  @Test
  void pollFetchesFiltersAndCounts() throws IOException {
    when(transport.send(anyString(), any(Duration.class))).thenReturn(Outcome.success(sample()));
    QuakeWatchJob job = job(new WatchProperties(true, 60_000L, 24L, 5.0, "TR", OrderBy.TIME));

    job.poll();

    verify(transport).send(
        "starttime=2024-12-31T00:00:00&endtime=2025-01-01T00:00:00&minmagnitude=5.0&orderby=time",
        Duration.ofMillis(5_000));
    assertThat(job.lastOutcome().value().records()).extracting(EarthquakeRecord::id)
        .containsExactly("us7000elaz", "us7000tr02");
    assertThat(meterRegistry.get("quakes.watch.fetch.total").counter().count()).isEqualTo(1.0);
    assertThat(meterRegistry.get("quakes.watch.events.total").counter().count()).isEqualTo(2.0);
    assertThat(meterRegistry.get("quakes.watch.errors.total").counter().count()).isEqualTo(0.0);
  }

  @Test
  void pollCountsFailuresAndKeepsGoing() {
    when(transport.send(anyString(), any(Duration.class)))
        .thenReturn(Outcome.failure(QueryError.httpStatus(503)));
    QuakeWatchJob job = job(new WatchProperties(true, 60_000L, 24L, 5.0, null, null));

    job.poll();
    job.poll();

    assertThat(job.lastOutcome().error().kind()).isEqualTo(ErrorKind.TRANSPORT);
    assertThat(meterRegistry.get("quakes.watch.fetch.total").counter().count()).isEqualTo(2.0);
    assertThat(meterRegistry.get("quakes.watch.errors.total").counter().count()).isEqualTo(2.0);
  }

  @Test
  void pollDoesNothingWhenDisabled() {
    QuakeWatchJob job = job(new WatchProperties(false, 60_000L, 24L, 5.0, null, null));

    job.poll();

    verifyNoInteractions(transport);
    assertThat(job.lastOutcome()).isNull();
  }

  private QuakeWatchJob job(WatchProperties properties) {
    return new QuakeWatchJob(client, properties, meterRegistry, CLOCK);
  }

  private static byte[] sample() throws IOException {
    try (InputStream in = QuakeWatchJobTest.class.getResourceAsStream("/usgs/sample-response.json")) {
      return in.readAllBytes();
    }
  }
}
