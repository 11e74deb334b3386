package com.quakeradar.client;

import com.quakeradar.client.config.WatchProperties;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.model.EarthquakeRecord;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.usgs.UsgsClient;
import com.quakeradar.client.usgs.UsgsQuery;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically queries the feed over a rolling look-back window and reports what it finds.
 *
 * <p>Disabled unless {@code watch.enabled=true}.
 */
@Component
public class QuakeWatchJob {
  private static final Logger log = LoggerFactory.getLogger(QuakeWatchJob.class);
  private static final long DEFAULT_LOOKBACK_HOURS = 24L;

  private final UsgsClient usgsClient;
  private final WatchProperties properties;
  private final Clock clock;
  private final Counter fetchCounter;
  private final Counter eventCounter;
  private final Counter errorCounter;
  private volatile Outcome<ResultSet> lastOutcome;

  public QuakeWatchJob(UsgsClient usgsClient, WatchProperties properties, MeterRegistry meterRegistry, Clock clock) {
    this.usgsClient = usgsClient;
    this.properties = properties;
    this.clock = clock;
    this.fetchCounter = meterRegistry.counter("quakes.watch.fetch.total");
    this.eventCounter = meterRegistry.counter("quakes.watch.events.total");
    this.errorCounter = meterRegistry.counter("quakes.watch.errors.total");
  }

  @PostConstruct
  public void logWatchConfig() {
    if (!properties.enabled()) {
      log.info("Quake watch disabled (watch.enabled=false)");
      return;
    }
    log.info(
        "Quake watch configured: lookbackHours={}, minMagnitude={}, country={}, orderBy={}",
        lookbackHours(),
        properties.minMagnitude(),
        properties.countryCode(),
        properties.orderBy());
  }

  @Scheduled(fixedDelayString = "${watch.refresh-ms:300000}")
  public void poll() {
    if (!properties.enabled()) {
      return;
    }
    Outcome<ResultSet> outcome = buildQuery().fetch();
    lastOutcome = outcome;
    fetchCounter.increment();

    if (!outcome.isSuccess()) {
      // Keep the scheduler running; the next cycle tries again.
      errorCounter.increment();
      log.warn("Quake watch cycle failed: {}", outcome.error());
      return;
    }

    ResultSet results = outcome.value();
    eventCounter.increment(results.count());
    Optional<EarthquakeRecord> strongest = strongest(results);
    if (strongest.isPresent()) {
      EarthquakeRecord top = strongest.get();
      log.info("Quake watch found {} events in the last {}h; strongest M{} {} at {}",
          results.count(), lookbackHours(), top.magnitude(), top.place(), top.time());
    } else {
      log.info("Quake watch found {} events in the last {}h", results.count(), lookbackHours());
    }
  }

  UsgsQuery buildQuery() {
    Instant end = clock.instant();
    UsgsQuery query = usgsClient.query()
        .withStartTime(end.minus(Duration.ofHours(lookbackHours())))
        .withEndTime(end);
    if (properties.minMagnitude() != null) {
      query = query.withMinMagnitude(properties.minMagnitude());
    }
    if (properties.countryCode() != null && !properties.countryCode().isBlank()) {
      query = query.withCountryCode(properties.countryCode());
    }
    if (properties.orderBy() != null) {
      query = query.withOrderBy(properties.orderBy());
    }
    return query;
  }

  Outcome<ResultSet> lastOutcome() {
    return lastOutcome;
  }

  private long lookbackHours() {
    return properties.lookbackHours() > 0 ? properties.lookbackHours() : DEFAULT_LOOKBACK_HOURS;
  }

  private static Optional<EarthquakeRecord> strongest(ResultSet results) {
    return results.records().stream()
        .filter(record -> Objects.nonNull(record.magnitude()))
        .max(Comparator.comparingDouble(EarthquakeRecord::magnitude));
  }
}
