package com.quakeradar.client.usgs;

import com.quakeradar.client.config.UsgsProperties;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.filter.CountryFilter;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.query.ParameterValidator;
import com.quakeradar.client.query.QueryDescriptor;
import com.quakeradar.client.time.TimeNormalizer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for querying the USGS earthquake feed.
 *
 * <p>Validation always runs before any network activity. When the descriptor carries a country
 * code, results are narrowed to that country's boundary polygons after decoding.
 */
@Component
public class UsgsClient {
  private static final Logger log = LoggerFactory.getLogger(UsgsClient.class);
  private static final long DEFAULT_TIMEOUT_MS = 10_000L;

  private final ParameterValidator validator;
  private final RequestExecutor executor;
  private final CountryFilter countryFilter;
  private final TimeNormalizer timeNormalizer;
  private final Duration defaultTimeout;

  public UsgsClient(
      ParameterValidator validator,
      RequestExecutor executor,
      CountryFilter countryFilter,
      TimeNormalizer timeNormalizer,
      UsgsProperties properties) {
    this.validator = validator;
    this.executor = executor;
    this.countryFilter = countryFilter;
    this.timeNormalizer = timeNormalizer;
    this.defaultTimeout = Duration.ofMillis(properties.timeoutMs() > 0 ? properties.timeoutMs() : DEFAULT_TIMEOUT_MS);
  }

  /** Starts a new empty query bound to this client. */
  public UsgsQuery query() {
    return new UsgsQuery(this, timeNormalizer, QueryDescriptor.empty());
  }

  public Outcome<QueryDescriptor> validate(QueryDescriptor descriptor) {
    Outcome<QueryDescriptor> result = validator.validate(descriptor);
    if (!result.isSuccess()) {
      log.debug("Rejected query {}: {}", descriptor, result.error());
    }
    return result;
  }

  public Outcome<ResultSet> execute(QueryDescriptor descriptor) {
    return execute(descriptor, defaultTimeout);
  }

  /**
   * Validates, sends and decodes a query, then applies the country filter if one is set.
   *
   * @param descriptor criteria
   * @param timeout network timeout for this call
   * @return filtered results or the first failure
   */
  public Outcome<ResultSet> execute(QueryDescriptor descriptor, Duration timeout) {
    return validate(descriptor)
        .flatMap(valid -> executor.execute(valid, timeout))
        .flatMap(results -> descriptor.hasCountryCode()
            ? countryFilter.apply(results, descriptor.countryCode())
            : Outcome.success(results));
  }

  public Duration defaultTimeout() {
    return defaultTimeout;
  }
}
