package com.quakeradar.client.usgs;

import com.quakeradar.client.error.ErrorKind;
import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.error.QueryError;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** {@link Transport} over the JDK {@link HttpClient}. No retries. */
@Component
public class HttpTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(HttpTransport.class);
  private static final Duration MIN_TIMEOUT = Duration.ofMillis(100);

  private final UsgsEndpointProvider endpointProvider;
  private final HttpClient httpClient;
  private final Timer queryRequestTimer;
  private final Counter successCounter;
  private final Counter clientErrorCounter;
  private final Counter serverErrorCounter;
  private final Counter timeoutCounter;
  private final Counter exceptionCounter;
  private final AtomicInteger lastStatusCode = new AtomicInteger(0);

  public HttpTransport(UsgsEndpointProvider endpointProvider, HttpClient httpClient, MeterRegistry meterRegistry) {
    this.endpointProvider = endpointProvider;
    this.httpClient = httpClient;

    this.queryRequestTimer = Timer.builder("quakes.usgs.query.http.duration")
        .description("USGS /query HTTP request duration (seconds)")
        .publishPercentileHistogram(true)
        .register(meterRegistry);

    this.successCounter = outcomeCounter(meterRegistry, "success");
    this.clientErrorCounter = outcomeCounter(meterRegistry, "client_error");
    this.serverErrorCounter = outcomeCounter(meterRegistry, "server_error");
    this.timeoutCounter = outcomeCounter(meterRegistry, "timeout");
    this.exceptionCounter = outcomeCounter(meterRegistry, "exception");

    meterRegistry.gauge("quakes.usgs.query.http.last_status", lastStatusCode);
  }

  @Override
  public Outcome<byte[]> send(String serializedQuery, Duration timeout) {
    Duration effectiveTimeout = timeout == null || timeout.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : timeout;
    String url = null;

    long httpStartNs = System.nanoTime();
    try {
      // A bad usgs.base-url surfaces here as a TRANSPORT failure.
      url = endpointProvider.queryUrl(serializedQuery);
      HttpRequest request = HttpRequest.newBuilder()
          .uri(URI.create(url))
          .timeout(effectiveTimeout)
          .header("Accept", "application/geo+json, application/json")
          .GET()
          .build();
      HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      int status = response.statusCode();
      lastStatusCode.set(status);

      if (status >= 400) {
        if (status >= 500) {
          serverErrorCounter.increment();
        } else {
          clientErrorCounter.increment();
        }
        log.warn("USGS query failed: status={}, url={}", status, url);
        return Outcome.failure(QueryError.httpStatus(status));
      }
      successCounter.increment();
      byte[] body = response.body();
      return Outcome.success(body == null ? new byte[0] : body);
    } catch (HttpTimeoutException ex) {
      lastStatusCode.set(0);
      timeoutCounter.increment();
      log.warn("USGS query timed out after {} ms: {}", effectiveTimeout.toMillis(), url);
      return Outcome.failure(QueryError.of(
          ErrorKind.TIMEOUT, "USGS query timed out after " + effectiveTimeout.toMillis() + " ms", ex));
    } catch (InterruptedException ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      Thread.currentThread().interrupt();
      log.error("USGS query interrupted: {}", url, ex);
      return Outcome.failure(QueryError.of(ErrorKind.TRANSPORT, "USGS query interrupted", ex));
    } catch (IOException | RuntimeException ex) {
      lastStatusCode.set(0);
      exceptionCounter.increment();
      log.error("USGS query failed: {}", url, ex);
      return Outcome.failure(QueryError.of(ErrorKind.TRANSPORT, "USGS query failed: " + ex.getMessage(), ex));
    } finally {
      queryRequestTimer.record(System.nanoTime() - httpStartNs, TimeUnit.NANOSECONDS);
    }
  }

  private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
    // Keep cardinality low: a handful of outcomes, no URL labels.
    return Counter.builder("quakes.usgs.query.http.requests.total")
        .description("USGS /query HTTP requests (by outcome)")
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
