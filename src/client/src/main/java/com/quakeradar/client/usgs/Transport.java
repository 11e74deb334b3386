package com.quakeradar.client.usgs;

import com.quakeradar.client.error.Outcome;
import java.time.Duration;

/** Sends an encoded query to the feed and returns the raw response body. */
public interface Transport {
  /**
   * @param serializedQuery URL query string produced by a {@link Codec}
   * @param timeout request timeout; on expiry the call is cancelled and {@code TIMEOUT} is returned
   * @return response body, or a {@code TRANSPORT} / {@code TIMEOUT} failure
   */
  Outcome<byte[]> send(String serializedQuery, Duration timeout);
}
