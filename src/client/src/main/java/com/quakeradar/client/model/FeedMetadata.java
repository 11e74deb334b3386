package com.quakeradar.client.model;

import java.time.Instant;
import java.util.List;

/**
 * Collection-level data echoed by the feed.
 *
 * @param generated when the feed produced the response
 * @param url request URL as seen by the feed
 * @param title feed title
 * @param status HTTP-like status reported in the payload
 * @param apiVersion feed API version
 * @param count number of features in the result; rewritten when a client-side filter drops events
 * @param bbox the collection's {@code bbox} member as sent, {@code null} when absent
 */
public record FeedMetadata(
    Instant generated,
    String url,
    String title,
    Integer status,
    String apiVersion,
    Integer count,
    List<Double> bbox) {

  public FeedMetadata {
    bbox = bbox == null ? null : List.copyOf(bbox);
  }

  public FeedMetadata withCount(int filteredCount) {
    return new FeedMetadata(generated, url, title, status, apiVersion, filteredCount, bbox);
  }
}
