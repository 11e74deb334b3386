package com.quakeradar.client.usgs;

import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.query.QueryDescriptor;

/** Wire format of the feed: query encoding and response decoding. */
public interface Codec {
  /** Encodes a validated descriptor as a URL query string. Unset slots are omitted. */
  String encode(QueryDescriptor descriptor);

  /**
   * Decodes a response body.
   *
   * @param body raw response bytes
   * @param query descriptor echoed into the result set
   * @return decoded records, or a {@code DECODE} failure
   */
  Outcome<ResultSet> decode(byte[] body, QueryDescriptor query);
}
