package com.quakeradar.client.usgs;

import com.quakeradar.client.error.Outcome;
import com.quakeradar.client.model.ResultSet;
import com.quakeradar.client.query.QueryDescriptor;
import java.time.Duration;
import org.springframework.stereotype.Component;

/** Encodes a descriptor, sends it and decodes the response. Expects an already validated descriptor. */
@Component
public class RequestExecutor {
  private final Codec codec;
  private final Transport transport;

  public RequestExecutor(Codec codec, Transport transport) {
    this.codec = codec;
    this.transport = transport;
  }

  public Outcome<ResultSet> execute(QueryDescriptor descriptor, Duration timeout) {
    String serialized = codec.encode(descriptor);
    return transport.send(serialized, timeout).flatMap(body -> codec.decode(body, descriptor));
  }
}
