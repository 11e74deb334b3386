package com.quakeradar.client.config;

import com.quakeradar.client.query.OrderBy;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch")
public record WatchProperties(
    boolean enabled,
    long refreshMs,
    long lookbackHours,
    Double minMagnitude,
    String countryCode,
    OrderBy orderBy) {}
