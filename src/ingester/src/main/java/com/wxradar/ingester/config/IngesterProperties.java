package com.wxradar.ingester.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ingester")
public record IngesterProperties(Http http, Feed metar, Feed taf, Feed airports) {
  public record Http(Duration connectTimeout, Duration requestTimeout) {}

  public record Feed(String url, Duration refreshInterval) {}
}
