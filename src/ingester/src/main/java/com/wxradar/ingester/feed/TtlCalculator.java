package com.wxradar.ingester.feed;

import java.time.Clock;
import java.time.OffsetDateTime;
import org.springframework.stereotype.Component;

/** Turns a report timestamp and a freshness window into seconds left before expiry. */
@Component
public class TtlCalculator {
  private final Clock clock;

  public TtlCalculator(Clock clock) {
    this.clock = clock;
  }

  /**
   * Computes {@code timestamp + window - now} in whole seconds.
   *
   * <p>The result is zero or negative when the report is already stale; the store treats that as
   * immediate expiry.
   *
   * @param timestamp RFC 3339 timestamp, e.g. {@code 2024-05-01T12:00:00Z}
   * @param windowSeconds freshness window added to the timestamp
   * @return remaining seconds, possibly non-positive
   * @throws java.time.format.DateTimeParseException when the timestamp is malformed
   */
  public long expireSeconds(String timestamp, long windowSeconds) {
    long epochSeconds = OffsetDateTime.parse(timestamp).toEpochSecond();
    return epochSeconds + windowSeconds - clock.instant().getEpochSecond();
  }
}
