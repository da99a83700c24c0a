package com.wxradar.ingester.feed;

import java.time.Duration;
import java.time.Instant;

/** One periodically refreshed upstream feed. */
public interface FeedIngestor {
  String feedName();

  /** Delay between the end of one cycle and the start of the next. */
  Duration refreshInterval();

  /** Start time of the last cycle that completed successfully, {@link Instant#EPOCH} if none. */
  Instant lastUpdated();

  /** Runs one cycle; never throws. */
  IngestResult ingest();
}
