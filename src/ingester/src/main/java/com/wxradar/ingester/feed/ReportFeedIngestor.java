package com.wxradar.ingester.feed;

import com.wxradar.common.location.LocationCodes;
import com.wxradar.common.store.ReportKeyspace;
import com.wxradar.common.store.WeatherStore;
import com.wxradar.ingester.csv.CsvHeader;
import com.wxradar.ingester.fetch.FeedClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import org.apache.commons.csv.CSVRecord;

/** Feeds of raw weather reports keyed by station, each report expiring after a window. */
abstract class ReportFeedIngestor extends AbstractFeedIngestor {
  static final String STATION_ID = "station_id";

  private final WeatherStore store;
  private final TtlCalculator ttlCalculator;
  private final ReportKeyspace keyspace;

  ReportFeedIngestor(
      String feedName,
      ReportKeyspace keyspace,
      FeedClient feedClient,
      WeatherStore store,
      TtlCalculator ttlCalculator,
      Clock clock,
      MeterRegistry meterRegistry,
      String url,
      Duration refreshInterval) {
    super(feedName, feedClient, clock, meterRegistry, url, refreshInterval);
    this.store = store;
    this.ttlCalculator = ttlCalculator;
    this.keyspace = keyspace;
  }

  /** Column holding the timestamp the expiry window starts from. */
  protected abstract String timestampField();

  protected abstract long windowSeconds();

  protected abstract String reportValue(CsvHeader header, CSVRecord row);

  @Override
  protected RowOutcome storeRow(CsvHeader header, CSVRecord row) {
    String code = field(header, row, STATION_ID);
    if (!LocationCodes.isValid(code)) {
      throw new RowRejectedException("invalid station id '" + code + "'");
    }
    String timestamp = field(header, row, timestampField());
    long ttl;
    try {
      ttl = ttlCalculator.expireSeconds(timestamp, windowSeconds());
    } catch (DateTimeParseException ex) {
      throw new RowRejectedException("bad timestamp '" + timestamp + "' for " + code, ex);
    }
    // An expired report still clears any older value left under the code.
    store.upsertWithTtl(keyspace, code, reportValue(header, row), ttl);
    return ttl > 0 ? RowOutcome.STORED : RowOutcome.SKIPPED;
  }
}
