package com.wxradar.ingester.feed;

import com.wxradar.common.store.ReportKeyspace;
import com.wxradar.common.store.WeatherStore;
import com.wxradar.ingester.config.IngesterProperties;
import com.wxradar.ingester.csv.CsvHeader;
import com.wxradar.ingester.fetch.FeedClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.List;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

/**
 * Forecasts; each expires at the end of its validity period.
 *
 * <p>TAF rows carry a variable number of forecast groups, so row width is not enforced.
 */
@Component
public class TafFeedIngestor extends ReportFeedIngestor {
  private static final List<String> FIELDS = List.of("raw_text", STATION_ID, "valid_time_to");

  public TafFeedIngestor(
      FeedClient feedClient,
      WeatherStore store,
      TtlCalculator ttlCalculator,
      Clock clock,
      MeterRegistry meterRegistry,
      IngesterProperties properties) {
    super(
        "taf",
        ReportKeyspace.TAF,
        feedClient,
        store,
        ttlCalculator,
        clock,
        meterRegistry,
        properties.taf().url(),
        properties.taf().refreshInterval());
  }

  @Override
  protected List<String> fieldNames() {
    return FIELDS;
  }

  @Override
  protected boolean enforceRowWidth() {
    return false;
  }

  @Override
  protected String timestampField() {
    return "valid_time_to";
  }

  @Override
  protected long windowSeconds() {
    return 0;
  }

  @Override
  protected String reportValue(CsvHeader header, CSVRecord row) {
    return field(header, row, "raw_text");
  }
}
