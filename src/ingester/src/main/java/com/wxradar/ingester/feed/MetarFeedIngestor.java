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

/** Current observations; each stays valid for three hours after observation time. */
@Component
public class MetarFeedIngestor extends ReportFeedIngestor {
  private static final long WINDOW_SECONDS = 3 * 60 * 60;
  private static final List<String> FIELDS =
      List.of("raw_text", STATION_ID, "observation_time", "metar_type");

  public MetarFeedIngestor(
      FeedClient feedClient,
      WeatherStore store,
      TtlCalculator ttlCalculator,
      Clock clock,
      MeterRegistry meterRegistry,
      IngesterProperties properties) {
    super(
        "metar",
        ReportKeyspace.METAR,
        feedClient,
        store,
        ttlCalculator,
        clock,
        meterRegistry,
        properties.metar().url(),
        properties.metar().refreshInterval());
  }

  @Override
  protected List<String> fieldNames() {
    return FIELDS;
  }

  @Override
  protected String timestampField() {
    return "observation_time";
  }

  @Override
  protected long windowSeconds() {
    return WINDOW_SECONDS;
  }

  @Override
  protected String reportValue(CsvHeader header, CSVRecord row) {
    return field(header, row, "metar_type") + " " + field(header, row, "raw_text");
  }
}
