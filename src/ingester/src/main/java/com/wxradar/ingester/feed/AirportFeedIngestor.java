package com.wxradar.ingester.feed;

import com.wxradar.common.location.LocationCodes;
import com.wxradar.common.location.LocationRecord;
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
 * Imports airport metadata from the OurAirports dump.
 *
 * <p>Locations are created once and never overwritten; existing records stay as first imported.
 */
@Component
public class AirportFeedIngestor extends AbstractFeedIngestor {
  private static final String CLOSED = "closed";
  private static final List<String> FIELDS = List.of(
      "type",
      "name",
      "latitude_deg",
      "longitude_deg",
      "elevation_ft",
      "iso_country",
      "iso_region",
      "municipality",
      "gps_code");

  private final WeatherStore store;

  public AirportFeedIngestor(
      FeedClient feedClient,
      WeatherStore store,
      Clock clock,
      MeterRegistry meterRegistry,
      IngesterProperties properties) {
    super(
        "airports",
        feedClient,
        clock,
        meterRegistry,
        properties.airports().url(),
        properties.airports().refreshInterval());
    this.store = store;
  }

  @Override
  protected List<String> fieldNames() {
    return FIELDS;
  }

  @Override
  protected RowOutcome storeRow(CsvHeader header, CSVRecord row) {
    String code = field(header, row, "gps_code");
    if (CLOSED.equals(field(header, row, "type"))) {
      throw new RowRejectedException(code + " is closed");
    }
    if (!LocationCodes.isValid(code)) {
      throw new RowRejectedException("invalid gps code '" + code + "'");
    }
    LocationRecord record;
    try {
      record = new LocationRecord(
          code,
          field(header, row, "name"),
          field(header, row, "municipality"),
          field(header, row, "iso_country"),
          Double.parseDouble(field(header, row, "latitude_deg")),
          Double.parseDouble(field(header, row, "longitude_deg")),
          Integer.parseInt(field(header, row, "elevation_ft")));
    } catch (NumberFormatException ex) {
      throw new RowRejectedException("bad number for " + code + ": " + ex.getMessage(), ex);
    }
    return store.createLocationIfAbsent(record) ? RowOutcome.STORED : RowOutcome.UNCHANGED;
  }
}
