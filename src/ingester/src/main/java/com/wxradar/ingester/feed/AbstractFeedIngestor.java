package com.wxradar.ingester.feed;

import com.wxradar.ingester.csv.CsvHeader;
import com.wxradar.ingester.csv.CsvHeaderException;
import com.wxradar.ingester.csv.CsvHeaderResolver;
import com.wxradar.ingester.csv.CsvRowReader;
import com.wxradar.ingester.fetch.FeedClient;
import com.wxradar.ingester.fetch.FeedTransportException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Shared ingestion cycle: conditional fetch, header discovery, row streaming and bookkeeping.
 *
 * <p>Subclasses only describe their columns and how one row is stored. A cycle is never retried;
 * the next scheduled run starts from scratch.
 */
public abstract class AbstractFeedIngestor implements FeedIngestor {
  private final Logger log = LoggerFactory.getLogger(getClass());

  private final String feedName;
  private final FeedClient feedClient;
  private final Clock clock;
  private final String url;
  private final Duration refreshInterval;
  private final Counter updatedCycles;
  private final Counter notModifiedCycles;
  private final Counter failedCycles;
  private final Counter storedRows;
  private final Counter unchangedRows;
  private final Counter skippedRows;
  private volatile Instant lastUpdated = Instant.EPOCH;

  protected AbstractFeedIngestor(
      String feedName,
      FeedClient feedClient,
      Clock clock,
      MeterRegistry meterRegistry,
      String url,
      Duration refreshInterval) {
    this.feedName = feedName;
    this.feedClient = feedClient;
    this.clock = clock;
    this.url = url;
    this.refreshInterval = refreshInterval;
    this.updatedCycles = cycleCounter(meterRegistry, "updated");
    this.notModifiedCycles = cycleCounter(meterRegistry, "not_modified");
    this.failedCycles = cycleCounter(meterRegistry, "failed");
    this.storedRows = rowCounter(meterRegistry, "stored");
    this.unchangedRows = rowCounter(meterRegistry, "unchanged");
    this.skippedRows = rowCounter(meterRegistry, "skipped");
  }

  /** Column names this feed reads, in the order {@link #storeRow} expects them. */
  protected abstract List<String> fieldNames();

  /** Whether rows must have exactly as many fields as the header row. */
  protected boolean enforceRowWidth() {
    return true;
  }

  /**
   * Stores one data row.
   *
   * @throws RowRejectedException when the row is unusable; the row is skipped
   * @throws DataAccessException when the store fails; the cycle is aborted
   */
  protected abstract RowOutcome storeRow(CsvHeader header, CSVRecord row);

  @Override
  public final String feedName() {
    return feedName;
  }

  @Override
  public Duration refreshInterval() {
    return refreshInterval;
  }

  @Override
  public Instant lastUpdated() {
    return lastUpdated;
  }

  @Override
  public IngestResult ingest() {
    Instant started = clock.instant();
    try {
      Optional<InputStream> body = feedClient.fetchIfModified(url, lastUpdated);
      if (body.isEmpty()) {
        notModifiedCycles.increment();
        log.info("{} feed not modified since {}", feedName(), lastUpdated);
        return IngestResult.notModified();
      }
      IngestResult result;
      try (Reader reader = new InputStreamReader(body.get(), StandardCharsets.UTF_8);
           CSVParser parser = CSVFormat.DEFAULT.parse(reader)) {
        result = ingestRows(new CsvRowReader(parser.iterator()));
      }
      lastUpdated = started;
      updatedCycles.increment();
      log.info(
          "{} feed updated: stored={}, unchanged={}, skipped={}",
          feedName(),
          result.stored(),
          result.unchanged(),
          result.skipped());
      return result;
    } catch (FeedTransportException ex) {
      log.error("{} feed fetch failed: {}", feedName(), ex.getMessage());
    } catch (CsvHeaderException ex) {
      log.error("{} feed header not usable: {} (indices {})", feedName(), ex.getMessage(), ex.getIndices());
    } catch (DataAccessException ex) {
      log.error("{} feed storage failed, cycle aborted", feedName(), ex);
    } catch (IOException | UncheckedIOException ex) {
      log.error("{} feed stream broken, cycle aborted", feedName(), ex);
    } catch (RuntimeException ex) {
      // Keep the scheduler running even if a cycle fails.
      log.error("{} feed cycle failed", feedName(), ex);
    }
    failedCycles.increment();
    return IngestResult.failed();
  }

  private IngestResult ingestRows(CsvRowReader rows) {
    CsvHeader header = CsvHeaderResolver.resolve(rows, fieldNames());
    if (!enforceRowWidth()) {
      rows.relaxWidth();
    }
    int stored = 0;
    int unchanged = 0;
    int skipped = 0;
    while (rows.hasNext()) {
      CSVRecord row = rows.next();
      RowOutcome outcome;
      try {
        if (!rows.hasExpectedWidth(row)) {
          throw new RowRejectedException(
              "expected " + rows.expectedWidth() + " fields, got " + row.size());
        }
        outcome = storeRow(header, row);
      } catch (RowRejectedException ex) {
        log.debug("{} feed row {} skipped: {}", feedName(), row.getRecordNumber(), ex.getMessage());
        outcome = RowOutcome.SKIPPED;
      }
      switch (outcome) {
        case STORED -> stored++;
        case UNCHANGED -> unchanged++;
        default -> skipped++;
      }
    }
    storedRows.increment(stored);
    unchangedRows.increment(unchanged);
    skippedRows.increment(skipped);
    return new IngestResult(IngestResult.Outcome.UPDATED, stored, unchanged, skipped);
  }

  /**
   * Reads a resolved column from a row.
   *
   * @throws RowRejectedException when the row is too short for the column
   */
  protected static String field(CsvHeader header, CSVRecord row, String fieldName) {
    int index = header.indexOf(fieldName);
    if (index >= row.size()) {
      throw new RowRejectedException("missing field " + fieldName);
    }
    return row.get(index);
  }

  private Counter cycleCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.feed.cycles.total")
        .description("Feed ingestion cycles (by feed and outcome)")
        .tag("feed", feedName)
        .tag("outcome", outcome)
        .register(meterRegistry);
  }

  private Counter rowCounter(MeterRegistry meterRegistry, String outcome) {
    return Counter.builder("ingester.feed.rows.total")
        .description("Feed rows processed (by feed and outcome)")
        .tag("feed", feedName)
        .tag("outcome", outcome)
        .register(meterRegistry);
  }
}
