package com.wxradar.ingester.csv;

import java.util.Iterator;
import org.apache.commons.csv.CSVRecord;

/**
 * Forward-only CSV row source that remembers the row width later rows must match.
 *
 * <p>The width is unset until {@link CsvHeaderResolver} finds the header row. Feeds whose rows
 * legitimately vary in width call {@link #relaxWidth()} after resolution.
 */
public class CsvRowReader {
  public static final int ANY_WIDTH = -1;

  private final Iterator<CSVRecord> records;
  private int expectedWidth = ANY_WIDTH;

  public CsvRowReader(Iterator<CSVRecord> records) {
    this.records = records;
  }

  public boolean hasNext() {
    return records.hasNext();
  }

  public CSVRecord next() {
    return records.next();
  }

  public int expectedWidth() {
    return expectedWidth;
  }

  void expectWidth(int width) {
    this.expectedWidth = width;
  }

  public void relaxWidth() {
    this.expectedWidth = ANY_WIDTH;
  }

  /**
   * Checks a row against the enforced width.
   *
   * @param row row read from this reader
   * @return {@code true} when no width is enforced or the row matches it
   */
  public boolean hasExpectedWidth(CSVRecord row) {
    return expectedWidth == ANY_WIDTH || row.size() == expectedWidth;
  }
}
