package com.wxradar.ingester.csv;

import java.util.List;

/** Raised when a CSV stream has no usable header row; aborts the current ingestion cycle. */
public class CsvHeaderException extends RuntimeException {
  private final List<Integer> indices;

  public CsvHeaderException(String message, List<Integer> indices) {
    super(message);
    this.indices = List.copyOf(indices);
  }

  /** Column indices resolved before the failure, {@code -1} for fields not found. */
  public List<Integer> getIndices() {
    return indices;
  }
}
