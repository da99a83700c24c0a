package com.wxradar.ingester.csv;

import java.util.List;

/**
 * Column positions of the requested fields within a discovered header row.
 *
 * @param fieldNames requested field names, in request order
 * @param indices zero-based column index of each requested field
 * @param width number of fields in the header row
 */
public record CsvHeader(List<String> fieldNames, List<Integer> indices, int width) {

  public CsvHeader {
    fieldNames = List.copyOf(fieldNames);
    indices = List.copyOf(indices);
  }

  /**
   * Looks up the column of a requested field.
   *
   * @param fieldName one of {@link #fieldNames()}
   * @return zero-based column index
   * @throws IllegalArgumentException when the field was not requested
   */
  public int indexOf(String fieldName) {
    int position = fieldNames.indexOf(fieldName);
    if (position < 0) {
      throw new IllegalArgumentException("Field " + fieldName + " was not requested");
    }
    return indices.get(position);
  }
}
