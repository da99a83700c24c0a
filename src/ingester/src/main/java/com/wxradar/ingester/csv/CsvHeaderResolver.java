package com.wxradar.ingester.csv;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.apache.commons.csv.CSVRecord;

/**
 * Finds named columns in CSV feeds that prefix the header with free-form diagnostic lines.
 *
 * <p>Heuristic: the first row with more than one field is the header. This is best effort for
 * loosely formatted feeds, not a general CSV dialect detector.
 */
public final class CsvHeaderResolver {
  public static final int NOT_FOUND = -1;

  private CsvHeaderResolver() {}

  /**
   * Skips leading single-field rows, then maps each field name to its column in the header row.
   *
   * <p>On success the reader enforces the header width for subsequent rows. Duplicate column
   * names resolve to their first occurrence.
   *
   * @param rows row source positioned at the start of the stream
   * @param fieldNames non-empty list of exact column names
   * @return resolved header
   * @throws CsvHeaderException when no names are given, the stream ends before a header row, or
   *     any name is missing from the header (indices of all names are reported)
   */
  public static CsvHeader resolve(CsvRowReader rows, List<String> fieldNames) {
    if (fieldNames == null || fieldNames.isEmpty()) {
      throw new CsvHeaderException("No field names specified", List.of());
    }
    int[] indices = new int[fieldNames.size()];
    Arrays.fill(indices, NOT_FOUND);

    rows.relaxWidth();
    while (rows.hasNext()) {
      CSVRecord record = rows.next();
      if (record.size() <= 1) {
        continue;
      }
      rows.expectWidth(record.size());
      for (int column = 0; column < record.size(); column++) {
        String value = record.get(column);
        for (int i = 0; i < indices.length; i++) {
          if (indices[i] == NOT_FOUND && value.equals(fieldNames.get(i))) {
            indices[i] = column;
          }
        }
      }
      List<Integer> resolved = toList(indices);
      List<String> missing = IntStream.range(0, indices.length)
          .filter(i -> indices[i] == NOT_FOUND)
          .mapToObj(fieldNames::get)
          .collect(Collectors.toList());
      if (!missing.isEmpty()) {
        throw new CsvHeaderException(
            "Fields " + missing + " not found in CSV header " + record.toList(), resolved);
      }
      return new CsvHeader(fieldNames, resolved, record.size());
    }
    throw new CsvHeaderException("CSV stream ended before a header row was found", toList(indices));
  }

  private static List<Integer> toList(int[] indices) {
    List<Integer> list = new ArrayList<>(indices.length);
    for (int index : indices) {
      list.add(index);
    }
    return list;
  }
}
