package com.wxradar.common.store;

import com.wxradar.common.location.LocationRecord;
import java.util.List;
import java.util.Optional;

/**
 * Key-value storage for location metadata and the latest METAR/TAF per location.
 *
 * <p>The three keyspaces are independent: reads spanning several keyspaces are not atomic, so a
 * refresh landing between two reads may pair an older METAR with a newer TAF. Callers accept this
 * in exchange for lock-free reads. Implementations do not validate location codes.
 */
public interface WeatherStore {

  /**
   * Reads the metadata of one location.
   *
   * @param code ICAO location code
   * @return the record, or empty when the location is unknown
   */
  Optional<LocationRecord> getLocation(String code);

  /**
   * Reads the metadata of several locations.
   *
   * @param codes location codes
   * @return one entry per code, in the same order
   */
  List<Optional<LocationRecord>> getLocations(List<String> codes);

  /**
   * Reads current reports from one keyspace.
   *
   * @param keyspace report keyspace
   * @param codes location codes
   * @return one value per code, in the same order; an empty string where nothing is stored
   */
  List<String> batchGet(ReportKeyspace keyspace, List<String> codes);

  /**
   * Stores location metadata unless the location already exists.
   *
   * @param record metadata to store
   * @return {@code true} when the record was created, {@code false} when left unchanged
   */
  boolean createLocationIfAbsent(LocationRecord record);

  /**
   * Sets or replaces a report with a time-to-live.
   *
   * <p>A non-positive TTL means the report is already expired: any stored value is removed and
   * nothing is written.
   *
   * @param keyspace report keyspace
   * @param code location code
   * @param value raw report text
   * @param ttlSeconds seconds until expiry
   */
  void upsertWithTtl(ReportKeyspace keyspace, String code, String value, long ttlSeconds);

  /**
   * Checks whether location metadata exists for a code.
   *
   * @param code location code
   * @return {@code true} when the location keyspace holds the code
   */
  boolean exists(String code);
}
