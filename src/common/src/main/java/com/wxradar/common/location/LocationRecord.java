package com.wxradar.common.location;

/**
 * Static metadata for one ICAO location, imported once from the airport feed.
 *
 * @param code ICAO location code (storage key)
 * @param name airport name
 * @param city municipality served
 * @param countryCode ISO 3166-1 alpha-2 country code
 * @param latitude latitude in degrees
 * @param longitude longitude in degrees
 * @param altitudeFeet field elevation in feet
 */
public record LocationRecord(
    String code,
    String name,
    String city,
    String countryCode,
    double latitude,
    double longitude,
    int altitudeFeet) {

  /**
   * Derives the elevation in meters, truncated to whole meters.
   *
   * @return elevation in meters
   */
  public int altitudeMeters() {
    return altitudeFeet * 3048 / 10000;
  }
}
