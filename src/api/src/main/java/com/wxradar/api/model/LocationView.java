package com.wxradar.api.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.wxradar.common.location.LocationRecord;

/**
 * JSON view of one location; fields without data are left out of the payload. Zero coordinates and
 * elevations count as missing data, matching the empty strings of text fields.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LocationView(
    @JsonProperty("location") String location,
    @JsonProperty("metar") String metar,
    @JsonProperty("taf") String taf,
    @JsonProperty("name") String name,
    @JsonProperty("city") String city,
    @JsonProperty("country_code") String countryCode,
    @JsonProperty("latitude") Double latitude,
    @JsonProperty("longitude") Double longitude,
    @JsonProperty("altitude_meters") Integer altitudeMeters,
    @JsonProperty("altitude_feet") Integer altitudeFeet) {

  /** View carrying only the code, for a known location without current reports. */
  public static LocationView codeOnly(String code) {
    return of(code, null, null, null);
  }

  public static LocationView of(String code, String metar, String taf, LocationRecord record) {
    if (record == null) {
      return new LocationView(code, metar, taf, null, null, null, null, null, null, null);
    }
    return new LocationView(
        code,
        metar,
        taf,
        record.name(),
        record.city(),
        record.countryCode(),
        nonZero(record.latitude()),
        nonZero(record.longitude()),
        nonZero(record.altitudeMeters()),
        nonZero(record.altitudeFeet()));
  }

  private static Double nonZero(double value) {
    return value == 0.0 ? null : value;
  }

  private static Integer nonZero(int value) {
    return value == 0 ? null : value;
  }
}
