package com.wxradar.common.store;

/** TTL-bound report keyspaces, one string value per location code. */
public enum ReportKeyspace {
  METAR("metar:"),
  TAF("taf:");

  private final String keySegment;

  ReportKeyspace(String keySegment) {
    this.keySegment = keySegment;
  }

  public String keySegment() {
    return keySegment;
  }
}
