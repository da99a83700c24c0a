package com.wxradar.api.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Lookup endpoints and the keyspaces each one reads. */
public enum Endpoint {
  METAR(true, false, false),
  TAF(false, true, false),
  LOCATION(false, false, true),
  ALL(true, true, true);

  private final boolean metar;
  private final boolean taf;
  private final boolean location;

  Endpoint(boolean metar, boolean taf, boolean location) {
    this.metar = metar;
    this.taf = taf;
    this.location = location;
  }

  public boolean readsMetar() {
    return metar;
  }

  public boolean readsTaf() {
    return taf;
  }

  public boolean readsLocation() {
    return location;
  }

  /** Path segment naming this endpoint, e.g. {@code metar}. */
  public String pathName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<Endpoint> fromPath(String segment) {
    return Arrays.stream(values()).filter(endpoint -> endpoint.pathName().equals(segment)).findFirst();
  }
}
