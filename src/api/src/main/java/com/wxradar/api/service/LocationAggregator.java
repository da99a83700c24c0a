package com.wxradar.api.service;

import com.wxradar.api.api.NotFoundException;
import com.wxradar.api.model.Endpoint;
import com.wxradar.api.model.LocationView;
import com.wxradar.common.location.LocationRecord;
import com.wxradar.common.store.ReportKeyspace;
import com.wxradar.common.store.WeatherStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Merges METAR, TAF and location data into per-location views.
 *
 * <p>Each keyspace is read in one batch call. The reads are not atomic with respect to each
 * other, so a view may pair reports from different ingestion cycles.
 */
@Service
public class LocationAggregator {
  private final WeatherStore store;

  public LocationAggregator(WeatherStore store) {
    this.store = store;
  }

  /**
   * Looks up several locations; codes without any data for the endpoint are omitted.
   *
   * @param endpoint keyspaces to read
   * @param codes validated location codes
   * @return views in request order
   */
  public List<LocationView> lookup(Endpoint endpoint, List<String> codes) {
    if (codes.isEmpty()) {
      return List.of();
    }
    List<String> metars = endpoint.readsMetar()
        ? store.batchGet(ReportKeyspace.METAR, codes)
        : Collections.nCopies(codes.size(), "");
    List<String> tafs = endpoint.readsTaf()
        ? store.batchGet(ReportKeyspace.TAF, codes)
        : Collections.nCopies(codes.size(), "");
    List<Optional<LocationRecord>> locations = endpoint.readsLocation()
        ? store.getLocations(codes)
        : Collections.nCopies(codes.size(), Optional.<LocationRecord>empty());

    List<LocationView> views = new ArrayList<>();
    for (int i = 0; i < codes.size(); i++) {
      String metar = metars.get(i);
      String taf = tafs.get(i);
      LocationRecord record = locations.get(i).orElse(null);
      if (metar.isEmpty() && taf.isEmpty() && record == null) {
        continue;
      }
      views.add(LocationView.of(codes.get(i), metar, taf, record));
    }
    return views;
  }

  /**
   * Looks up one location.
   *
   * @param endpoint keyspaces to read
   * @param code validated location code
   * @return the view, or a code-only view when the location is known but has no data here
   * @throws NotFoundException when nothing at all is stored for the code
   */
  public LocationView lookupSingle(Endpoint endpoint, String code) {
    List<LocationView> views = lookup(endpoint, List.of(code));
    if (!views.isEmpty()) {
      return views.get(0);
    }
    if (!store.exists(code)) {
      throw new NotFoundException("no data for location " + code);
    }
    return LocationView.codeOnly(code);
  }
}
