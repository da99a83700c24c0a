package com.wxradar.api.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.wxradar.api.api.NotFoundException;
import com.wxradar.api.model.Endpoint;
import com.wxradar.api.model.LocationView;
import com.wxradar.common.location.LocationRecord;
import com.wxradar.common.store.InMemoryWeatherStore;
import com.wxradar.common.store.ReportKeyspace;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocationAggregatorTest {
  private static final LocationRecord LVIV =
      new LocationRecord("UKLL", "Lviv International Airport", "Lviv", "UA", 49.8125, 23.9561, 1071);

  private InMemoryWeatherStore store;
  private LocationAggregator aggregator;

  @BeforeEach
  void setUp() {
    store = new InMemoryWeatherStore(Clock.fixed(Instant.parse("2024-05-01T12:30:00Z"), ZoneOffset.UTC));
    aggregator = new LocationAggregator(store);
    store.createLocationIfAbsent(LVIV);
    store.upsertWithTtl(ReportKeyspace.METAR, "UKLL", "METAR UKLL 011200Z CAVOK", 600);
    store.upsertWithTtl(ReportKeyspace.TAF, "UKLL", "TAF UKLL 011100Z 0112/0212 CAVOK", 600);
    store.upsertWithTtl(ReportKeyspace.METAR, "EGLL", "METAR EGLL 011220Z 24012KT", 600);
  }

  @Test
  void allMergesEveryKeyspace() {
    LocationView view = aggregator.lookupSingle(Endpoint.ALL, "UKLL");

    assertThat(view.location()).isEqualTo("UKLL");
    assertThat(view.metar()).isEqualTo("METAR UKLL 011200Z CAVOK");
    assertThat(view.taf()).isEqualTo("TAF UKLL 011100Z 0112/0212 CAVOK");
    assertThat(view.name()).isEqualTo("Lviv International Airport");
    assertThat(view.countryCode()).isEqualTo("UA");
    assertThat(view.altitudeFeet()).isEqualTo(1071);
    assertThat(view.altitudeMeters()).isEqualTo(326);
  }

  @Test
  void metarEndpointReadsOnlyMetar() {
    LocationView view = aggregator.lookupSingle(Endpoint.METAR, "UKLL");

    assertThat(view.metar()).isNotEmpty();
    assertThat(view.taf()).isEmpty();
    assertThat(view.name()).isNull();
  }

  @Test
  void locationEndpointNeverCarriesReports() {
    LocationView view = aggregator.lookupSingle(Endpoint.LOCATION, "UKLL");

    assertThat(view.metar()).isEmpty();
    assertThat(view.taf()).isEmpty();
    assertThat(view.city()).isEqualTo("Lviv");
  }

  @Test
  void allProducesViewWithoutLocationMetadata() {
    LocationView view = aggregator.lookupSingle(Endpoint.ALL, "EGLL");

    assertThat(view.metar()).isEqualTo("METAR EGLL 011220Z 24012KT");
    assertThat(view.name()).isNull();
    assertThat(view.latitude()).isNull();
  }

  @Test
  void knownLocationWithoutReportsGivesCodeOnlyView() {
    store.createLocationIfAbsent(new LocationRecord("LFPG", "Paris CDG", "Paris", "FR", 49.0, 2.5, 392));

    assertThat(aggregator.lookupSingle(Endpoint.TAF, "LFPG")).isEqualTo(LocationView.codeOnly("LFPG"));
  }

  @Test
  void unknownSingleLocationIsNotFound() {
    assertThatThrownBy(() -> aggregator.lookupSingle(Endpoint.METAR, "ZZZZ"))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining("ZZZZ");
  }

  @Test
  void batchOmitsCodesWithoutDataAndKeepsOrder() {
    List<LocationView> views = aggregator.lookup(Endpoint.METAR, List.of("EGLL", "ZZZZ", "UKLL"));

    assertThat(views).extracting(LocationView::location).containsExactly("EGLL", "UKLL");
  }

  @Test
  void emptyBatchReadsNothing() {
    assertThat(aggregator.lookup(Endpoint.ALL, List.of())).isEmpty();
  }
}
