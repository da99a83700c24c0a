package com.wxradar.common.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryWeatherStoreTest extends WeatherStoreContract {
  private TestClock clock;
  private InMemoryWeatherStore store;

  @BeforeEach
  void setUp() {
    clock = new TestClock(Instant.parse("2024-05-01T12:00:00Z"));
    store = new InMemoryWeatherStore(clock);
  }

  @Override
  WeatherStore store() {
    return store;
  }

  @Test
  void reportDisappearsOnceTtlElapses() {
    store.upsertWithTtl(ReportKeyspace.METAR, "UKLL", "METAR UKLL 011200Z", 60);

    clock.advance(Duration.ofSeconds(59));
    assertThat(store.batchGet(ReportKeyspace.METAR, List.of("UKLL"))).containsExactly("METAR UKLL 011200Z");

    clock.advance(Duration.ofSeconds(1));
    assertThat(store.batchGet(ReportKeyspace.METAR, List.of("UKLL"))).containsExactly("");
  }

  @Test
  void locationMetadataNeverExpires() {
    store.createLocationIfAbsent(LVIV);

    clock.advance(Duration.ofDays(3650));

    assertThat(store.exists("UKLL")).isTrue();
  }
}
