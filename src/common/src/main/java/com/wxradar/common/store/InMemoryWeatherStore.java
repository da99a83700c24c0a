package com.wxradar.common.store;

import com.wxradar.common.location.LocationRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link WeatherStore} with clock-driven expiry.
 *
 * <p>Used by tests and by single-node runs with {@code wx.storage.type=memory}. Expired reports
 * are dropped lazily on read.
 */
public class InMemoryWeatherStore implements WeatherStore {
  private final Clock clock;
  private final Map<String, LocationRecord> locations = new ConcurrentHashMap<>();
  private final Map<ReportKeyspace, Map<String, Report>> reports = new EnumMap<>(ReportKeyspace.class);

  public InMemoryWeatherStore(Clock clock) {
    this.clock = clock;
    for (ReportKeyspace keyspace : ReportKeyspace.values()) {
      reports.put(keyspace, new ConcurrentHashMap<>());
    }
  }

  @Override
  public Optional<LocationRecord> getLocation(String code) {
    return Optional.ofNullable(locations.get(code));
  }

  @Override
  public List<Optional<LocationRecord>> getLocations(List<String> codes) {
    return codes.stream().map(this::getLocation).toList();
  }

  @Override
  public List<String> batchGet(ReportKeyspace keyspace, List<String> codes) {
    Map<String, Report> values = reports.get(keyspace);
    Instant now = clock.instant();
    return codes.stream().map(code -> {
      Report report = values.get(code);
      if (report == null) {
        return "";
      }
      if (!report.expiresAt().isAfter(now)) {
        values.remove(code, report);
        return "";
      }
      return report.value();
    }).toList();
  }

  @Override
  public boolean createLocationIfAbsent(LocationRecord record) {
    return locations.putIfAbsent(record.code(), record) == null;
  }

  @Override
  public void upsertWithTtl(ReportKeyspace keyspace, String code, String value, long ttlSeconds) {
    Map<String, Report> values = reports.get(keyspace);
    if (ttlSeconds <= 0) {
      values.remove(code);
      return;
    }
    values.put(code, new Report(value, clock.instant().plusSeconds(ttlSeconds)));
  }

  @Override
  public boolean exists(String code) {
    return locations.containsKey(code);
  }

  private record Report(String value, Instant expiresAt) {}
}
