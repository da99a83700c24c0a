package com.wxradar.common.store;

import com.wxradar.common.location.LocationRecord;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

/**
 * Redis-backed {@link WeatherStore}.
 *
 * <p>Layout, with the default prefix {@code wx:icao:}:
 * <ul>
 *   <li>{@code wx:icao:loc:{CODE}}: hash of location fields, no expiry</li>
 *   <li>{@code wx:icao:metar:{CODE}}: string with TTL</li>
 *   <li>{@code wx:icao:taf:{CODE}}: string with TTL</li>
 * </ul>
 */
public class RedisWeatherStore implements WeatherStore {
  public static final String DEFAULT_KEY_PREFIX = "wx:icao:";

  static final String LOCATION_SEGMENT = "loc:";
  static final String FIELD_NAME = "name";
  static final String FIELD_CITY = "city";
  static final String FIELD_COUNTRY = "country";
  static final String FIELD_LATITUDE = "lat";
  static final String FIELD_LONGITUDE = "lon";
  static final String FIELD_ALTITUDE_FEET = "alt_ft";

  // EXISTS and HSET run as one script so concurrent imports cannot both create the hash.
  private static final RedisScript<Long> CREATE_IF_ABSENT = new DefaultRedisScript<>(
      "if redis.call('EXISTS', KEYS[1]) == 1 then return 0 end "
          + "redis.call('HSET', KEYS[1], unpack(ARGV)) "
          + "return 1",
      Long.class);

  private final StringRedisTemplate redisTemplate;
  private final String keyPrefix;

  public RedisWeatherStore(StringRedisTemplate redisTemplate, String keyPrefix) {
    this.redisTemplate = redisTemplate;
    this.keyPrefix = keyPrefix == null || keyPrefix.isBlank() ? DEFAULT_KEY_PREFIX : keyPrefix;
  }

  @Override
  public Optional<LocationRecord> getLocation(String code) {
    Map<Object, Object> hash = redisTemplate.opsForHash().entries(locationKey(code));
    return toLocation(code, hash);
  }

  @Override
  public List<Optional<LocationRecord>> getLocations(List<String> codes) {
    if (codes.isEmpty()) {
      return List.of();
    }
    // One pipelined round trip on a single pooled connection.
    List<Object> replies = redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
      for (String code : codes) {
        connection.hashCommands().hGetAll(locationKey(code).getBytes(StandardCharsets.UTF_8));
      }
      return null;
    });
    if (replies.size() != codes.size()) {
      throw new DataRetrievalFailureException(
          "Expected " + codes.size() + " location replies but got " + replies.size());
    }
    List<Optional<LocationRecord>> result = new ArrayList<>(codes.size());
    for (int i = 0; i < codes.size(); i++) {
      result.add(toLocation(codes.get(i), (Map<?, ?>) replies.get(i)));
    }
    return result;
  }

  @Override
  public List<String> batchGet(ReportKeyspace keyspace, List<String> codes) {
    if (codes.isEmpty()) {
      return List.of();
    }
    List<String> keys = codes.stream().map(code -> reportKey(keyspace, code)).toList();
    List<String> values = redisTemplate.opsForValue().multiGet(keys);
    if (values == null || values.size() != codes.size()) {
      throw new DataRetrievalFailureException("MGET returned an incomplete reply for " + keyspace);
    }
    return values.stream().map(value -> value == null ? "" : value).toList();
  }

  @Override
  public boolean createLocationIfAbsent(LocationRecord record) {
    Long created = redisTemplate.execute(
        CREATE_IF_ABSENT,
        List.of(locationKey(record.code())),
        FIELD_NAME, nullToEmpty(record.name()),
        FIELD_CITY, nullToEmpty(record.city()),
        FIELD_COUNTRY, nullToEmpty(record.countryCode()),
        FIELD_LATITUDE, String.valueOf(record.latitude()),
        FIELD_LONGITUDE, String.valueOf(record.longitude()),
        FIELD_ALTITUDE_FEET, String.valueOf(record.altitudeFeet()));
    return created != null && created == 1L;
  }

  @Override
  public void upsertWithTtl(ReportKeyspace keyspace, String code, String value, long ttlSeconds) {
    String key = reportKey(keyspace, code);
    if (ttlSeconds <= 0) {
      redisTemplate.delete(key);
      return;
    }
    redisTemplate.opsForValue().set(key, value, Duration.ofSeconds(ttlSeconds));
  }

  @Override
  public boolean exists(String code) {
    return Boolean.TRUE.equals(redisTemplate.hasKey(locationKey(code)));
  }

  String locationKey(String code) {
    return keyPrefix + LOCATION_SEGMENT + code;
  }

  String reportKey(ReportKeyspace keyspace, String code) {
    return keyPrefix + keyspace.keySegment() + code;
  }

  private Optional<LocationRecord> toLocation(String code, Map<?, ?> hash) {
    if (hash == null || hash.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new LocationRecord(
          code,
          field(hash, FIELD_NAME),
          field(hash, FIELD_CITY),
          field(hash, FIELD_COUNTRY),
          Double.parseDouble(field(hash, FIELD_LATITUDE)),
          Double.parseDouble(field(hash, FIELD_LONGITUDE)),
          Integer.parseInt(field(hash, FIELD_ALTITUDE_FEET))));
    } catch (NumberFormatException ex) {
      throw new DataRetrievalFailureException("Malformed location hash for " + code, ex);
    }
  }

  private static String field(Map<?, ?> hash, String name) {
    Object value = hash.get(name);
    return value == null ? "" : value.toString();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
