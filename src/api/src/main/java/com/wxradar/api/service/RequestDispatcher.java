package com.wxradar.api.service;

import com.wxradar.api.api.BadRequestException;
import com.wxradar.api.api.ForbiddenException;
import com.wxradar.api.api.UnprocessableEntityException;
import com.wxradar.api.model.Endpoint;
import com.wxradar.api.model.LocationQuery;
import com.wxradar.common.location.LocationCodes;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Utility class turning a request path and query into a {@link LocationQuery}.
 *
 * <p>Accepted shapes are {@code /{endpoint}/{CODE}} for a single lookup and
 * {@code /{endpoint}?location=A,B} for a batch.
 */
public final class RequestDispatcher {
  static final String LOCATION_PARAM = "location";

  private RequestDispatcher() {}

  /**
   * Parses and validates a lookup request.
   *
   * @param path decoded path within the application, starting with {@code /}
   * @param params decoded query parameters; repeated values are concatenated
   * @param maxLocations largest accepted batch
   * @return validated query with uppercase codes
   * @throws BadRequestException for a malformed path or an unknown query parameter
   * @throws UnprocessableEntityException for an unknown endpoint, a missing or doubled
   *     location selector, or an invalid code
   * @throws ForbiddenException when a batch names more than {@code maxLocations} codes
   */
  public static LocationQuery parse(String path, Map<String, List<String>> params, int maxLocations) {
    List<String> segments = pathSegments(path);
    for (String name : params.keySet()) {
      if (!LOCATION_PARAM.equals(name)) {
        throw new BadRequestException("unknown query parameter " + name);
      }
    }

    Endpoint endpoint = Endpoint.fromPath(segments.get(0))
        .orElseThrow(() -> new UnprocessableEntityException("unknown endpoint " + segments.get(0)));

    boolean pathSelector = segments.size() == 2;
    boolean querySelector = params.containsKey(LOCATION_PARAM);
    if (pathSelector == querySelector) {
      throw new UnprocessableEntityException(
          "give either a location in the path or a location query parameter, not both or neither");
    }

    if (pathSelector) {
      String code = segments.get(1).toUpperCase(Locale.ROOT);
      requireValid(code);
      return new LocationQuery(endpoint, List.of(code), false);
    }

    List<String> codes = new ArrayList<>();
    for (String value : params.get(LOCATION_PARAM)) {
      for (String item : value.split(",", -1)) {
        codes.add(item.toUpperCase(Locale.ROOT));
      }
    }
    if (codes.size() > maxLocations) {
      throw new ForbiddenException("at most " + maxLocations + " locations per request");
    }
    codes.forEach(RequestDispatcher::requireValid);
    return new LocationQuery(endpoint, codes, true);
  }

  /**
   * Splits and decodes a raw query string.
   *
   * @param rawQuery query string as sent by the client, may be {@code null}
   * @return decoded parameters in request order; a name without value maps to an empty string
   * @throws BadRequestException when the query carries an invalid percent-encoding
   */
  public static Map<String, List<String>> parseQuery(String rawQuery) {
    if (rawQuery == null || rawQuery.isEmpty()) {
      return Map.of();
    }
    try {
      MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance()
          .query(rawQuery)
          .build(true)
          .getQueryParams();
      Map<String, List<String>> params = new LinkedHashMap<>();
      raw.forEach((name, values) -> {
        List<String> decoded = params.computeIfAbsent(decode(name), key -> new ArrayList<>());
        for (String value : values) {
          decoded.add(value == null ? "" : decode(value));
        }
      });
      return params;
    } catch (IllegalArgumentException ex) {
      throw new BadRequestException("malformed query string: " + ex.getMessage());
    }
  }

  private static String decode(String component) {
    return UriUtils.decode(component.replace('+', ' '), StandardCharsets.UTF_8);
  }

  private static List<String> pathSegments(String path) {
    List<String> segments = new ArrayList<>(Arrays.asList(path.split("/", -1)));
    if (!segments.isEmpty() && segments.get(0).isEmpty()) {
      segments.remove(0);
    }
    if (!segments.isEmpty() && segments.get(segments.size() - 1).isEmpty()) {
      segments.remove(segments.size() - 1);
    }
    if (segments.isEmpty() || segments.size() > 2) {
      throw new BadRequestException("path must be /{endpoint} or /{endpoint}/{location}");
    }
    return segments;
  }

  private static void requireValid(String code) {
    if (!LocationCodes.isValid(code)) {
      throw new UnprocessableEntityException("invalid location code '" + code + "'");
    }
  }
}
