package com.wxradar.api.api;

import com.wxradar.api.config.ApiProperties;
import com.wxradar.api.model.LocationQuery;
import com.wxradar.api.service.LocationAggregator;
import com.wxradar.api.service.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UrlPathHelper;

/**
 * REST controller exposing read-only weather lookups.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code GET /{endpoint}/{CODE}}: one object</li>
 *   <li>{@code GET /{endpoint}?location=A,B}: array, unknown codes omitted</li>
 * </ul>
 * where {@code endpoint} is {@code metar}, {@code taf}, {@code location} or {@code all}.
 */
@RestController
public class LocationController {
  private final LocationAggregator aggregator;
  private final ApiProperties properties;

  public LocationController(LocationAggregator aggregator, ApiProperties properties) {
    this.aggregator = aggregator;
    this.properties = properties;
  }

  /**
   * Serves a single or batch lookup.
   *
   * @param request current request; path and query string are decoded here so that a bad
   *     percent-encoding is reported as 400
   * @return a view for a single lookup, a list of views for a batch
   */
  @GetMapping({"/{endpoint:metar|taf|location|all}", "/{endpoint:metar|taf|location|all}/**"})
  public Object lookup(HttpServletRequest request) {
    String path = UrlPathHelper.defaultInstance.getPathWithinApplication(request);
    LocationQuery query = RequestDispatcher.parse(
        path, RequestDispatcher.parseQuery(request.getQueryString()), properties.getMaxLocations());
    if (query.batch()) {
      return aggregator.lookup(query.endpoint(), query.locations());
    }
    return aggregator.lookupSingle(query.endpoint(), query.locations().get(0));
  }
}
