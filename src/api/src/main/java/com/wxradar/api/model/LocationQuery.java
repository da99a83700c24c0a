package com.wxradar.api.model;

import java.util.List;

/**
 * Parsed lookup request.
 *
 * @param endpoint endpoint to serve
 * @param locations validated uppercase codes; exactly one when not a batch
 * @param batch whether codes came from the {@code location} query parameter
 */
public record LocationQuery(Endpoint endpoint, List<String> locations, boolean batch) {
  public LocationQuery {
    locations = List.copyOf(locations);
  }
}
