package com.wxradar.api.api;

/**
 * Raised for a single location that is entirely unknown.
 *
 * <p>Mapped to HTTP 404 by {@link ApiExceptionHandler}.
 */
public class NotFoundException extends RuntimeException {
  public NotFoundException(String message) {
    super(message);
  }
}
