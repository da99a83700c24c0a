package com.wxradar.api.api;

/**
 * Raised for a path outside the API or a batch that is too large.
 *
 * <p>Mapped to HTTP 403 by {@link ApiExceptionHandler}.
 */
public class ForbiddenException extends RuntimeException {
  public ForbiddenException(String message) {
    super(message);
  }
}
