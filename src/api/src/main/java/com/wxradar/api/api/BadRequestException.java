package com.wxradar.api.api;

/**
 * Raised for invalid request syntax (path shape, unknown query parameter).
 *
 * <p>Mapped to HTTP 400 by {@link ApiExceptionHandler}.
 */
public class BadRequestException extends RuntimeException {
  public BadRequestException(String message) {
    super(message);
  }
}
