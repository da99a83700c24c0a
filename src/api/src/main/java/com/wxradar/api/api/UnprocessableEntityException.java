package com.wxradar.api.api;

/**
 * Raised for a well-formed request naming an invalid location or endpoint.
 *
 * <p>Mapped to HTTP 422 by {@link ApiExceptionHandler}.
 */
public class UnprocessableEntityException extends RuntimeException {
  public UnprocessableEntityException(String message) {
    super(message);
  }
}
