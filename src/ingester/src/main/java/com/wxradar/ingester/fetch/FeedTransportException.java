package com.wxradar.ingester.fetch;

/** Feed unreachable, timed out or answered with a non-200 status. */
public class FeedTransportException extends RuntimeException {
  public FeedTransportException(String message) {
    super(message);
  }

  public FeedTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
