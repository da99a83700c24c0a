package com.wxradar.ingester.feed;

/** A single feed row could not be stored; the row is skipped and the cycle goes on. */
public class RowRejectedException extends RuntimeException {
  public RowRejectedException(String message) {
    super(message);
  }

  public RowRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
