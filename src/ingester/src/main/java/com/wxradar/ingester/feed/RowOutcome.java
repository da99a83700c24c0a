package com.wxradar.ingester.feed;

enum RowOutcome {
  STORED,
  UNCHANGED,
  SKIPPED
}
