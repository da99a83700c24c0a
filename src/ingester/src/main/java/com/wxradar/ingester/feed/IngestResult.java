package com.wxradar.ingester.feed;

/**
 * Summary of one ingestion cycle.
 *
 * @param outcome how the cycle ended
 * @param stored rows written to the store
 * @param unchanged rows whose key already existed and was left untouched
 * @param skipped rows rejected or filtered out
 */
public record IngestResult(Outcome outcome, int stored, int unchanged, int skipped) {
  public enum Outcome {
    UPDATED,
    NOT_MODIFIED,
    FAILED
  }

  public static IngestResult notModified() {
    return new IngestResult(Outcome.NOT_MODIFIED, 0, 0, 0);
  }

  public static IngestResult failed() {
    return new IngestResult(Outcome.FAILED, 0, 0, 0);
  }
}
