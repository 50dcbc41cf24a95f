package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.LogEvent;

/**
 * Outcome of ingesting one line: exactly one of {@code event} and {@code failure} is set.
 *
 * @param event the produced event, or null on failure
 * @param failure the failure reason, or null on success
 */
public record IngestResult(LogEvent event, FailureReason failure) {

  public static IngestResult success(LogEvent event) {
    return new IngestResult(event, null);
  }

  public static IngestResult failure(FailureReason reason) {
    return new IngestResult(null, reason);
  }

  public boolean isSuccess() {
    return event != null;
  }
}
