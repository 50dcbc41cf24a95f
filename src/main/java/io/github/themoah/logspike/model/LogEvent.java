package io.github.themoah.logspike.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical log event consumed by the pattern store.
 *
 * @param timestamp event time in UTC
 * @param service emitting service
 * @param level upper-cased level label
 * @param template normalized message with variable values replaced by placeholders
 * @param raw the original line
 * @param requestId request id supplied by the source, or null
 */
public record LogEvent(
  Instant timestamp,
  String service,
  String level,
  String template,
  String raw,
  String requestId
) {

  public LogEvent {
    Objects.requireNonNull(timestamp, "timestamp cannot be null");
    Objects.requireNonNull(service, "service cannot be null");
    Objects.requireNonNull(level, "level cannot be null");
    Objects.requireNonNull(template, "template cannot be null");
  }

  /**
   * Creates an event without a request id.
   */
  public static LogEvent of(Instant timestamp, String service, String level, String template, String raw) {
    return new LogEvent(timestamp, service, level, template, raw, null);
  }

  /**
   * Returns the aggregation identity of this event.
   */
  public PatternKey key() {
    return new PatternKey(service, level, template);
  }
}
