package io.github.themoah.logspike.model;

import java.time.Instant;

/**
 * Intermediate record produced by a line parser, before message normalization.
 *
 * @param timestamp event time in UTC
 * @param service emitting service, "unknown" when the source did not say
 * @param level upper-cased level label, "UNKNOWN" when absent
 * @param message raw message text, empty when absent
 * @param requestId request id supplied by the source, or null
 */
public record ParsedLog(
  Instant timestamp,
  String service,
  String level,
  String message,
  String requestId
) {}
