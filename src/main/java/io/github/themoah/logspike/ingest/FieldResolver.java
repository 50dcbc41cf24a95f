package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.ParsedLog;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the canonical fields of a structured record through their accepted aliases.
 * Shared by the JSON and key=value parsers so both accept the same field names.
 */
final class FieldResolver {

  static final List<String> TIMESTAMP_FIELDS = List.of("timestamp", "time", "ts");
  static final List<String> SERVICE_FIELDS = List.of("service", "svc", "app");
  static final List<String> LEVEL_FIELDS = List.of("level", "severity");
  static final List<String> MESSAGE_FIELDS = List.of("msg", "message");
  static final List<String> REQUEST_ID_FIELDS = List.of("request_id", "requestId", "req_id", "trace_id");

  static final String DEFAULT_SERVICE = "unknown";
  static final String DEFAULT_LEVEL = "UNKNOWN";

  private FieldResolver() {}

  /**
   * Builds a parsed record from structured fields.
   *
   * @param fields field name to value (strings, numbers or nested values)
   * @return the record, or empty if no timestamp alias holds a parseable timestamp
   */
  static Optional<ParsedLog> resolve(Map<String, ?> fields) {
    Object rawTimestamp = first(fields, TIMESTAMP_FIELDS);
    if (rawTimestamp == null) {
      return Optional.empty();
    }
    Optional<Instant> timestamp = TimestampParser.parse(rawTimestamp);
    if (timestamp.isEmpty()) {
      return Optional.empty();
    }

    String service = text(first(fields, SERVICE_FIELDS), DEFAULT_SERVICE);
    String level = text(first(fields, LEVEL_FIELDS), DEFAULT_LEVEL).toUpperCase(Locale.ROOT);
    String message = text(first(fields, MESSAGE_FIELDS), "");
    String requestId = text(first(fields, REQUEST_ID_FIELDS), null);

    return Optional.of(new ParsedLog(timestamp.get(), service, level, message, requestId));
  }

  /**
   * Returns the value of the first alias that is present and not blank.
   */
  private static Object first(Map<String, ?> fields, List<String> aliases) {
    for (String alias : aliases) {
      Object value = fields.get(alias);
      if (value == null) {
        continue;
      }
      if (value instanceof String s && s.isBlank()) {
        continue;
      }
      return value;
    }
    return null;
  }

  private static String text(Object value, String defaultValue) {
    return value == null ? defaultValue : value.toString();
  }
}
