package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.ParsedLog;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses lines of the form {@code 2026-01-03T14:00:01 ERROR user-service timeout after 5000ms}.
 */
public class TimestampTextParser implements LineParser {

  private static final Pattern LINE = Pattern.compile(
    "^(\\d{4}-\\d{2}-\\d{2}T\\S+)\\s+([A-Z]+)\\s+([A-Za-z0-9_-]+)\\s+(.+)$");

  @Override
  public Optional<ParsedLog> parse(String line) {
    Matcher m = LINE.matcher(line.strip());
    if (!m.matches()) {
      return Optional.empty();
    }
    Optional<Instant> timestamp = TimestampParser.parse(m.group(1));
    if (timestamp.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new ParsedLog(timestamp.get(), m.group(3), m.group(2), m.group(4), null));
  }
}
