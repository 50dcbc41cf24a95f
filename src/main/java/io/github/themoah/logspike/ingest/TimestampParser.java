package io.github.themoah.logspike.ingest;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses the timestamp representations found in log lines into UTC instants.
 *
 * <p>Accepted forms:
 * <ul>
 *   <li>ISO-8601 date-time with {@code Z} or an offset ({@code +02:00} or {@code +0200})</li>
 *   <li>ISO-8601 local date-time without a zone, taken as UTC</li>
 *   <li>either of the above with a space instead of {@code T}</li>
 *   <li>epoch seconds, or epoch milliseconds when larger than 10^11</li>
 * </ul>
 */
public final class TimestampParser {

  private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;
  private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d");
  private static final Pattern EPOCH = Pattern.compile("^\\d{1,15}(?:\\.\\d+)?$");

  private static final DateTimeFormatter ISO_OPTIONAL_OFFSET = new DateTimeFormatterBuilder()
    .parseCaseInsensitive()
    .append(DateTimeFormatter.ISO_LOCAL_DATE_TIME)
    .optionalStart().appendOffset("+HH:MM", "Z").optionalEnd()
    .optionalStart().appendOffset("+HHMM", "Z").optionalEnd()
    .toFormatter();

  private TimestampParser() {}

  /**
   * Parses a timestamp value taken from a structured field.
   *
   * @param value a string or number, may be null
   * @return the instant, or empty if the value is not a recognizable timestamp
   */
  public static Optional<Instant> parse(Object value) {
    if (value instanceof Number number) {
      return fromEpoch(number.doubleValue());
    }
    if (value instanceof String text) {
      return parse(text);
    }
    return Optional.empty();
  }

  /**
   * Parses a textual timestamp.
   *
   * @param text the timestamp text, may be null
   * @return the instant, or empty if the text is not a recognizable timestamp
   */
  public static Optional<Instant> parse(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String s = text.strip();

    if (EPOCH.matcher(s).matches()) {
      return fromEpoch(Double.parseDouble(s));
    }

    if (SPACE_SEPARATED.matcher(s).lookingAt()) {
      s = s.substring(0, 10) + 'T' + s.substring(11);
    }

    try {
      TemporalAccessor parsed = ISO_OPTIONAL_OFFSET.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offsetDateTime) {
        return Optional.of(offsetDateTime.toInstant());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Optional<Instant> fromEpoch(double epoch) {
    if (Double.isNaN(epoch) || Double.isInfinite(epoch) || epoch < 0) {
      return Optional.empty();
    }
    long millis = epoch >= EPOCH_MILLIS_THRESHOLD
      ? Math.round(epoch)
      : Math.round(epoch * 1000.0);
    return Optional.of(Instant.ofEpochMilli(millis));
  }
}
