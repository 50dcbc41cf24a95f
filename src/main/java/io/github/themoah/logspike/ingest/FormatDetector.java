package io.github.themoah.logspike.ingest;

import java.util.regex.Pattern;

/**
 * Cheap structural classification of raw lines.
 *
 * <p>This is a heuristic, not a validator: a parser may still reject a line after a
 * positive detection. Detection never fails and checks shapes in a fixed order, so a
 * line that looks like both JSON and key=value is always JSON.
 */
public final class FormatDetector {

  private static final Pattern ISO_TIMESTAMP_PREFIX = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");

  private FormatDetector() {}

  /**
   * Detects the structural format of a line.
   *
   * @param line the raw line, may be null
   * @return the detected format, UNKNOWN when nothing matches
   */
  public static LogFormat detect(String line) {
    if (line == null) {
      return LogFormat.UNKNOWN;
    }
    String s = line.strip();
    if (s.isEmpty()) {
      return LogFormat.UNKNOWN;
    }
    if (s.startsWith("{") && s.endsWith("}")) {
      return LogFormat.JSON;
    }
    if (ISO_TIMESTAMP_PREFIX.matcher(s).lookingAt()) {
      return LogFormat.TIMESTAMP_TEXT;
    }
    if (s.indexOf('=') >= 0 && s.indexOf(' ') >= 0) {
      return LogFormat.KEY_VALUE;
    }
    return LogFormat.UNKNOWN;
  }
}
