package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.ParsedLog;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses logfmt-style lines such as
 * {@code ts=2026-01-03T14:00:01Z level=ERROR service=user-service msg="timeout after 5000ms"}.
 *
 * <p>Values are bare tokens or double-quoted strings; inside quotes {@code \"} and
 * {@code \\} are unescaped. When a key repeats, the last value wins.
 */
public class KeyValueParser implements LineParser {

  private static final Pattern PAIR = Pattern.compile("(\\w+)=(?:\"((?:[^\"\\\\]|\\\\.)*)\"|(\\S+))");

  @Override
  public Optional<ParsedLog> parse(String line) {
    Map<String, String> fields = extractPairs(line);
    if (fields.isEmpty()) {
      return Optional.empty();
    }
    return FieldResolver.resolve(fields);
  }

  static Map<String, String> extractPairs(String line) {
    Map<String, String> fields = new HashMap<>();
    Matcher m = PAIR.matcher(line);
    while (m.find()) {
      String value = m.group(2) != null ? unescape(m.group(2)) : m.group(3);
      fields.put(m.group(1), value);
    }
    return fields;
  }

  private static String unescape(String quoted) {
    if (quoted.indexOf('\\') < 0) {
      return quoted;
    }
    StringBuilder sb = new StringBuilder(quoted.length());
    for (int i = 0; i < quoted.length(); i++) {
      char c = quoted.charAt(i);
      if (c == '\\' && i + 1 < quoted.length()) {
        sb.append(quoted.charAt(++i));
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
