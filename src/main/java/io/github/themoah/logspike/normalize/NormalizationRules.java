package io.github.themoah.logspike.normalize;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The default normalization table and loaders for additional rules.
 *
 * <p>Rules run top to bottom and each sees the output of the previous ones, so the
 * order below is significant: structured tokens (UUIDs, addresses, versions, ids embedded
 * in paths or key/value pairs) are replaced before the generic float and integer rules
 * would consume their digits. No replacement contains a digit or text that any rule
 * matches, which keeps normalization idempotent.
 *
 * <p>Placeholders end in {@code >}, which is a word boundary for whatever follows. Every
 * rule whose match ends in a word character therefore ends with {@code \b}, and the
 * exception rule refuses to start right after a placeholder, so a second pass finds
 * nothing the first pass left behind.
 */
public final class NormalizationRules {

  private static final Logger log = LoggerFactory.getLogger(NormalizationRules.class);

  private NormalizationRules() {}

  private static final List<NormalizationRule> DEFAULTS = List.of(
    NormalizationRule.of("uuid",
      "\\b[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b",
      Pattern.CASE_INSENSITIVE, "<UUID>"),
    NormalizationRule.of("exception",
      "(?<![>\\w])\\b((?:[a-z][a-z0-9_]*\\.)+)[A-Z][A-Za-z0-9_]*(?:Exception|Error)\\b", "$1<EXCEPTION>"),
    NormalizationRule.of("python_traceback",
      "\\bTraceback \\(most recent call last\\):", "<PYTHON_TRACEBACK>"),
    NormalizationRule.of("pod_id",
      "\\bpod-[a-z0-9][a-z0-9-]*\\b", "pod-<POD_ID>"),
    NormalizationRule.of("ipv4",
      "\\b\\d{1,3}(?:\\.\\d{1,3}){3}\\b", "<IP>"),
    NormalizationRule.of("version",
      "\\bv?\\d+\\.\\d+\\.\\d+(?:-[0-9A-Za-z.]+)?\\b", "<VERSION>"),
    NormalizationRule.of("user_id",
      "\\buser_id=\\d+\\b", Pattern.CASE_INSENSITIVE, "user_id=<USER_ID>"),
    NormalizationRule.of("auth_error",
      "\\b(?:invalid|expired) token\\b", Pattern.CASE_INSENSITIVE, "<AUTH_ERROR>"),
    NormalizationRule.of("queue_offset",
      "\\b(offset[= ])\\d+\\b", Pattern.CASE_INSENSITIVE, "$1<OFFSET>"),
    NormalizationRule.of("queue_partition",
      "\\b(partition[= ])\\d+\\b", Pattern.CASE_INSENSITIVE, "$1<PARTITION>"),
    NormalizationRule.of("sql_error_code",
      "\\bSQL error code \\d+\\b", Pattern.CASE_INSENSITIVE, "SQL error code <SQL_CODE>"),
    NormalizationRule.of("sql_constraint",
      "violates constraint \"[^\"]+\"", Pattern.CASE_INSENSITIVE, "violates constraint \"<CONSTRAINT>\""),
    NormalizationRule.of("rest_path_id",
      "(/[A-Za-z][A-Za-z_-]*)/\\d+\\b", "$1/<ID>"),
    NormalizationRule.of("http_method",
      "\\b(?:GET|POST|PUT|DELETE|PATCH|HEAD|OPTIONS)\\b", "<HTTP_METHOD>"),
    NormalizationRule.of("http_status_keyed",
      "\\b((?:status|status_code|http_status)[=:] ?|status |HTTP/\\d(?:\\.\\d)? )[1-5]\\d{2}\\b",
      Pattern.CASE_INSENSITIVE, "$1<HTTP_STATUS>"),
    NormalizationRule.of("http_status_request_line",
      "(<HTTP_METHOD> \\S+ )[1-5]\\d{2}\\b", "$1<HTTP_STATUS>"),
    NormalizationRule.of("duration",
      "\\b\\d+(?:\\.\\d+)?(ms|us|ns|s)\\b", "<DURATION>$1"),
    NormalizationRule.of("hex",
      "\\b0x[0-9a-fA-F]+\\b", "<HEX>"),
    NormalizationRule.of("float",
      "\\b\\d+\\.\\d+\\b", "<FLOAT>"),
    NormalizationRule.of("integer",
      "\\b\\d+\\b", "<NUM>")
  );

  /**
   * Returns the built-in rule table in evaluation order.
   */
  public static List<NormalizationRule> defaults() {
    return DEFAULTS;
  }

  /**
   * Builds rules from a JSON array of {@code {"name", "pattern", "replacement"}} objects.
   *
   * @param rules the rule definitions
   * @return rules in array order
   * @throws IllegalArgumentException if an entry is incomplete or its pattern does not compile
   */
  public static List<NormalizationRule> fromJson(JsonArray rules) {
    List<NormalizationRule> result = new ArrayList<>(rules.size());
    for (int i = 0; i < rules.size(); i++) {
      JsonObject rule;
      try {
        rule = rules.getJsonObject(i);
      } catch (ClassCastException e) {
        throw new IllegalArgumentException("Rule at index " + i + " is not a JSON object", e);
      }
      if (rule == null) {
        throw new IllegalArgumentException("Rule at index " + i + " is null");
      }
      String name = rule.getString("name", "custom_" + i);
      String pattern = rule.getString("pattern");
      String replacement = rule.getString("replacement");
      if (pattern == null || replacement == null) {
        throw new IllegalArgumentException("Rule " + name + " needs both pattern and replacement");
      }
      try {
        result.add(NormalizationRule.of(name, pattern, replacement));
      } catch (PatternSyntaxException e) {
        throw new IllegalArgumentException("Rule " + name + " has an invalid pattern: " + e.getDescription(), e);
      }
    }
    return result;
  }

  /**
   * Loads additional rules from a JSON file.
   *
   * @param path the file holding a JSON array of rule definitions
   * @return the parsed rules
   * @throws IOException if the file cannot be read
   * @throws IllegalArgumentException if the content is not a valid rule array
   */
  public static List<NormalizationRule> fromFile(Path path) throws IOException {
    log.info("Loading normalization rules from file: {}", path);
    String content = Files.readString(path, StandardCharsets.UTF_8);
    try {
      return fromJson(new JsonArray(content));
    } catch (DecodeException e) {
      throw new IllegalArgumentException("Rules file is not a JSON array: " + path, e);
    }
  }
}
