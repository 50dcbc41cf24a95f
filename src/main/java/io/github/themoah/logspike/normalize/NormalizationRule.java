package io.github.themoah.logspike.normalize;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A single substitution in the normalization table.
 *
 * @param name short identifier used in logs and diagnostics
 * @param pattern what to match
 * @param replacement {@link java.util.regex.Matcher#replaceAll(String)} replacement, may use group references
 */
public record NormalizationRule(
  String name,
  Pattern pattern,
  String replacement
) {

  public NormalizationRule {
    Objects.requireNonNull(name, "name cannot be null");
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Objects.requireNonNull(replacement, "replacement cannot be null");
  }

  public static NormalizationRule of(String name, String regex, String replacement) {
    return new NormalizationRule(name, Pattern.compile(regex), replacement);
  }

  public static NormalizationRule of(String name, String regex, int flags, String replacement) {
    return new NormalizationRule(name, Pattern.compile(regex, flags), replacement);
  }

  /**
   * Applies this rule to every match in the input.
   */
  public String apply(String input) {
    return pattern.matcher(input).replaceAll(replacement);
  }
}
