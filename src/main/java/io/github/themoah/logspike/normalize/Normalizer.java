package io.github.themoah.logspike.normalize;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a log message to a stable template by applying an ordered rule table.
 *
 * <p>Normalization is total: any string, including the empty one, produces a template.
 */
public class Normalizer {

  private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

  private static final String ENV_RULES_FILE = "NORMALIZER_RULES_FILE";

  private final List<NormalizationRule> rules;

  public Normalizer() {
    this(NormalizationRules.defaults());
  }

  public Normalizer(List<NormalizationRule> rules) {
    this.rules = List.copyOf(rules);
  }

  /**
   * Creates a normalizer whose extra rules run ahead of the default table.
   *
   * @param extraRules rules that take precedence over the defaults
   */
  public static Normalizer withExtraRules(List<NormalizationRule> extraRules) {
    List<NormalizationRule> combined = new ArrayList<>(extraRules.size() + NormalizationRules.defaults().size());
    combined.addAll(extraRules);
    combined.addAll(NormalizationRules.defaults());
    return new Normalizer(combined);
  }

  /**
   * Creates a normalizer from the default table plus the rules named by
   * NORMALIZER_RULES_FILE, if set. An unreadable or invalid file is logged and ignored.
   */
  public static Normalizer fromEnvironment() {
    String file = System.getenv(ENV_RULES_FILE);
    if (file == null || file.isBlank()) {
      log.info("Normalizer using {} default rules", NormalizationRules.defaults().size());
      return new Normalizer();
    }
    try {
      List<NormalizationRule> extra = NormalizationRules.fromFile(Path.of(file));
      log.info("Normalizer using {} custom rules ahead of {} default rules",
        extra.size(), NormalizationRules.defaults().size());
      return withExtraRules(extra);
    } catch (IOException | IllegalArgumentException e) {
      log.warn("Could not load {}={}: {}, using default rules", ENV_RULES_FILE, file, e.getMessage());
      return new Normalizer();
    }
  }

  /**
   * Normalizes a message into its template.
   *
   * @param message the raw message, may be null
   * @return the template, empty for a null or empty message
   */
  public String normalize(String message) {
    if (message == null || message.isEmpty()) {
      return "";
    }
    String template = message;
    for (NormalizationRule rule : rules) {
      template = rule.apply(template);
    }
    return template;
  }

  public List<NormalizationRule> rules() {
    return rules;
  }
}
