package io.github.themoah.logspike.normalize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds templates that probably describe the same message but were normalized apart.
 *
 * <p>Each template is reduced to a base shape where every placeholder and every leftover
 * number becomes {@code <VAR>}. Shapes shared by several distinct templates point at a
 * variable part the rule table does not cover yet.
 */
public final class FragmentationAnalyzer {

  public static final int MIN_FRAGMENTS = 2;

  private static final String VAR = "<VAR>";
  private static final Pattern PLACEHOLDER = Pattern.compile("<[^>]+>");
  private static final Pattern DURATION = Pattern.compile("\\b\\d+(?:ms|s|us|ns)\\b");
  private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");

  private FragmentationAnalyzer() {
  }

  /**
   * A base shape with the distinct templates that collapse into it.
   */
  public record FragmentGroup(String shape, List<String> templates) {

    public FragmentGroup {
      templates = List.copyOf(templates);
    }
  }

  public static String baseShape(String template) {
    String shape = PLACEHOLDER.matcher(template).replaceAll(VAR);
    shape = DURATION.matcher(shape).replaceAll(VAR);
    return NUMBER.matcher(shape).replaceAll(VAR);
  }

  /**
   * Groups templates by base shape.
   *
   * @param templates templates in any order; duplicates count once
   * @return groups with at least {@link #MIN_FRAGMENTS} templates, largest first,
   *     ties in first-seen order
   */
  public static List<FragmentGroup> analyze(Collection<String> templates) {
    Map<String, Set<String>> byShape = new LinkedHashMap<>();
    for (String template : templates) {
      byShape.computeIfAbsent(baseShape(template), s -> new LinkedHashSet<>()).add(template);
    }

    List<FragmentGroup> groups = new ArrayList<>();
    for (Map.Entry<String, Set<String>> entry : byShape.entrySet()) {
      if (entry.getValue().size() >= MIN_FRAGMENTS) {
        groups.add(new FragmentGroup(entry.getKey(), new ArrayList<>(entry.getValue())));
      }
    }
    groups.sort((a, b) -> Integer.compare(b.templates().size(), a.templates().size()));
    return groups;
  }
}
