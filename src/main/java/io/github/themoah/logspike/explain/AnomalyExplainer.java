package io.github.themoah.logspike.explain;

import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.AnomalyContext;
import io.vertx.core.Future;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns an anomaly context into a narrative explanation using a completion service.
 *
 * <p>The response must contain the sections {@code SUMMARY:}, {@code WHY IT MATTERS:},
 * {@code WHERE TO LOOK:} and {@code CONFIDENCE:}. Anything else fails with
 * {@link MalformedExplanationException}.
 */
public class AnomalyExplainer {

  private static final Logger log = LoggerFactory.getLogger(AnomalyExplainer.class);

  static final String SUMMARY = "SUMMARY";
  static final String WHY_IT_MATTERS = "WHY IT MATTERS";
  static final String WHERE_TO_LOOK = "WHERE TO LOOK";
  static final String CONFIDENCE = "CONFIDENCE";

  private final TextCompletionClient client;

  public AnomalyExplainer(TextCompletionClient client) {
    this.client = client;
  }

  public Future<Explanation> explain(AnomalyContext context) {
    String prompt = buildPrompt(context);
    return client.complete(prompt)
      .compose(text -> {
        try {
          return Future.succeededFuture(parse(text));
        } catch (MalformedExplanationException e) {
          log.warn("Discarding malformed explanation for {}", context.anomaly().key());
          return Future.failedFuture(e);
        }
      });
  }

  String buildPrompt(AnomalyContext ctx) {
    Anomaly a = ctx.anomaly();
    StringBuilder sb = new StringBuilder();
    sb.append("You are a senior production engineer assisting during an incident.\n\n");
    sb.append("Facts:\n");
    sb.append("- Service: ").append(a.key().service()).append('\n');
    sb.append("- Log level: ").append(a.key().level()).append('\n');
    sb.append("- Log pattern: \"").append(a.key().template()).append("\"\n");
    sb.append("- Reason flagged: ").append(a.reason().getValue()).append('\n');
    sb.append("- Severity score: ").append(format(a.severity())).append('\n');
    sb.append("- First seen: ").append(a.firstSeen()).append('\n');
    sb.append("- Last seen: ").append(a.lastSeen()).append('\n');
    sb.append("- Recent weighted count: ").append(format(a.recentWeighted())).append('\n');
    sb.append("- Baseline avg count: ").append(format(a.baselineWeighted())).append("\n\n");

    sb.append("Context window: ").append(ctx.windowStart()).append(" to ").append(ctx.windowEnd()).append("\n\n");
    sb.append("Log level distribution in window:\n").append(ctx.levelBreakdown()).append("\n\n");
    sb.append("Related patterns in same service:\n");
    if (ctx.relatedPatterns().isEmpty()) {
      sb.append("(none)\n");
    } else {
      ctx.relatedPatterns().forEach((key, count) ->
        sb.append("- [").append(key.level()).append("] ").append(key.template())
          .append(": ").append(count).append('\n'));
    }
    if (ctx.deployEvent() != null) {
      sb.append("\nDeployment in window: version ").append(ctx.deployEvent().version())
        .append(" at ").append(ctx.deployEvent().timestamp()).append('\n');
    }

    sb.append("\nInstructions:\n");
    sb.append("- Do NOT propose fixes\n");
    sb.append("- Do NOT speculate beyond the facts\n");
    sb.append("- Explain why this anomaly matters\n");
    sb.append("- Suggest which area of the system to investigate\n");
    sb.append("- Be concise and precise\n\n");
    sb.append("Return the response in this exact format:\n\n");
    sb.append(SUMMARY).append(":\n<one paragraph>\n\n");
    sb.append(WHY_IT_MATTERS).append(":\n<one paragraph>\n\n");
    sb.append(WHERE_TO_LOOK).append(":\n<bullet points>\n\n");
    sb.append(CONFIDENCE).append(":\n<number between 0 and 1>\n");
    return sb.toString();
  }

  /**
   * Parses a completion into an explanation.
   *
   * <p>A non-blank line ending with ':' opens a section; following non-blank lines belong
   * to it. Lines before the first section are ignored.
   *
   * @throws MalformedExplanationException if a section is missing or the confidence is not a number
   */
  static Explanation parse(String text) {
    if (text == null) {
      throw new MalformedExplanationException("Completion response is empty", null);
    }
    Map<String, List<String>> sections = new HashMap<>();
    List<String> current = null;
    for (String rawLine : text.split("\\R")) {
      String line = rawLine.strip();
      if (line.isEmpty()) {
        continue;
      }
      if (line.endsWith(":")) {
        current = new ArrayList<>();
        sections.put(line.substring(0, line.length() - 1), current);
      } else if (current != null) {
        current.add(line);
      }
    }

    List<String> confidence = require(sections, CONFIDENCE, text);
    if (confidence.isEmpty()) {
      throw new MalformedExplanationException("Section " + CONFIDENCE + " is empty", text);
    }
    double value;
    try {
      value = Double.parseDouble(confidence.get(0));
    } catch (NumberFormatException e) {
      throw new MalformedExplanationException(
        "Confidence is not a number: '" + confidence.get(0) + "'", text, e);
    }

    return new Explanation(
      String.join(" ", require(sections, SUMMARY, text)),
      String.join(" ", require(sections, WHY_IT_MATTERS, text)),
      String.join("\n", require(sections, WHERE_TO_LOOK, text)),
      value
    );
  }

  private static List<String> require(Map<String, List<String>> sections, String name, String text) {
    List<String> lines = sections.get(name);
    if (lines == null) {
      throw new MalformedExplanationException("Missing section " + name, text);
    }
    return lines;
  }

  private static String format(double value) {
    return String.format(Locale.ROOT, "%.2f", value);
  }
}
