package io.github.themoah.logspike.explain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.logspike.model.Anomaly;
import io.github.themoah.logspike.model.Anomaly.Reason;
import io.github.themoah.logspike.model.AnomalyContext;
import io.github.themoah.logspike.model.DeployEvent;
import io.github.themoah.logspike.model.PatternKey;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AnomalyExplainer.
 */
public class AnomalyExplainerTest {

  private static final String WELL_FORMED = String.join("\n",
    "SUMMARY:",
    "Timeouts in user-service rose sharply.",
    "They started after the latest deploy.",
    "",
    "WHY IT MATTERS:",
    "Users cannot log in.",
    "",
    "WHERE TO LOOK:",
    "- database connection pool",
    "- upstream auth provider",
    "",
    "CONFIDENCE:",
    "0.8");

  private static final PatternKey KEY = new PatternKey("user-service", "ERROR", "timeout after <DURATION>ms");
  private static final Instant LAST_SEEN = Instant.parse("2026-01-03T14:05:24Z");

  private static AnomalyContext context() {
    Anomaly anomaly = new Anomaly(KEY, Reason.SPIKE, 125.0, 125.0, 1.0,
      Instant.parse("2026-01-03T14:00:30Z"), LAST_SEEN);
    return new AnomalyContext(
      anomaly,
      LAST_SEEN.minusSeconds(300),
      LAST_SEEN,
      Map.of(new PatternKey("user-service", "WARN", "retrying request"), 4L),
      Map.of("ERROR", 30L),
      new DeployEvent("user-service", "1.5.0", Instant.parse("2026-01-03T14:03:00Z")),
      List.of());
  }

  /**
   * Records prompts and answers with a fixed completion.
   */
  private static class FakeClient implements TextCompletionClient {
    private final String answer;
    private final List<String> prompts = new ArrayList<>();

    FakeClient(String answer) {
      this.answer = answer;
    }

    @Override
    public Future<String> complete(String prompt) {
      prompts.add(prompt);
      return Future.succeededFuture(answer);
    }
  }

  @Test
  void parse_wellFormed() {
    Explanation explanation = AnomalyExplainer.parse(WELL_FORMED);

    assertEquals("Timeouts in user-service rose sharply. They started after the latest deploy.",
      explanation.summary());
    assertEquals("Users cannot log in.", explanation.whyItMatters());
    assertEquals("- database connection pool\n- upstream auth provider", explanation.whereToLook());
    assertEquals(0.8, explanation.confidence());
  }

  @Test
  void parse_ignoresPreamble() {
    Explanation explanation = AnomalyExplainer.parse("Here you go.\n\n" + WELL_FORMED);

    assertEquals("Users cannot log in.", explanation.whyItMatters());
  }

  @Test
  void parse_missingSection() {
    String text = WELL_FORMED.replace("WHY IT MATTERS:", "WHY:");

    MalformedExplanationException e = assertThrows(MalformedExplanationException.class,
      () -> AnomalyExplainer.parse(text));
    assertEquals(text, e.response());
  }

  @Test
  void parse_badConfidence() {
    assertThrows(MalformedExplanationException.class,
      () -> AnomalyExplainer.parse(WELL_FORMED.replace("0.8", "fairly sure")));
    assertThrows(MalformedExplanationException.class,
      () -> AnomalyExplainer.parse(WELL_FORMED.replace("0.8", "")));
  }

  @Test
  void parse_null() {
    assertThrows(MalformedExplanationException.class, () -> AnomalyExplainer.parse(null));
  }

  @Test
  void explain_sendsFactsAndParsesAnswer() {
    FakeClient client = new FakeClient(WELL_FORMED);
    AnomalyExplainer explainer = new AnomalyExplainer(client);

    Future<Explanation> result = explainer.explain(context());

    assertTrue(result.succeeded());
    assertEquals(0.8, result.result().confidence());
    assertEquals(1, client.prompts.size());
    String prompt = client.prompts.get(0);
    assertTrue(prompt.contains("- Service: user-service"));
    assertTrue(prompt.contains("- Log pattern: \"timeout after <DURATION>ms\""));
    assertTrue(prompt.contains("- Severity score: 125.00"));
    assertTrue(prompt.contains("- [WARN] retrying request: 4"));
    assertTrue(prompt.contains("version 1.5.0"));
    assertTrue(prompt.contains("CONFIDENCE:"));
  }

  @Test
  void explain_failsOnMalformedAnswer() {
    AnomalyExplainer explainer = new AnomalyExplainer(new FakeClient("I am not sure."));

    Future<Explanation> result = explainer.explain(context());

    assertFalse(result.succeeded());
    assertTrue(result.cause() instanceof MalformedExplanationException);
  }
}
