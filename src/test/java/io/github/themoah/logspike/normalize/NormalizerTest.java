package io.github.themoah.logspike.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Normalizer and the default rule table.
 */
public class NormalizerTest {

  private static final List<String> CORPUS = List.of(
    "Connection from 10.0.0.12 failed",
    "user_id=4821 login failed: invalid token",
    "request 550e8400-e29b-41d4-a716-446655440000 done",
    "deployed v1.2.3 to pod-api-7f9c",
    "GET /api/users/123 200 in 35ms",
    "consumer lag at offset=99812 partition=3",
    "java.net.SocketTimeoutException: Read timed out after 30s",
    "retry 3 of 5, backoff 0.25",
    "pointer 0x7ffee4b2",
    "ERROR: duplicate key value violates constraint \"users_email_key\"",
    "status=503 from upstream",
    "SQL error code 1062 on insert",
    "Traceback (most recent call last):",
    "HTTP/1.1 404 for /orders/77",
    ""
  );

  // Fragments that sit next to placeholders once glued together without separators.
  private static final List<String> FRAGMENTS = List.of(
    "partition=", "offset ", "user_id=", "123", "7", "1.5", "ms", "s", "invalid token",
    "pod-", "abc", "0x1f", "FooError", "java.io.", ".", "=", " ", "-", "_", "X",
    "/orders/", "GET ", "status ", "HTTP/1.1 ", "10.0.0.1", "v1.2.3");

  private final Normalizer normalizer = new Normalizer();

  @Test
  void normalize_ipAddress() {
    assertEquals("Connection from <IP> failed", normalizer.normalize("Connection from 10.0.0.12 failed"));
  }

  @Test
  void normalize_userIdAndAuthError() {
    assertEquals("user_id=<USER_ID> login failed: <AUTH_ERROR>",
      normalizer.normalize("user_id=4821 login failed: invalid token"));
  }

  @Test
  void normalize_uuid() {
    assertEquals("request <UUID> done",
      normalizer.normalize("request 550E8400-E29B-41D4-A716-446655440000 done"));
  }

  @Test
  void normalize_versionAndPod() {
    assertEquals("deployed <VERSION> to pod-<POD_ID>", normalizer.normalize("deployed v1.2.3 to pod-api-7f9c"));
  }

  @Test
  void normalize_requestLine() {
    assertEquals("<HTTP_METHOD> /api/users/<ID> <HTTP_STATUS> in <DURATION>ms",
      normalizer.normalize("GET /api/users/123 200 in 35ms"));
  }

  @Test
  void normalize_queueCoordinates() {
    assertEquals("consumer lag at offset=<OFFSET> partition=<PARTITION>",
      normalizer.normalize("consumer lag at offset=99812 partition=3"));
  }

  @Test
  void normalize_exceptionKeepsPackage() {
    assertEquals("java.net.<EXCEPTION>: Read timed out after <DURATION>s",
      normalizer.normalize("java.net.SocketTimeoutException: Read timed out after 30s"));
  }

  @Test
  void normalize_numbers() {
    assertEquals("retry <NUM> of <NUM>, backoff <FLOAT>", normalizer.normalize("retry 3 of 5, backoff 0.25"));
    assertEquals("pointer <HEX>", normalizer.normalize("pointer 0x7ffee4b2"));
  }

  @Test
  void normalize_sqlErrors() {
    assertEquals("ERROR: duplicate key value violates constraint \"<CONSTRAINT>\"",
      normalizer.normalize("ERROR: duplicate key value violates constraint \"users_email_key\""));
    assertEquals("SQL error code <SQL_CODE> on insert", normalizer.normalize("SQL error code 1062 on insert"));
  }

  @Test
  void normalize_statusCodes() {
    assertEquals("status=<HTTP_STATUS> from upstream", normalizer.normalize("status=503 from upstream"));
    assertEquals("status <HTTP_STATUS> for /orders/<ID>", normalizer.normalize("status 404 for /orders/77"));
  }

  @Test
  void normalize_emptyAndNull() {
    assertEquals("", normalizer.normalize(""));
    assertEquals("", normalizer.normalize(null));
  }

  @Test
  void normalize_isIdempotent() {
    for (String message : CORPUS) {
      String once = normalizer.normalize(message);
      assertEquals(once, normalizer.normalize(once), "not idempotent for: " + message);
    }
  }

  @Test
  void normalize_isIdempotentForGluedFragments() {
    Random random = new Random(20260103L);
    List<String> failures = new ArrayList<>();
    for (int i = 0; i < 100_000 && failures.size() < 10; i++) {
      StringBuilder message = new StringBuilder();
      int parts = 1 + random.nextInt(6);
      for (int j = 0; j < parts; j++) {
        message.append(FRAGMENTS.get(random.nextInt(FRAGMENTS.size())));
      }
      String once = normalizer.normalize(message.toString());
      String twice = normalizer.normalize(once);
      if (!once.equals(twice)) {
        failures.add("[" + message + "] -> [" + once + "] -> [" + twice + "]");
      }
    }
    assertEquals(List.of(), failures);
  }

  @Test
  void normalize_prefixRulesNeedWholeNumbers() {
    assertEquals("partition=1invalid token", normalizer.normalize("partition=1invalid token"));
    assertEquals("user_id=200pod-abc", normalizer.normalize("user_id=200pod-abc"));
    assertEquals("offset <OFFSET> <AUTH_ERROR>", normalizer.normalize("offset 12 invalid token"));
  }

  @Test
  void normalize_exceptionNotTakenFromDurationUnit() {
    assertEquals("=.<DURATION>ms.FooError", normalizer.normalize("=.1ms.FooError"));
    assertEquals("<DURATION>s.java.io.<EXCEPTION>", normalizer.normalize("1.5s.java.io.FooError"));
  }

  @Test
  void withExtraRules_runBeforeDefaults() throws Exception {
    List<NormalizationRule> extra = NormalizationRules.fromFile(resource("normalizer-rules.json"));
    Normalizer custom = Normalizer.withExtraRules(extra);

    assertEquals("order-<ORDER_ID> shipped", custom.normalize("order-ab12cd shipped"));
    assertEquals("order-ab12cd shipped", normalizer.normalize("order-ab12cd shipped"));
    assertEquals(NormalizationRules.defaults().size() + 1, custom.rules().size());
    assertEquals("order_id", custom.rules().get(0).name());
  }

  @Test
  void fromJson_rejectsIncompleteRule() {
    JsonArray rules = new JsonArray().add(new JsonObject().put("name", "broken").put("pattern", "x"));

    assertThrows(IllegalArgumentException.class, () -> NormalizationRules.fromJson(rules));
  }

  @Test
  void fromJson_rejectsInvalidPattern() {
    JsonArray rules = new JsonArray()
      .add(new JsonObject().put("name", "bad").put("pattern", "[unclosed").put("replacement", "<X>"));

    assertThrows(IllegalArgumentException.class, () -> NormalizationRules.fromJson(rules));
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(NormalizerTest.class.getClassLoader().getResource(name).toURI());
  }
}
