package io.github.themoah.logspike.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.logspike.model.ParsedLog;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for the JSON, timestamp-text and key=value line parsers.
 */
public class LineParsersTest {

  private static final Instant TS = Instant.parse("2026-01-03T14:00:01Z");

  private final JsonLineParser json = new JsonLineParser();
  private final TimestampTextParser text = new TimestampTextParser();
  private final KeyValueParser keyValue = new KeyValueParser();

  @Test
  void json_canonicalFields() {
    ParsedLog log = json.parse(
      "{\"timestamp\":\"2026-01-03T14:00:01Z\",\"service\":\"api\",\"level\":\"ERROR\",\"message\":\"boom\"}")
      .orElseThrow();

    assertEquals(TS, log.timestamp());
    assertEquals("api", log.service());
    assertEquals("ERROR", log.level());
    assertEquals("boom", log.message());
    assertNull(log.requestId());
  }

  @Test
  void json_aliasesAndLowercaseLevel() {
    ParsedLog log = json.parse(
      "{\"ts\":\"2026-01-03T14:00:01Z\",\"svc\":\"user-service\",\"severity\":\"warn\",\"msg\":\"slow\",\"trace_id\":\"t-1\"}")
      .orElseThrow();

    assertEquals("user-service", log.service());
    assertEquals("WARN", log.level());
    assertEquals("slow", log.message());
    assertEquals("t-1", log.requestId());
  }

  @Test
  void json_numericEpochTimestamp() {
    ParsedLog log = json.parse("{\"time\":" + TS.toEpochMilli() + ",\"msg\":\"x\"}").orElseThrow();

    assertEquals(TS, log.timestamp());
    assertEquals("unknown", log.service());
    assertEquals("UNKNOWN", log.level());
  }

  @Test
  void json_missingTimestampIsRejected() {
    assertTrue(json.parse("{\"service\":\"api\",\"msg\":\"boom\"}").isEmpty());
  }

  @Test
  void json_malformedIsRejected() {
    assertTrue(json.parse("{\"service\": api}").isEmpty());
  }

  @Test
  void text_parsesAllParts() {
    ParsedLog log = text.parse("2026-01-03T14:00:01 ERROR user-service timeout after 5000ms").orElseThrow();

    assertEquals(TS, log.timestamp());
    assertEquals("ERROR", log.level());
    assertEquals("user-service", log.service());
    assertEquals("timeout after 5000ms", log.message());
  }

  @Test
  void text_requiresMessage() {
    assertTrue(text.parse("2026-01-03T14:00:01 ERROR user-service").isEmpty());
  }

  @Test
  void text_rejectsBadTimestamp() {
    assertTrue(text.parse("2026-01-03Tnonsense ERROR api boom").isEmpty());
  }

  @Test
  void keyValue_quotedAndBareValues() {
    ParsedLog log = keyValue.parse(
      "ts=2026-01-03T14:00:01Z level=error service=billing msg=\"charge failed for \\\"card\\\"\" request_id=r-9")
      .orElseThrow();

    assertEquals(TS, log.timestamp());
    assertEquals("ERROR", log.level());
    assertEquals("billing", log.service());
    assertEquals("charge failed for \"card\"", log.message());
    assertEquals("r-9", log.requestId());
  }

  @Test
  void keyValue_lastValueWins() {
    Map<String, String> pairs = KeyValueParser.extractPairs("a=1 b=2 a=3");

    assertEquals("3", pairs.get("a"));
    assertEquals("2", pairs.get("b"));
  }

  @Test
  void keyValue_withoutTimestampIsRejected() {
    Optional<ParsedLog> parsed = keyValue.parse("level=ERROR msg=boom");
    assertTrue(parsed.isEmpty());
  }
}
