package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.ParsedLog;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses JSON object lines such as
 * {@code {"ts":"2026-01-03T14:00:01Z","level":"error","svc":"user-service","msg":"timeout after 5000ms"}}.
 */
public class JsonLineParser implements LineParser {

  private static final Logger log = LoggerFactory.getLogger(JsonLineParser.class);

  @Override
  public Optional<ParsedLog> parse(String line) {
    JsonObject json;
    try {
      json = new JsonObject(line.strip());
    } catch (DecodeException | ClassCastException e) {
      log.debug("Rejected JSON line: {}", e.getMessage());
      return Optional.empty();
    }
    return FieldResolver.resolve(json.getMap());
  }
}
