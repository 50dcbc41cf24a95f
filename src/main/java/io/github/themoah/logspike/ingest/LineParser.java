package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.ParsedLog;
import java.util.Optional;

/**
 * Parser for one {@link LogFormat}. Implementations never throw; a line they cannot
 * handle yields an empty result.
 */
public interface LineParser {

  /**
   * Parses a raw line.
   *
   * @param line the raw line
   * @return the parsed record, or empty if the line does not fit this format
   */
  Optional<ParsedLog> parse(String line);
}
