package io.github.themoah.logspike.ingest;

import io.github.themoah.logspike.model.LogEvent;
import io.github.themoah.logspike.model.ParsedLog;
import io.github.themoah.logspike.normalize.Normalizer;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw lines into canonical events: format detection, then the parser for that
 * format, then message normalization.
 *
 * <p>Ingestion never throws. Every line is counted either as a success or as a failure
 * under its {@link FailureReason}.
 */
public class Ingestor {

  private static final Logger log = LoggerFactory.getLogger(Ingestor.class);

  private final Map<LogFormat, LineParser> parsers;
  private final Normalizer normalizer;

  private final AtomicLong succeeded = new AtomicLong();
  private final Map<FailureReason, AtomicLong> failures = new ConcurrentHashMap<>();

  public Ingestor(Normalizer normalizer) {
    this(normalizer, defaultParsers());
  }

  /**
   * Constructor for testing with injectable parsers.
   */
  Ingestor(Normalizer normalizer, Map<LogFormat, LineParser> parsers) {
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer cannot be null");
    this.parsers = new EnumMap<>(parsers);
  }

  private static Map<LogFormat, LineParser> defaultParsers() {
    Map<LogFormat, LineParser> parsers = new EnumMap<>(LogFormat.class);
    parsers.put(LogFormat.JSON, new JsonLineParser());
    parsers.put(LogFormat.TIMESTAMP_TEXT, new TimestampTextParser());
    parsers.put(LogFormat.KEY_VALUE, new KeyValueParser());
    return parsers;
  }

  /**
   * Ingests a single raw line.
   *
   * @param line the raw line
   * @return the event, or the reason the line was dropped
   */
  public IngestResult ingest(String line) {
    IngestResult result;
    try {
      result = process(line);
    } catch (RuntimeException e) {
      log.warn("Unexpected error ingesting line: {}", e.toString());
      result = IngestResult.failure(FailureReason.INTERNAL_ERROR);
    }

    if (result.isSuccess()) {
      succeeded.incrementAndGet();
    } else {
      failures.computeIfAbsent(result.failure(), k -> new AtomicLong()).incrementAndGet();
      log.debug("Dropped line ({}): {}", result.failure().getValue(), line);
    }
    return result;
  }

  /**
   * Ingests a single raw line, returning null when it is dropped.
   */
  public LogEvent ingestOrNull(String line) {
    return ingest(line).event();
  }

  private IngestResult process(String line) {
    LogFormat format = FormatDetector.detect(line);
    LineParser parser = parsers.get(format);
    if (parser == null) {
      return IngestResult.failure(FailureReason.UNRECOGNIZED_FORMAT);
    }

    Optional<ParsedLog> parsed = parser.parse(line);
    if (parsed.isEmpty()) {
      return IngestResult.failure(FailureReason.UNPARSEABLE_LINE);
    }

    ParsedLog p = parsed.get();
    String template = normalizer.normalize(p.message());
    return IngestResult.success(new LogEvent(
      p.timestamp(),
      p.service(),
      p.level(),
      template,
      line,
      p.requestId()
    ));
  }

  /**
   * Returns a snapshot of the success and failure counters.
   */
  public IngestStats stats() {
    Map<String, Long> byReason = new HashMap<>();
    long failed = 0;
    for (Map.Entry<FailureReason, AtomicLong> entry : failures.entrySet()) {
      long count = entry.getValue().get();
      byReason.put(entry.getKey().getValue(), count);
      failed += count;
    }
    return new IngestStats(succeeded.get(), failed, byReason);
  }
}
