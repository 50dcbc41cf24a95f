package io.github.themoah.logspike.source;

import io.github.themoah.logspike.ingest.IngestResult;
import io.github.themoah.logspike.ingest.Ingestor;
import io.github.themoah.logspike.store.PatternStore;

/**
 * Ingests raw lines and records the accepted events in the store.
 */
public class IngestPipeline {

  private final Ingestor ingestor;
  private final PatternStore store;

  public IngestPipeline(Ingestor ingestor, PatternStore store) {
    this.ingestor = ingestor;
    this.store = store;
  }

  /**
   * Counts of one batch.
   */
  public record BatchResult(long accepted, long rejected) {}

  /**
   * Processes one line.
   *
   * @return true if the line produced an event
   */
  public boolean accept(String line) {
    IngestResult result = ingestor.ingest(line);
    if (result.isSuccess()) {
      store.add(result.event());
      return true;
    }
    return false;
  }

  /**
   * Processes a block of newline-delimited lines. Blank lines are skipped and not counted.
   */
  public BatchResult acceptAll(String body) {
    long accepted = 0;
    long rejected = 0;
    if (body == null) {
      return new BatchResult(0, 0);
    }
    for (String line : body.split("\\R")) {
      if (line.isBlank()) {
        continue;
      }
      if (accept(line)) {
        accepted++;
      } else {
        rejected++;
      }
    }
    return new BatchResult(accepted, rejected);
  }

  public Ingestor ingestor() {
    return ingestor;
  }

  public PatternStore store() {
    return store;
  }
}
