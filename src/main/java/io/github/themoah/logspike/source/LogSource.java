package io.github.themoah.logspike.source;

import io.vertx.core.Future;

/**
 * A producer of raw log lines feeding an {@link IngestPipeline}.
 */
public interface LogSource {

  /**
   * Short description used in logs and health responses, e.g. {@code file:/var/log/app.log}.
   */
  String name();

  /**
   * Starts reading. The future completes once the source is attached, not when it is exhausted.
   */
  Future<Void> start();

  Future<Void> stop();

  /**
   * Returns false once the source has failed.
   */
  boolean isHealthy();

  /**
   * Number of lines handed to the pipeline so far.
   */
  long linesRead();
}
