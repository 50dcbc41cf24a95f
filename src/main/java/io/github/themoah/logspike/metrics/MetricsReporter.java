package io.github.themoah.logspike.metrics;

import io.github.themoah.logspike.detect.SeverityThresholds;
import io.github.themoah.logspike.ingest.IngestStats;
import io.github.themoah.logspike.model.DetectionResult;
import io.vertx.core.Future;

/**
 * Interface for reporting ingest and detection metrics to external systems.
 */
public interface MetricsReporter {

  /**
   * Reports cumulative ingest counters.
   */
  void reportIngest(IngestStats stats);

  /**
   * Reports the outcome of one detection pass.
   *
   * @param result the detection result
   * @param thresholds bands used to label each anomaly
   * @param storeKeys number of keys currently in the store
   */
  void reportDetection(DetectionResult result, SeverityThresholds thresholds, int storeKeys);

  Future<Void> start();

  /**
   * Closes the reporter and releases resources.
   */
  Future<Void> close();
}
