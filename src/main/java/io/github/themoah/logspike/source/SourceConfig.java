package io.github.themoah.logspike.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects which input sources run.
 *
 * @param logFile path of a log file to replay, or null
 * @param kafkaTopic topic to consume log lines from, or null
 */
public record SourceConfig(
  String logFile,
  String kafkaTopic
) {

  private static final Logger log = LoggerFactory.getLogger(SourceConfig.class);

  public boolean fileEnabled() {
    return logFile != null && !logFile.isBlank();
  }

  public boolean kafkaEnabled() {
    return kafkaTopic != null && !kafkaTopic.isBlank();
  }

  /**
   * Loads configuration from LOG_FILE and KAFKA_LOG_TOPIC.
   */
  public static SourceConfig fromEnvironment() {
    SourceConfig config = new SourceConfig(System.getenv("LOG_FILE"), System.getenv("KAFKA_LOG_TOPIC"));
    log.info("Source config: logFile={}, kafkaTopic={}",
      config.fileEnabled() ? config.logFile() : "-",
      config.kafkaEnabled() ? config.kafkaTopic() : "-");
    return config;
  }
}
