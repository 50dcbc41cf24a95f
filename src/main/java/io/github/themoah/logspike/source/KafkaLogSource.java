package io.github.themoah.logspike.source;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.kafka.client.consumer.KafkaConsumer;
import io.vertx.kafka.client.consumer.KafkaConsumerRecord;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes log lines from a Kafka topic, one record value per line.
 */
public class KafkaLogSource implements LogSource {

  private static final Logger log = LoggerFactory.getLogger(KafkaLogSource.class);

  private final KafkaConsumer<String, String> consumer;
  private final String topic;
  private final IngestPipeline pipeline;
  private final AtomicLong linesRead = new AtomicLong();

  private volatile boolean healthy = true;

  public KafkaLogSource(Vertx vertx, KafkaSourceConfig config, String topic, IngestPipeline pipeline) {
    this(KafkaConsumer.create(vertx, config.toProperties()), topic, pipeline);
    log.info("Created Kafka consumer: bootstrapServers={}, groupId={}",
      config.getBootstrapServers(), config.getGroupId());
  }

  /**
   * Creates a source over an existing consumer (for testing).
   */
  KafkaLogSource(KafkaConsumer<String, String> consumer, String topic, IngestPipeline pipeline) {
    this.consumer = Objects.requireNonNull(consumer, "consumer cannot be null");
    this.topic = Objects.requireNonNull(topic, "topic cannot be null");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
  }

  @Override
  public String name() {
    return "kafka:" + topic;
  }

  @Override
  public Future<Void> start() {
    consumer.handler(this::handleRecord);
    consumer.exceptionHandler(err -> {
      healthy = false;
      log.error("Kafka consumer error on topic {}", topic, err);
    });
    return consumer.subscribe(topic)
      .onSuccess(v -> log.info("Subscribed to topic {}", topic))
      .onFailure(err -> {
        healthy = false;
        log.error("Failed to subscribe to topic {}", topic, err);
      });
  }

  void handleRecord(KafkaConsumerRecord<String, String> record) {
    String value = record.value();
    if (value == null || value.isBlank()) {
      return;
    }
    linesRead.incrementAndGet();
    pipeline.accept(value);
  }

  @Override
  public Future<Void> stop() {
    log.info("Closing Kafka consumer for topic {}", topic);
    return consumer.close();
  }

  @Override
  public boolean isHealthy() {
    return healthy;
  }

  @Override
  public long linesRead() {
    return linesRead.get();
  }
}
