package io.github.themoah.logspike.source;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration holder for the Kafka log consumer.
 */
public class KafkaSourceConfig {

  private static final Logger log = LoggerFactory.getLogger(KafkaSourceConfig.class);

  private static final String DEFAULT_CONFIG_FILE = "application.properties";
  private static final String PROP_BOOTSTRAP_SERVERS = "kafka.bootstrap.servers";
  private static final String PROP_GROUP_ID = "kafka.group.id";
  private static final String PROP_AUTO_OFFSET_RESET = "kafka.auto.offset.reset";
  private static final String PROP_PREFIX = "kafka.";

  private static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";
  private static final String DEFAULT_GROUP_ID = "logspike";
  private static final String DEFAULT_AUTO_OFFSET_RESET = "latest";

  private final String bootstrapServers;
  private final String groupId;
  private final String autoOffsetReset;
  private final Map<String, String> additionalProperties;

  private KafkaSourceConfig(Builder builder) {
    this.bootstrapServers = builder.bootstrapServers;
    this.groupId = builder.groupId;
    this.autoOffsetReset = builder.autoOffsetReset;
    this.additionalProperties = new HashMap<>(builder.additionalProperties);
  }

  public String getBootstrapServers() {
    return bootstrapServers;
  }

  public String getGroupId() {
    return groupId;
  }

  public String getAutoOffsetReset() {
    return autoOffsetReset;
  }

  /**
   * Returns consumer properties with string deserializers for keys and values.
   */
  public Map<String, String> toProperties() {
    Map<String, String> props = new HashMap<>();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, autoOffsetReset);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
    props.putAll(additionalProperties);
    return props;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static KafkaSourceConfig fromEnvironment() {
    return builder()
      .bootstrapServers(System.getenv().getOrDefault("KAFKA_BOOTSTRAP_SERVERS", DEFAULT_BOOTSTRAP_SERVERS))
      .groupId(System.getenv().getOrDefault("KAFKA_GROUP_ID", DEFAULT_GROUP_ID))
      .autoOffsetReset(System.getenv().getOrDefault("KAFKA_AUTO_OFFSET_RESET", DEFAULT_AUTO_OFFSET_RESET))
      .build();
  }

  /**
   * Loads configuration from application.properties on the classpath, falling back to
   * environment variables when the resource is missing or unreadable.
   */
  public static KafkaSourceConfig load() {
    try {
      return fromClasspath(DEFAULT_CONFIG_FILE);
    } catch (IOException e) {
      log.info("No classpath config found, loading from environment: {}", e.getMessage());
      return fromEnvironment();
    }
  }

  /**
   * Loads configuration from a properties file on the classpath.
   *
   * @param resourceName the name of the properties file on the classpath
   * @throws IOException if the resource is missing or cannot be read
   */
  public static KafkaSourceConfig fromClasspath(String resourceName) throws IOException {
    log.info("Loading Kafka configuration from classpath: {}", resourceName);
    try (InputStream is = KafkaSourceConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
      if (is == null) {
        throw new IOException("Resource not found on classpath: " + resourceName);
      }
      Properties props = new Properties();
      props.load(is);
      return fromProperties(props);
    }
  }

  /**
   * Creates configuration from kafka.* properties. Unknown kafka.* keys are passed to the
   * consumer with the prefix removed.
   */
  public static KafkaSourceConfig fromProperties(Properties props) {
    Builder builder = builder();

    String bootstrapServers = props.getProperty(PROP_BOOTSTRAP_SERVERS);
    if (bootstrapServers != null && !bootstrapServers.isBlank()) {
      builder.bootstrapServers(bootstrapServers);
    }
    String groupId = props.getProperty(PROP_GROUP_ID);
    if (groupId != null && !groupId.isBlank()) {
      builder.groupId(groupId);
    }
    String offsetReset = props.getProperty(PROP_AUTO_OFFSET_RESET);
    if (offsetReset != null && !offsetReset.isBlank()) {
      builder.autoOffsetReset(offsetReset);
    }

    for (String name : props.stringPropertyNames()) {
      if (name.startsWith(PROP_PREFIX)
          && !name.equals(PROP_BOOTSTRAP_SERVERS)
          && !name.equals(PROP_GROUP_ID)
          && !name.equals(PROP_AUTO_OFFSET_RESET)) {
        builder.property(name.substring(PROP_PREFIX.length()), props.getProperty(name));
      }
    }

    log.info("Kafka configuration loaded: bootstrapServers={}, groupId={}",
      builder.bootstrapServers, builder.groupId);
    return builder.build();
  }

  public static class Builder {

    private String bootstrapServers = DEFAULT_BOOTSTRAP_SERVERS;
    private String groupId = DEFAULT_GROUP_ID;
    private String autoOffsetReset = DEFAULT_AUTO_OFFSET_RESET;
    private final Map<String, String> additionalProperties = new HashMap<>();

    public Builder bootstrapServers(String bootstrapServers) {
      this.bootstrapServers = Objects.requireNonNull(bootstrapServers, "bootstrapServers cannot be null");
      return this;
    }

    public Builder groupId(String groupId) {
      this.groupId = Objects.requireNonNull(groupId, "groupId cannot be null");
      return this;
    }

    public Builder autoOffsetReset(String autoOffsetReset) {
      this.autoOffsetReset = Objects.requireNonNull(autoOffsetReset, "autoOffsetReset cannot be null");
      return this;
    }

    public Builder property(String key, String value) {
      this.additionalProperties.put(key, value);
      return this;
    }

    public KafkaSourceConfig build() {
      return new KafkaSourceConfig(this);
    }
  }
}
