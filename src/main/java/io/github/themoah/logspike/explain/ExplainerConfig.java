package io.github.themoah.logspike.explain;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the OpenRouter-backed explainer.
 *
 * @param apiKey API key, or null when explanations are disabled
 * @param model model identifier
 * @param endpoint chat completions URL
 * @param timeout request timeout
 * @param temperature sampling temperature
 * @param maxTokens completion token limit
 */
public record ExplainerConfig(
  String apiKey,
  String model,
  String endpoint,
  Duration timeout,
  double temperature,
  int maxTokens
) {

  private static final Logger log = LoggerFactory.getLogger(ExplainerConfig.class);

  public static final String DEFAULT_MODEL = "google/gemma-3n-e2b-it:free";
  public static final String DEFAULT_ENDPOINT = "https://openrouter.ai/api/v1/chat/completions";
  private static final long DEFAULT_TIMEOUT_MS = 30_000L;
  private static final double DEFAULT_TEMPERATURE = 0.2;
  private static final int DEFAULT_MAX_TOKENS = 400;

  /**
   * Returns true if an API key is configured.
   */
  public boolean isEnabled() {
    return apiKey != null && !apiKey.isBlank();
  }

  public static ExplainerConfig disabled() {
    return new ExplainerConfig(null, DEFAULT_MODEL, DEFAULT_ENDPOINT,
      Duration.ofMillis(DEFAULT_TIMEOUT_MS), DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>OPENROUTER_API_KEY - API key; explanations are disabled without it</li>
   *   <li>OPENROUTER_MODEL - Model identifier (default: google/gemma-3n-e2b-it:free)</li>
   *   <li>OPENROUTER_ENDPOINT - Chat completions URL (default: OpenRouter public API)</li>
   *   <li>OPENROUTER_TIMEOUT_MS - Request timeout (default: 30000)</li>
   * </ul>
   */
  public static ExplainerConfig fromEnvironment() {
    String apiKey = System.getenv("OPENROUTER_API_KEY");
    String model = getEnvOrDefault("OPENROUTER_MODEL", DEFAULT_MODEL);
    String endpoint = getEnvOrDefault("OPENROUTER_ENDPOINT", DEFAULT_ENDPOINT);
    long timeoutMs = parseLong("OPENROUTER_TIMEOUT_MS", DEFAULT_TIMEOUT_MS);

    ExplainerConfig config = new ExplainerConfig(apiKey, model, endpoint,
      Duration.ofMillis(timeoutMs), DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    if (config.isEnabled()) {
      log.info("Explainer enabled: model={}, endpoint={}, timeoutMs={}", model, endpoint, timeoutMs);
    } else {
      log.info("Explainer disabled (OPENROUTER_API_KEY not set)");
    }
    return config;
  }

  private static String getEnvOrDefault(String envVar, String defaultValue) {
    String value = System.getenv(envVar);
    return (value == null || value.isBlank()) ? defaultValue : value;
  }

  private static long parseLong(String envVar, long defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  @Override
  public String toString() {
    return "ExplainerConfig[model=" + model + ", endpoint=" + endpoint
      + ", timeout=" + timeout + ", enabled=" + isEnabled() + "]";
  }
}
