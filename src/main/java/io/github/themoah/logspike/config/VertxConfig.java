package io.github.themoah.logspike.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x options for the launcher.
 * The worker pool size can be set with VERTX_WORKER_POOL_SIZE.
 */
public final class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  private VertxConfig() {}

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    String poolSize = System.getenv(ENV_WORKER_POOL_SIZE);
    if (poolSize != null && !poolSize.isBlank()) {
      try {
        options.setWorkerPoolSize(Integer.parseInt(poolSize));
        log.info("Worker pool size set to {}", poolSize);
      } catch (NumberFormatException e) {
        log.warn("Invalid {}: {}, using default: {}",
          ENV_WORKER_POOL_SIZE, poolSize, VertxOptions.DEFAULT_WORKER_POOL_SIZE);
      }
    }
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    log.info("Using default event-loop threading model");
    return new DeploymentOptions();
  }
}
