package io.github.themoah.logspike.model;

import java.time.Instant;

/**
 * Externally derived deployment marker used for correlation.
 */
public record DeployEvent(
  String service,
  String version,
  Instant timestamp
) {}
