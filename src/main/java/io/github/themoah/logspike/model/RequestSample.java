package io.github.themoah.logspike.model;

import java.time.Instant;

/**
 * A request id observed for a pattern key, with the time it was seen.
 */
public record RequestSample(String requestId, Instant timestamp) {}
