package io.github.themoah.logspike.model;

import java.time.Instant;

/**
 * Lifetime statistics of a pattern key. Unlike buckets these are never evicted.
 *
 * @param totalCount events seen since the key first appeared
 * @param firstSeen earliest event timestamp
 * @param lastSeen latest event timestamp
 */
public record PatternStats(
  long totalCount,
  Instant firstSeen,
  Instant lastSeen
) {}
