package io.github.themoah.logspike.model;

import java.time.Instant;

/**
 * Event count for one pattern key in one fixed-duration time slot.
 *
 * @param start bucket start, aligned to a multiple of the bucket size
 * @param count number of events in the slot
 */
public record Bucket(Instant start, long count) {}
