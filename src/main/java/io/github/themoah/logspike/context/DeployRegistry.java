package io.github.themoah.logspike.context;

import io.github.themoah.logspike.model.DeployEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, in-memory list of deployments reported to the service, oldest first.
 */
public class DeployRegistry {

  private static final Logger log = LoggerFactory.getLogger(DeployRegistry.class);

  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final Deque<DeployEvent> events = new ArrayDeque<>();

  public DeployRegistry() {
    this(DEFAULT_CAPACITY);
  }

  public DeployRegistry(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive, got " + capacity);
    }
    this.capacity = capacity;
  }

  public synchronized void register(DeployEvent event) {
    events.addLast(event);
    if (events.size() > capacity) {
      events.removeFirst();
    }
    log.info("Registered deploy: service={}, version={}, at={}",
      event.service(), event.version(), event.timestamp());
  }

  public synchronized List<DeployEvent> snapshot() {
    return new ArrayList<>(events);
  }
}
