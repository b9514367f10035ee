package com.marketchat.relay.processors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.relay.connection.ClientConnection;
import com.marketchat.relay.domain.ServerEvent;
import com.marketchat.relay.sessions.ConnectionDirectory;
import com.marketchat.store.common.TransportDroppedException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes events to sets of connections.
 *
 * <p>An event is serialized once and written to each target in turn. A
 * target that is gone or fails to accept the write is reported as
 * {@link TransportDroppedException}, logged, closed, and skipped; the rest of
 * the targets still get the event.
 */
@Service
public class EventBroadcaster {

  private static final Logger logger = LoggerFactory.getLogger(EventBroadcaster.class);

  private final ObjectMapper objectMapper;
  private final ConnectionDirectory directory;

  private final Counter eventsEmitted;
  private final Counter fanOutDropped;

  public EventBroadcaster(ObjectMapper objectMapper, ConnectionDirectory directory,
      MeterRegistry meterRegistry) {
    this.objectMapper = objectMapper;
    this.directory = directory;
    this.eventsEmitted = Counter.builder("relay.events.emitted")
        .description("Events written to client connections")
        .register(meterRegistry);
    this.fanOutDropped = Counter.builder("relay.fanout.dropped")
        .description("Fan-out writes skipped because the connection was gone or broken")
        .register(meterRegistry);
  }

  /**
   * Sends an event to every listed connection.
   *
   * @return ids of the connections that accepted the write
   */
  public Set<String> broadcast(Collection<String> connectionIds, ServerEvent event) {
    Set<String> reached = new LinkedHashSet<>();
    if (connectionIds.isEmpty()) {
      return reached;
    }

    String payload;
    try {
      payload = objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize " + event.getClass().getSimpleName(), e);
    }

    int failureCount = 0;
    for (String connectionId : new LinkedHashSet<>(connectionIds)) {
      try {
        deliver(connectionId, payload);
        reached.add(connectionId);
        eventsEmitted.increment();
      } catch (TransportDroppedException e) {
        failureCount++;
        fanOutDropped.increment();
        logger.warn("Skipping connection {}: {}", e.getConnectionId(), e.getMessage());
      }
    }

    logger.debug("Broadcasted {} to {} connection(s). Success: {}, Failed: {}",
        event.getClass().getSimpleName(), connectionIds.size(), reached.size(), failureCount);
    return reached;
  }

  /**
   * Sends an event to one connection, typically an error report to the
   * connection that caused it.
   */
  public boolean sendTo(String connectionId, ServerEvent event) {
    return !broadcast(Set.of(connectionId), event).isEmpty();
  }

  private void deliver(String connectionId, String payload) {
    Optional<ClientConnection> target = directory.find(connectionId);
    if (target.isEmpty()) {
      throw new TransportDroppedException(connectionId, "connection no longer registered");
    }
    ClientConnection connection = target.get();
    if (!connection.isOpen()) {
      throw new TransportDroppedException(connectionId, "connection closed");
    }
    try {
      connection.send(payload);
    } catch (IOException | RuntimeException e) {
      connection.close();
      throw new TransportDroppedException(connectionId, "send failed: " + e.getMessage(), e);
    }
  }
}
