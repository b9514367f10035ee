package com.marketchat.relay.sessions;

import com.marketchat.relay.connection.ClientConnection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * connectionId -> live transport handle. Filled when a transport opens and
 * emptied when it closes; registries only ever hold ids.
 */
@Component
public class ConnectionDirectory {

  private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();

  public void add(ClientConnection connection) {
    connections.put(connection.getId(), connection);
  }

  public void remove(String connectionId) {
    connections.remove(connectionId);
  }

  public Optional<ClientConnection> find(String connectionId) {
    return Optional.ofNullable(connections.get(connectionId));
  }

  public boolean isLive(String connectionId) {
    ClientConnection connection = connections.get(connectionId);
    return connection != null && connection.isOpen();
  }

  public int size() {
    return connections.size();
  }
}
