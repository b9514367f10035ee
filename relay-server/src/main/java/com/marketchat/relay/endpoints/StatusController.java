package com.marketchat.relay.endpoints;

import com.marketchat.relay.sessions.ConnectionDirectory;
import com.marketchat.relay.sessions.RoomMultiplexer;
import com.marketchat.relay.sessions.SessionRegistry;
import com.marketchat.store.service.MessageStore;
import java.util.HashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class StatusController {

  private final SessionRegistry sessions;
  private final RoomMultiplexer rooms;
  private final ConnectionDirectory directory;
  private final MessageStore messageStore;

  @Value("${server.id:unknown}")
  private String serverId;

  public StatusController(SessionRegistry sessions, RoomMultiplexer rooms,
      ConnectionDirectory directory, MessageStore messageStore) {
    this.sessions = sessions;
    this.rooms = rooms;
    this.directory = directory;
    this.messageStore = messageStore;
  }

  @GetMapping("/health")
  public Map<String, Object> health() {
    Map<String, Object> response = new HashMap<>();
    response.put("status", "UP");
    response.put("timestamp", java.time.Instant.now().toString());
    return response;
  }

  @GetMapping("/stats")
  public Map<String, Object> stats() {
    Map<String, Object> response = new HashMap<>();
    response.put("serverId", serverId);
    response.put("connections", directory.size());
    response.put("registeredConnections", sessions.connectionCount());
    response.put("onlineUsers", sessions.onlineUsers().size());
    response.put("rooms", rooms.roomCount());
    response.put("roomStats", rooms.getRoomStats());
    response.put("storeStats", messageStore.getStoreStats());
    return response;
  }
}
