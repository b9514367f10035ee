package com.marketchat.relay.processors;

import com.marketchat.relay.sessions.ConnectionDirectory;
import com.marketchat.relay.sessions.RoomMultiplexer;
import com.marketchat.relay.sessions.SessionRegistry;
import com.marketchat.store.common.ValidationException;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Connect and disconnect lifecycle. Every step is idempotent, so a client
 * that drops and reconnects ends up with exactly the registrations and
 * room memberships it would have had by staying connected.
 */
@Service
public class ReconnectionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ReconnectionHandler.class);

  private final SessionRegistry sessions;
  private final RoomMultiplexer rooms;
  private final ConnectionDirectory directory;
  private final EventRelay relay;

  public ReconnectionHandler(SessionRegistry sessions, RoomMultiplexer rooms,
      ConnectionDirectory directory, EventRelay relay) {
    this.sessions = sessions;
    this.rooms = rooms;
    this.directory = directory;
    this.relay = relay;
  }

  /**
   * Registers the connection for the user and subscribes it to all of the
   * user's conversations.
   *
   * @return ids of the conversations joined
   */
  public List<String> onConnect(String userId, String connectionId) {
    registerUser(userId, connectionId);
    return joinAllConversations(userId, connectionId);
  }

  /**
   * Binds the connection to the user. If the transport closed while this
   * ran, the binding is undone straight away so nothing is left behind.
   */
  public void registerUser(String userId, String connectionId) {
    if (StringUtils.isBlank(userId)) {
      throw new ValidationException("userId missing");
    }
    sessions.register(userId, connectionId);
    if (!directory.isLive(connectionId)) {
      logger.debug("Connection {} closed during registration of {}", connectionId, userId);
      onDisconnect(connectionId);
    }
  }

  public List<String> joinAllConversations(String userId, String connectionId) {
    if (StringUtils.isBlank(userId)) {
      throw new ValidationException("userId missing");
    }
    List<String> joined = rooms.joinAll(userId, connectionId);
    if (!directory.isLive(connectionId)) {
      rooms.leaveAll(connectionId);
    }
    return joined;
  }

  /**
   * Drops every trace of the connection. Safe for connections that never
   * registered or joined anything, and safe to call more than once.
   */
  public void onDisconnect(String connectionId) {
    directory.remove(connectionId);
    Optional<SessionRegistry.Unregistration> unregistration = sessions.unregister(connectionId);
    Set<String> roomsLeft = rooms.leaveAll(connectionId);
    relay.connectionClosed(connectionId, roomsLeft);

    logger.info("Connection {} closed (user: {}, rooms left: {}). Active connections: {}",
        connectionId,
        unregistration.map(SessionRegistry.Unregistration::getUserId).orElse("unregistered"),
        roomsLeft.size(), sessions.connectionCount());
  }
}
