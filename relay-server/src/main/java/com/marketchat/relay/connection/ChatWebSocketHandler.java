package com.marketchat.relay.connection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketchat.relay.domain.MessageErrorEvent;
import com.marketchat.relay.entities.ClientAction;
import com.marketchat.relay.entities.ClientActionVisitor;
import com.marketchat.relay.entities.JoinAllConversationsAction;
import com.marketchat.relay.entities.JoinRoomAction;
import com.marketchat.relay.entities.MarkMessagesAsReadAction;
import com.marketchat.relay.entities.RegisterUserAction;
import com.marketchat.relay.entities.SendMessageAction;
import com.marketchat.relay.entities.StartTypingAction;
import com.marketchat.relay.entities.StopTypingAction;
import com.marketchat.relay.processors.EventBroadcaster;
import com.marketchat.relay.processors.EventRelay;
import com.marketchat.relay.processors.ReconnectionHandler;
import com.marketchat.relay.sessions.ConnectionDirectory;
import com.marketchat.relay.sessions.SessionRegistry;
import com.marketchat.store.common.ErrorKind;
import com.marketchat.store.common.PermissionDeniedException;
import com.marketchat.store.common.RelayException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * WebSocket entry point: turns text frames into client actions and routes
 * them to the relay. Failures are reported to the sending connection only,
 * as a {@code messageError} event.
 */
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

  private static final Logger logger = LoggerFactory.getLogger(ChatWebSocketHandler.class);

  private static final String INVALID_JSON = "INVALID_JSON";

  private final ObjectMapper mapper;
  private final EventRelay relay;
  private final ReconnectionHandler reconnection;
  private final SessionRegistry sessions;
  private final ConnectionDirectory directory;
  private final EventBroadcaster broadcaster;

  private final int sendTimeLimitMs;
  private final int bufferSizeLimit;

  // Metrics
  private final Counter actionsReceived;
  private final Counter actionsRejected;

  public ChatWebSocketHandler(ObjectMapper mapper, EventRelay relay, ReconnectionHandler reconnection,
      SessionRegistry sessions, ConnectionDirectory directory, EventBroadcaster broadcaster,
      MeterRegistry meterRegistry,
      @Value("${relay.ws.send-time-limit-ms:10000}") int sendTimeLimitMs,
      @Value("${relay.ws.buffer-size-limit:524288}") int bufferSizeLimit) {
    this.mapper = mapper;
    this.relay = relay;
    this.reconnection = reconnection;
    this.sessions = sessions;
    this.directory = directory;
    this.broadcaster = broadcaster;
    this.sendTimeLimitMs = sendTimeLimitMs;
    this.bufferSizeLimit = bufferSizeLimit;
    this.actionsReceived = Counter.builder("relay.actions.received")
        .description("Client actions received over WebSocket")
        .register(meterRegistry);
    this.actionsRejected = Counter.builder("relay.actions.rejected")
        .description("Client actions that failed to parse or were refused")
        .register(meterRegistry);
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    directory.add(new WebSocketClientConnection(session, sendTimeLimitMs, bufferSizeLimit));

    Object userId = session.getAttributes().get(UserHandshakeInterceptor.USER_ID_ATTRIBUTE);
    if (userId instanceof String) {
      try {
        reconnection.onConnect((String) userId, session.getId());
      } catch (RelayException e) {
        reportError(session.getId(), e, "connect");
      }
    }

    logger.info("Session {} connected (user: {}) | Total connections: {}",
        session.getId(), userId == null ? "pending registration" : userId, directory.size());
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    String payload = message.getPayload();
    actionsReceived.increment();

    ClientAction action;

    // Parse JSON
    try {
      action = mapper.readValue(payload, ClientAction.class);
    } catch (JsonProcessingException e) {
      actionsRejected.increment();
      sendError(session.getId(), INVALID_JSON, "Malformed or unknown action: " + e.getOriginalMessage(), null);
      logger.warn("Invalid action from session {}: {}", session.getId(), payload);
      return;
    }
    if (action == null) {
      actionsRejected.increment();
      sendError(session.getId(), INVALID_JSON, "Frame carries no action", null);
      logger.warn("Empty action from session {}: {}", session.getId(), payload);
      return;
    }

    try {
      action.accept(new ActionDispatcher(session.getId()));
    } catch (RelayException e) {
      actionsRejected.increment();
      reportError(session.getId(), e, action.name());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    logger.warn("Transport error on session {}: {}", session.getId(), exception.getMessage());
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    reconnection.onDisconnect(session.getId());
    logger.info("Session {} disconnected (code: {}, reason: {}) | Total connections: {}",
        session.getId(), status.getCode(), status.getReason(), directory.size());
  }

  private void reportError(String connectionId, RelayException e, String actionName) {
    if (e.getKind() == ErrorKind.STORE_UNAVAILABLE) {
      logger.error("Action {} from session {} aborted: {}", actionName, connectionId, e.getMessage());
    } else {
      logger.warn("Action {} from session {} refused ({}): {}",
          actionName, connectionId, e.getCode(), e.getMessage());
    }
    sendError(connectionId, e.getCode(), e.getMessage(), actionName);
  }

  /**
   * Sends an error event to the client
   */
  private void sendError(String connectionId, String code, String message, String actionName) {
    broadcaster.sendTo(connectionId, new MessageErrorEvent(code, message, actionName));
  }

  /**
   * Runs actions on behalf of one connection. Once the connection is bound to
   * a user, actions can only speak for that user.
   */
  private final class ActionDispatcher implements ClientActionVisitor {

    private final String connectionId;

    private ActionDispatcher(String connectionId) {
      this.connectionId = connectionId;
    }

    @Override
    public void visit(RegisterUserAction action) {
      requireActingUser(action.getUserId());
      reconnection.registerUser(action.getUserId(), connectionId);
    }

    @Override
    public void visit(JoinRoomAction action) {
      relay.joinRoom(connectionId, action.getConversationId());
    }

    @Override
    public void visit(JoinAllConversationsAction action) {
      requireActingUser(action.getUserId());
      reconnection.joinAllConversations(action.getUserId(), connectionId);
    }

    @Override
    public void visit(SendMessageAction action) {
      requireActingUser(action.getSenderId());
      relay.send(action.toCommand());
    }

    @Override
    public void visit(StartTypingAction action) {
      requireActingUser(action.getUserId());
      relay.startTyping(action.getConversationId(), action.getUserId(), connectionId);
    }

    @Override
    public void visit(StopTypingAction action) {
      requireActingUser(action.getUserId());
      relay.stopTyping(action.getConversationId(), action.getUserId(), connectionId);
    }

    @Override
    public void visit(MarkMessagesAsReadAction action) {
      requireActingUser(action.getUserId());
      relay.markRead(action.getConversationId(), action.getUserId());
    }

    private void requireActingUser(String claimedUserId) {
      Optional<String> owner = sessions.userOf(connectionId);
      if (owner.isPresent() && StringUtils.isNotBlank(claimedUserId)
          && !owner.get().equals(claimedUserId)) {
        throw new PermissionDeniedException(String.format(
            "Connection %s is registered as %s and cannot act as %s",
            connectionId, owner.get(), claimedUserId));
      }
    }
  }
}
