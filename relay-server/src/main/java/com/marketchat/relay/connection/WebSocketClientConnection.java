package com.marketchat.relay.connection;

import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * {@link ClientConnection} over a Spring WebSocket session. Sends go through
 * a {@link ConcurrentWebSocketSessionDecorator} so concurrent fan-outs are
 * serialized per session and a stalled client is cut off instead of blocking
 * senders.
 */
public class WebSocketClientConnection implements ClientConnection {

  private static final Logger logger = LoggerFactory.getLogger(WebSocketClientConnection.class);

  private final WebSocketSession session;

  public WebSocketClientConnection(WebSocketSession session, int sendTimeLimitMs, int bufferSizeLimit) {
    this.session = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, bufferSizeLimit);
  }

  @Override
  public String getId() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String payload) throws IOException {
    session.sendMessage(new TextMessage(payload));
  }

  @Override
  public void close() {
    try {
      session.close(CloseStatus.SESSION_NOT_RELIABLE);
    } catch (IOException e) {
      logger.debug("Failed to close session {}: {}", session.getId(), e.getMessage());
    }
  }
}
