package com.marketchat.relay.connection;

import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Copies the {@code userId} query parameter into the session attributes.
 * Identity is established before the handshake; connections without the
 * parameter are still accepted and register later with {@code registerUser}.
 */
public class UserHandshakeInterceptor implements HandshakeInterceptor {

  public static final String USER_ID_ATTRIBUTE = "userId";

  @Override
  public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
      WebSocketHandler wsHandler, Map<String, Object> attributes) {
    String userId = UriComponentsBuilder.fromUri(request.getURI())
        .build()
        .getQueryParams()
        .getFirst(USER_ID_ATTRIBUTE);
    if (StringUtils.isNotBlank(userId)) {
      attributes.put(USER_ID_ATTRIBUTE, userId.trim());
    }
    return true;
  }

  @Override
  public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
      WebSocketHandler wsHandler, Exception exception) {
    // nothing to do
  }
}
