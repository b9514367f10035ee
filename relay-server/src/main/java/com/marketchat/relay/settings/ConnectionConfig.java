package com.marketchat.relay.settings;

import com.marketchat.relay.connection.ChatWebSocketHandler;
import com.marketchat.relay.connection.UserHandshakeInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;


@Configuration
@EnableWebSocket
public class ConnectionConfig implements WebSocketConfigurer {

  @Autowired
  private ChatWebSocketHandler chatHandler;

  @Value("${relay.ws.path:/ws/chat}")
  private String path;

  @Value("${relay.ws.allowed-origins:*}")
  private String[] allowedOrigins;

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry.addHandler(chatHandler, path)
        .addInterceptors(new UserHandshakeInterceptor())
        .setAllowedOriginPatterns(allowedOrigins);
  }
}
