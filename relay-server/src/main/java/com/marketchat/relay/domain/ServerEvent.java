package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;

/**
 * Event pushed to WebSocket clients. The {@code event} property names the
 * kind; the set of kinds is closed.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "event")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ReceiveMessageEvent.class, name = "receiveMessage"),
    @JsonSubTypes.Type(value = UserTypingEvent.class, name = "userTyping"),
    @JsonSubTypes.Type(value = MessagesReadUpdateEvent.class, name = "messagesReadUpdate"),
    @JsonSubTypes.Type(value = MessagesDeliveredUpdateEvent.class, name = "messagesDeliveredUpdate"),
    @JsonSubTypes.Type(value = ConversationUpdatedEvent.class, name = "conversationUpdated"),
    @JsonSubTypes.Type(value = ActiveUsersUpdateEvent.class, name = "activeUsersUpdate"),
    @JsonSubTypes.Type(value = MessageErrorEvent.class, name = "messageError")
})
public abstract class ServerEvent {

  @JsonProperty("serverTimestamp")
  private String serverTimestamp = Instant.now().toString();

  public String getServerTimestamp() {
    return serverTimestamp;
  }

  public void setServerTimestamp(String serverTimestamp) {
    this.serverTimestamp = serverTimestamp;
  }
}
