package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Inbound action sent by a client over its WebSocket connection. The
 * {@code action} property selects the kind; unknown kinds fail to parse.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "action")
@JsonSubTypes({
    @JsonSubTypes.Type(value = RegisterUserAction.class, name = "registerUser"),
    @JsonSubTypes.Type(value = JoinRoomAction.class, name = "joinRoom"),
    @JsonSubTypes.Type(value = JoinAllConversationsAction.class, name = "joinAllConversations"),
    @JsonSubTypes.Type(value = SendMessageAction.class, name = "sendMessage"),
    @JsonSubTypes.Type(value = StartTypingAction.class, name = "startTyping"),
    @JsonSubTypes.Type(value = StopTypingAction.class, name = "stopTyping"),
    @JsonSubTypes.Type(value = MarkMessagesAsReadAction.class, name = "markMessagesAsRead")
})
public abstract class ClientAction {

  public abstract void accept(ClientActionVisitor visitor);

  /**
   * Wire name of this action, used in error reports.
   */
  public abstract String name();
}
