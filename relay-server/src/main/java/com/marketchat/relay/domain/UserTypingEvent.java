package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public class UserTypingEvent extends ServerEvent {

  @JsonProperty("conversationId")
  private final String conversationId;

  @JsonProperty("userId")
  private final String userId;

  @JsonProperty("isTyping")
  private final boolean typing;

  public UserTypingEvent(String conversationId, String userId, boolean typing) {
    this.conversationId = conversationId;
    this.userId = userId;
    this.typing = typing;
  }

  public String getConversationId() { return conversationId; }

  public String getUserId() { return userId; }

  public boolean isTyping() { return typing; }
}
