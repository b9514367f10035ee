package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public class MarkMessagesAsReadAction extends ClientAction {

  @JsonProperty("conversationId")
  private String conversationId;

  @JsonProperty("userId")
  private String userId;

  public MarkMessagesAsReadAction() {
  }

  public MarkMessagesAsReadAction(String conversationId, String userId) {
    this.conversationId = conversationId;
    this.userId = userId;
  }

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "markMessagesAsRead";
  }

  public String getConversationId() { return conversationId; }
  public void setConversationId(String conversationId) { this.conversationId = conversationId; }

  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
}
