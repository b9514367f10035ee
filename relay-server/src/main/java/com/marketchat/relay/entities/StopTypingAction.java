package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public class StopTypingAction extends ClientAction {

  @JsonProperty("conversationId")
  private String conversationId;

  @JsonProperty("userId")
  private String userId;

  public StopTypingAction() {
  }

  public StopTypingAction(String conversationId, String userId) {
    this.conversationId = conversationId;
    this.userId = userId;
  }

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "stopTyping";
  }

  public String getConversationId() { return conversationId; }
  public void setConversationId(String conversationId) { this.conversationId = conversationId; }

  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
}
