package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public class JoinAllConversationsAction extends ClientAction {

  @JsonProperty("userId")
  private String userId;

  public JoinAllConversationsAction() {
  }

  public JoinAllConversationsAction(String userId) {
    this.userId = userId;
  }

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "joinAllConversations";
  }

  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
}
