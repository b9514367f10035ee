package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public class JoinRoomAction extends ClientAction {

  @JsonProperty("conversationId")
  private String conversationId;

  public JoinRoomAction() {
  }

  public JoinRoomAction(String conversationId) {
    this.conversationId = conversationId;
  }

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "joinRoom";
  }

  public String getConversationId() { return conversationId; }
  public void setConversationId(String conversationId) { this.conversationId = conversationId; }
}
