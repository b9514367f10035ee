package com.marketchat.relay.entities;

import com.fasterxml.jackson.annotation.JsonProperty;

public class RegisterUserAction extends ClientAction {

  @JsonProperty("userId")
  private String userId;

  public RegisterUserAction() {
  }

  public RegisterUserAction(String userId) {
    this.userId = userId;
  }

  @Override
  public void accept(ClientActionVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String name() {
    return "registerUser";
  }

  public String getUserId() { return userId; }
  public void setUserId(String userId) { this.userId = userId; }
}
