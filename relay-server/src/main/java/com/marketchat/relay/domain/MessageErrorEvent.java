package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Failure report for one inbound action. Only ever sent to the connection
 * that issued the action.
 */
public class MessageErrorEvent extends ServerEvent {

  @JsonProperty("status")
  private final String status = "ERROR";

  @JsonProperty("code")
  private final String code;

  @JsonProperty("message")
  private final String message;

  @JsonProperty("action")
  private final String action;

  public MessageErrorEvent(String code, String message, String action) {
    this.code = code;
    this.message = message;
    this.action = action;
  }

  public String getStatus() { return status; }

  public String getCode() { return code; }

  public String getMessage() { return message; }

  public String getAction() { return action; }
}
