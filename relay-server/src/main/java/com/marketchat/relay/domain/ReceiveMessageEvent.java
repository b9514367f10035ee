package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.store.domain.Message;

/**
 * A newly persisted message. Carries the durable id so clients can drop
 * duplicates.
 */
public class ReceiveMessageEvent extends ServerEvent {

  @JsonProperty("message")
  private final Message message;

  public ReceiveMessageEvent(Message message) {
    this.message = message;
  }

  public Message getMessage() {
    return message;
  }
}
