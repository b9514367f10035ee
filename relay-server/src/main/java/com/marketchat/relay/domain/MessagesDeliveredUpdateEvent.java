package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.store.domain.Message;
import java.util.List;

public class MessagesDeliveredUpdateEvent extends ServerEvent {

  @JsonProperty("conversationId")
  private final String conversationId;

  @JsonProperty("deliveredTo")
  private final String deliveredTo;

  @JsonProperty("messages")
  private final List<Message> messages;

  public MessagesDeliveredUpdateEvent(String conversationId, String deliveredTo, List<Message> messages) {
    this.conversationId = conversationId;
    this.deliveredTo = deliveredTo;
    this.messages = List.copyOf(messages);
  }

  public String getConversationId() { return conversationId; }

  public String getDeliveredTo() { return deliveredTo; }

  public List<Message> getMessages() { return messages; }
}
