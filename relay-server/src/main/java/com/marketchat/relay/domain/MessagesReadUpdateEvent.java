package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.store.domain.Message;
import java.time.Instant;
import java.util.List;

/**
 * Read receipts: the reader and the conversation's history after the update.
 */
public class MessagesReadUpdateEvent extends ServerEvent {

  @JsonProperty("conversationId")
  private final String conversationId;

  @JsonProperty("readBy")
  private final String readBy;

  @JsonProperty("messages")
  private final List<Message> messages;

  @JsonProperty("timestamp")
  private final Instant timestamp;

  public MessagesReadUpdateEvent(String conversationId, String readBy, List<Message> messages,
      Instant timestamp) {
    this.conversationId = conversationId;
    this.readBy = readBy;
    this.messages = List.copyOf(messages);
    this.timestamp = timestamp;
  }

  public String getConversationId() { return conversationId; }

  public String getReadBy() { return readBy; }

  public List<Message> getMessages() { return messages; }

  public Instant getTimestamp() { return timestamp; }
}
