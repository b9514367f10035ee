package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketchat.store.domain.Conversation;

/**
 * Summary or unread counters of a conversation changed. Sent to every live
 * connection of both participants, whether or not they joined the room.
 */
public class ConversationUpdatedEvent extends ServerEvent {

  @JsonProperty("conversation")
  private final Conversation conversation;

  public ConversationUpdatedEvent(Conversation conversation) {
    this.conversation = conversation;
  }

  public Conversation getConversation() {
    return conversation;
  }
}
