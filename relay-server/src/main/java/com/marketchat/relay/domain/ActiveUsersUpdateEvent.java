package com.marketchat.relay.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ActiveUsersUpdateEvent extends ServerEvent {

  @JsonProperty("conversationId")
  private final String conversationId;

  @JsonProperty("activeUsers")
  private final List<String> activeUsers;

  public ActiveUsersUpdateEvent(String conversationId, List<String> activeUsers) {
    this.conversationId = conversationId;
    this.activeUsers = List.copyOf(activeUsers);
  }

  public String getConversationId() { return conversationId; }

  public List<String> getActiveUsers() { return activeUsers; }
}
