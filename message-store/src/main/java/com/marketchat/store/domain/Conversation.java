package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A two-party conversation. Carries a denormalized preview of the latest
 * message and one unread counter per participant.
 */
public class Conversation {

  @JsonProperty("id")
  private String id;

  @JsonProperty("participantA")
  private String participantA;

  @JsonProperty("participantB")
  private String participantB;

  @JsonProperty("lastMessage")
  private String lastMessage;

  @JsonProperty("lastMessageId")
  private String lastMessageId;

  @JsonProperty("unreadCount")
  private Map<String, Integer> unreadCount = new LinkedHashMap<>();

  @JsonProperty("createdAt")
  private Instant createdAt;

  @JsonProperty("updatedAt")
  private Instant updatedAt;

  public Conversation() {
  }

  public Conversation(String id, String participantA, String participantB, Instant createdAt) {
    this.id = id;
    this.participantA = participantA;
    this.participantB = participantB;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.lastMessage = "";
    this.unreadCount.put(participantA, 0);
    this.unreadCount.put(participantB, 0);
  }

  public boolean hasParticipant(String userId) {
    return userId != null && (userId.equals(participantA) || userId.equals(participantB));
  }

  /**
   * Returns the participant that is not {@code userId}, or null when
   * {@code userId} is not part of this conversation.
   */
  public String otherParticipant(String userId) {
    if (userId == null) {
      return null;
    }
    if (userId.equals(participantA)) {
      return participantB;
    }
    if (userId.equals(participantB)) {
      return participantA;
    }
    return null;
  }

  public int unreadFor(String userId) {
    Integer count = unreadCount.get(userId);
    return count == null ? 0 : count;
  }

  public void setUnreadFor(String userId, int count) {
    unreadCount.put(userId, Math.max(0, count));
  }

  @JsonIgnore
  public Conversation copy() {
    Conversation copy = new Conversation();
    copy.id = id;
    copy.participantA = participantA;
    copy.participantB = participantB;
    copy.lastMessage = lastMessage;
    copy.lastMessageId = lastMessageId;
    copy.unreadCount = new LinkedHashMap<>(unreadCount);
    copy.createdAt = createdAt;
    copy.updatedAt = updatedAt;
    return copy;
  }

  public String getId() { return id; }
  public void setId(String id) { this.id = id; }

  public String getParticipantA() { return participantA; }
  public void setParticipantA(String participantA) { this.participantA = participantA; }

  public String getParticipantB() { return participantB; }
  public void setParticipantB(String participantB) { this.participantB = participantB; }

  public String getLastMessage() { return lastMessage; }
  public void setLastMessage(String lastMessage) { this.lastMessage = lastMessage; }

  public String getLastMessageId() { return lastMessageId; }
  public void setLastMessageId(String lastMessageId) { this.lastMessageId = lastMessageId; }

  public Map<String, Integer> getUnreadCount() { return unreadCount; }
  public void setUnreadCount(Map<String, Integer> unreadCount) {
    this.unreadCount = unreadCount == null ? new LinkedHashMap<>() : new LinkedHashMap<>(unreadCount);
  }

  public Instant getCreatedAt() { return createdAt; }
  public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

  public Instant getUpdatedAt() { return updatedAt; }
  public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
