package com.marketchat.store.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Delivery status of a message. Only ever advances: SENT, DELIVERED, READ.
 */
public enum MessageStatus {
  @JsonProperty("sent") SENT(0),
  @JsonProperty("delivered") DELIVERED(1),
  @JsonProperty("read") READ(2);

  private final int rank;

  MessageStatus(int rank) {
    this.rank = rank;
  }

  /**
   * True when moving from this status to {@code other} is an advance.
   */
  public boolean isBefore(MessageStatus other) {
    return rank < other.rank;
  }

  public boolean isUnread() {
    return isBefore(READ);
  }
}
