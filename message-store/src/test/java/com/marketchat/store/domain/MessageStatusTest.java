package com.marketchat.store.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MessageStatusTest {

  @Test
  void statusesAdvanceFromSentThroughDeliveredToRead() {
    assertThat(MessageStatus.SENT.isBefore(MessageStatus.DELIVERED)).isTrue();
    assertThat(MessageStatus.DELIVERED.isBefore(MessageStatus.READ)).isTrue();
    assertThat(MessageStatus.READ.isBefore(MessageStatus.DELIVERED)).isFalse();
    assertThat(MessageStatus.DELIVERED.isBefore(MessageStatus.DELIVERED)).isFalse();
  }

  @Test
  void onlyReadCountsAsRead() {
    assertThat(MessageStatus.SENT.isUnread()).isTrue();
    assertThat(MessageStatus.DELIVERED.isUnread()).isTrue();
    assertThat(MessageStatus.READ.isUnread()).isFalse();
  }
}
