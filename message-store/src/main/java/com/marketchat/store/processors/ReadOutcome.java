package com.marketchat.store.processors;

import com.marketchat.store.domain.Message;
import java.util.Collections;
import java.util.List;

/**
 * Result of a bulk read transition: the messages that moved to READ and
 * whether the reader's unread counter had to be reset.
 */
public class ReadOutcome {

  private final List<Message> changedMessages;
  private final boolean counterReset;

  public ReadOutcome(List<Message> changedMessages, boolean counterReset) {
    this.changedMessages = Collections.unmodifiableList(changedMessages);
    this.counterReset = counterReset;
  }

  public List<Message> getChangedMessages() {
    return changedMessages;
  }

  public boolean isCounterReset() {
    return counterReset;
  }

  /**
   * True when the transition changed nothing and must not be persisted or
   * announced.
   */
  public boolean isNoOp() {
    return changedMessages.isEmpty() && !counterReset;
  }
}
