package com.marketchat.store.processors;

import com.marketchat.store.common.PermissionDeniedException;
import com.marketchat.store.domain.Attachment;
import com.marketchat.store.domain.Conversation;
import com.marketchat.store.domain.Message;
import com.marketchat.store.domain.MessageKind;
import com.marketchat.store.domain.MessageStatus;
import com.marketchat.store.domain.SendCommand;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.apache.commons.lang3.StringUtils;

/**
 * Status transitions for messages and the unread counters they drive.
 *
 * <p>Pure logic: callers load the conversation and its messages, apply a
 * transition here, and persist whatever comes back changed. Status only
 * advances (sent, delivered, read); {@code readAt} is set exactly when a
 * message reaches READ.
 */
public class DeliveryStateMachine {

  private final Clock clock;

  public DeliveryStateMachine() {
    this(Clock.systemUTC());
  }

  public DeliveryStateMachine(Clock clock) {
    this.clock = clock;
  }

  /**
   * Creates a SENT message, bumps the receiver's unread counter and refreshes
   * the conversation preview.
   *
   * @throws PermissionDeniedException if the sender is not a participant or
   *     the receiver is not the other participant
   */
  public Message create(Conversation conversation, SendCommand command) {
    String senderId = command.getSenderId();
    String receiverId = command.getReceiverId();
    if (!conversation.hasParticipant(senderId)) {
      throw PermissionDeniedException.notParticipant(senderId, conversation.getId());
    }
    if (!StringUtils.equals(receiverId, conversation.otherParticipant(senderId))) {
      throw new PermissionDeniedException(String.format(
          "Receiver %s is not the other participant of conversation %s",
          receiverId, conversation.getId()));
    }

    Instant now = clock.instant();
    Message message = new Message();
    message.setId(UUID.randomUUID().toString());
    message.setConversationId(conversation.getId());
    message.setSenderId(senderId);
    message.setReceiverId(receiverId);
    message.setText(StringUtils.defaultString(command.getText()));
    message.setAttachment(command.getFile() == null ? null : command.getFile().copy());
    message.setKind(command.resolveKind());
    message.setStatus(MessageStatus.SENT);
    message.setCreatedAt(now);

    conversation.setUnreadFor(receiverId, conversation.unreadFor(receiverId) + 1);
    conversation.setLastMessage(preview(message));
    conversation.setLastMessageId(message.getId());
    conversation.setUpdatedAt(now);
    return message;
  }

  /**
   * Moves every SENT message addressed to {@code receiverId} to DELIVERED.
   * Counters are untouched.
   *
   * @return the messages that changed, empty when nothing did
   */
  public List<Message> markDelivered(Conversation conversation, Collection<Message> messages,
      String receiverId) {
    requireParticipant(conversation, receiverId);
    List<Message> changed = new ArrayList<>();
    for (Message message : messages) {
      if (belongsTo(conversation, message) && message.isAddressedTo(receiverId)
          && message.getStatus().isBefore(MessageStatus.DELIVERED)) {
        message.setStatus(MessageStatus.DELIVERED);
        changed.add(message);
      }
    }
    return changed;
  }

  /**
   * Moves every unread message addressed to {@code readerId} to READ and
   * resets the reader's unread counter. Calling it again changes nothing.
   */
  public ReadOutcome markRead(Conversation conversation, Collection<Message> messages,
      String readerId) {
    requireParticipant(conversation, readerId);
    Instant now = clock.instant();
    List<Message> changed = new ArrayList<>();
    for (Message message : messages) {
      if (belongsTo(conversation, message) && message.isAddressedTo(readerId)
          && message.getStatus().isUnread()) {
        advanceToRead(message, now);
        changed.add(message);
      }
    }
    boolean counterReset = conversation.unreadFor(readerId) != 0;
    conversation.setUnreadFor(readerId, 0);
    return new ReadOutcome(changed, counterReset);
  }

  /**
   * Marks a single message read on behalf of its receiver.
   *
   * @return false when the message was already READ
   * @throws PermissionDeniedException if {@code readerId} is not the receiver
   */
  public boolean markMessageRead(Conversation conversation, Message message, String readerId) {
    if (!message.isAddressedTo(readerId)) {
      throw new PermissionDeniedException(String.format(
          "User %s is not the receiver of message %s", readerId, message.getId()));
    }
    if (!message.getStatus().isUnread()) {
      return false;
    }
    advanceToRead(message, clock.instant());
    conversation.setUnreadFor(readerId, conversation.unreadFor(readerId) - 1);
    return true;
  }

  /**
   * Conversation-list preview for a message.
   */
  public static String preview(Message message) {
    if (StringUtils.isNotBlank(message.getText())) {
      return message.getText();
    }
    Attachment file = message.getAttachment();
    MessageKind kind = message.getKind() == null ? MessageKind.TEXT : message.getKind();
    switch (kind) {
      case IMAGE:
        return "Sent an image";
      case VOICE:
        return "Sent a voice message";
      case DOCUMENT:
        return file != null && StringUtils.isNotBlank(file.getName())
            ? "Sent a document: " + file.getName()
            : "Sent a document";
      default:
        return "";
    }
  }

  private static void advanceToRead(Message message, Instant now) {
    message.setStatus(MessageStatus.READ);
    message.setReadAt(now);
  }

  private static boolean belongsTo(Conversation conversation, Message message) {
    return StringUtils.equals(conversation.getId(), message.getConversationId());
  }

  private static void requireParticipant(Conversation conversation, String userId) {
    if (!conversation.hasParticipant(userId)) {
      throw PermissionDeniedException.notParticipant(userId, conversation.getId());
    }
  }
}
