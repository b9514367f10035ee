package com.marketchat.relay.processors;

import com.marketchat.relay.domain.ActiveUsersUpdateEvent;
import com.marketchat.relay.domain.ConversationUpdatedEvent;
import com.marketchat.relay.domain.MessagesDeliveredUpdateEvent;
import com.marketchat.relay.domain.MessagesReadUpdateEvent;
import com.marketchat.relay.domain.ReceiveMessageEvent;
import com.marketchat.relay.domain.UserTypingEvent;
import com.marketchat.relay.sessions.ConnectionDirectory;
import com.marketchat.relay.sessions.RoomMultiplexer;
import com.marketchat.relay.sessions.SessionRegistry;
import com.marketchat.store.common.NotFoundException;
import com.marketchat.store.common.PermissionDeniedException;
import com.marketchat.store.common.RelayException;
import com.marketchat.store.common.StoreUnavailableException;
import com.marketchat.store.common.ValidationException;
import com.marketchat.store.domain.Conversation;
import com.marketchat.store.domain.Message;
import com.marketchat.store.domain.SendCommand;
import com.marketchat.store.helpers.MessageValidator;
import com.marketchat.store.processors.DeliveryStateMachine;
import com.marketchat.store.processors.ReadOutcome;
import com.marketchat.store.service.MessageStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Every client action that touches a conversation goes through here.
 *
 * <p>Actions on one conversation run inside that conversation's slot in
 * {@link ConversationLocks}: the store write happens first and events are
 * emitted only after it succeeded, before the slot is released. A failed
 * write therefore emits nothing, and subscribers see one conversation's
 * events in commit order.
 */
@Service
public class EventRelay {

  private static final Logger logger = LoggerFactory.getLogger(EventRelay.class);

  private final MessageStore messageStore;
  private final DeliveryStateMachine stateMachine;
  private final SessionRegistry sessions;
  private final RoomMultiplexer rooms;
  private final ConnectionDirectory directory;
  private final EventBroadcaster broadcaster;
  private final ConversationLocks locks;
  private final TypingTracker typing;
  private final Clock clock;
  private final int maxTextLength;

  private final Counter messagesPersisted;

  public EventRelay(MessageStore messageStore, DeliveryStateMachine stateMachine,
      SessionRegistry sessions, RoomMultiplexer rooms, ConnectionDirectory directory,
      EventBroadcaster broadcaster, ConversationLocks locks, TypingTracker typing, Clock clock, MeterRegistry meterRegistry,
      @Value("${relay.message.max-length:5000}") int maxTextLength) {
    this.messageStore = messageStore;
    this.stateMachine = stateMachine;
    this.sessions = sessions;
    this.rooms = rooms;
    this.directory = directory;
    this.broadcaster = broadcaster;
    this.locks = locks;
    this.typing = typing;
    this.clock = clock;
    this.maxTextLength = maxTextLength;
    this.messagesPersisted = Counter.builder("relay.messages.persisted")
        .description("Messages written to the store")
        .register(meterRegistry);
  }

  /**
   * Persists a new message and pushes it to the room, to every connection
   * of the sender and to every connection of the receiver. When the receiver
   * got it live, the message moves on to delivered.
   *
   * @return the stored message, carrying its durable id
   */
  public Message send(SendCommand command) {
    String problem = MessageValidator.validate(command, maxTextLength);
    if (problem != null) {
      throw new ValidationException(problem);
    }

    return locks.withLock(command.getConversationId(), () -> {
      Conversation conversation = loadConversation(command.getConversationId());
      Message message = stateMachine.create(conversation, command);
      persist(conversation, List.of(message));
      messagesPersisted.increment();
      logger.debug("Message {} persisted in conversation {} ({} -> {})",
          message.getId(), conversation.getId(), message.getSenderId(), message.getReceiverId());

      Set<String> receiverConnections = sessions.connectionsFor(message.getReceiverId());
      Set<String> targets = new LinkedHashSet<>(rooms.membersOf(conversation.getId()));
      targets.addAll(sessions.connectionsFor(message.getSenderId()));
      targets.addAll(receiverConnections);
      Set<String> reached = broadcaster.broadcast(targets, new ReceiveMessageEvent(message.copy()));

      conversationUpserted(conversation);

      if (reached.stream().anyMatch(receiverConnections::contains)) {
        deliverLive(conversation, message);
      }
      return message;
    });
  }

  /**
   * Marks every unread message addressed to the reader as read and resets
   * their counter. A call that changes nothing persists and emits nothing.
   */
  public ReadOutcome markRead(String conversationId, String readerId) {
    requireId("conversationId", conversationId);
    requireId("userId", readerId);
    return locks.withLock(conversationId, () -> {
      Conversation conversation = loadConversation(conversationId);
      List<Message> history = messageStore.messagesFor(conversationId);
      ReadOutcome outcome = stateMachine.markRead(conversation, history, readerId);
      if (outcome.isNoOp()) {
        logger.debug("Nothing to mark read for {} in conversation {}", readerId, conversationId);
        return outcome;
      }

      persist(conversation, outcome.getChangedMessages());
      if (!outcome.getChangedMessages().isEmpty()) {
        broadcaster.broadcast(rooms.membersOf(conversationId), new MessagesReadUpdateEvent(
            conversationId, readerId, messageStore.messagesFor(conversationId), clock.instant()));
      }
      conversationUpserted(conversation);
      logger.debug("{} message(s) marked read by {} in conversation {}",
          outcome.getChangedMessages().size(), readerId, conversationId);
      return outcome;
    });
  }

  /**
   * Marks one message read on behalf of its receiver.
   *
   * @return the message as stored afterwards
   */
  public Message markMessageRead(String messageId, String readerId) {
    requireId("messageId", messageId);
    requireId("userId", readerId);
    String conversationId = messageStore.findMessage(messageId)
        .orElseThrow(() -> NotFoundException.message(messageId))
        .getConversationId();

    return locks.withLock(conversationId, () -> {
      Conversation conversation = loadConversation(conversationId);
      Message message = messageStore.findMessage(messageId)
          .orElseThrow(() -> NotFoundException.message(messageId));
      if (!stateMachine.markMessageRead(conversation, message, readerId)) {
        return message;
      }

      persist(conversation, List.of(message));
      broadcaster.broadcast(rooms.membersOf(conversationId), new MessagesReadUpdateEvent(
          conversationId, readerId, messageStore.messagesFor(conversationId), clock.instant()));
      conversationUpserted(conversation);
      return message;
    });
  }

  /**
   * Moves every sent message addressed to {@code receiverId} to delivered.
   *
   * @return the messages that changed
   */
  public List<Message> markDelivered(String conversationId, String receiverId) {
    return locks.withLock(conversationId, () -> {
      Conversation conversation = loadConversation(conversationId);
      List<Message> changed = stateMachine.markDelivered(
          conversation, messageStore.messagesFor(conversationId), receiverId);
      if (changed.isEmpty()) {
        return changed;
      }
      persist(conversation, changed);
      emitDelivered(conversationId, receiverId);
      return changed;
    });
  }

  /**
   * History of a conversation in creation order. A participant viewer marks
   * what was waiting for them as delivered first.
   *
   * @throws PermissionDeniedException if {@code viewerId} is not a participant
   */
  public List<Message> history(String conversationId, String viewerId) {
    requireId("conversationId", conversationId);
    Conversation conversation = loadConversation(conversationId);
    if (StringUtils.isNotBlank(viewerId)) {
      if (!conversation.hasParticipant(viewerId)) {
        throw PermissionDeniedException.notParticipant(viewerId, conversationId);
      }
      markDelivered(conversationId, viewerId);
    }
    return messageStore.messagesFor(conversationId);
  }

  /**
   * History of the pair's conversation; empty when they never talked.
   */
  public List<Message> historyBetween(String userId, String otherUserId) {
    requireId("userId1", userId);
    requireId("userId2", otherUserId);
    return messageStore.conversationBetween(userId, otherUserId)
        .map(conversation -> messageStore.messagesFor(conversation.getId()))
        .orElse(List.of());
  }

  /**
   * Subscribes a registered connection to one conversation and marks
   * everything waiting there for its user as delivered. A connection whose
   * transport closed in the meantime is taken straight back out.
   *
   * @throws PermissionDeniedException if the connection has not registered
   *     or its user is not a participant
   */
  public void joinRoom(String connectionId, String conversationId) {
    requireId("conversationId", conversationId);
    Conversation conversation = loadConversation(conversationId);
    String userId = sessions.userOf(connectionId)
        .orElseThrow(() -> new PermissionDeniedException(String.format(
            "Connection %s must register before joining conversation %s",
            connectionId, conversationId)));
    if (!conversation.hasParticipant(userId)) {
      throw PermissionDeniedException.notParticipant(userId, conversationId);
    }

    rooms.join(conversationId, connectionId);
    if (!directory.isLive(connectionId)) {
      rooms.leave(conversationId, connectionId);
      logger.debug("Connection {} closed while joining conversation {}", connectionId, conversationId);
      return;
    }
    markDelivered(conversationId, userId);
    announceActiveUsers(conversationId);
  }

  public void startTyping(String conversationId, String userId, String originConnectionId) {
    requireTypingParticipant(conversationId, userId);
    typing.start(conversationId, userId, originConnectionId,
        () -> expireTyping(conversationId, userId, originConnectionId));
    emitTyping(conversationId, userId, originConnectionId, true);
  }

  public void stopTyping(String conversationId, String userId, String originConnectionId) {
    requireTypingParticipant(conversationId, userId);
    typing.stop(conversationId, userId);
    emitTyping(conversationId, userId, originConnectionId, false);
  }

  /**
   * Pushes the conversation summary to every connection of both
   * participants, joined to the room or not.
   */
  public void conversationUpserted(Conversation conversation) {
    Set<String> targets = new LinkedHashSet<>(sessions.connectionsFor(conversation.getParticipantA()));
    targets.addAll(sessions.connectionsFor(conversation.getParticipantB()));
    broadcaster.broadcast(targets, new ConversationUpdatedEvent(conversation.copy()));
  }

  /**
   * Find-or-create for a pair of users. A new conversation is announced to
   * both of them.
   */
  public Conversation openConversation(String userId, String otherUserId) {
    boolean existed = messageStore.conversationBetween(userId, otherUserId).isPresent();
    Conversation conversation = messageStore.findOrCreateConversation(userId, otherUserId);
    if (!existed) {
      logger.info("Conversation {} opened between {} and {}",
          conversation.getId(), conversation.getParticipantA(), conversation.getParticipantB());
      conversationUpserted(conversation);
    }
    return conversation;
  }

  /**
   * Registered users currently subscribed to the conversation.
   */
  public List<String> activeUsers(String conversationId) {
    Set<String> users = new TreeSet<>();
    for (String connectionId : rooms.membersOf(conversationId)) {
      sessions.userOf(connectionId).ifPresent(users::add);
    }
    return List.copyOf(users);
  }

  public void announceActiveUsers(String conversationId) {
    Set<String> members = rooms.membersOf(conversationId);
    if (members.isEmpty()) {
      return;
    }
    broadcaster.broadcast(members, new ActiveUsersUpdateEvent(conversationId, activeUsers(conversationId)));
  }

  /**
   * Clean-up after a connection went away: its typing indicators stop and
   * the rooms it left learn the new set of active users.
   */
  public void connectionClosed(String connectionId, Collection<String> roomsLeft) {
    for (TypingTracker.TypingKey key : typing.clearConnection(connectionId)) {
      try {
        emitTyping(key.getConversationId(), key.getUserId(), connectionId, false);
      } catch (RelayException e) {
        logger.warn("Could not stop typing of {} in {}: {}",
            key.getUserId(), key.getConversationId(), e.getMessage());
      }
    }
    for (String conversationId : roomsLeft) {
      announceActiveUsers(conversationId);
    }
  }

  private void deliverLive(Conversation conversation, Message message) {
    List<Message> changed = stateMachine.markDelivered(
        conversation, List.of(message), message.getReceiverId());
    if (changed.isEmpty()) {
      return;
    }
    try {
      persist(conversation, changed);
    } catch (RelayException e) {
      // the send itself is committed; delivery is picked up on the next join or fetch
      logger.warn("Message {} reached {} but delivered status was not stored: {}",
          message.getId(), message.getReceiverId(), e.getMessage());
      return;
    }
    emitDelivered(conversation.getId(), message.getReceiverId());
  }

  private void emitDelivered(String conversationId, String receiverId) {
    broadcaster.broadcast(rooms.membersOf(conversationId), new MessagesDeliveredUpdateEvent(
        conversationId, receiverId, messageStore.messagesFor(conversationId)));
  }

  private void emitTyping(String conversationId, String userId, String originConnectionId,
      boolean isTyping) {
    locks.run(conversationId, () -> {
      Set<String> targets = new LinkedHashSet<>(rooms.membersOf(conversationId));
      targets.remove(originConnectionId);
      broadcaster.broadcast(targets, new UserTypingEvent(conversationId, userId, isTyping));
    });
  }

  private void expireTyping(String conversationId, String userId, String originConnectionId) {
    logger.debug("Typing indicator of {} in {} expired", userId, conversationId);
    try {
      emitTyping(conversationId, userId, originConnectionId, false);
    } catch (RelayException e) {
      logger.warn("Could not expire typing of {} in {}: {}", userId, conversationId, e.getMessage());
    }
  }

  private void requireTypingParticipant(String conversationId, String userId) {
    requireId("conversationId", conversationId);
    requireId("userId", userId);
    Conversation conversation = loadConversation(conversationId);
    if (!conversation.hasParticipant(userId)) {
      throw PermissionDeniedException.notParticipant(userId, conversationId);
    }
  }

  private Conversation loadConversation(String conversationId) {
    return messageStore.findConversation(conversationId)
        .orElseThrow(() -> NotFoundException.conversation(conversationId));
  }

  private void persist(Conversation conversation, Collection<Message> changed) {
    try {
      messageStore.commit(conversation, changed);
    } catch (RelayException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new StoreUnavailableException("Message store write failed: " + e.getMessage(), e);
    }
  }

  private static void requireId(String field, String value) {
    if (StringUtils.isBlank(value)) {
      throw new ValidationException(field + " missing");
    }
  }
}
