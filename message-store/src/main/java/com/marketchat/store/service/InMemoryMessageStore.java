package com.marketchat.store.service;

import com.marketchat.store.common.NotFoundException;
import com.marketchat.store.common.ValidationException;
import com.marketchat.store.domain.Conversation;
import com.marketchat.store.domain.Message;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link MessageStore}. Commits are atomic with respect to
 * readers; callers only ever see copies.
 */
public class InMemoryMessageStore implements MessageStore {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageStore.class);

  private final Clock clock;

  // conversationId -> conversation
  private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

  // sorted participant pair -> conversationId
  private final Map<String, String> conversationByPair = new ConcurrentHashMap<>();

  // messageId -> message
  private final Map<String, Message> messages = new ConcurrentHashMap<>();

  // conversationId -> message ids in creation order
  private final Map<String, List<String>> history = new ConcurrentHashMap<>();

  private final ReadWriteLock commitLock = new ReentrantReadWriteLock();

  public InMemoryMessageStore() {
    this(Clock.systemUTC());
  }

  public InMemoryMessageStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public Conversation findOrCreateConversation(String userId, String otherUserId) {
    if (StringUtils.isAnyBlank(userId, otherUserId)) {
      throw new ValidationException("both participant ids are required");
    }
    if (userId.equals(otherUserId)) {
      throw new ValidationException("a conversation needs two distinct participants");
    }
    String conversationId = conversationByPair.computeIfAbsent(pairKey(userId, otherUserId), key -> {
      Conversation created = new Conversation(
          UUID.randomUUID().toString(), userId, otherUserId, clock.instant());
      conversations.put(created.getId(), created);
      history.put(created.getId(), new CopyOnWriteArrayList<>());
      logger.info("Created conversation {} between {} and {}", created.getId(), userId, otherUserId);
      return created.getId();
    });
    return read(() -> conversations.get(conversationId).copy());
  }

  @Override
  public Optional<Conversation> findConversation(String conversationId) {
    if (conversationId == null) {
      return Optional.empty();
    }
    return read(() -> Optional.ofNullable(conversations.get(conversationId)).map(Conversation::copy));
  }

  @Override
  public Optional<Conversation> conversationBetween(String userId, String otherUserId) {
    if (StringUtils.isAnyBlank(userId, otherUserId)) {
      return Optional.empty();
    }
    String conversationId = conversationByPair.get(pairKey(userId, otherUserId));
    return findConversation(conversationId);
  }

  @Override
  public List<Conversation> conversationsFor(String userId) {
    if (StringUtils.isBlank(userId)) {
      return new ArrayList<>();
    }
    return read(() -> {
      List<Conversation> result = new ArrayList<>();
      for (Conversation conversation : conversations.values()) {
        if (conversation.hasParticipant(userId)) {
          result.add(conversation.copy());
        }
      }
      result.sort(Comparator.comparing(Conversation::getUpdatedAt).reversed()
          .thenComparing(Conversation::getId));
      return result;
    });
  }

  @Override
  public List<Message> messagesFor(String conversationId) {
    if (conversationId == null) {
      return new ArrayList<>();
    }
    return read(() -> {
      List<Message> result = new ArrayList<>();
      for (String messageId : history.getOrDefault(conversationId, List.of())) {
        Message message = messages.get(messageId);
        if (message != null) {
          result.add(message.copy());
        }
      }
      return result;
    });
  }

  @Override
  public Optional<Message> findMessage(String messageId) {
    if (messageId == null) {
      return Optional.empty();
    }
    return read(() -> Optional.ofNullable(messages.get(messageId)).map(Message::copy));
  }

  @Override
  public void commit(Conversation conversation, Collection<Message> changed) {
    commitLock.writeLock().lock();
    try {
      if (!conversations.containsKey(conversation.getId())) {
        throw NotFoundException.conversation(conversation.getId());
      }
      for (Message message : changed) {
        if (!conversation.getId().equals(message.getConversationId())) {
          throw new IllegalArgumentException(String.format(
              "Message %s does not belong to conversation %s", message.getId(), conversation.getId()));
        }
      }
      conversations.put(conversation.getId(), conversation.copy());
      List<String> ids = history.computeIfAbsent(conversation.getId(), k -> new CopyOnWriteArrayList<>());
      for (Message message : changed) {
        if (messages.put(message.getId(), message.copy()) == null) {
          ids.add(message.getId());
        }
      }
      logger.debug("Committed conversation {} with {} message(s)", conversation.getId(), changed.size());
    } finally {
      commitLock.writeLock().unlock();
    }
  }

  /**
   * Gets current store statistics
   */
  @Override
  public String getStoreStats() {
    return String.format("Conversations: %d, Messages: %d", conversations.size(), messages.size());
  }

  private <T> T read(Supplier<T> reader) {
    commitLock.readLock().lock();
    try {
      return reader.get();
    } finally {
      commitLock.readLock().unlock();
    }
  }

  private static String pairKey(String userId, String otherUserId) {
    return userId.compareTo(otherUserId) <= 0
        ? userId + '\u0000' + otherUserId
        : otherUserId + '\u0000' + userId;
  }
}
