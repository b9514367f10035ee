package com.marketchat.store.service;

import com.marketchat.store.domain.Conversation;
import com.marketchat.store.domain.Message;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable keeper of conversations and messages, and the source of truth for
 * history and delivery state.
 *
 * <p>Every method returns detached copies; mutating a returned object has no
 * effect until it is passed back through {@link #commit}. Implementations
 * signal an unreachable or timed-out backend with
 * {@link com.marketchat.store.common.StoreUnavailableException}.
 */
public interface MessageStore {

  /**
   * Returns the single conversation for the unordered pair, creating it on
   * first contact.
   *
   * @throws com.marketchat.store.common.ValidationException if either id is
   *     blank or both are equal
   */
  Conversation findOrCreateConversation(String userId, String otherUserId);

  Optional<Conversation> findConversation(String conversationId);

  Optional<Conversation> conversationBetween(String userId, String otherUserId);

  /**
   * Conversations the user participates in, most recently updated first.
   */
  List<Conversation> conversationsFor(String userId);

  /**
   * History of a conversation in creation order. Empty for unknown ids.
   */
  List<Message> messagesFor(String conversationId);

  Optional<Message> findMessage(String messageId);

  /**
   * Atomically writes a conversation together with new or changed messages
   * belonging to it. On failure nothing is written.
   *
   * @throws com.marketchat.store.common.NotFoundException if the conversation
   *     does not exist
   */
  void commit(Conversation conversation, Collection<Message> messages);

  /**
   * One-line summary of what the store holds, for status pages.
   */
  String getStoreStats();
}
