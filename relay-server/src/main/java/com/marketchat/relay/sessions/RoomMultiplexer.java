package com.marketchat.relay.sessions;

import com.marketchat.store.domain.Conversation;
import com.marketchat.store.service.MessageStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Maintains room membership: which connections receive a conversation's live
 * events.
 *
 * <p>Membership only ever comes from explicit joins. All changes for one
 * connection run inside a {@code compute} on {@code roomsByConnection}, which
 * in turn updates {@code membersByRoom}; that keeps both directions in step
 * and never takes the locks in the opposite order.
 */
@Component
public class RoomMultiplexer {

  private static final Logger logger = LoggerFactory.getLogger(RoomMultiplexer.class);

  private final MessageStore messageStore;

  // conversationId -> connectionIds
  private final Map<String, Set<String>> membersByRoom = new ConcurrentHashMap<>();

  // connectionId -> conversationIds
  private final Map<String, Set<String>> roomsByConnection = new ConcurrentHashMap<>();

  public RoomMultiplexer(MessageStore messageStore) {
    this.messageStore = messageStore;
  }

  /**
   * Adds a connection to a room. Idempotent.
   *
   * @return true if the connection was not already a member
   */
  public boolean join(String conversationId, String connectionId) {
    AtomicBoolean added = new AtomicBoolean(false);
    roomsByConnection.compute(connectionId, (id, rooms) -> {
      Set<String> target = rooms == null ? ConcurrentHashMap.newKeySet() : rooms;
      if (target.add(conversationId)) {
        added.set(true);
        membersByRoom.compute(conversationId, (room, members) -> {
          Set<String> updated = members == null ? ConcurrentHashMap.newKeySet() : members;
          updated.add(id);
          return updated;
        });
      }
      return target;
    });
    if (added.get()) {
      logger.debug("Connection {} joined room {}. Room size: {}",
          connectionId, conversationId, membersOf(conversationId).size());
    }
    return added.get();
  }

  /**
   * Joins the connection to every conversation the user takes part in.
   *
   * @return ids of all the user's conversations
   */
  public List<String> joinAll(String userId, String connectionId) {
    List<String> conversationIds = new ArrayList<>();
    for (Conversation conversation : messageStore.conversationsFor(userId)) {
      join(conversation.getId(), connectionId);
      conversationIds.add(conversation.getId());
    }
    logger.info("Connection {} of user {} joined {} conversation rooms",
        connectionId, userId, conversationIds.size());
    return conversationIds;
  }

  /**
   * Removes a connection from one room. No-op if it was not a member.
   */
  public boolean leave(String conversationId, String connectionId) {
    AtomicBoolean removed = new AtomicBoolean(false);
    roomsByConnection.computeIfPresent(connectionId, (id, rooms) -> {
      if (rooms.remove(conversationId)) {
        removed.set(true);
        removeMember(conversationId, id);
      }
      return rooms.isEmpty() ? null : rooms;
    });
    return removed.get();
  }

  /**
   * Removes a connection from every room. Safe for connections that never
   * joined anything.
   *
   * @return the rooms it left
   */
  public Set<String> leaveAll(String connectionId) {
    Set<String> left = ConcurrentHashMap.newKeySet();
    roomsByConnection.computeIfPresent(connectionId, (id, rooms) -> {
      for (String conversationId : rooms) {
        removeMember(conversationId, id);
        left.add(conversationId);
      }
      return null;
    });
    if (!left.isEmpty()) {
      logger.debug("Connection {} left {} rooms", connectionId, left.size());
    }
    return Set.copyOf(left);
  }

  /**
   * Snapshot of the room's current subscribers.
   */
  public Set<String> membersOf(String conversationId) {
    Set<String> members = membersByRoom.get(conversationId);
    return members == null ? Set.of() : Set.copyOf(members);
  }

  public Set<String> roomsOf(String connectionId) {
    Set<String> rooms = roomsByConnection.get(connectionId);
    return rooms == null ? Set.of() : Set.copyOf(rooms);
  }

  /**
   * Gets current room statistics
   */
  public String getRoomStats() {
    int totalMemberships = membersByRoom.values().stream()
        .mapToInt(Set::size)
        .sum();
    return String.format("Active rooms: %d, Total memberships: %d",
        membersByRoom.size(), totalMemberships);
  }

  public int roomCount() {
    return membersByRoom.size();
  }

  private void removeMember(String conversationId, String connectionId) {
    membersByRoom.computeIfPresent(conversationId, (room, members) -> {
      members.remove(connectionId);
      return members.isEmpty() ? null : members;
    });
  }
}
