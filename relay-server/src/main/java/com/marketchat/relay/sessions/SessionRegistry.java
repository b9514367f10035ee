package com.marketchat.relay.sessions;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Which live connections belong to which user.
 *
 * <p>A user may hold any number of connections (tabs, devices). Every change
 * for a given connection id runs inside one atomic {@code compute} on
 * {@code ownerByConnection}, and the per-user sets are only touched from
 * there, so a register racing an unregister for the same id ends in exactly
 * one of the two states. Lock order is always connection map, then user map.
 */
@Component
public class SessionRegistry {

  private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

  // connectionId -> userId
  private final Map<String, String> ownerByConnection = new ConcurrentHashMap<>();

  // userId -> connectionIds
  private final Map<String, Set<String>> connectionsByUser = new ConcurrentHashMap<>();

  /**
   * Binds a connection to a user. Registering the same pair again is a
   * no-op; a connection previously bound to another user is rebound.
   *
   * @return true if this made the user go from offline to online
   */
  public boolean register(String userId, String connectionId) {
    AtomicBoolean cameOnline = new AtomicBoolean(false);
    ownerByConnection.compute(connectionId, (id, previousOwner) -> {
      if (userId.equals(previousOwner)) {
        return previousOwner;
      }
      if (previousOwner != null) {
        detach(previousOwner, id);
      }
      connectionsByUser.compute(userId, (user, ids) -> {
        Set<String> target = ids;
        if (target == null) {
          target = ConcurrentHashMap.newKeySet();
          cameOnline.set(true);
        }
        target.add(id);
        return target;
      });
      return userId;
    });
    if (cameOnline.get()) {
      logger.info("User {} is online (connection {})", userId, connectionId);
    }
    return cameOnline.get();
  }

  /**
   * Removes a connection. Unknown ids are ignored.
   *
   * @return the owner and whether that was their last connection, or empty
   *     when the connection was never registered
   */
  public Optional<Unregistration> unregister(String connectionId) {
    AtomicBoolean wentOffline = new AtomicBoolean(false);
    String[] owner = new String[1];
    ownerByConnection.computeIfPresent(connectionId, (id, userId) -> {
      owner[0] = userId;
      wentOffline.set(detach(userId, id));
      return null;
    });
    if (owner[0] == null) {
      return Optional.empty();
    }
    if (wentOffline.get()) {
      logger.info("User {} is offline (last connection {} closed)", owner[0], connectionId);
    }
    return Optional.of(new Unregistration(owner[0], wentOffline.get()));
  }

  /**
   * Snapshot of the user's live connection ids; empty when offline.
   */
  public Set<String> connectionsFor(String userId) {
    if (userId == null) {
      return Set.of();
    }
    Set<String> ids = connectionsByUser.get(userId);
    return ids == null ? Set.of() : Set.copyOf(ids);
  }

  public Optional<String> userOf(String connectionId) {
    return connectionId == null ? Optional.empty() : Optional.ofNullable(ownerByConnection.get(connectionId));
  }

  public boolean isOnline(String userId) {
    return userId != null && connectionsByUser.containsKey(userId);
  }

  public Set<String> onlineUsers() {
    return new TreeSet<>(connectionsByUser.keySet());
  }

  public int connectionCount() {
    return ownerByConnection.size();
  }

  /**
   * Removes one connection from a user's set.
   *
   * @return true if the set became empty and was dropped
   */
  private boolean detach(String userId, String connectionId) {
    AtomicBoolean emptied = new AtomicBoolean(false);
    connectionsByUser.computeIfPresent(userId, (user, ids) -> {
      ids.remove(connectionId);
      if (ids.isEmpty()) {
        emptied.set(true);
        return null;
      }
      return ids;
    });
    return emptied.get();
  }

  /**
   * Outcome of {@link #unregister}.
   */
  public static class Unregistration {

    private final String userId;
    private final boolean wentOffline;

    public Unregistration(String userId, boolean wentOffline) {
      this.userId = userId;
      this.wentOffline = wentOffline;
    }

    public String getUserId() {
      return userId;
    }

    public boolean isWentOffline() {
      return wentOffline;
    }
  }
}
