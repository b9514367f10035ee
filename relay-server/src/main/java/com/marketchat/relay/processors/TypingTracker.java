package com.marketchat.relay.processors;

import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Active typing indicators with an expiry. A started indicator stops by
 * itself after the timeout unless it is refreshed or stopped first.
 */
@Component
public class TypingTracker {

  private static final Logger logger = LoggerFactory.getLogger(TypingTracker.class);

  private final long timeoutMs;
  private final ScheduledExecutorService scheduler;

  private final Map<TypingKey, Indicator> active = new ConcurrentHashMap<>();

  public TypingTracker(@Value("${relay.typing.timeout-ms:3000}") long timeoutMs) {
    this.timeoutMs = timeoutMs;
    this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
      Thread thread = new Thread(r, "typing-expiry");
      thread.setDaemon(true);
      return thread;
    });
  }

  @PreDestroy
  public void shutdown() {
    logger.info("Stopping typing tracker with {} active indicator(s)", active.size());
    scheduler.shutdownNow();
    active.clear();
  }

  /**
   * Starts or refreshes an indicator; {@code onExpire} runs if it is still
   * active when the timeout elapses.
   */
  public void start(String conversationId, String userId, String connectionId, Runnable onExpire) {
    TypingKey key = new TypingKey(conversationId, userId);
    Indicator indicator = new Indicator(connectionId);
    Indicator previous = active.put(key, indicator);
    if (previous != null) {
      previous.cancel();
    }
    indicator.expiry = scheduler.schedule(() -> {
      if (active.remove(key, indicator)) {
        try {
          onExpire.run();
        } catch (RuntimeException e) {
          logger.warn("Typing expiry of {} in {} failed", userId, conversationId, e);
        }
      }
    }, timeoutMs, TimeUnit.MILLISECONDS);
  }

  /**
   * @return true if an indicator was active
   */
  public boolean stop(String conversationId, String userId) {
    Indicator removed = active.remove(new TypingKey(conversationId, userId));
    if (removed == null) {
      return false;
    }
    removed.cancel();
    return true;
  }

  /**
   * Cancels every indicator started from a connection.
   *
   * @return the indicators that were cancelled
   */
  public List<TypingKey> clearConnection(String connectionId) {
    List<TypingKey> cleared = new ArrayList<>();
    for (Map.Entry<TypingKey, Indicator> entry : active.entrySet()) {
      Indicator indicator = entry.getValue();
      if (indicator.connectionId.equals(connectionId) && active.remove(entry.getKey(), indicator)) {
        indicator.cancel();
        cleared.add(entry.getKey());
      }
    }
    return cleared;
  }

  public boolean isTyping(String conversationId, String userId) {
    return active.containsKey(new TypingKey(conversationId, userId));
  }

  /**
   * (conversation, user) pair identifying one indicator.
   */
  public static final class TypingKey {

    private final String conversationId;
    private final String userId;

    public TypingKey(String conversationId, String userId) {
      this.conversationId = conversationId;
      this.userId = userId;
    }

    public String getConversationId() {
      return conversationId;
    }

    public String getUserId() {
      return userId;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof TypingKey)) return false;
      TypingKey other = (TypingKey) o;
      return conversationId.equals(other.conversationId) && userId.equals(other.userId);
    }

    @Override
    public int hashCode() {
      return Objects.hash(conversationId, userId);
    }
  }

  private static final class Indicator {

    private final String connectionId;
    private volatile ScheduledFuture<?> expiry;

    private Indicator(String connectionId) {
      this.connectionId = connectionId;
    }

    private void cancel() {
      ScheduledFuture<?> future = expiry;
      if (future != null) {
        future.cancel(false);
      }
    }
  }
}
