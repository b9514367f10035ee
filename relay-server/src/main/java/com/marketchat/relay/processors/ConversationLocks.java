package com.marketchat.relay.processors;

import com.marketchat.store.common.StoreUnavailableException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * One serialization slot per conversation id.
 *
 * <p>Actions on the same conversation run one at a time, in arrival order
 * (fair locks); actions on different conversations never contend. Entries
 * are reference counted and dropped once no action holds or waits on them.
 */
@Component
public class ConversationLocks {

  private final long timeoutMs;

  private final Map<String, Slot> slots = new ConcurrentHashMap<>();

  public ConversationLocks(@Value("${relay.action-timeout-ms:5000}") long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  /**
   * Runs {@code action} while holding the conversation's slot.
   *
   * @throws StoreUnavailableException if the slot is not acquired within the
   *     configured timeout
   */
  public <T> T withLock(String conversationId, Supplier<T> action) {
    Slot slot = slots.compute(conversationId, (id, existing) -> {
      Slot target = existing == null ? new Slot() : existing;
      target.references++;
      return target;
    });
    boolean acquired = false;
    try {
      acquired = slot.lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS);
      if (!acquired) {
        throw new StoreUnavailableException(String.format(
            "Conversation %s is busy; no acknowledgment within %d ms", conversationId, timeoutMs));
      }
      return action.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StoreUnavailableException("Interrupted while waiting for conversation " + conversationId, e);
    } finally {
      if (acquired) {
        slot.lock.unlock();
      }
      slots.computeIfPresent(conversationId, (id, existing) -> --existing.references == 0 ? null : existing);
    }
  }

  public void run(String conversationId, Runnable action) {
    withLock(conversationId, () -> {
      action.run();
      return null;
    });
  }

  int activeSlots() {
    return slots.size();
  }

  private static final class Slot {
    private final ReentrantLock lock = new ReentrantLock(true);
    // guarded by the map's compute
    private int references;
  }
}
