package com.marketchat.relay.processors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marketchat.store.common.StoreUnavailableException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConversationLocksTest {

  private final ExecutorService pool = Executors.newFixedThreadPool(4);

  @AfterEach
  void tearDown() {
    pool.shutdownNow();
  }

  @Test
  void actionsOnOneConversationNeverOverlap() throws Exception {
    ConversationLocks locks = new ConversationLocks(5000);
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();

    Future<?>[] futures = new Future<?>[8];
    for (int i = 0; i < futures.length; i++) {
      futures[i] = pool.submit(() -> locks.run("conv-1", () -> {
        maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
        sleep(5);
        inside.decrementAndGet();
      }));
    }
    for (Future<?> future : futures) {
      future.get();
    }

    assertThat(maxInside.get()).isEqualTo(1);
    assertThat(locks.activeSlots()).isZero();
  }

  @Test
  void differentConversationsRunInParallel() throws Exception {
    ConversationLocks locks = new ConversationLocks(5000);
    CountDownLatch bothInside = new CountDownLatch(2);

    Future<Boolean> first = pool.submit(() -> locks.withLock("conv-1", () -> await(bothInside)));
    Future<Boolean> second = pool.submit(() -> locks.withLock("conv-2", () -> await(bothInside)));

    assertThat(first.get()).isTrue();
    assertThat(second.get()).isTrue();
  }

  @Test
  void busyConversationTimesOutAsStoreUnavailable() throws Exception {
    ConversationLocks locks = new ConversationLocks(50);
    CountDownLatch holding = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    Future<?> holder = pool.submit(() -> locks.run("conv-1", () -> {
      holding.countDown();
      awaitQuietly(release);
    }));
    holding.await();

    assertThatThrownBy(() -> locks.run("conv-1", () -> { }))
        .isInstanceOf(StoreUnavailableException.class)
        .hasMessageContaining("conv-1");

    release.countDown();
    holder.get();
    assertThat(locks.activeSlots()).isZero();
  }

  @Test
  void slotIsReleasedWhenTheActionThrows() {
    ConversationLocks locks = new ConversationLocks(50);

    assertThatThrownBy(() -> locks.run("conv-1", () -> {
      throw new IllegalStateException("boom");
    })).isInstanceOf(IllegalStateException.class);

    assertThat(locks.withLock("conv-1", () -> "again")).isEqualTo("again");
    assertThat(locks.activeSlots()).isZero();
  }

  private static boolean await(CountDownLatch latch) {
    latch.countDown();
    try {
      return latch.await(2, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private static void awaitQuietly(CountDownLatch latch) {
    try {
      latch.await(2, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
