package com.acme.inventory.lock;

import static org.assertj.core.api.Assertions.*;

import com.acme.inventory.config.LockConfig;
import com.acme.inventory.core.Jsons;
import com.acme.inventory.support.InMemoryObjectStore;
import com.acme.inventory.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ObjectStoreLockTest {

  private static final String KEY = "reports/2024/june/iam-june-01-20240601.csv";
  private static final String LOCK_KEY = KEY + ".lock";

  private InMemoryObjectStore store;
  private MutableClock clock;
  private LockConfig config;
  private List<Duration> sleeps;
  private ObjectStoreLock lock;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStore();
    clock = MutableClock.at("2024-06-01T12:00:00Z");
    config = new LockConfig();
    config.setJitterFactor(0.0);
    sleeps = new ArrayList<>();
    lock = new ObjectStoreLock(store, config, clock, sleeps::add);
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  @Nested
  @DisplayName("acquire")
  class Acquire {

    @Test
    @DisplayName("a fresh acquire succeeds with a unique lock id")
    void freshAcquire() {
      AcquireResult first = lock.acquire(KEY, "req-1");
      lock.release(KEY, first.lockId());
      AcquireResult second = lock.acquire(KEY, "req-2");

      assertThat(first.acquired()).isTrue();
      assertThat(second.acquired()).isTrue();
      assertThat(first.lockId()).isNotBlank().isNotEqualTo(second.lockId());
    }

    @Test
    @DisplayName("the lock object uses the documented JSON field names")
    void lockRecordFormat() {
      AcquireResult result = lock.acquire(KEY, "req-1");

      Map<String, String> stored = Jsons.toStringMap(store.getString(LOCK_KEY));
      assertThat(stored)
          .containsEntry("lock_id", result.lockId())
          .containsEntry("request_id", "req-1")
          .containsEntry("timestamp", "2024-06-01T12:00:00Z")
          .containsEntry("expires", "2024-06-01T12:01:00Z");
    }

    @Test
    @DisplayName("a held lock cannot be acquired again")
    void heldLock() {
      lock.acquire(KEY, "req-1");

      AcquireResult second = lock.acquire(KEY, "req-2");

      assertThat(second.acquired()).isFalse();
      assertThat(second.lockId()).isNull();
    }

    @Test
    @DisplayName("without conditional writes acquisition falls back to check-then-put")
    void fallbackWithoutConditionalWrite() {
      InMemoryObjectStore plain = new InMemoryObjectStore(false);
      ObjectStoreLock plainLock = new ObjectStoreLock(plain, config, clock, sleeps::add);

      assertThat(plainLock.acquire(KEY, "req-1").acquired()).isTrue();
      assertThat(plainLock.acquire(KEY, "req-2").acquired()).isFalse();

      clock.advanceSeconds(61);
      assertThat(plainLock.acquire(KEY, "req-3").acquired()).isTrue();
    }

    @Test
    @DisplayName("requiring conditional writes refuses stores without them")
    void requireConditionalWrite() {
      config.setRequireConditionalWrite(true);
      InMemoryObjectStore plain = new InMemoryObjectStore(false);
      ObjectStoreLock strictLock = new ObjectStoreLock(plain, config, clock, sleeps::add);

      assertThat(strictLock.acquire(KEY, "req-1").acquired()).isFalse();
      assertThat(plain.contains(LOCK_KEY)).isFalse();
    }
  }

  @Nested
  @DisplayName("stale detection")
  class Stale {

    @Test
    @DisplayName("no lock is not stale")
    void absent() {
      StaleCheck check = lock.checkStale(KEY);

      assertThat(check.stale()).isFalse();
      assertThat(check.lock()).isEmpty();
    }

    @Test
    @DisplayName("an unexpired lock is not stale")
    void live() {
      String lockId = lock.acquire(KEY, "req-1").lockId();
      clock.advanceSeconds(60);

      StaleCheck check = lock.checkStale(KEY);

      assertThat(check.stale()).isFalse();
      assertThat(check.lock()).map(LockRecord::lockId).contains(lockId);
    }

    @Test
    @DisplayName("an expired lock is detected, broken and re-acquired")
    void expiredLock() {
      lock.acquire(KEY, "crashed-writer");
      clock.advanceSeconds(61);

      assertThat(lock.checkStale(KEY).stale()).isTrue();
      assertThat(lock.breakStale(KEY)).isTrue();
      assertThat(store.contains(LOCK_KEY)).isFalse();
      assertThat(lock.acquire(KEY, "req-2").acquired()).isTrue();
    }

    @Test
    @DisplayName("breakStale leaves a live lock alone")
    void breakLiveLock() {
      lock.acquire(KEY, "req-1");

      assertThat(lock.breakStale(KEY)).isFalse();
      assertThat(store.contains(LOCK_KEY)).isTrue();
    }

    @Test
    @DisplayName("an unreadable lock object counts as stale")
    void unreadable() {
      store.putString(LOCK_KEY, "{garbage");

      StaleCheck check = lock.checkStale(KEY);

      assertThat(check.stale()).isTrue();
      assertThat(check.lock()).isEmpty();
      assertThat(lock.breakStale(KEY)).isTrue();
    }

    @Test
    @DisplayName("breaking a stale lock leaves a lock another writer took in the meantime")
    void breakStaleRacesWithNewOwner() {
      InterleavingStore racing = new InterleavingStore();
      ObjectStoreLock first = new ObjectStoreLock(racing, config, clock, sleeps::add);
      ObjectStoreLock second = new ObjectStoreLock(racing, config, clock, sleeps::add);
      first.acquire(KEY, "crashed-writer");
      clock.advanceSeconds(61);

      List<Boolean> firstBroke = new ArrayList<>();
      AtomicReference<AcquireResult> firstAcquired = new AtomicReference<>();
      racing.afterNextRead(
          () -> {
            firstBroke.add(first.breakStale(KEY));
            firstAcquired.set(first.acquire(KEY, "req-first"));
          });

      boolean secondBroke = second.breakStale(KEY);
      AcquireResult secondAcquired = second.acquire(KEY, "req-second");

      assertThat(firstBroke).containsExactly(true);
      assertThat(firstAcquired.get().acquired()).isTrue();
      assertThat(secondBroke).isFalse();
      assertThat(secondAcquired.acquired()).isFalse();
      assertThat(first.isHeldBy(KEY, firstAcquired.get().lockId())).isTrue();
    }

    @Test
    @DisplayName("a store read error is reported as not stale")
    void readError() {
      lock.acquire(KEY, "req-1");
      store.failReads(true);

      assertThat(lock.checkStale(KEY).stale()).isFalse();
    }
  }

  @Nested
  @DisplayName("release")
  class Release {

    @Test
    @DisplayName("the owner releases; a second release finds no lock")
    void doubleRelease() {
      String lockId = lock.acquire(KEY, "req-1").lockId();

      assertThat(lock.release(KEY, lockId)).isEqualTo(ReleaseResult.RELEASED);
      assertThat(lock.release(KEY, lockId)).isEqualTo(ReleaseResult.NO_SUCH_LOCK);
      assertThat(store.contains(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("a non-owner cannot release")
    void notOwner() {
      lock.acquire(KEY, "req-1");

      assertThat(lock.release(KEY, "someone-else")).isEqualTo(ReleaseResult.NOT_OWNER);
      assertThat(store.contains(LOCK_KEY)).isTrue();
    }

    @Test
    @DisplayName("a store failure is reported as FAILED")
    void storeFailure() {
      String lockId = lock.acquire(KEY, "req-1").lockId();
      store.failReads(true);

      assertThat(lock.release(KEY, lockId)).isEqualTo(ReleaseResult.FAILED);
    }
  }

  @Nested
  @DisplayName("writeWithLock")
  class WriteWithLock {

    @Test
    @DisplayName("uncontended write runs once and releases")
    void uncontended() {
      LockedWriteResult<String> result = lock.writeWithLock(KEY, lockId -> "wrote:" + lockId, "req-1");

      assertThat(result.acquired()).isTrue();
      assertThat(result.value()).isEqualTo("wrote:" + result.lockId());
      assertThat(result.attempts()).isEqualTo(1);
      assertThat(sleeps).isEmpty();
      assertThat(store.contains(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("contention exhausts attempts with exponential backoff and a structured failure")
    void contention() {
      lock.acquire(KEY, "other-writer");
      AtomicInteger writes = new AtomicInteger();

      LockedWriteResult<Integer> result = lock.writeWithLock(KEY, id -> writes.incrementAndGet(), 3, "req-1");

      assertThat(result.acquired()).isFalse();
      assertThat(result.attempts()).isEqualTo(3);
      assertThat(result.message()).contains("after 3 attempts");
      assertThat(writes).hasValue(0);
      assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("a stale lock is broken before the retry")
    void breaksStaleLockOnRetry() {
      lock.acquire(KEY, "crashed-writer");
      clock.advanceSeconds(120);

      LockedWriteResult<String> result = lock.writeWithLock(KEY, id -> "ok", "req-1");

      assertThat(result.acquired()).isTrue();
      assertThat(result.attempts()).isEqualTo(2);
      assertThat(store.contains(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("the writer does not run when the lock no longer carries its id")
    void lockLostAfterAcquire() {
      InMemoryObjectStore overwriting =
          new InMemoryObjectStore() {
            @Override
            public boolean putIfAbsent(String key, byte[] content, String contentType) {
              boolean created = super.putIfAbsent(key, content, contentType);
              Instant now = clock.instant();
              putString(
                  key,
                  Jsons.toJson(new LockRecord("intruder", now, now.plusSeconds(60), "req-other")));
              return created;
            }
          };
      ObjectStoreLock contested = new ObjectStoreLock(overwriting, config, clock, sleeps::add);
      AtomicInteger writes = new AtomicInteger();

      LockedWriteResult<Integer> result =
          contested.writeWithLock(KEY, id -> writes.incrementAndGet(), 2, "req-1");

      assertThat(result.acquired()).isFalse();
      assertThat(writes).hasValue(0);
      assertThat(contested.isHeldBy(KEY, "intruder")).isTrue();
    }

    @Test
    @DisplayName("writer exceptions propagate after the lock is released")
    void writerFailure() {
      assertThatThrownBy(
              () ->
                  lock.writeWithLock(
                      KEY,
                      id -> {
                        throw new IllegalStateException("disk full");
                      },
                      "req-1"))
          .isInstanceOf(IllegalStateException.class)
          .hasMessage("disk full");
      assertThat(store.contains(LOCK_KEY)).isFalse();
    }

    @Test
    @DisplayName("an interrupted backoff stops retrying")
    void interrupted() {
      lock.acquire(KEY, "other-writer");
      ObjectStoreLock interruptible =
          new ObjectStoreLock(
              store,
              config,
              clock,
              d -> {
                throw new InterruptedException();
              });

      LockedWriteResult<String> result = interruptible.writeWithLock(KEY, id -> "ok", 5, "req-1");

      assertThat(result.acquired()).isFalse();
      assertThat(result.message()).contains("Interrupted");
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    @DisplayName("concurrent writers never overlap")
    void mutualExclusion() throws Exception {
      ObjectStoreLock shared = new ObjectStoreLock(store, config, clock, d -> Thread.sleep(1));
      AtomicInteger active = new AtomicInteger();
      AtomicInteger maxActive = new AtomicInteger();
      AtomicInteger completed = new AtomicInteger();
      ExecutorService pool = Executors.newFixedThreadPool(6);
      List<Future<LockedWriteResult<Integer>>> futures = new ArrayList<>();
      try {
        for (int i = 0; i < 6; i++) {
          String requestId = "req-" + i;
          futures.add(
              pool.submit(
                  () ->
                      shared.writeWithLock(
                          KEY,
                          id -> {
                            int now = active.incrementAndGet();
                            maxActive.accumulateAndGet(now, Math::max);
                            try {
                              Thread.sleep(5);
                            } catch (InterruptedException e) {
                              Thread.currentThread().interrupt();
                            }
                            active.decrementAndGet();
                            return completed.incrementAndGet();
                          },
                          10_000,
                          requestId)));
        }
        for (Future<LockedWriteResult<Integer>> f : futures) {
          assertThat(f.get(30, TimeUnit.SECONDS).acquired()).isTrue();
        }
      } finally {
        pool.shutdownNow();
      }

      assertThat(completed).hasValue(6);
      assertThat(maxActive).hasValue(1);
    }
  }

  /** Runs a hook once, right after the next read returns its value to the reader. */
  private static class InterleavingStore extends InMemoryObjectStore {
    private final AtomicReference<Runnable> pending = new AtomicReference<>();

    void afterNextRead(Runnable hook) {
      pending.set(hook);
    }

    @Override
    public Optional<byte[]> get(String key) {
      Optional<byte[]> value = super.get(key);
      Runnable hook = pending.getAndSet(null);
      if (hook != null) {
        hook.run();
      }
      return value;
    }
  }
}
