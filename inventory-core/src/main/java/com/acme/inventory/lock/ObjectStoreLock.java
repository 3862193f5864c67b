package com.acme.inventory.lock;

import com.acme.inventory.config.LockConfig;
import com.acme.inventory.core.Jsons;
import com.acme.inventory.spi.ObjectStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advisory lock over an {@link ObjectStore}, held as a JSON object at {@code <key>.lock}.
 *
 * <p>Holders cooperate: nothing stops a writer that ignores the lock. Expired locks are treated as
 * abandoned and may be deleted by any contender before it retries. When the store offers an atomic
 * create the lock uses it; otherwise acquisition is a check-then-put that two contenders can both
 * win, which is logged once per instance (or refused outright when {@link
 * LockConfig#isRequireConditionalWrite()} is set).
 */
public class ObjectStoreLock {
  private static final Logger LOG = LoggerFactory.getLogger(ObjectStoreLock.class);

  static final String LOCK_SUFFIX = ".lock";
  private static final String CONTENT_TYPE = "application/json";

  private final ObjectStore store;
  private final LockConfig config;
  private final Clock clock;
  private final Sleeper sleeper;
  private final AtomicBoolean capabilityGapLogged = new AtomicBoolean();

  public ObjectStoreLock(ObjectStore store, LockConfig config) {
    this(store, config, Clock.systemUTC(), Sleeper.SYSTEM);
  }

  public ObjectStoreLock(ObjectStore store, LockConfig config, Clock clock, Sleeper sleeper) {
    this.store = store;
    this.config = config;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public static String lockKey(String key) {
    return key + LOCK_SUFFIX;
  }

  public AcquireResult acquire(String key, String requestId) {
    return acquire(key, config.getTimeout(), requestId);
  }

  public AcquireResult acquire(String key, Duration timeout, String requestId) {
    String lockKey = lockKey(key);
    String lockId = UUID.randomUUID().toString();
    Instant now = clock.instant();
    byte[] content = Jsons.toBytes(new LockRecord(lockId, now, now.plus(timeout), requestId));

    LOG.info(
        "Attempting to acquire lock {} (lockId={}, requestId={}, timeout={})",
        lockKey,
        lockId,
        requestId,
        timeout);
    try {
      boolean created;
      if (store.supportsConditionalWrite()) {
        created = store.putIfAbsent(lockKey, content, CONTENT_TYPE);
      } else {
        created = acquireWithoutConditionalWrite(lockKey, content, now);
      }
      if (!created) {
        LOG.info("Lock {} is held by another writer (requestId={})", lockKey, requestId);
        return AcquireResult.notAcquired();
      }
      LOG.info("Acquired lock {} (lockId={}, requestId={})", lockKey, lockId, requestId);
      return AcquireResult.acquired(lockId);
    } catch (RuntimeException e) {
      LOG.error("Error acquiring lock {} (requestId={})", lockKey, requestId, e);
      return AcquireResult.notAcquired();
    }
  }

  private boolean acquireWithoutConditionalWrite(String lockKey, byte[] content, Instant now) {
    if (config.isRequireConditionalWrite()) {
      LOG.error(
          "Store {} has no conditional write and lock.require-conditional-write is set; refusing {}",
          store.getClass().getSimpleName(),
          lockKey);
      return false;
    }
    if (capabilityGapLogged.compareAndSet(false, true)) {
      LOG.warn(
          "Store {} has no conditional write; lock acquisition is check-then-put and may race",
          store.getClass().getSimpleName());
    }
    Optional<byte[]> existing = store.get(lockKey);
    if (existing.isPresent()) {
      Optional<LockRecord> current = parse(existing.get());
      if (current.isPresent() && !isStale(current.get(), now)) {
        return false;
      }
    }
    store.put(lockKey, content, CONTENT_TYPE);
    return true;
  }

  public StaleCheck checkStale(String key) {
    String lockKey = lockKey(key);
    Optional<byte[]> content = readLock(lockKey);
    if (content.isEmpty()) {
      return StaleCheck.absent();
    }
    return evaluate(lockKey, content.get());
  }

  /**
   * Deletes the lock object if it is stale. The delete only goes through while the object still
   * holds the content that was judged stale, so a lock another writer took in the meantime stays.
   * Returns true when a stale lock was removed.
   */
  public boolean breakStale(String key) {
    String lockKey = lockKey(key);
    Optional<byte[]> content = readLock(lockKey);
    if (content.isEmpty()) {
      return false;
    }
    StaleCheck check = evaluate(lockKey, content.get());
    if (!check.stale()) {
      return false;
    }
    String staleLockId = check.lock().map(LockRecord::lockId).orElse("unreadable");
    try {
      if (!store.deleteIfUnchanged(lockKey, content.get())) {
        LOG.info(
            "Lock {} changed since it was found stale (staleLockId={}), leaving it",
            lockKey,
            staleLockId);
        return false;
      }
      LOG.info("Broke stale lock {} (staleLockId={})", lockKey, staleLockId);
      return true;
    } catch (RuntimeException e) {
      LOG.error("Error breaking stale lock {}", lockKey, e);
      return false;
    }
  }

  /** Whether the lock object currently carries {@code lockId}. Read errors answer false. */
  public boolean isHeldBy(String key, String lockId) {
    String lockKey = lockKey(key);
    Optional<byte[]> content = readLock(lockKey);
    return content.flatMap(ObjectStoreLock::parse).map(r -> lockId.equals(r.lockId())).orElse(false);
  }

  // empty on a missing object and on a read error
  private Optional<byte[]> readLock(String lockKey) {
    try {
      Optional<byte[]> content = store.get(lockKey);
      if (content.isEmpty()) {
        LOG.debug("No lock exists at {}", lockKey);
      }
      return content;
    } catch (RuntimeException e) {
      LOG.error("Error checking lock {}", lockKey, e);
      return Optional.empty();
    }
  }

  private StaleCheck evaluate(String lockKey, byte[] content) {
    Optional<LockRecord> lock = parse(content);
    if (lock.isEmpty()) {
      LOG.warn("Lock {} is unreadable, treating it as stale", lockKey);
      return StaleCheck.unreadable();
    }

    LockRecord record = lock.get();
    Instant now = clock.instant();
    if (isStale(record, now)) {
      LOG.info(
          "Found stale lock {} (lockId={}, ownerRequestId={}, expired {}s ago)",
          lockKey,
          record.lockId(),
          record.ownerRequestId(),
          record.expiresAt() == null ? "?" : Duration.between(record.expiresAt(), now).toSeconds());
      return StaleCheck.of(true, record);
    }
    LOG.debug(
        "Lock {} is still valid (lockId={}, ownerRequestId={})",
        lockKey,
        record.lockId(),
        record.ownerRequestId());
    return StaleCheck.of(false, record);
  }

  /** Deletes the lock object only if it still carries {@code lockId}. */
  public ReleaseResult release(String key, String lockId) {
    String lockKey = lockKey(key);
    try {
      Optional<byte[]> content = store.get(lockKey);
      if (content.isEmpty()) {
        LOG.warn("Cannot release lock {} (lockId={}): lock does not exist", lockKey, lockId);
        return ReleaseResult.NO_SUCH_LOCK;
      }
      Optional<LockRecord> current = parse(content.get());
      if (current.isEmpty() || !lockId.equals(current.get().lockId())) {
        LOG.warn(
            "Cannot release lock {} (lockId={}): owned by {}",
            lockKey,
            lockId,
            current.map(LockRecord::lockId).orElse("unreadable record"));
        return ReleaseResult.NOT_OWNER;
      }
      if (!store.deleteIfUnchanged(lockKey, content.get())) {
        LOG.warn("Cannot release lock {} (lockId={}): it changed during release", lockKey, lockId);
        return ReleaseResult.NOT_OWNER;
      }
      LOG.info("Released lock {} (lockId={})", lockKey, lockId);
      return ReleaseResult.RELEASED;
    } catch (RuntimeException e) {
      LOG.error("Error releasing lock {} (lockId={})", lockKey, lockId, e);
      return ReleaseResult.FAILED;
    }
  }

  public <T> LockedWriteResult<T> writeWithLock(String key, LockedWriter<T> writer, String requestId) {
    return writeWithLock(key, writer, config.getMaxAttempts(), requestId);
  }

  /**
   * Runs {@code writer} while holding the lock on {@code key}, retrying acquisition with
   * exponential backoff and jitter. The lock is released after the writer returns or throws; a
   * writer exception reaches the caller after the release.
   */
  public <T> LockedWriteResult<T> writeWithLock(
      String key, LockedWriter<T> writer, int maxAttempts, String requestId) {
    LOG.info(
        "Write to {} with locking (requestId={}, maxAttempts={}, {})",
        key,
        requestId,
        maxAttempts,
        config);
    Duration totalWait = Duration.ZERO;

    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      if (attempt > 0) {
        if (breakStale(key)) {
          LOG.info("Broke stale lock on {} before attempt {}/{}", key, attempt + 1, maxAttempts);
        }
        Duration wait = backoff(attempt);
        LOG.info(
            "Waiting {}ms before lock attempt {}/{} on {} (requestId={})",
            wait.toMillis(),
            attempt + 1,
            maxAttempts,
            key,
            requestId);
        try {
          sleeper.sleep(wait);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          LOG.warn("Interrupted while waiting for lock on {} (requestId={})", key, requestId);
          return LockedWriteResult.lockFailed(
              attempt, "Interrupted while waiting for lock on " + key);
        }
        totalWait = totalWait.plus(wait);
      }

      AcquireResult acquired = acquire(key, requestId);
      if (!acquired.acquired()) {
        LOG.warn(
            "Could not acquire lock on {} (attempt {}/{}, requestId={})",
            key,
            attempt + 1,
            maxAttempts,
            requestId);
        continue;
      }
      if (!isHeldBy(key, acquired.lockId())) {
        LOG.warn(
            "Lock on {} no longer carries lockId={} after acquisition (attempt {}/{}, requestId={})",
            key,
            acquired.lockId(),
            attempt + 1,
            maxAttempts,
            requestId);
        continue;
      }

      try {
        T value = writer.write(acquired.lockId());
        return LockedWriteResult.written(value, acquired.lockId(), attempt + 1);
      } finally {
        ReleaseResult released = release(key, acquired.lockId());
        if (released != ReleaseResult.RELEASED) {
          LOG.warn("Failed to release lock on {} (lockId={}): {}", key, acquired.lockId(), released);
        }
      }
    }

    LOG.error(
        "Failed to acquire lock on {} after {} attempts (waited {}ms, requestId={})",
        key,
        maxAttempts,
        totalWait.toMillis(),
        requestId);
    return LockedWriteResult.lockFailed(
        maxAttempts, "Failed to acquire lock on " + key + " after " + maxAttempts + " attempts");
  }

  Duration backoff(int attempt) {
    double jitter =
        config.getJitterFactor() > 0
            ? ThreadLocalRandom.current().nextDouble(0, config.getJitterFactor())
            : 0.0;
    double seconds = Math.pow(config.getBaseBackoffSeconds(), attempt) + jitter;
    return Duration.ofMillis(Math.round(seconds * 1000));
  }

  // a record without expiry counts as stale
  private static boolean isStale(LockRecord record, Instant now) {
    return record.expiresAt() == null || record.isExpired(now);
  }

  private static Optional<LockRecord> parse(byte[] content) {
    try {
      return Optional.ofNullable(Jsons.fromJson(content, LockRecord.class));
    } catch (IllegalArgumentException e) {
      LOG.debug("Unparseable lock record: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
