package com.acme.inventory.lock;

/**
 * Outcome of {@link ObjectStoreLock#writeWithLock}. When {@code acquired} is false the writer never
 * ran and {@code message} says why.
 */
public record LockedWriteResult<T>(
    boolean acquired, T value, String lockId, int attempts, String message) {

  public static <T> LockedWriteResult<T> written(T value, String lockId, int attempts) {
    return new LockedWriteResult<>(true, value, lockId, attempts, null);
  }

  public static <T> LockedWriteResult<T> lockFailed(int attempts, String message) {
    return new LockedWriteResult<>(false, null, null, attempts, message);
  }
}
