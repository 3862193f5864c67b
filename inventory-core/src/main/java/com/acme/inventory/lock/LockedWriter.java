package com.acme.inventory.lock;

/** Work performed while holding the lock; receives the id of the held lock. */
@FunctionalInterface
public interface LockedWriter<T> {
  T write(String lockId);
}
