package com.acme.inventory.lock;

import java.util.Optional;

/**
 * Result of inspecting a lock object. {@code lock} is empty when no lock exists, when it could not
 * be read, or when its content was not a valid lock record.
 */
public record StaleCheck(boolean stale, Optional<LockRecord> lock) {

  static StaleCheck absent() {
    return new StaleCheck(false, Optional.empty());
  }

  static StaleCheck unreadable() {
    return new StaleCheck(true, Optional.empty());
  }

  static StaleCheck of(boolean stale, LockRecord lock) {
    return new StaleCheck(stale, Optional.of(lock));
  }
}
