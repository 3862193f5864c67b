package com.acme.inventory.spi;

import java.util.Arrays;
import java.util.Optional;

/**
 * Minimal key/value object storage. Implementations throw {@link ObjectStoreException} for
 * failures other than a missing key.
 */
public interface ObjectStore {

  Optional<byte[]> get(String key);

  void put(String key, byte[] content, String contentType);

  /** Deleting a missing key is not an error. */
  void delete(String key);

  /** Whether {@link #putIfAbsent} is available and atomic. */
  default boolean supportsConditionalWrite() {
    return false;
  }

  /**
   * Creates the object only if no object exists under {@code key}.
   *
   * @return true when this call created the object
   */
  default boolean putIfAbsent(String key, byte[] content, String contentType) {
    throw new UnsupportedOperationException(getClass().getSimpleName() + " has no conditional write");
  }

  /**
   * Deletes the object only while its content still equals {@code expected}. The default re-reads
   * and then deletes, which leaves a short window between the two calls; stores that can compare
   * and delete in one step override it.
   *
   * @return true when this call deleted the object
   */
  default boolean deleteIfUnchanged(String key, byte[] expected) {
    Optional<byte[]> current = get(key);
    if (current.isEmpty() || !Arrays.equals(current.get(), expected)) {
      return false;
    }
    delete(key);
    return true;
  }
}
