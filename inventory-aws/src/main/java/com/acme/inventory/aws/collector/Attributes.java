package com.acme.inventory.aws.collector;

import java.util.Map;

final class Attributes {
  private Attributes() {}

  /** Adds the value under {@code key} unless it is null; SDK models leave absent fields null. */
  static void putIfPresent(Map<String, String> attributes, String key, Object value) {
    if (value != null) {
      attributes.put(key, value.toString());
    }
  }
}
