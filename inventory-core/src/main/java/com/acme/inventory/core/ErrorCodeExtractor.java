package com.acme.inventory.core;

import java.util.Optional;

/** Reads a service error code (e.g. {@code ThrottlingException}) from a transport-specific error. */
@FunctionalInterface
public interface ErrorCodeExtractor {
  Optional<String> extract(Throwable error);
}
