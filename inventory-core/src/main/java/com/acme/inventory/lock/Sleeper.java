package com.acme.inventory.lock;

import java.time.Duration;

/** Blocking pause between lock attempts, replaceable in tests. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
