package com.onthegomap.terrainpack.fetch;

import java.time.Duration;

/** Blocks the current thread, replaced in tests to avoid real waits. */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> {
    if (!duration.isZero() && !duration.isNegative()) {
      Thread.sleep(duration.toMillis());
    }
  };

  void sleep(Duration duration) throws InterruptedException;
}
