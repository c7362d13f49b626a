package com.onthegomap.terrainpack.stats;

import com.onthegomap.terrainpack.util.Format;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import javax.annotation.concurrent.ThreadSafe;

/** Wall time of one export stage, frozen the first time it is stopped. */
@ThreadSafe
public final class Timer {

  private static final long RUNNING = Long.MIN_VALUE;

  private final long startNanos = System.nanoTime();
  private final AtomicLong stopNanos = new AtomicLong(RUNNING);

  private Timer() {}

  static Timer start() {
    return new Timer();
  }

  void stop() {
    stopNanos.compareAndSet(RUNNING, System.nanoTime());
  }

  public boolean isRunning() {
    return stopNanos.get() == RUNNING;
  }

  /** Returns time from start until the stop, or until now while still running. */
  public Duration elapsed() {
    long stop = stopNanos.get();
    return Duration.ofNanos((stop == RUNNING ? System.nanoTime() : stop) - startNanos);
  }

  @Override
  public String toString() {
    return Format.duration(elapsed()) + (isRunning() ? " (running)" : "");
  }
}
