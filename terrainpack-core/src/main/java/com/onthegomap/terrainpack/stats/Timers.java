package com.onthegomap.terrainpack.stats;

import com.onthegomap.terrainpack.util.Format;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A registry of export stages that are being timed.
 */
@ThreadSafe
public class Timers {

  private static final Logger LOGGER = LoggerFactory.getLogger(Timers.class);
  private final Map<String, Timer> timers = Collections.synchronizedMap(new LinkedHashMap<>());

  public void printSummary() {
    var all = all();
    int maxLength = (int) all.keySet().stream().mapToLong(String::length).max().orElse(0);
    for (var entry : all.entrySet()) {
      LOGGER.info("\t{} {}", Format.padRight(entry.getKey(), maxLength), entry.getValue());
    }
  }

  public Finishable startTimer(String name, boolean log) {
    Timer timer = Timer.start();
    timers.put(name, timer);
    if (log) {
      LOGGER.info("Starting...");
    }
    return () -> {
      timer.stop();
      if (log) {
        LOGGER.info("Finished in {}", timer);
      }
    };
  }

  /** Returns a snapshot of all timers started so far. */
  public Map<String, Timer> all() {
    synchronized (timers) {
      return new LinkedHashMap<>(timers);
    }
  }

  /** A handle that callers can use to indicate a task has finished. */
  public interface Finishable {

    void stop();
  }
}
