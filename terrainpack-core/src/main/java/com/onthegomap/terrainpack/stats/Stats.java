package com.onthegomap.terrainpack.stats;

import com.onthegomap.terrainpack.util.Format;
import com.onthegomap.terrainpack.util.LogUtil;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects and reports statistics about an export job that are too detailed for regular log lines: how long each
 * stage took and how many input features were dropped for each kind of data error.
 */
public interface Stats {

  /** Returns a new stat collector that stores stats in-memory to report through {@link #printSummary()}. */
  static Stats inMemory() {
    return new InMemory();
  }

  /** Logs stage timings and data error counts at the end of a job. */
  default void printSummary() {
    Logger logger = LoggerFactory.getLogger(getClass());
    logger.info("");
    logger.info("-".repeat(40));
    timers().printSummary();
    var errors = dataErrors();
    if (!errors.isEmpty()) {
      logger.info("-".repeat(40));
      errors.forEach((code, count) -> logger.info("\t{}\t{}", code, Format.count(count)));
    }
  }

  /**
   * Records that a long-running stage with {@code name} has started and returns a handle to call when finished.
   * <p>
   * Also sets the "stage" prefix that shows up in the logs to {@code name}.
   */
  default Timers.Finishable startStage(String name) {
    LogUtil.setStage(name);
    var timer = timers().startTimer(name, true);
    return () -> {
      timer.stop();
      LogUtil.clearStage();
    };
  }

  /** Returns the timers for all stages started with {@link #startStage(String)}. */
  Timers timers();

  /**
   * Records that an invalid input feature was discarded where {@code errorCode} identifies the kind of failure.
   */
  void dataError(String errorCode);

  /** Returns the number of times each data error code was recorded, sorted by code. */
  Map<String, Long> dataErrors();

  /** A stat collector that stores everything in memory. */
  class InMemory implements Stats {

    /** use {@link #inMemory()} */
    private InMemory() {}

    private final Timers timers = new Timers();
    private final ConcurrentMap<String, LongAdder> dataErrors = new ConcurrentHashMap<>();

    @Override
    public Timers timers() {
      return timers;
    }

    @Override
    public void dataError(String errorCode) {
      dataErrors.computeIfAbsent(errorCode, c -> new LongAdder()).increment();
    }

    @Override
    public Map<String, Long> dataErrors() {
      Map<String, Long> result = new TreeMap<>();
      dataErrors.forEach((code, counter) -> result.put(code, counter.sum()));
      return result;
    }
  }
}
