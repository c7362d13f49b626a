package com.onthegomap.terrainpack.geo;

import com.onthegomap.terrainpack.stats.Stats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An error caused by unusable input geometry that should be counted and skipped instead of halting the whole export,
 * since bad data is sure to turn up in the wild.
 */
public class GeometryException extends Exception {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryException.class);

  private final String stat;

  /**
   * Constructs a new exception with a detailed error message.
   *
   * @param stat    string that uniquely identifies this kind of error, used to count occurrences in stats
   * @param message description of the error, detailed enough to find the offending feature from it
   */
  public GeometryException(String stat, String message) {
    super(message);
    this.stat = stat;
  }

  /** Returns the unique code for this error condition. */
  public String stat() {
    return stat;
  }

  /** Increments a stat counter for this error and logs it at debug level. */
  public void log(Stats stats, String statPrefix, String logPrefix) {
    stats.dataError(statPrefix + "_" + stat);
    LOGGER.debug("{}: {}", logPrefix, getMessage());
  }
}
