package com.onthegomap.terrainpack.util;

import org.slf4j.MDC;

/**
 * Tracks the export stage of the current thread in the SLF4J {@link MDC} under {@code stage}, which the log
 * layout prints as a {@code [stage]} prefix.
 * <p>
 * Worker threads use a nested name like {@code geometry/geometry-2}, so lines from parallel work can be told apart.
 */
public final class LogUtil {

  static final String STAGE_KEY = "stage";

  private LogUtil() {}

  public static void setStage(String stage) {
    if (stage == null || stage.isBlank()) {
      clearStage();
    } else {
      MDC.put(STAGE_KEY, stage);
    }
  }

  /** Sets the stage of a worker thread started from a thread in {@code parent}. */
  public static void setStage(String parent, String child) {
    setStage(parent == null || parent.equals(child) ? child : parent + "/" + child);
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage of the current thread, or null outside of any stage. */
  public static String getStage() {
    return MDC.get(STAGE_KEY);
  }
}
