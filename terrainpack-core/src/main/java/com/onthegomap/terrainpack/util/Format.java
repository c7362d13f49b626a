package com.onthegomap.terrainpack.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Compact renderings of sizes, counts and durations for log lines.
 */
public final class Format {

  private static final String[] STORAGE_UNITS = {"B", "kB", "MB", "GB", "TB"};
  private static final String[] COUNT_UNITS = {"", "k", "M", "B", "T"};

  private Format() {}

  /** Returns a byte count like {@code 512B}, {@code 1.2kB} or {@code 34MB}. */
  public static String storage(long bytes) {
    return scaled(bytes, STORAGE_UNITS);
  }

  /** Returns a count like {@code 999}, {@code 1.5k} or {@code 12M}. */
  public static String count(long value) {
    return scaled(value, COUNT_UNITS);
  }

  private static String scaled(long value, String[] units) {
    if (value < 0) {
      return "-";
    }
    double scaled = value;
    int unit = 0;
    while (scaled >= 1000 && unit < units.length - 1) {
      scaled /= 1000;
      unit++;
    }
    if (unit == 0) {
      return value + units[0];
    }
    // one decimal below 10 so 1.2k and 12k both stay short
    return (scaled < 10 ? String.format(Locale.ROOT, "%.1f", scaled) : Long.toString(Math.round(scaled))) +
      units[unit];
  }

  /** Returns a duration like {@code 0.4s}, {@code 12s} or {@code 1h2m3s}. */
  public static String duration(Duration duration) {
    long millis = duration.toMillis();
    if (millis < 1_000) {
      return String.format(Locale.ROOT, "%.1fs", millis / 1000d);
    }
    long seconds = Math.round(millis / 1000d);
    long hours = seconds / 3600;
    long minutes = (seconds % 3600) / 60;
    StringBuilder result = new StringBuilder();
    if (hours > 0) {
      result.append(hours).append('h');
    }
    if (hours > 0 || minutes > 0) {
      result.append(minutes).append('m');
    }
    return result.append(seconds % 60).append('s').toString();
  }

  /** Pads {@code text} with trailing spaces to {@code width} characters. */
  public static String padRight(String text, int width) {
    return text.length() >= width ? text : text + " ".repeat(width - text.length());
  }
}
