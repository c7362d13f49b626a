package com.onthegomap.terrainpack.util;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads numbers out of free-form map tag values like {@code height=12 m}, {@code width=6'6"} or
 * {@code lanes=2;3}.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Map_features/Units">Map features/Units</a>
 */
public final class Parse {

  private static final Pattern NUMBER = Pattern.compile("^-?(\\d+(\\.\\d*)?|\\.\\d+)$");
  private static final Pattern LEADING_INTEGER = Pattern.compile("^-?\\d+");
  private static final Pattern MEASURE = Pattern.compile("^\\s*(-?(?:\\d+(?:\\.\\d*)?|\\.\\d+))\\s*([a-z]+|'|\")?",
    Pattern.CASE_INSENSITIVE);

  private enum LengthUnit {
    METERS(1, "", "m", "meter", "meters", "metre", "metres"),
    KILOMETERS(1000, "km"),
    MILES(1609.344, "mi"),
    NAUTICAL_MILES(1852, "nmi"),
    FEET(0.3048, "ft", "'"),
    INCHES(0.0254, "in", "\"");

    private static final Map<String, LengthUnit> BY_SYMBOL = new HashMap<>();

    static {
      for (var unit : values()) {
        for (String symbol : unit.symbols) {
          BY_SYMBOL.put(symbol, unit);
        }
      }
    }

    private final double meters;
    private final String[] symbols;

    LengthUnit(double meters, String... symbols) {
      this.meters = meters;
      this.symbols = symbols;
    }
  }

  private Parse() {}

  /** Returns {@code value} as a plain decimal number, or null if it is anything else. */
  public static Double decimal(String value) {
    if (value == null) {
      return null;
    }
    String stripped = value.strip();
    return NUMBER.matcher(stripped).matches() ? Double.valueOf(stripped) : null;
  }

  /** Returns the integer {@code value} starts with, so {@code "3;4"} is 3, or null if there is none. */
  public static Integer leadingInteger(String value) {
    if (value == null) {
      return null;
    }
    Matcher matcher = LEADING_INTEGER.matcher(value.strip());
    if (!matcher.find()) {
      return null;
    }
    try {
      return Integer.valueOf(matcher.group());
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /**
   * Returns a length tag converted to meters, or null if it has no leading number or an unknown unit.
   * <p>
   * A bare number is in meters. Feet may be followed by inches, as in {@code 15'3"}.
   */
  public static Double meters(String value) {
    if (value == null) {
      return null;
    }
    Matcher matcher = MEASURE.matcher(value);
    if (!matcher.find()) {
      return null;
    }
    String symbol = matcher.group(2) == null ? "" : matcher.group(2).toLowerCase(Locale.ROOT);
    LengthUnit unit = LengthUnit.BY_SYMBOL.get(symbol);
    if (unit == null) {
      return null;
    }
    double meters = Double.parseDouble(matcher.group(1)) * unit.meters;
    if (unit == LengthUnit.FEET) {
      Matcher inches = MEASURE.matcher(value.substring(matcher.end()));
      if (inches.find() && inches.group(2) != null &&
        LengthUnit.BY_SYMBOL.get(inches.group(2).toLowerCase(Locale.ROOT)) == LengthUnit.INCHES) {
        meters += Double.parseDouble(inches.group(1)) * LengthUnit.INCHES.meters;
      }
    }
    return meters;
  }
}
