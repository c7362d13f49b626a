package com.onthegomap.terrainpack.geometry;

import java.util.Map;

/**
 * Typical widths in meters for linear features that have no explicit {@code width} tag, and default lane counts.
 */
public class WidthTable {

  private static final double DEFAULT_ROAD_WIDTH = 5;

  private static final Map<String, Double> ROADS = Map.ofEntries(
    Map.entry("motorway", 12d),
    Map.entry("motorway_link", 6d),
    Map.entry("trunk", 10d),
    Map.entry("trunk_link", 6d),
    Map.entry("primary", 8d),
    Map.entry("primary_link", 5d),
    Map.entry("secondary", 7d),
    Map.entry("tertiary", 6d),
    Map.entry("residential", 5d),
    Map.entry("living_street", 4d),
    Map.entry("unclassified", 5d),
    Map.entry("service", 3.5),
    Map.entry("track", 3d),
    Map.entry("path", 1.5),
    Map.entry("footway", 1.5),
    Map.entry("pedestrian", 4d),
    Map.entry("bridleway", 2d),
    Map.entry("steps", 2d),
    Map.entry("cycleway", 2d)
  );

  private static final Map<String, Double> RAIL = Map.of(
    "rail", 3d,
    "light_rail", 2.5,
    "tram", 2.5,
    "subway", 3d,
    "narrow_gauge", 2d,
    "monorail", 1.5,
    "funicular", 2d
  );

  private static final Map<String, Double> BARRIERS = Map.of(
    "fence", 0.1,
    "wall", 0.3,
    "city_wall", 2d,
    "retaining_wall", 0.5,
    "hedge", 1d,
    "guard_rail", 0.3
  );

  private static final Map<String, Double> WATERWAYS = Map.of(
    "river", 10d,
    "canal", 8d,
    "stream", 2d,
    "ditch", 1d,
    "drain", 1d
  );

  private WidthTable() {}

  /** Width in meters of a {@code kind} path with classifying tag value {@code category}. */
  public static double width(PathKind kind, String category) {
    return switch (kind) {
      case ROAD, TRAIL -> ROADS.getOrDefault(category, DEFAULT_ROAD_WIDTH);
      case RAIL -> RAIL.getOrDefault(category, 3d);
      case FENCE -> BARRIERS.getOrDefault(category, 0.2);
      case WATERWAY -> WATERWAYS.getOrDefault(category, 2d);
    };
  }

  /** Lane (or track) count to use when untagged. */
  public static int defaultLanes(PathKind kind) {
    return kind == PathKind.ROAD ? 2 : 1;
  }
}
