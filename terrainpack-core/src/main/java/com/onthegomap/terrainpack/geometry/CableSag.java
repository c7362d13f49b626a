package com.onthegomap.terrainpack.geometry;

import com.onthegomap.terrainpack.geo.Vec3;
import java.util.ArrayList;
import java.util.List;

/**
 * Approximates a cable hanging between two anchors with a sine profile instead of solving the catenary equation.
 * <p>
 * At fraction {@code t} of the span the cable hangs {@code distance * sagFactor * sin(t * PI)} below the straight line
 * between the anchors, so the deepest point is mid-span and both anchors have no sag.
 */
public class CableSag {

  /** Fewest interpolated points on a span, however short. */
  public static final int MIN_INTERMEDIATE_POINTS = 10;

  private CableSag() {}

  /** Returns the vertical offset (zero or negative) at fraction {@code t} of a span {@code distance} long. */
  public static double sagAt(double distance, double sagFactor, double t) {
    if (t <= 0 || t >= 1) {
      return 0;
    }
    return -distance * sagFactor * Math.sin(t * Math.PI);
  }

  /** Returns the number of points to interpolate between anchors {@code distance} apart. */
  public static int intermediatePoints(double distance, double spacing) {
    return Math.max(MIN_INTERMEDIATE_POINTS, (int) Math.floor(distance / spacing));
  }

  /**
   * Returns {@code start}, the interpolated points, then {@code end}.
   *
   * @param spacing   target distance between interpolated points, in the same unit as the anchors
   * @param sagFactor mid-span sag as a fraction of the horizontal anchor distance
   */
  public static List<Vec3> interpolate(Vec3 start, Vec3 end, double spacing, double sagFactor) {
    double distance = start.horizontalDistance(end);
    int n = intermediatePoints(distance, spacing);
    List<Vec3> result = new ArrayList<>(n + 2);
    result.add(start);
    for (int i = 1; i <= n; i++) {
      double t = i / (n + 1d);
      Vec3 straight = start.lerp(end, t);
      result.add(new Vec3(straight.x(), straight.y(), straight.z() + sagAt(distance, sagFactor, t)));
    }
    result.add(end);
    return result;
  }
}
