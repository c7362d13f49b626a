package com.onthegomap.terrainpack.geometry;

import com.onthegomap.terrainpack.geo.Vec3;
import java.util.ArrayList;
import java.util.List;

/**
 * Geometry helpers over local-frame vertex lists.
 */
public class Curves {

  private Curves() {}

  /**
   * Returns a Hermite tangent for every point of a polyline.
   * <p>
   * Each tangent points along the average of the unit directions of the edges into and out of the point (just the one
   * adjacent edge at the ends) and has half the length of the following edge, or of the previous edge at the last
   * point.
   */
  public static List<Vec3> hermiteTangents(List<Vec3> points) {
    int n = points.size();
    List<Vec3> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Vec3 incoming = i > 0 ? points.get(i).minus(points.get(i - 1)) : null;
      Vec3 outgoing = i < n - 1 ? points.get(i + 1).minus(points.get(i)) : null;
      Vec3 direction;
      if (incoming == null && outgoing == null) {
        direction = Vec3.ZERO;
      } else if (incoming == null) {
        direction = outgoing.normalize();
      } else if (outgoing == null) {
        direction = incoming.normalize();
      } else {
        direction = incoming.normalize().plus(outgoing.normalize()).normalize();
      }
      double segment = outgoing != null ? outgoing.length() : incoming != null ? incoming.length() : 0;
      result.add(direction.times(segment / 2));
    }
    return result;
  }

  /** Returns the bearing from {@code from} to {@code to} in degrees clockwise from north (+x), in [0, 360). */
  public static double bearing(Vec3 from, Vec3 to) {
    double degrees = Math.toDegrees(Math.atan2(to.y() - from.y(), to.x() - from.x()));
    double normalized = degrees % 360;
    return normalized < 0 ? normalized + 360 : normalized;
  }

  /**
   * Returns the index {@code i} of the longest horizontal edge from {@code ring[i]} to {@code ring[i + 1]}, including
   * the closing edge from the last vertex back to the first. Ties go to the first edge.
   */
  public static int longestEdge(List<Vec3> ring) {
    int best = -1;
    double bestLength = -1;
    for (int i = 0; i < ring.size(); i++) {
      double length = ring.get(i).horizontalDistance(ring.get((i + 1) % ring.size()));
      if (length > bestLength) {
        bestLength = length;
        best = i;
      }
    }
    return best;
  }

  /** Returns the mean of {@code points}. */
  public static Vec3 centroid(List<Vec3> points) {
    double x = 0, y = 0, z = 0;
    for (Vec3 point : points) {
      x += point.x();
      y += point.y();
      z += point.z();
    }
    int n = points.size();
    return new Vec3(x / n, y / n, z / n);
  }
}
