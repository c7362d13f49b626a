package com.onthegomap.terrainpack.geometry;

import com.onthegomap.terrainpack.geo.Vec3;
import java.util.List;

/**
 * A fetched map feature converted to the local frame, with the attributes a renderer needs to place it.
 * <p>
 * All positions and lengths are in engine units. Values are immutable.
 */
public sealed interface ConvertedFeature {

  /** ID of the OSM element this was derived from. */
  long sourceId();

  Kind kind();

  enum Kind {
    BUILDING("buildings"),
    LINEAR_PATH("paths"),
    SUSPENDED_CABLE("cables"),
    POINT_FEATURE("points");

    private final String group;

    Kind(String group) {
      this.group = group;
    }

    /** Plural name used to group features of this kind in output. */
    public String group() {
      return group;
    }
  }

  /**
   * A building footprint extruded to {@code height}.
   *
   * @param footprint ring of vertices without the repeated closing vertex
   * @param position  mean of the footprint vertices
   * @param rotation  bearing of the longest footprint edge in degrees clockwise from north, in [0, 360)
   */
  record Building(
    long sourceId,
    List<Vec3> footprint,
    Vec3 position,
    double rotation,
    double height,
    double minHeight,
    String roofShape,
    String name
  ) implements ConvertedFeature {

    public Building {
      footprint = List.copyOf(footprint);
    }

    @Override
    public Kind kind() {
      return Kind.BUILDING;
    }
  }

  /**
   * A road, railway, trail, fence or waterway as a curve through {@code points} with one Hermite tangent per point.
   *
   * @param category      the tag value that classified it, like {@code residential} or {@code tram}
   * @param possiblySplit true if the source way may be a fragment cut at a chunk seam
   */
  record LinearPath(
    long sourceId,
    PathKind pathKind,
    String category,
    List<Vec3> points,
    List<Vec3> tangents,
    double width,
    int lanes,
    String name,
    boolean possiblySplit
  ) implements ConvertedFeature {

    public LinearPath {
      points = List.copyOf(points);
      tangents = List.copyOf(tangents);
      if (points.size() != tangents.size()) {
        throw new IllegalArgumentException(points.size() + " points but " + tangents.size() + " tangents");
      }
    }

    @Override
    public Kind kind() {
      return Kind.LINEAR_PATH;
    }
  }

  /**
   * One span of an overhead cable between two anchors, sagging below the straight line between them.
   *
   * @param span   index of this span along the source way
   * @param points anchors and interpolated points, first and last equal to {@code start} and {@code end}
   */
  record SuspendedCable(
    long sourceId,
    int span,
    String category,
    Vec3 start,
    Vec3 end,
    double sagFactor,
    List<Vec3> points
  ) implements ConvertedFeature {

    public SuspendedCable {
      points = List.copyOf(points);
    }

    @Override
    public Kind kind() {
      return Kind.SUSPENDED_CABLE;
    }
  }

  /**
   * A single located thing like a bench or street lamp.
   *
   * @param category {@code key=value} of the tag that classified it
   */
  record PointFeature(
    long sourceId,
    String category,
    String name,
    Vec3 position
  ) implements ConvertedFeature {

    @Override
    public Kind kind() {
      return Kind.POINT_FEATURE;
    }
  }
}
