package com.onthegomap.terrainpack.reader.osm;

import com.carrotsearch.hppc.LongArrayList;
import com.onthegomap.terrainpack.reader.WithTags;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Envelope;

/**
 * An element returned by the map-feature query service.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Elements">OSM element data model</a>
 */
public sealed interface OsmElement extends WithTags {

  /** OSM element ID, unique within one {@link Type}. */
  long id();

  Type type();

  enum Type {
    NODE,
    WAY,
    RELATION;

    /** Returns the type for the {@code "type"} field of a query response element, or null if unrecognized. */
    public static Type fromName(String name) {
      return switch (name) {
        case "node" -> NODE;
        case "way" -> WAY;
        case "relation" -> RELATION;
        default -> null;
      };
    }
  }

  /** A geodetic coordinate in degrees. */
  record LatLon(double lat, double lon) {}

  /** A point on the earth's surface. */
  record Node(
    @Override long id,
    @Override Map<String, String> tags,
    double lat,
    double lon
  ) implements OsmElement {

    public Node {
      tags = Map.copyOf(tags);
    }

    @Override
    public Type type() {
      return Type.NODE;
    }
  }

  /**
   * An ordered list of vertices that define a polyline or, when the first and last vertex match, a ring.
   * <p>
   * Vertex coordinates are inlined in {@code geometry}. {@code possiblySplit} is set when a chunked fetch may have
   * returned this way as a fragment of a longer one that crosses a chunk seam. {@code nodes} is copied on the way in
   * and out so a way never changes after construction.
   */
  record Way(
    @Override long id,
    @Override Map<String, String> tags,
    LongArrayList nodes,
    List<LatLon> geometry,
    boolean possiblySplit
  ) implements OsmElement {

    public Way {
      tags = Map.copyOf(tags);
      nodes = nodes == null ? new LongArrayList() : nodes.clone();
      geometry = List.copyOf(geometry);
    }

    public Way(long id, Map<String, String> tags, List<LatLon> geometry) {
      this(id, tags, new LongArrayList(), geometry, false);
    }

    @Override
    public LongArrayList nodes() {
      return nodes.clone();
    }

    @Override
    public Type type() {
      return Type.WAY;
    }

    /** Returns the lon/lat extent of {@code geometry}, a null envelope when it has no vertices. */
    public Envelope envelope() {
      Envelope envelope = new Envelope();
      for (var point : geometry) {
        envelope.expandToInclude(point.lon(), point.lat());
      }
      return envelope;
    }

    /** Returns true if the first and last vertex are the same and there are enough vertices to form a ring. */
    public boolean isClosed() {
      return geometry.size() >= 4 && geometry.get(0).equals(geometry.get(geometry.size() - 1));
    }

    public Way withPossiblySplit(boolean value) {
      return value == possiblySplit ? this : new Way(id, tags, nodes, geometry, value);
    }
  }

  /** An ordered list of nodes, ways, and other relations. */
  record Relation(
    @Override long id,
    @Override Map<String, String> tags,
    List<Member> members
  ) implements OsmElement {

    public Relation {
      tags = Map.copyOf(tags);
      members = List.copyOf(members);
    }

    @Override
    public Type type() {
      return Type.RELATION;
    }

    /** A node, way, or relation contained in a relation with an optional "role". */
    public record Member(
      Type type,
      long ref,
      String role
    ) {}
  }
}
