package com.onthegomap.terrainpack.geometry;

import com.onthegomap.terrainpack.config.TerrainpackConfig;
import com.onthegomap.terrainpack.geo.GeometryException;
import com.onthegomap.terrainpack.geo.LocalFrameTransformer;
import com.onthegomap.terrainpack.geo.Vec3;
import com.onthegomap.terrainpack.reader.WithTags;
import com.onthegomap.terrainpack.reader.osm.FeatureCollection;
import com.onthegomap.terrainpack.reader.osm.OsmElement;
import com.onthegomap.terrainpack.stats.Stats;
import com.onthegomap.terrainpack.util.Parse;
import com.onthegomap.terrainpack.worker.Worker;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts fetched map features into buildings, linear paths, suspended cables and point features in the local
 * frame.
 * <p>
 * Elements with unusable geometry are dropped, counted in the {@link BuildSummary} and recorded as data errors
 * instead of failing the build. The builder keeps no mutable state, so disjoint subsets can be converted on
 * different threads.
 */
@ThreadSafe
public class GeometryBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeometryBuilder.class);
  private static final Set<String> TRAIL_HIGHWAYS = Set.of("path", "footway", "track", "cycleway", "bridleway",
    "steps");
  private static final Set<String> NON_LINEAR_RAILWAYS = Set.of("platform", "station", "halt", "stop",
    "turntable", "roundhouse", "level_crossing", "crossing", "switch", "signal", "buffer_stop");
  private static final Set<String> LINEAR_WATERWAYS = Set.of("river", "stream", "canal", "ditch", "drain");
  private static final Set<String> NON_CABLE_AERIALWAYS = Set.of("station", "pylon");
  private static final List<String> POINT_KEYS = List.of("amenity", "shop", "highway", "power", "barrier",
    "tourism", "leisure", "natural", "historic", "man_made");

  private final LocalFrameTransformer transformer;
  private final Settings settings;
  private final Stats stats;

  public GeometryBuilder(LocalFrameTransformer transformer, Settings settings, Stats stats) {
    this.transformer = transformer;
    this.settings = settings;
    this.stats = stats;
  }

  /** Converts every element of {@code features} on the calling thread. */
  public BuildResult build(FeatureCollection features) {
    List<OsmElement> elements = features.stream().toList();
    List<ConvertedFeature> output = new ArrayList<>();
    var summary = BuildSummary.builder();
    convertAll(elements, output, summary);
    return new BuildResult(output, summary.build());
  }

  /**
   * Converts every element of {@code features} using {@code threads} worker threads.
   * <p>
   * Returns the same result as {@link #build(FeatureCollection)}, in the same order.
   */
  public BuildResult buildParallel(FeatureCollection features, int threads) {
    List<OsmElement> elements = features.stream().toList();
    if (threads <= 1 || elements.size() < 2) {
      return build(features);
    }
    int sliceSize = Math.max(64, (int) Math.ceil(elements.size() / (threads * 4d)));
    int slices = (elements.size() + sliceSize - 1) / sliceSize;
    List<List<ConvertedFeature>> outputs = new ArrayList<>(slices);
    List<BuildSummary.Builder> summaries = new ArrayList<>(slices);
    for (int i = 0; i < slices; i++) {
      outputs.add(new ArrayList<>());
      summaries.add(BuildSummary.builder());
    }
    Worker.forSlices("geometry", threads, slices, slice -> {
      int from = slice * sliceSize;
      int to = Math.min(elements.size(), from + sliceSize);
      convertAll(elements.subList(from, to), outputs.get(slice), summaries.get(slice));
    }).await();

    List<ConvertedFeature> output = new ArrayList<>();
    var summary = BuildSummary.builder();
    for (int i = 0; i < slices; i++) {
      output.addAll(outputs.get(i));
      summary.merge(summaries.get(i));
    }
    return new BuildResult(output, summary.build());
  }

  private void convertAll(List<OsmElement> elements, List<ConvertedFeature> output, BuildSummary.Builder summary) {
    for (var element : elements) {
      try {
        int before = output.size();
        convert(element, output, summary);
        for (int i = before; i < output.size(); i++) {
          summary.built(output.get(i).kind());
        }
      } catch (GeometryException e) {
        e.log(stats, "geometry", "Dropped " + element.type().name().toLowerCase(Locale.ROOT) + " " + element.id());
        summary.dropped(e.stat());
      }
    }
  }

  private void convert(OsmElement element, List<ConvertedFeature> output, BuildSummary.Builder summary)
    throws GeometryException {
    if (element instanceof OsmElement.Node node) {
      String category = pointCategory(node);
      if (category == null) {
        summary.skipped("untagged_node");
      } else {
        output.add(new ConvertedFeature.PointFeature(node.id(), category, node.getString("name"),
          transformer.toLocalChecked(node.lat(), node.lon())));
      }
    } else if (element instanceof OsmElement.Way way) {
      convertWay(way, output, summary);
    } else {
      // multipolygon members are not inlined in the response
      summary.skipped("relation");
    }
  }

  private void convertWay(OsmElement.Way way, List<ConvertedFeature> output, BuildSummary.Builder summary)
    throws GeometryException {
    if (way.hasTag("building")) {
      output.add(buildBuilding(way.id(), way, transformRing(way)));
    } else if (way.hasTag("power", "line", "minor_line") ||
      (way.hasTag("aerialway") && !NON_CABLE_AERIALWAYS.contains(way.getString("aerialway")))) {
      output.addAll(buildCables(way, transformLine(way)));
    } else {
      PathKind kind = pathKind(way);
      if (kind == null) {
        summary.skipped("unclassified_way");
      } else {
        output.add(buildPath(way, kind, transformLine(way)));
      }
    }
  }

  private static PathKind pathKind(OsmElement.Way way) {
    String highway = way.getString("highway");
    if (highway != null) {
      return TRAIL_HIGHWAYS.contains(highway) ? PathKind.TRAIL : PathKind.ROAD;
    }
    String railway = way.getString("railway");
    if (railway != null && !NON_LINEAR_RAILWAYS.contains(railway)) {
      return PathKind.RAIL;
    }
    if (way.hasTag("barrier")) {
      return PathKind.FENCE;
    }
    if (LINEAR_WATERWAYS.contains(way.getString("waterway", ""))) {
      return PathKind.WATERWAY;
    }
    return null;
  }

  private static String categoryTag(PathKind kind) {
    return switch (kind) {
      case ROAD, TRAIL -> "highway";
      case RAIL -> "railway";
      case FENCE -> "barrier";
      case WATERWAY -> "waterway";
    };
  }

  private static String pointCategory(OsmElement.Node node) {
    for (String key : POINT_KEYS) {
      String value = node.getString(key);
      if (value != null) {
        return key + "=" + value;
      }
    }
    return null;
  }

  /**
   * Transforms a building outline, rejecting it if any vertex is too far outside the bounding box. The repeated closing
   * vertex is dropped.
   */
  private List<Vec3> transformRing(OsmElement.Way way) throws GeometryException {
    var geometry = way.geometry();
    int n = way.isClosed() ? geometry.size() - 1 : geometry.size();
    List<Vec3> result = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      var point = geometry.get(i);
      result.add(transformer.toLocalChecked(point.lat(), point.lon()));
    }
    return result;
  }

  /**
   * Transforms a line, keeping the longest run of consecutive vertices that are close enough to the bounding box since
   * lines crossing the edge of the area come back with their full length.
   */
  private List<Vec3> transformLine(OsmElement.Way way) {
    List<Vec3> best = List.of();
    List<Vec3> current = new ArrayList<>();
    for (var point : way.geometry()) {
      try {
        current.add(transformer.toLocalChecked(point.lat(), point.lon()));
      } catch (GeometryException e) {
        if (current.size() > best.size()) {
          best = current;
        }
        current = new ArrayList<>();
      }
    }
    return current.size() > best.size() ? current : best;
  }

  /**
   * Returns a building from a footprint already in the local frame.
   *
   * @throws GeometryException if the footprint has fewer than 3 distinct vertices
   */
  public ConvertedFeature.Building buildBuilding(long id, WithTags tags, List<Vec3> ring) throws GeometryException {
    if (ring.stream().distinct().count() < 3) {
      throw new GeometryException("building_degenerate",
        "building footprint has " + ring.size() + " vertices, need at least 3 distinct");
    }
    int longest = Curves.longestEdge(ring);
    double rotation = Curves.bearing(ring.get(longest), ring.get((longest + 1) % ring.size()));
    double unitScale = transformer.unitScale();
    Double minHeight = Parse.meters(tags.getString("min_height"));
    return new ConvertedFeature.Building(
      id,
      ring,
      Curves.centroid(ring),
      rotation,
      resolveHeightMeters(tags, settings) * unitScale,
      minHeight == null ? 0 : minHeight * unitScale,
      tags.getString("roof:shape"),
      tags.getString("name")
    );
  }

  /**
   * Returns the height of a building in meters from the first of: {@code building:height} or {@code height} tag,
   * {@code building:levels} times the level height, or the default height.
   */
  public static double resolveHeightMeters(WithTags tags, Settings settings) {
    for (String key : List.of("building:height", "height")) {
      Double height = Parse.meters(tags.getString(key));
      if (height != null && height > 0) {
        return height;
      }
    }
    Double levels = Parse.decimal(tags.getString("building:levels"));
    if (levels != null && levels > 0) {
      return levels * settings.levelHeight();
    }
    return settings.defaultBuildingHeight();
  }

  private ConvertedFeature.LinearPath buildPath(OsmElement.Way way, PathKind kind, List<Vec3> points)
    throws GeometryException {
    if (points.size() < 2) {
      throw new GeometryException("path_degenerate", "path has " + points.size() + " usable vertices, need 2");
    }
    String category = way.getString(categoryTag(kind));
    Double width = Parse.meters(way.getString("width"));
    if (width == null || width <= 0) {
      width = WidthTable.width(kind, category);
    }
    Integer lanes = Parse.leadingInteger(way.getString(kind == PathKind.RAIL ? "tracks" : "lanes"));
    return new ConvertedFeature.LinearPath(
      way.id(),
      kind,
      category,
      points,
      Curves.hermiteTangents(points),
      width * transformer.unitScale(),
      lanes == null || lanes <= 0 ? WidthTable.defaultLanes(kind) : lanes,
      way.getString("name"),
      way.possiblySplit()
    );
  }

  private List<ConvertedFeature.SuspendedCable> buildCables(OsmElement.Way way, List<Vec3> ground)
    throws GeometryException {
    if (ground.size() < 2) {
      throw new GeometryException("cable_degenerate", "cable has " + ground.size() + " usable vertices, need 2");
    }
    String category = way.hasTag("power") ? "power=" + way.getString("power") : "aerialway=" +
      way.getString("aerialway");
    double unitScale = transformer.unitScale();
    Double tagged = Parse.meters(way.getString("height"));
    double anchorHeight = (tagged != null && tagged > 0 ? tagged : defaultAnchorHeight(way)) * unitScale;
    double spacing = settings.cableSpacing() * unitScale;
    List<ConvertedFeature.SuspendedCable> result = new ArrayList<>(ground.size() - 1);
    for (int i = 0; i < ground.size() - 1; i++) {
      Vec3 start = ground.get(i).plus(new Vec3(0, 0, anchorHeight));
      Vec3 end = ground.get(i + 1).plus(new Vec3(0, 0, anchorHeight));
      if (start.horizontalDistance(end) == 0) {
        LOGGER.trace("Skipping zero-length span {} of way {}", i, way.id());
        continue;
      }
      result.add(new ConvertedFeature.SuspendedCable(way.id(), i, category, start, end, settings.sagFactor(),
        CableSag.interpolate(start, end, spacing, settings.sagFactor())));
    }
    if (result.isEmpty()) {
      throw new GeometryException("cable_degenerate", "cable has no span with length");
    }
    return result;
  }

  private static double defaultAnchorHeight(OsmElement.Way way) {
    if (way.hasTag("power", "line")) {
      return 15;
    } else if (way.hasTag("power", "minor_line")) {
      return 8;
    }
    return 10;
  }

  /**
   * Tunable constants for derived geometry, in meters unless noted.
   *
   * @param levelHeight           height of one building level
   * @param defaultBuildingHeight height of a building with no height or levels tag
   * @param cableSpacing          target distance between interpolated cable points
   * @param sagFactor             mid-span cable sag as a fraction of span length
   */
  public record Settings(double levelHeight, double defaultBuildingHeight, double cableSpacing, double sagFactor) {

    public static Settings from(TerrainpackConfig config) {
      return new Settings(config.levelHeight(), config.defaultBuildingHeight(), config.cableSpacing(),
        config.sagFactor());
    }

    public static Settings defaults() {
      return from(TerrainpackConfig.defaults());
    }
  }

  /** Converted features in input order, plus diagnostics. */
  public record BuildResult(List<ConvertedFeature> features, BuildSummary summary) {

    public BuildResult {
      features = List.copyOf(features);
    }
  }
}
