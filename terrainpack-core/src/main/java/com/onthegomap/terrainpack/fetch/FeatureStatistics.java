package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.reader.osm.FeatureCollection;
import com.onthegomap.terrainpack.reader.osm.OsmElement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts of fetched elements by type and by broad feature class, for logging and package metadata.
 *
 * @param nodes     number of nodes
 * @param ways      number of ways
 * @param relations number of relations
 * @param byClass   counts keyed like {@code highway:residential}, {@code building}, {@code railway}, {@code water},
 *                  {@code poi}
 */
public record FeatureStatistics(long nodes, long ways, long relations, Map<String, Long> byClass) {

  public FeatureStatistics {
    byClass = Map.copyOf(byClass);
  }

  public static FeatureStatistics of(FeatureCollection features) {
    Map<String, Long> byClass = new TreeMap<>();
    features.stream().forEach(element -> {
      for (String key : classify(element)) {
        byClass.merge(key, 1L, Long::sum);
      }
    });
    return new FeatureStatistics(features.nodes().size(), features.ways().size(), features.relations().size(),
      byClass);
  }

  private static List<String> classify(OsmElement element) {
    List<String> result = new ArrayList<>(2);
    String highway = element.getString("highway");
    if (highway != null) {
      result.add("highway:" + highway);
    }
    if (element.hasTag("building")) {
      result.add("building");
    }
    if (element.hasTag("railway")) {
      result.add("railway");
    }
    if (element.hasTag("natural", "water") || element.hasTag("waterway")) {
      result.add("water");
    }
    if (element.hasTag("amenity")) {
      result.add("poi");
    }
    return result;
  }

  public long total() {
    return nodes + ways + relations;
  }
}
