package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.geo.BoundingBox;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Set;

/**
 * Builds Overpass QL queries that return every feature of a set of categories inside a box with inline geometry.
 *
 * @see <a href="https://wiki.openstreetmap.org/wiki/Overpass_API/Overpass_QL">Overpass QL</a>
 */
public class OverpassQuery {

  private OverpassQuery() {}

  /** Returns the query text for {@code categories} in {@code bbox}, with a server-side timeout. */
  public static String build(BoundingBox bbox, Set<FeatureCategory> categories, Duration timeout) {
    String box = bbox.toOverpassBbox();
    StringBuilder query = new StringBuilder()
      .append("[out:json][timeout:").append(Math.max(1, timeout.toSeconds())).append("];\n")
      .append("(\n");
    for (var category : categories) {
      for (String selector : category.selectors()) {
        query.append("  ").append(selector).append('(').append(box).append(");\n");
      }
    }
    return query.append(");\nout geom;").toString();
  }

  /** Returns the form-encoded request body that carries {@code query}. */
  public static String formBody(String query) {
    return "data=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
  }
}
