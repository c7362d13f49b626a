package com.onthegomap.terrainpack;

import com.onthegomap.terrainpack.reader.osm.OsmElement;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class TestUtils {

  private TestUtils() {}

  /** Returns an Overpass JSON response containing {@code elements}. */
  public static String overpassResponse(String... elements) {
    return """
      {"version": 0.6, "generator": "test", "elements": [%s]}
      """.formatted(String.join(",", elements));
  }

  public static InputStream overpassStream(String... elements) {
    return new ByteArrayInputStream(overpassResponse(elements).getBytes(StandardCharsets.UTF_8));
  }

  public static String nodeJson(long id, double lat, double lon, Map<String, String> tags) {
    return """
      {"type": "node", "id": %d, "lat": %s, "lon": %s, "tags": %s}
      """.formatted(id, lat, lon, tagsJson(tags));
  }

  /** Returns a way element with inline geometry from {@code latLons} as lat, lon pairs. */
  public static String wayJson(long id, Map<String, String> tags, double... latLons) {
    List<String> nodes = new ArrayList<>();
    List<String> geometry = new ArrayList<>();
    for (int i = 0; i < latLons.length; i += 2) {
      nodes.add(Long.toString(id * 1000 + i / 2));
      geometry.add("{\"lat\": %s, \"lon\": %s}".formatted(latLons[i], latLons[i + 1]));
    }
    return """
      {"type": "way", "id": %d, "nodes": [%s], "geometry": [%s], "tags": %s}
      """.formatted(id, String.join(",", nodes), String.join(",", geometry), tagsJson(tags));
  }

  private static String tagsJson(Map<String, String> tags) {
    return tags.entrySet().stream()
      .map(e -> "\"" + e.getKey() + "\": \"" + e.getValue() + "\"")
      .collect(Collectors.joining(",", "{", "}"));
  }

  public static OsmElement.Way way(long id, Map<String, String> tags, double... latLons) {
    List<OsmElement.LatLon> geometry = new ArrayList<>();
    for (int i = 0; i < latLons.length; i += 2) {
      geometry.add(new OsmElement.LatLon(latLons[i], latLons[i + 1]));
    }
    return new OsmElement.Way(id, tags, geometry);
  }
}
