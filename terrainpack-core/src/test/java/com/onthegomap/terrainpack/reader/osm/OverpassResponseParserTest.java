package com.onthegomap.terrainpack.reader.osm;

import static org.junit.jupiter.api.Assertions.*;

import com.carrotsearch.hppc.LongArrayList;
import com.onthegomap.terrainpack.reader.FileFormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OverpassResponseParserTest {

  private final OverpassResponseParser parser = new OverpassResponseParser();

  private FeatureCollection parse(String json) throws IOException {
    return parser.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }

  @Test
  void testParseElements() throws IOException {
    var result = parse("""
      {
        "version": 0.6,
        "elements": [
          {"type": "node", "id": 1, "lat": 37.71, "lon": -122.49, "tags": {"amenity": "bench"}},
          {
            "type": "way", "id": 2, "nodes": [10, 11],
            "geometry": [{"lat": 37.7, "lon": -122.5}, null, {"lat": 37.8, "lon": -122.4}],
            "tags": {"highway": "residential", "name": "Main St", "lanes": null}
          },
          {
            "type": "relation", "id": 3,
            "members": [{"type": "way", "ref": 2, "role": "outer"}, {"type": "area", "ref": 5}],
            "tags": {"type": "multipolygon", "building": "yes"}
          },
          {"type": "area", "id": 4}
        ]
      }
      """);

    assertEquals(3, result.size());
    assertEquals(new OsmElement.Node(1, Map.of("amenity", "bench"), 37.71, -122.49), result.nodes().get(0));
    var way = result.ways().get(0);
    assertEquals(2, way.id());
    assertEquals(LongArrayList.from(10, 11), way.nodes());
    assertEquals(List.of(new OsmElement.LatLon(37.7, -122.5), new OsmElement.LatLon(37.8, -122.4)), way.geometry());
    assertEquals(Map.of("highway", "residential", "name", "Main St"), way.tags());
    assertFalse(way.possiblySplit());
    var relation = result.relations().get(0);
    assertEquals(List.of(new OsmElement.Relation.Member(OsmElement.Type.WAY, 2, "outer")), relation.members());
  }

  @Test
  void testEmptyElements() throws IOException {
    assertTrue(parse("{\"elements\": []}").isEmpty());
  }

  @Test
  void testNotJson() {
    assertThrows(FileFormatException.class, () -> parse("<html>Too Many Requests</html>"));
  }

  @Test
  void testMissingElementsIncludesRemark() {
    var e = assertThrows(FileFormatException.class,
      () -> parse("{\"remark\": \"runtime error: Query timed out\"}"));
    assertTrue(e.getMessage().contains("Query timed out"), e.getMessage());
  }
}
