package com.onthegomap.terrainpack.reader.osm;

import static com.onthegomap.terrainpack.TestUtils.way;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FeatureCollectionTest {

  private final OsmElement.Node node1 = new OsmElement.Node(1, Map.of("amenity", "bench"), 1, 2);
  private final OsmElement.Node node1Later = new OsmElement.Node(1, Map.of("amenity", "bench", "new", "tag"), 1, 2);
  private final OsmElement.Way way1 = way(1, Map.of("highway", "service"), 1, 2, 3, 4);
  private final OsmElement.Way way2 = way(2, Map.of("highway", "service"), 1, 2, 3, 4);

  @Test
  void testKeepsFirstOccurrence() {
    var builder = FeatureCollection.builder();
    assertTrue(builder.add(node1));
    assertFalse(builder.add(node1Later));
    // same id, different type
    assertTrue(builder.add(way1));
    var result = builder.build();
    assertEquals(List.of(node1), result.nodes());
    assertEquals(List.of(way1), result.ways());
    assertEquals(1, builder.duplicates());
  }

  @Test
  void testMergeIsIdempotent() {
    var chunk = FeatureCollection.of(List.of(node1, way1, way2));
    var once = FeatureCollection.builder();
    once.addAll(chunk);
    var twice = FeatureCollection.builder();
    assertEquals(3, twice.addAll(chunk));
    assertEquals(0, twice.addAll(chunk));
    assertEquals(once.build(), twice.build());
    assertEquals(3, twice.duplicates());
  }

  @Test
  void testOfRemovesDuplicates() {
    var collection = FeatureCollection.of(List.of(way1, way2, way1, node1));
    assertEquals(3, collection.size());
    assertEquals(List.of(way1, way2), collection.ways());
    assertEquals(3, collection.stream().count());
  }

  @Test
  void testMapWays() {
    var collection = FeatureCollection.of(List.of(node1, way1, way2));
    var mapped = collection.mapWays(way -> way.withPossiblySplit(way.id() == 2));
    assertFalse(mapped.ways().get(0).possiblySplit());
    assertTrue(mapped.ways().get(1).possiblySplit());
    assertEquals(collection.nodes(), mapped.nodes());
    assertTrue(FeatureCollection.empty().isEmpty());
  }

  @Test
  void testWayIsClosed() {
    assertTrue(way(1, Map.of(), 0, 0, 0, 1, 1, 1, 0, 0).isClosed());
    assertFalse(way(1, Map.of(), 0, 0, 0, 1, 1, 1).isClosed());
    assertFalse(way(1, Map.of(), 0, 0, 1, 1, 0, 0).isClosed());
  }
}
