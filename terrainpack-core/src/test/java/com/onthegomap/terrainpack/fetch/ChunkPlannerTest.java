package com.onthegomap.terrainpack.fetch;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.terrainpack.geo.BoundingBox;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

class ChunkPlannerTest {

  private static final BoundingBox SAN_FRANCISCO = new BoundingBox(-122.5, 37.7, -122.4, 37.8);
  private final ChunkPlanner planner = new ChunkPlanner(DensityTable.defaults(), 50_000);

  @Test
  void testSanFranciscoRoadsSplitIntoFourChunks() {
    var plan = planner.plan(SAN_FRANCISCO, Set.of(FeatureCategory.ROADS));
    assertTrue(plan.estimate() > 50_000, "estimate " + plan.estimate());
    assertTrue(plan.estimate() < 100_000, "estimate " + plan.estimate());
    assertEquals(2, plan.gridSize());
    assertEquals(4, plan.chunks().size());
    assertBox(-122.5, 37.7, -122.45, 37.75, plan.chunks().get(0));
    assertBox(-122.45, 37.7, -122.4, 37.75, plan.chunks().get(1));
    assertBox(-122.5, 37.75, -122.45, 37.8, plan.chunks().get(2));
    assertBox(-122.45, 37.75, -122.4, 37.8, plan.chunks().get(3));
    assertArrayEquals(new double[]{37.75}, plan.latitudeSeams(), 1e-12);
    assertArrayEquals(new double[]{-122.45}, plan.longitudeSeams(), 1e-12);
  }

  private static void assertBox(double minLon, double minLat, double maxLon, double maxLat, BoundingBox actual) {
    assertEquals(minLon, actual.minLon(), 1e-9, actual::toString);
    assertEquals(minLat, actual.minLat(), 1e-9, actual::toString);
    assertEquals(maxLon, actual.maxLon(), 1e-9, actual::toString);
    assertEquals(maxLat, actual.maxLat(), 1e-9, actual::toString);
  }

  @Test
  void testSmallAreaIsOneChunk() {
    var bbox = new BoundingBox(-122.5, 37.7, -122.49, 37.71);
    var plan = planner.plan(bbox, Set.of(FeatureCategory.ROADS));
    assertEquals(1, plan.gridSize());
    assertEquals(List.of(bbox), plan.chunks());
    assertEquals(0, plan.latitudeSeams().length);
  }

  @Test
  void testEstimateUsesDensitiesAndMargin() {
    var table = new DensityTable(java.util.Map.of(FeatureCategory.ROADS, 100d, FeatureCategory.WATER, 50d), 2);
    var custom = new ChunkPlanner(table, 1000);
    var bbox = SAN_FRANCISCO;
    long expected = (long) (bbox.areaKm2() * 150 * 2);
    assertEquals(expected, custom.estimateNodes(bbox, Set.of(FeatureCategory.ROADS, FeatureCategory.WATER)));
    assertEquals(0, custom.estimateNodes(bbox, Set.of(FeatureCategory.POI)));
  }

  @ParameterizedTest
  @CsvSource({
    "1, 1",
    "2, 2",
    "4, 2",
    "5, 3",
    "9, 3",
    "10, 4",
    "100, 10",
    "101, 11",
  })
  void testGridSize(long requests, int expected) {
    assertEquals(expected, ChunkPlanner.gridSize(requests));
  }

  @Test
  void testRequestsNeeded() {
    assertEquals(1, planner.requestsNeeded(0));
    assertEquals(1, planner.requestsNeeded(50_000));
    assertEquals(2, planner.requestsNeeded(50_001));
  }

  @Test
  void testChunkCountNeverDecreasesWithArea() {
    int previous = 0;
    for (int i = 1; i <= 40; i++) {
      double side = 0.02 * i;
      var bbox = new BoundingBox(-122.5, 37.7, -122.5 + side, 37.7 + side);
      int chunks = planner.plan(bbox, Set.of(FeatureCategory.ROADS, FeatureCategory.BUILDINGS)).chunks().size();
      assertTrue(chunks >= previous, "chunk count dropped from " + previous + " to " + chunks + " at " + side);
      previous = chunks;
    }
    assertTrue(previous > 1);
  }

  @Test
  void testChunkCountNeverDecreasesWithCategories() {
    Set<FeatureCategory> some = Set.of(FeatureCategory.ROADS);
    Set<FeatureCategory> more = Set.of(FeatureCategory.ROADS, FeatureCategory.BUILDINGS, FeatureCategory.POI);
    assertTrue(planner.plan(SAN_FRANCISCO, more).chunks().size() >= planner.plan(SAN_FRANCISCO, some).chunks().size());
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4, 7})
  void testSplitCoversBoxExactly(int n) {
    var bbox = new BoundingBox(-122.51, 37.69, -122.37, 37.83);
    List<BoundingBox> chunks = ChunkPlanner.split(bbox, n);
    assertEquals(n * n, chunks.size());

    var factory = new GeometryFactory();
    Geometry union = factory.toGeometry(chunks.get(0).toEnvelope());
    double totalArea = 0;
    for (var chunk : chunks) {
      assertTrue(bbox.toEnvelope().contains(chunk.toEnvelope()), chunk + " outside " + bbox);
      totalArea += chunk.width() * chunk.height();
      union = union.union(factory.toGeometry(chunk.toEnvelope()));
    }
    Geometry expected = factory.toGeometry(bbox.toEnvelope());
    assertEquals(expected.getArea(), union.getArea(), 1e-12);
    assertTrue(union.buffer(1e-9).contains(expected));
    // no overlaps beyond shared edges
    assertEquals(expected.getArea(), totalArea, 1e-12);
  }

  @Test
  void testSplitSharesExactEdges() {
    var bbox = new BoundingBox(0.1, 0.1, 0.4, 0.7);
    var chunks = ChunkPlanner.split(bbox, 3);
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        var chunk = chunks.get(row * 3 + col);
        if (col < 2) {
          assertEquals(chunk.maxLon(), chunks.get(row * 3 + col + 1).minLon());
        }
        if (row < 2) {
          assertEquals(chunk.maxLat(), chunks.get((row + 1) * 3 + col).minLat());
        }
      }
    }
    assertEquals(0.4, chunks.get(8).maxLon());
    assertEquals(0.7, chunks.get(8).maxLat());
  }
}
