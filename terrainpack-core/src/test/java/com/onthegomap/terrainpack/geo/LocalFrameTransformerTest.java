package com.onthegomap.terrainpack.geo;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LocalFrameTransformerTest {

  private final BoundingBox bbox = new BoundingBox(-122.5, 37.7, -122.4, 37.8);

  @Test
  void testSouthWestCornerIsOrigin() {
    var transformer = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 0));
    assertEquals(Vec3.ZERO, transformer.toLocal(37.7, -122.5));
  }

  @Test
  void testAxes() {
    var transformer = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 0), 1, Vec3.ZERO, 0);
    Vec3 north = transformer.toLocal(37.8, -122.5);
    Vec3 east = transformer.toLocal(37.7, -122.4);
    assertEquals(0.1 * GeoUtils.METERS_PER_DEGREE_LAT, north.x(), 1e-6);
    assertEquals(0, north.y(), 1e-9);
    assertEquals(0, east.x(), 1e-9);
    assertEquals(0.1 * GeoUtils.metersPerDegreeLon(37.75), east.y(), 1e-6);
  }

  @ParameterizedTest
  @CsvSource({
    "37.7, -122.5, 37.8, -122.4",
    "37.71, -122.49, 37.72, -122.48",
    "37.75, -122.5, 37.75, -122.4",
    "37.7, -122.45, 37.8, -122.45",
  })
  void testDistancesMatchHaversine(double lat1, double lon1, double lat2, double lon2) {
    var transformer = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 0), 1, Vec3.ZERO, 0);
    double expected = GeoUtils.distanceMeters(lat1, lon1, lat2, lon2);
    double actual = transformer.toLocal(lat1, lon1).horizontalDistance(transformer.toLocal(lat2, lon2));
    assertEquals(expected, actual, expected * 0.01);
  }

  @Test
  void testUnitScaleAndOrigin() {
    var meters = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 12), 1, Vec3.ZERO, 0);
    var centimeters = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 12), 100, new Vec3(1, 2, 3), 0);
    Vec3 m = meters.toLocal(37.75, -122.45);
    Vec3 cm = centimeters.toLocal(37.75, -122.45);
    assertEquals(m.x() * 100 + 1, cm.x(), 1e-6);
    assertEquals(m.y() * 100 + 2, cm.y(), 1e-6);
    assertEquals(12, m.z(), 1e-9);
    assertEquals(1203, cm.z(), 1e-6);
  }

  @Test
  void testElevationFollowsRaster() {
    // rises from 0 at the south edge to 100 at the north edge
    var raster = HeightRaster.of(2, 2, new float[]{0, 0, 100, 100}, -9999);
    var transformer = new LocalFrameTransformer(bbox, raster, 1, Vec3.ZERO, 0);
    assertEquals(0, transformer.toLocal(37.7, -122.45).z(), 1e-6);
    assertEquals(50, transformer.toLocal(37.75, -122.45).z(), 1e-6);
    assertEquals(100, transformer.toLocal(37.8, -122.45).z(), 1e-6);
  }

  @Test
  void testNoDataGroundIsZero() {
    var raster = HeightRaster.of(1, 1, new float[]{-9999}, -9999);
    var transformer = new LocalFrameTransformer(bbox, raster, 1, new Vec3(0, 0, 5), 0);
    assertEquals(5, transformer.toLocal(37.75, -122.45).z(), 1e-9);
  }

  @Test
  void testClampTolerance() throws GeometryException {
    var transformer = new LocalFrameTransformer(bbox, HeightRaster.flat(2, 2, 0), 1, Vec3.ZERO, 0.01);
    assertEquals(0, transformer.clampDelta(37.75, -122.45));
    assertEquals(0.005, transformer.clampDelta(37.805, -122.45), 1e-9);
    assertNotNull(transformer.toLocalChecked(37.805, -122.45));
    var e = assertThrows(GeometryException.class, () -> transformer.toLocalChecked(37.85, -122.45));
    assertEquals("outside_bbox", e.stat());
  }
}
