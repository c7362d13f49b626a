package com.onthegomap.terrainpack.geo;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.terrainpack.config.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class BoundingBoxTest {

  @Test
  void testParse() {
    var bbox = BoundingBox.parse(" -122.5, 37.7,-122.4,37.8 ");
    assertEquals(-122.5, bbox.minLon());
    assertEquals(37.7, bbox.minLat());
    assertEquals(-122.4, bbox.maxLon());
    assertEquals(37.8, bbox.maxLat());
    assertEquals(37.75, bbox.centerLat(), 1e-9);
    assertEquals(-122.45, bbox.centerLon(), 1e-9);
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1,2,3", "a,b,c,d", "1,2,3,4,5"})
  void testParseInvalid(String input) {
    assertThrows(ValidationException.class, () -> BoundingBox.parse(input));
  }

  @ParameterizedTest
  @CsvSource({
    "1, 0, 0, 1",
    "0, 1, 1, 0",
    "0, 0, 0, 1",
    "-181, 0, 0, 1",
    "0, -91, 1, 1",
    "0, 0, 181, 1",
    "0, 0, 1, 91",
  })
  void testInvalidCorners(double minLon, double minLat, double maxLon, double maxLat) {
    assertThrows(ValidationException.class, () -> new BoundingBox(minLon, minLat, maxLon, maxLat));
  }

  @Test
  void testRequireSideBetween() {
    var bbox = new BoundingBox(0, 0, 0.1, 0.2);
    assertSame(bbox, bbox.requireSideBetween(0.001, 10));
    assertThrows(ValidationException.class, () -> bbox.requireSideBetween(0.15, 10));
    assertThrows(ValidationException.class, () -> bbox.requireSideBetween(0.001, 0.15));
  }

  @Test
  void testArea() {
    // 0.1 degree square at 37.75 degrees north is about 8.8km x 11.05km
    var bbox = new BoundingBox(-122.5, 37.7, -122.4, 37.8);
    assertEquals(97.3, bbox.areaKm2(), 0.2);
  }

  @Test
  void testContainsAndEnvelope() {
    var bbox = new BoundingBox(1, 2, 3, 4);
    assertTrue(bbox.contains(3, 2));
    assertTrue(bbox.contains(2, 1));
    assertFalse(bbox.contains(5, 2));
    var envelope = bbox.toEnvelope();
    assertEquals(1, envelope.getMinX());
    assertEquals(2, envelope.getMinY());
    assertEquals(3, envelope.getMaxX());
    assertEquals(4, envelope.getMaxY());
    assertEquals("2.0,1.0,4.0,3.0", bbox.toOverpassBbox());
    assertEquals("-0.00090,0.00050,0.0095,0.0105",
      new BoundingBox(0.0005, -0.0009, 0.0105, 0.0095).toOverpassBbox());
    assertEquals("0.0,0.00000010,1.0,1.0", new BoundingBox(1e-7, 0, 1, 1).toOverpassBbox());
  }
}
