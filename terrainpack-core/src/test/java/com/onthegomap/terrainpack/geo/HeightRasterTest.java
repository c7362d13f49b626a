package com.onthegomap.terrainpack.geo;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HeightRasterTest {

  private static final float NO_DATA = -9999;

  @Test
  void testCornersAndCenter() {
    // 0 10
    // 20 30 with row 0 at the south
    var raster = HeightRaster.of(2, 2, new float[]{0, 10, 20, 30}, NO_DATA);
    assertEquals(0, raster.sampleBilinear(0, 0), 1e-9);
    assertEquals(10, raster.sampleBilinear(1, 0), 1e-9);
    assertEquals(20, raster.sampleBilinear(0, 1), 1e-9);
    assertEquals(30, raster.sampleBilinear(1, 1), 1e-9);
    assertEquals(15, raster.sampleBilinear(0.5, 0.5), 1e-9);
    assertEquals(5, raster.sampleBilinear(0.5, 0), 1e-9);
  }

  @Test
  void testClampsOutsideUnitSquare() {
    var raster = HeightRaster.of(2, 2, new float[]{0, 10, 20, 30}, NO_DATA);
    assertEquals(0, raster.sampleBilinear(-1, -1), 1e-9);
    assertEquals(30, raster.sampleBilinear(2, 2), 1e-9);
  }

  @Test
  void testNoDataIsSkipped() {
    var raster = HeightRaster.of(2, 2, new float[]{NO_DATA, 10, 10, 10}, NO_DATA);
    assertEquals(10, raster.sampleBilinear(0.5, 0.5), 1e-9);
    assertEquals(10, raster.sampleBilinear(0.1, 0.1), 1e-9);
    assertEquals(10, raster.minElevation());
    assertEquals(10, raster.maxElevation());
  }

  @Test
  void testAllNoData() {
    var raster = HeightRaster.of(2, 2, new float[]{NO_DATA, NO_DATA, NO_DATA, NO_DATA}, NO_DATA);
    assertTrue(Double.isNaN(raster.sampleBilinear(0.5, 0.5)));
    assertTrue(Float.isNaN(raster.minElevation()));
  }

  @Test
  void testSingleSample() {
    var raster = HeightRaster.flat(1, 1, 42);
    assertEquals(42, raster.sampleBilinear(0.3, 0.9), 1e-9);
  }

  @Test
  void testRejectsWrongSampleCount() {
    assertThrows(IllegalArgumentException.class, () -> HeightRaster.of(2, 2, new float[3], NO_DATA));
    assertThrows(IllegalArgumentException.class, () -> HeightRaster.of(0, 2, new float[0], NO_DATA));
  }

  @Test
  void testReadFloat32(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("dem.f32");
    ByteBuffer buffer = ByteBuffer.allocate(6 * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (int i = 0; i < 6; i++) {
      buffer.putFloat(i * 1.5f);
    }
    Files.write(file, buffer.array());
    var raster = HeightRaster.readFloat32(file, 3, 2, NO_DATA);
    assertEquals(3, raster.width());
    assertEquals(2, raster.height());
    assertEquals(1.5f * 4, raster.get(1, 1));
    assertEquals(0, raster.minElevation());
    assertEquals(7.5f, raster.maxElevation());
    assertThrows(IOException.class, () -> HeightRaster.readFloat32(file, 2, 2, NO_DATA));
  }
}
