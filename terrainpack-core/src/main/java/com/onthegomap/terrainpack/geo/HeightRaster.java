package com.onthegomap.terrainpack.geo;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import javax.annotation.concurrent.Immutable;

/**
 * A grid of elevation samples in meters covering an export's bounding box.
 * <p>
 * Samples are stored row-major. Row 0 lies along the box's minimum latitude and column 0 along its minimum longitude,
 * so rows grow northward and columns grow eastward like the local frame. Samples equal to {@link #noData()} (or NaN)
 * have no elevation.
 */
@Immutable
public final class HeightRaster {

  private final int width;
  private final int height;
  private final float[] samples;
  private final float noData;
  private final float minElevation;
  private final float maxElevation;

  private HeightRaster(int width, int height, float[] samples, float noData) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("raster must be at least 1x1, got " + width + "x" + height);
    }
    if (samples.length != width * height) {
      throw new IllegalArgumentException(
        "expected " + (width * height) + " samples for " + width + "x" + height + " but got " + samples.length);
    }
    this.width = width;
    this.height = height;
    this.samples = samples;
    this.noData = noData;
    float min = Float.NaN;
    float max = Float.NaN;
    for (float sample : samples) {
      if (!isNoData(sample)) {
        min = Float.isNaN(min) ? sample : Math.min(min, sample);
        max = Float.isNaN(max) ? sample : Math.max(max, sample);
      }
    }
    this.minElevation = min;
    this.maxElevation = max;
  }

  /** Returns a raster over a copy of {@code samples}. */
  public static HeightRaster of(int width, int height, float[] samples, float noData) {
    return new HeightRaster(width, height, samples.clone(), noData);
  }

  /** Returns a raster with every sample set to {@code elevation}. */
  public static HeightRaster flat(int width, int height, float elevation) {
    float[] samples = new float[width * height];
    Arrays.fill(samples, elevation);
    return new HeightRaster(width, height, samples, Float.NaN);
  }

  /** Returns a raster where each sample is computed from its column and row. */
  public static HeightRaster generate(int width, int height, float noData, SampleFunction function) {
    float[] samples = new float[width * height];
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        samples[row * width + col] = function.apply(col, row);
      }
    }
    return new HeightRaster(width, height, samples, noData);
  }

  /** Reads {@code width * height} little-endian float32 samples from a raw file. */
  public static HeightRaster readFloat32(Path path, int width, int height, float noData) throws IOException {
    byte[] bytes = Files.readAllBytes(path);
    if (bytes.length != width * height * Float.BYTES) {
      throw new IOException(
        path + " has " + bytes.length + " bytes, expected " + (width * height * Float.BYTES) + " for " + width + "x" +
          height + " float32 samples");
    }
    float[] samples = new float[width * height];
    ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(samples);
    return new HeightRaster(width, height, samples, noData);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public float noData() {
    return noData;
  }

  /** Lowest valid sample, or NaN if every sample is no-data. */
  public float minElevation() {
    return minElevation;
  }

  /** Highest valid sample, or NaN if every sample is no-data. */
  public float maxElevation() {
    return maxElevation;
  }

  public float get(int col, int row) {
    return samples[row * width + col];
  }

  public boolean isNoData(float sample) {
    return Float.isNaN(sample) || sample == noData;
  }

  /** Returns a copy of the row-major samples. */
  public float[] samples() {
    return samples.clone();
  }

  /**
   * Returns the bilinear-interpolated elevation at fractional position {@code (u, v)} where {@code u} runs west to east
   * and {@code v} south to north over [0, 1]. Values outside [0, 1] are clamped.
   * <p>
   * No-data samples are left out and the remaining weights renormalized. Returns NaN when all four surrounding samples
   * are no-data.
   */
  public double sampleBilinear(double u, double v) {
    double px = clamp01(u) * (width - 1);
    double py = clamp01(v) * (height - 1);
    int x0 = (int) Math.floor(px);
    int y0 = (int) Math.floor(py);
    int x1 = Math.min(x0 + 1, width - 1);
    int y1 = Math.min(y0 + 1, height - 1);
    double fx = px - x0;
    double fy = py - y0;

    float[] values = {get(x0, y0), get(x1, y0), get(x0, y1), get(x1, y1)};
    double[] weights = {(1 - fx) * (1 - fy), fx * (1 - fy), (1 - fx) * fy, fx * fy};
    double sum = 0;
    double weightSum = 0;
    double plainSum = 0;
    int valid = 0;
    for (int i = 0; i < 4; i++) {
      if (!isNoData(values[i])) {
        sum += values[i] * weights[i];
        weightSum += weights[i];
        plainSum += values[i];
        valid++;
      }
    }
    if (valid == 0) {
      return Double.NaN;
    } else if (weightSum == 0) {
      // only zero-weight neighbors have data
      return plainSum / valid;
    } else if (valid == 4) {
      return sum;
    }
    return sum / weightSum;
  }

  private static double clamp01(double value) {
    return value < 0 ? 0 : value > 1 ? 1 : value;
  }

  @FunctionalInterface
  public interface SampleFunction {
    float apply(int col, int row);
  }
}
