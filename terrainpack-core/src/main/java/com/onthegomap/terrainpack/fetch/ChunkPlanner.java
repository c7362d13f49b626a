package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.geo.BoundingBox;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits a bounding box into a grid of equally-sized chunks so that each request stays below the query service's
 * per-request node cap.
 */
public class ChunkPlanner {

  private final DensityTable densities;
  private final long maxNodesPerRequest;

  public ChunkPlanner(DensityTable densities, long maxNodesPerRequest) {
    if (maxNodesPerRequest <= 0) {
      throw new IllegalArgumentException("max nodes per request must be positive: " + maxNodesPerRequest);
    }
    this.densities = densities;
    this.maxNodesPerRequest = maxNodesPerRequest;
  }

  /** Returns the estimated node count for {@code categories} in {@code bbox}, including the safety margin. */
  public long estimateNodes(BoundingBox bbox, Collection<FeatureCategory> categories) {
    return (long) (bbox.areaKm2() * densities.totalDensity(categories) * densities.safetyMargin());
  }

  /** Returns how many requests {@code estimate} nodes need, at least 1. */
  public long requestsNeeded(long estimate) {
    return Math.max(1, ceilDiv(estimate, maxNodesPerRequest));
  }

  /** Returns the side length of the smallest square grid with at least {@code requests} cells. */
  public static int gridSize(long requests) {
    int n = (int) Math.ceil(Math.sqrt(requests));
    // guard against floating point error on perfect squares
    while ((long) n * n < requests) {
      n++;
    }
    while (n > 1 && (long) (n - 1) * (n - 1) >= requests) {
      n--;
    }
    return Math.max(1, n);
  }

  /** Returns the chunk grid to fetch {@code categories} in {@code bbox}. */
  public ChunkPlan plan(BoundingBox bbox, Collection<FeatureCategory> categories) {
    long estimate = estimateNodes(bbox, categories);
    int n = estimate > maxNodesPerRequest ? gridSize(requestsNeeded(estimate)) : 1;
    return new ChunkPlan(bbox, estimate, n, split(bbox, n));
  }

  /**
   * Returns {@code n * n} boxes of equal angular size covering {@code bbox}, ordered south to north then west to east.
   * <p>
   * Boxes on the last row and column share the exact north and east edges of {@code bbox}, so rounding never leaves a
   * gap.
   */
  public static List<BoundingBox> split(BoundingBox bbox, int n) {
    if (n <= 1) {
      return List.of(bbox);
    }
    double lonStep = bbox.width() / n;
    double latStep = bbox.height() / n;
    List<BoundingBox> result = new ArrayList<>(n * n);
    for (int row = 0; row < n; row++) {
      double south = row == 0 ? bbox.minLat() : bbox.minLat() + row * latStep;
      double north = row == n - 1 ? bbox.maxLat() : bbox.minLat() + (row + 1) * latStep;
      for (int col = 0; col < n; col++) {
        double west = col == 0 ? bbox.minLon() : bbox.minLon() + col * lonStep;
        double east = col == n - 1 ? bbox.maxLon() : bbox.minLon() + (col + 1) * lonStep;
        result.add(new BoundingBox(west, south, east, north));
      }
    }
    return result;
  }

  private static long ceilDiv(long a, long b) {
    return -Math.floorDiv(-a, b);
  }

  /**
   * The chunks one fetch will request.
   *
   * @param bbox      the requested area
   * @param estimate  estimated node count for the whole area
   * @param gridSize  number of rows and columns
   * @param chunks    {@code gridSize * gridSize} boxes, row by row from the south-west
   */
  public record ChunkPlan(BoundingBox bbox, long estimate, int gridSize, List<BoundingBox> chunks) {

    public ChunkPlan {
      chunks = List.copyOf(chunks);
    }

    /** Latitudes of the seams between rows of chunks. */
    public double[] latitudeSeams() {
      double[] result = new double[gridSize - 1];
      for (int i = 1; i < gridSize; i++) {
        result[i - 1] = chunks.get(i * gridSize).minLat();
      }
      return result;
    }

    /** Longitudes of the seams between columns of chunks. */
    public double[] longitudeSeams() {
      double[] result = new double[gridSize - 1];
      for (int i = 1; i < gridSize; i++) {
        result[i - 1] = chunks.get(i).minLon();
      }
      return result;
    }
  }
}
