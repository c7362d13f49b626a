package com.onthegomap.terrainpack.config;

import com.onthegomap.terrainpack.fetch.DensityTable;
import com.onthegomap.terrainpack.fetch.FeatureCategory;
import com.onthegomap.terrainpack.fetch.RetryPolicy;
import com.onthegomap.terrainpack.geo.Vec3;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Settings that control how an export job fetches, converts and packs features.
 */
public record TerrainpackConfig(
  String overpassUrl,
  String httpUserAgent,
  Duration httpTimeout,
  int httpRetries,
  Duration httpRetryWait,
  Duration chunkDelay,
  long maxNodesPerRequest,
  DensityTable densityTable,
  double minBboxDegrees,
  double maxBboxDegrees,
  double unitScale,
  Vec3 origin,
  double clampTolerance,
  double levelHeight,
  double defaultBuildingHeight,
  double cableSpacing,
  double sagFactor,
  int threads
) {

  public static final String DEFAULT_OVERPASS_URL = "https://overpass-api.de/api/interpreter";

  public TerrainpackConfig {
    if (httpRetries < 1) {
      throw new IllegalArgumentException("http_retries must be at least 1, got " + httpRetries);
    }
    if (maxNodesPerRequest <= 0) {
      throw new IllegalArgumentException("max_nodes_per_request must be positive, got " + maxNodesPerRequest);
    }
    if (!(cableSpacing > 0)) {
      throw new IllegalArgumentException("cable_spacing must be positive, got " + cableSpacing);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be at least 1, got " + threads);
    }
  }

  public static TerrainpackConfig defaults() {
    return from(Arguments.of());
  }

  public static TerrainpackConfig from(Arguments arguments) {
    Map<FeatureCategory, Double> densities = new EnumMap<>(FeatureCategory.class);
    for (var category : FeatureCategory.values()) {
      densities.put(category, arguments.getDouble(
        "density_" + category.id(),
        "estimated nodes per square km for " + category.id().toLowerCase(Locale.ROOT),
        category.defaultDensity()
      ));
    }
    return new TerrainpackConfig(
      arguments.getString("overpass_url", "Overpass API interpreter endpoint", DEFAULT_OVERPASS_URL),
      arguments.getString("http_user_agent|user_agent", "User-Agent header to set when fetching map features",
        "Terrainpack downloader (https://github.com/onthegomap/terrainpack)"),
      arguments.getDuration("http_timeout", "Timeout to use when fetching one chunk of map features", "180s"),
      arguments.getInteger("http_retries", "Attempts per chunk before giving up on it", 3),
      arguments.getDuration("http_retry_wait", "Delay before the first retry of a chunk, doubled for each retry",
        "2s"),
      arguments.getDuration("chunk_delay", "Minimum delay between successive chunk requests", "1s"),
      arguments.getLong("max_nodes_per_request", "Feature-node cap the query service enforces per request",
        50_000),
      new DensityTable(densities,
        arguments.getDouble("density_margin", "Safety margin multiplied into node-count estimates", 1.3)),
      arguments.getDouble("min_bbox_degrees", "Smallest allowed bounding box side in degrees", 0.001),
      arguments.getDouble("max_bbox_degrees", "Largest allowed bounding box side in degrees", 10),
      arguments.getDouble("unit_scale", "Engine units per meter", 100),
      new Vec3(
        arguments.getDouble("origin_x", "Offset added to local x (north) in engine units", 0),
        arguments.getDouble("origin_y", "Offset added to local y (east) in engine units", 0),
        arguments.getDouble("origin_z", "Offset added to local z (up) in engine units", 0)
      ),
      arguments.getDouble("clamp_tolerance", "Degrees a vertex may lie outside the bounding box", 0.01),
      arguments.getDouble("level_height", "Meters per building level", 3),
      arguments.getDouble("default_building_height", "Building height in meters when no tag says otherwise", 3),
      arguments.getDouble("cable_spacing", "Meters between interpolated points on overhead cables", 5),
      arguments.getDouble("sag_factor", "Cable sag at mid-span as a fraction of span length", 0.02),
      arguments.threads()
    );
  }

  /** Retry settings for one chunk request. */
  public RetryPolicy retryPolicy() {
    return new RetryPolicy(httpRetries, httpRetryWait, 2);
  }
}
