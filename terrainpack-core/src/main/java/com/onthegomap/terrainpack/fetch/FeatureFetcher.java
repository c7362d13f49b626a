package com.onthegomap.terrainpack.fetch;

import com.google.common.net.HttpHeaders;
import com.onthegomap.terrainpack.config.TerrainpackConfig;
import com.onthegomap.terrainpack.geo.BoundingBox;
import com.onthegomap.terrainpack.reader.FileFormatException;
import com.onthegomap.terrainpack.reader.osm.FeatureCollection;
import com.onthegomap.terrainpack.reader.osm.OsmElement;
import com.onthegomap.terrainpack.reader.osm.OverpassResponseParser;
import com.onthegomap.terrainpack.stats.Stats;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches map features for a bounding box from an Overpass API endpoint.
 * <p>
 * Large areas are split into a grid of chunks by {@link ChunkPlanner}. Chunks are requested one at a time with a
 * minimum delay between them and a retry policy for each. A chunk that keeps failing becomes a {@link ChunkWarning}
 * and the fetch only fails when no chunk succeeds. Results are merged keeping the first copy of each element, since
 * features along chunk seams come back from both neighbors.
 * <p>
 * One instance holds no per-fetch state, so independent fetches may share it.
 */
public class FeatureFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(FeatureFetcher.class);

  private final TerrainpackConfig config;
  private final OverpassClient client;
  private final Sleeper sleeper;
  private final Stats stats;
  private final ChunkPlanner planner;
  private final RetryPolicy retryPolicy;
  private final OverpassResponseParser parser = new OverpassResponseParser();

  public FeatureFetcher(TerrainpackConfig config, OverpassClient client, Sleeper sleeper, Stats stats) {
    this.config = config;
    this.client = client;
    this.sleeper = sleeper;
    this.stats = stats;
    this.planner = new ChunkPlanner(config.densityTable(), config.maxNodesPerRequest());
    this.retryPolicy = config.retryPolicy();
  }

  /** Returns a fetcher that sends real HTTP requests. */
  public static FeatureFetcher create(TerrainpackConfig config, Stats stats) {
    HttpClient httpClient = HttpClient.newBuilder()
      .followRedirects(HttpClient.Redirect.NORMAL)
      .connectTimeout(Duration.ofSeconds(30))
      .build();
    return new FeatureFetcher(config, OverpassClient.wrap(httpClient), Sleeper.SYSTEM, stats);
  }

  public ChunkPlanner planner() {
    return planner;
  }

  /** Fetches {@code filters} in {@code bbox} without a way to cancel. */
  public FetchResult fetch(BoundingBox bbox, Set<FeatureCategory> filters) {
    return fetch(bbox, filters, () -> false);
  }

  /**
   * Fetches every feature of {@code filters} inside {@code bbox}.
   *
   * @param cancelled checked before each chunk request, when it returns true the fetch stops
   * @throws com.onthegomap.terrainpack.config.ValidationException if the box is outside the allowed size or no
   *                                                               category is selected
   * @throws QueryException                                        if every chunk failed
   * @throws CancellationException                                 if {@code cancelled} returned true or the thread
   *                                                               was interrupted
   */
  public FetchResult fetch(BoundingBox bbox, Set<FeatureCategory> filters, BooleanSupplier cancelled) {
    FeatureCategory.requireNonEmpty(filters);
    bbox.requireSideBetween(config.minBboxDegrees(), config.maxBboxDegrees());

    var plan = planner.plan(bbox, filters);
    int total = plan.chunks().size();
    LOGGER.info("Fetching {} for {} (~{} km2, estimated {} nodes) in {} chunk(s)",
      filters, bbox, Math.round(bbox.areaKm2()), plan.estimate(), total);

    var merged = FeatureCollection.builder();
    List<ChunkWarning> warnings = new ArrayList<>();
    for (int i = 0; i < total; i++) {
      if (cancelled.getAsBoolean()) {
        throw new CancellationException("Fetch cancelled after " + i + " of " + total + " chunks");
      }
      if (i > 0) {
        sleep(config.chunkDelay());
      }
      BoundingBox chunk = plan.chunks().get(i);
      try {
        FeatureCollection result = fetchChunk(i, total, chunk, filters);
        int added = merged.addAll(result);
        LOGGER.info("Chunk {}/{}: {} elements, {} new", i + 1, total, result.size(), added);
      } catch (ChunkFailedException e) {
        var warning = new ChunkWarning(i, chunk, e.attempts, e.getMessage());
        LOGGER.warn("Skipping {}", warning);
        stats.dataError("fetch_chunk_failed");
        warnings.add(warning);
      }
    }

    if (warnings.size() == total) {
      throw new QueryException("All " + total + " chunk(s) failed for " + bbox + ", last error: " +
        warnings.get(total - 1).cause(), warnings);
    }

    FeatureCollection features = merged.build();
    if (plan.gridSize() > 1) {
      features = markPossiblySplit(features, plan);
    }
    if (!warnings.isEmpty()) {
      LOGGER.warn("Fetched {} of {} chunks, results are incomplete", total - warnings.size(), total);
    }
    LOGGER.info("Fetched {} (removed {} duplicates)", features, merged.duplicates());
    return new FetchResult(features, warnings, plan, merged.duplicates());
  }

  private FeatureCollection fetchChunk(int index, int total, BoundingBox chunk, Set<FeatureCategory> filters)
    throws ChunkFailedException {
    String query = OverpassQuery.build(chunk, filters, config.httpTimeout());
    HttpRequest request = HttpRequest.newBuilder(URI.create(config.overpassUrl()))
      .timeout(config.httpTimeout().plusSeconds(10))
      .header(HttpHeaders.USER_AGENT, config.httpUserAgent())
      .header(HttpHeaders.CONTENT_TYPE, "application/x-www-form-urlencoded")
      .header(HttpHeaders.ACCEPT_ENCODING, "gzip")
      .POST(HttpRequest.BodyPublishers.ofString(OverpassQuery.formBody(query)))
      .build();

    int attempts = retryPolicy.maxAttempts();
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try (var body = client.send(request)) {
        return parser.parse(body);
      } catch (FileFormatException e) {
        // the service answered, asking again would return the same thing
        throw new ChunkFailedException(e.getMessage(), attempt);
      } catch (IOException e) {
        if (attempt == attempts) {
          throw new ChunkFailedException(e.getMessage(), attempt);
        }
        Duration wait = retryPolicy.delayAfterAttempt(attempt);
        LOGGER.warn("Chunk {}/{} attempt {}/{} failed: {}, retrying in {}ms", index + 1, total, attempt, attempts,
          e.getMessage(), wait.toMillis());
        sleep(wait);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Interrupted while fetching chunk " + (index + 1));
      }
    }
    throw new IllegalStateException("unreachable");
  }

  private void sleep(Duration duration) {
    try {
      sleeper.sleep(duration);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException("Interrupted while waiting between requests");
    }
  }

  /** Flags ways that cross a seam between chunks since each chunk may only have returned part of them. */
  static FeatureCollection markPossiblySplit(FeatureCollection features, ChunkPlanner.ChunkPlan plan) {
    double[] latSeams = plan.latitudeSeams();
    double[] lonSeams = plan.longitudeSeams();
    return features.mapWays(way -> way.withPossiblySplit(way.possiblySplit() || crossesSeam(way, latSeams, lonSeams)));
  }

  private static boolean crossesSeam(OsmElement.Way way, double[] latSeams, double[] lonSeams) {
    if (way.geometry().size() < 2) {
      return false;
    }
    Envelope extent = way.envelope();
    for (double seam : latSeams) {
      if (extent.getMinY() <= seam && extent.getMaxY() >= seam) {
        return true;
      }
    }
    for (double seam : lonSeams) {
      if (extent.getMinX() <= seam && extent.getMaxX() >= seam) {
        return true;
      }
    }
    return false;
  }

  private static class ChunkFailedException extends Exception {

    private final int attempts;

    ChunkFailedException(String message, int attempts) {
      super(message);
      this.attempts = attempts;
    }
  }
}
