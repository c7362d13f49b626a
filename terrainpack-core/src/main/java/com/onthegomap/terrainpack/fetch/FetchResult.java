package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.reader.osm.FeatureCollection;
import java.util.List;

/**
 * Merged features from every chunk that succeeded plus a warning for each chunk that did not.
 *
 * @param features          deduplicated features
 * @param warnings          chunks that were skipped
 * @param plan              the chunk grid that was fetched
 * @param duplicatesRemoved elements dropped because an earlier chunk already returned them
 */
public record FetchResult(
  FeatureCollection features,
  List<ChunkWarning> warnings,
  ChunkPlanner.ChunkPlan plan,
  long duplicatesRemoved
) {

  public FetchResult {
    warnings = List.copyOf(warnings);
  }

  public boolean isPartial() {
    return !warnings.isEmpty();
  }

  public int succeededChunks() {
    return plan.chunks().size() - warnings.size();
  }
}
