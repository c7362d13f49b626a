package com.onthegomap.terrainpack.fetch;

import com.onthegomap.terrainpack.geo.BoundingBox;

/**
 * A chunk that was skipped because every attempt to fetch it failed.
 *
 * @param index    position of the chunk in the plan
 * @param bbox     area the chunk covers
 * @param attempts attempts made before giving up
 * @param cause    description of the last failure
 */
public record ChunkWarning(int index, BoundingBox bbox, int attempts, String cause) {

  @Override
  public String toString() {
    return "chunk " + (index + 1) + " " + bbox + " failed after " + attempts + " attempt(s): " + cause;
  }
}
