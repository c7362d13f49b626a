package com.onthegomap.terrainpack.geometry;

/** What a {@link ConvertedFeature.LinearPath} represents. */
public enum PathKind {
  ROAD,
  TRAIL,
  RAIL,
  FENCE,
  WATERWAY
}
