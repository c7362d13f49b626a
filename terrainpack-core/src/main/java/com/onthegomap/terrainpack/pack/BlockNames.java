package com.onthegomap.terrainpack.pack;

import java.util.Locale;

/** Names of the blocks a terrain package may contain. */
public final class BlockNames {

  /** Ground elevation grid, the only required block. */
  public static final String ELEVATION_RASTER = "elevation-raster";
  /** Encoded imagery draped over the terrain. */
  public static final String BASE_IMAGERY = "base-imagery";
  /** Converted buildings, paths, cables and points. */
  public static final String VECTOR_FEATURE_GEOMETRY = "vector-feature-geometry";
  /** Fetch and build diagnostics. */
  public static final String EXPORT_SUMMARY = "export-summary";

  private static final String MATERIAL_MASK_PREFIX = "material-weight-mask/";

  private BlockNames() {}

  /** Returns the block name for the weight mask of {@code material}, like {@code material-weight-mask/grass}. */
  public static String materialMask(String material) {
    return MATERIAL_MASK_PREFIX + material.strip().toLowerCase(Locale.ROOT);
  }

  public static boolean isMaterialMask(String name) {
    return name.startsWith(MATERIAL_MASK_PREFIX) && name.length() > MATERIAL_MASK_PREFIX.length();
  }
}
