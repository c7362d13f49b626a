package com.onthegomap.terrainpack.pack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.onthegomap.terrainpack.geo.BoundingBox;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Descriptive fields stored at the start of a terrain package.
 *
 * @param generator       name and version of the program that wrote the package
 * @param createdAt       ISO-8601 instant the export was produced
 * @param projectName     user-chosen name for the export
 * @param bbox            the exported area
 * @param areaKm2         approximate area of {@code bbox}
 * @param heightmapWidth  columns in the elevation raster
 * @param heightmapHeight rows in the elevation raster
 * @param minElevation    lowest valid elevation in meters, null if unknown
 * @param maxElevation    highest valid elevation in meters, null if unknown
 * @param contentCounts   number of converted features by kind
 * @param properties      free-form key/value pairs
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PackageMetadata(
  String generator,
  String createdAt,
  String projectName,
  BoundingBox bbox,
  Double areaKm2,
  Integer heightmapWidth,
  Integer heightmapHeight,
  Double minElevation,
  Double maxElevation,
  Map<String, Long> contentCounts,
  Map<String, String> properties
) {

  public static final String GENERATOR = "terrainpack";

  public PackageMetadata {
    contentCounts = contentCounts == null ? Map.of() : Map.copyOf(new TreeMap<>(contentCounts));
    properties = properties == null ? Map.of() : Map.copyOf(properties);
    minElevation = finiteOrNull(minElevation);
    maxElevation = finiteOrNull(maxElevation);
  }

  /** Returns metadata for a new export of {@code bbox} created now. */
  public static PackageMetadata create(String projectName, BoundingBox bbox) {
    return new PackageMetadata(GENERATOR, Instant.now().toString(), projectName, bbox,
      bbox == null ? null : bbox.areaKm2(), null, null, null, null, Map.of(), Map.of());
  }

  private static Double finiteOrNull(Double value) {
    return value == null || value.isNaN() || value.isInfinite() ? null : value;
  }

  public PackageMetadata withHeightmap(int width, int height, double minElevation, double maxElevation) {
    return new PackageMetadata(generator, createdAt, projectName, bbox, areaKm2, width, height, minElevation,
      maxElevation, contentCounts, properties);
  }

  public PackageMetadata withContentCounts(Map<String, Long> counts) {
    return new PackageMetadata(generator, createdAt, projectName, bbox, areaKm2, heightmapWidth, heightmapHeight,
      minElevation, maxElevation, counts, properties);
  }

  public PackageMetadata withProperties(Map<String, String> newProperties) {
    return new PackageMetadata(generator, createdAt, projectName, bbox, areaKm2, heightmapWidth, heightmapHeight,
      minElevation, maxElevation, contentCounts, newProperties);
  }
}
