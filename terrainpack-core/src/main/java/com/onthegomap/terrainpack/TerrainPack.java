package com.onthegomap.terrainpack;

import com.onthegomap.terrainpack.config.Arguments;
import com.onthegomap.terrainpack.config.TerrainpackConfig;
import com.onthegomap.terrainpack.config.ValidationException;
import com.onthegomap.terrainpack.fetch.FeatureCategory;
import com.onthegomap.terrainpack.fetch.FeatureFetcher;
import com.onthegomap.terrainpack.geo.HeightRaster;
import com.onthegomap.terrainpack.pack.PackageReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point that exports one bounding box to a terrain package, or checks an existing package with
 * {@code --verify}.
 * <p>
 * Example:
 *
 * <pre>
 * java -jar terrainpack.jar --bbox=-122.52,37.70,-122.35,37.83 --filters=roads,buildings \
 *   --elevation=dem.f32 --elevation_width=512 --elevation_height=512 --output=sf.rter
 * </pre>
 */
public class TerrainPack {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerrainPack.class);

  private TerrainPack() {}

  public static void main(String... args) throws IOException {
    int exitCode = run(Arguments.fromArgsOrConfigFile(args));
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }

  /** Runs the job described by {@code arguments} and returns a process exit code. */
  static int run(Arguments arguments) throws IOException {
    if (arguments.getBoolean("verify", "check the package at 'input' instead of exporting", false)) {
      Path input = arguments.inputFile("input", "package file to verify");
      var report = PackageReader.verify(input);
      if (report.valid()) {
        LOGGER.info("{}", report);
        return 0;
      }
      LOGGER.error("{}", report);
      return 1;
    }

    var config = TerrainpackConfig.from(arguments);
    var stats = arguments.getStats();
    var bbox = arguments.bounds("bbox", "area to export as minLon,minLat,maxLon,maxLat");
    if (bbox == null) {
      throw new ValidationException("Missing required parameter: bbox");
    }
    var filters = FeatureCategory.parseFilterSet(
      arguments.getList("filters", "feature categories to fetch", List.of("roads", "buildings")));
    int width = arguments.getInteger("elevation_width", "columns in the elevation raster", 0);
    int height = arguments.getInteger("elevation_height", "rows in the elevation raster", 0);
    float noData = (float) arguments.getDouble("elevation_nodata", "elevation value that marks missing samples",
      -9999);
    Path elevationFile = arguments.inputFile("elevation", "raw little-endian float32 elevation raster");
    HeightRaster raster = HeightRaster.readFloat32(elevationFile, width, height, noData);

    Path imageryFile = arguments.file("imagery", "encoded base imagery to store as-is", null);
    byte[] imagery = imageryFile == null ? null : Files.readAllBytes(imageryFile);
    Map<String, byte[]> masks = new LinkedHashMap<>();
    for (String entry : arguments.getList("masks", "material=path pairs of raw uint8 weight masks", List.of())) {
      String[] parts = entry.split("=", 2);
      if (parts.length != 2 || parts[0].isBlank()) {
        throw new ValidationException("Expected material=path in masks, got " + entry);
      }
      masks.put(parts[0].strip(), Files.readAllBytes(Path.of(parts[1].strip())));
    }

    Path output = arguments.file("output", "package file to write", Path.of("data", "export.rter"));
    String name = arguments.getString("name", "project name stored in the package", "terrain-export");

    var request = new TerrainExport.Request(name, bbox, filters, raster, imagery, masks, Map.of(), output);
    var export = new TerrainExport(config, FeatureFetcher.create(config, stats), stats);
    var result = export.run(request);
    LOGGER.info("FINISHED! Wrote {}", result.output());
    stats.printSummary();
    return 0;
  }
}
