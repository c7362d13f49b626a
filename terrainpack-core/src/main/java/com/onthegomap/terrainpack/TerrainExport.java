package com.onthegomap.terrainpack;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.terrainpack.config.TerrainpackConfig;
import com.onthegomap.terrainpack.config.ValidationException;
import com.onthegomap.terrainpack.fetch.FeatureCategory;
import com.onthegomap.terrainpack.fetch.FeatureFetcher;
import com.onthegomap.terrainpack.fetch.FeatureStatistics;
import com.onthegomap.terrainpack.fetch.FetchResult;
import com.onthegomap.terrainpack.geo.BoundingBox;
import com.onthegomap.terrainpack.geo.HeightRaster;
import com.onthegomap.terrainpack.geo.LocalFrameTransformer;
import com.onthegomap.terrainpack.geometry.BuildSummary;
import com.onthegomap.terrainpack.geometry.FeatureGeometryEncoder;
import com.onthegomap.terrainpack.geometry.GeometryBuilder;
import com.onthegomap.terrainpack.pack.BlockNames;
import com.onthegomap.terrainpack.pack.DataBlock;
import com.onthegomap.terrainpack.pack.PackageMetadata;
import com.onthegomap.terrainpack.pack.PackageWriter;
import com.onthegomap.terrainpack.stats.Stats;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one export: fetch features for a bounding box, convert them into the local frame of an elevation raster and
 * write everything to a terrain package.
 */
public class TerrainExport {

  private static final Logger LOGGER = LoggerFactory.getLogger(TerrainExport.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final TerrainpackConfig config;
  private final FeatureFetcher fetcher;
  private final Stats stats;

  public TerrainExport(TerrainpackConfig config, FeatureFetcher fetcher, Stats stats) {
    this.config = config;
    this.fetcher = fetcher;
    this.stats = stats;
  }

  /**
   * What to export.
   *
   * @param projectName name stored in the package metadata
   * @param bbox        area to export
   * @param filters     feature categories to fetch
   * @param elevation   ground elevation covering {@code bbox}
   * @param imagery     encoded imagery bytes to store as-is, or null
   * @param masks       material name to a weight per elevation sample, row-major like {@code elevation}
   * @param properties  extra metadata properties
   * @param output      package file to create or replace
   */
  public record Request(
    String projectName,
    BoundingBox bbox,
    Set<FeatureCategory> filters,
    HeightRaster elevation,
    byte[] imagery,
    Map<String, byte[]> masks,
    Map<String, String> properties,
    Path output
  ) {

    public Request {
      masks = masks == null ? Map.of() : new LinkedHashMap<>(masks);
      properties = properties == null ? Map.of() : Map.copyOf(properties);
    }
  }

  /** What an export produced. */
  public record Result(Path output, PackageMetadata metadata, FetchResult fetch, BuildSummary build) {}

  public Result run(Request request) throws IOException {
    return run(request, () -> false);
  }

  /**
   * Runs every stage of the export for {@code request}.
   *
   * @throws ValidationException                            if the request is invalid, before anything is fetched
   * @throws com.onthegomap.terrainpack.fetch.QueryException if no feature chunk could be fetched
   * @throws java.util.concurrent.CancellationException     if {@code cancelled} returns true during the fetch
   * @throws IOException                                    if the package could not be written
   */
  public Result run(Request request, BooleanSupplier cancelled) throws IOException {
    validate(request);
    HeightRaster raster = request.elevation();

    FetchResult fetched;
    var stage = stats.startStage("fetch");
    try {
      fetched = fetcher.fetch(request.bbox(), request.filters(), cancelled);
    } finally {
      stage.stop();
    }
    var featureStats = FeatureStatistics.of(fetched.features());
    LOGGER.info("Fetched {} nodes, {} ways, {} relations", featureStats.nodes(), featureStats.ways(),
      featureStats.relations());

    GeometryBuilder.BuildResult built;
    stage = stats.startStage("geometry");
    try {
      var transformer = new LocalFrameTransformer(request.bbox(), raster, config.unitScale(), config.origin(),
        config.clampTolerance());
      var builder = new GeometryBuilder(transformer, GeometryBuilder.Settings.from(config), stats);
      built = builder.buildParallel(fetched.features(), config.threads());
      LOGGER.info("Built {} features, dropped {}, skipped {}", built.summary().totalBuilt(),
        built.summary().totalDropped(), built.summary().totalSkipped());
    } finally {
      stage.stop();
    }

    Map<String, Long> counts = new TreeMap<>(built.summary().built());
    counts.put("source_elements", featureStats.total());
    var metadata = PackageMetadata.create(request.projectName(), request.bbox())
      .withHeightmap(raster.width(), raster.height(), raster.minElevation(), raster.maxElevation())
      .withContentCounts(counts)
      .withProperties(request.properties());

    var writer = PackageWriter.newWriteToFile(request.output(), metadata);
    stage = stats.startStage("package");
    try {
      writer.addBlock(DataBlock.numericFloats(BlockNames.ELEVATION_RASTER, raster.samples(), raster.height(),
        raster.width()));
      if (request.imagery() != null) {
        writer.addBlock(DataBlock.opaque(BlockNames.BASE_IMAGERY, request.imagery()));
      }
      for (var mask : request.masks().entrySet()) {
        writer.addBlock(DataBlock.numericBytes(BlockNames.materialMask(mask.getKey()), mask.getValue(),
          raster.height(), raster.width()));
      }
      writer.addBlock(DataBlock.structuredText(BlockNames.VECTOR_FEATURE_GEOMETRY,
        new FeatureGeometryEncoder(MAPPER).encode(built.features())));
      writer.addBlock(DataBlock.structuredText(BlockNames.EXPORT_SUMMARY,
        exportSummary(fetched, featureStats, built.summary())));
      writer.close();
    } catch (IOException | RuntimeException e) {
      writer.abort();
      throw e;
    } finally {
      stage.stop();
    }
    if (fetched.isPartial()) {
      LOGGER.warn("{} is incomplete, {} of {} chunks failed", request.output(), fetched.warnings().size(),
        fetched.plan().chunks().size());
    }
    return new Result(request.output(), metadata, fetched, built.summary());
  }

  private void validate(Request request) {
    if (request.bbox() == null) {
      throw new ValidationException("Missing bounding box");
    }
    request.bbox().requireSideBetween(config.minBboxDegrees(), config.maxBboxDegrees());
    FeatureCategory.requireNonEmpty(request.filters());
    if (request.elevation() == null) {
      throw new ValidationException("Missing elevation raster");
    }
    if (request.output() == null) {
      throw new ValidationException("Missing output path");
    }
    if (Files.isDirectory(request.output())) {
      throw new ValidationException("Output " + request.output() + " is a directory");
    }
    int samples = request.elevation().width() * request.elevation().height();
    for (var mask : request.masks().entrySet()) {
      if (mask.getKey() == null || mask.getKey().isBlank()) {
        throw new ValidationException("Material mask names must not be blank");
      }
      if (mask.getValue().length != samples) {
        throw new ValidationException("Material mask " + mask.getKey() + " has " + mask.getValue().length +
          " samples, expected " + samples + " to match the elevation raster");
      }
    }
  }

  private byte[] exportSummary(FetchResult fetched, FeatureStatistics featureStats, BuildSummary build) {
    Map<String, Object> fetch = new LinkedHashMap<>();
    fetch.put("chunks", fetched.plan().chunks().size());
    fetch.put("gridSize", fetched.plan().gridSize());
    fetch.put("estimatedNodes", fetched.plan().estimate());
    fetch.put("succeededChunks", fetched.succeededChunks());
    fetch.put("duplicatesRemoved", fetched.duplicatesRemoved());
    fetch.put("warnings", fetched.warnings().stream().map(Object::toString).toList());
    fetch.put("statistics", featureStats);

    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("fetch", fetch);
    summary.put("build", build);
    summary.put("dataErrors", stats.dataErrors());
    try {
      return MAPPER.writeValueAsBytes(summary);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException(e);
    }
  }
}
