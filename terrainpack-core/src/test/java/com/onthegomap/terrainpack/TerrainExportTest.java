package com.onthegomap.terrainpack;

import static com.onthegomap.terrainpack.TestUtils.nodeJson;
import static com.onthegomap.terrainpack.TestUtils.overpassStream;
import static com.onthegomap.terrainpack.TestUtils.wayJson;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.terrainpack.config.Arguments;
import com.onthegomap.terrainpack.config.TerrainpackConfig;
import com.onthegomap.terrainpack.config.ValidationException;
import com.onthegomap.terrainpack.fetch.FeatureCategory;
import com.onthegomap.terrainpack.fetch.FeatureFetcher;
import com.onthegomap.terrainpack.fetch.OverpassClient;
import com.onthegomap.terrainpack.fetch.QueryException;
import com.onthegomap.terrainpack.geo.BoundingBox;
import com.onthegomap.terrainpack.geo.HeightRaster;
import com.onthegomap.terrainpack.pack.BlockNames;
import com.onthegomap.terrainpack.pack.TerrainPackage;
import com.onthegomap.terrainpack.stats.Stats;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TerrainExportTest {

  private static final BoundingBox BBOX = new BoundingBox(-122.5, 37.7, -122.49, 37.71);
  private static final Set<FeatureCategory> FILTERS = Set.of(FeatureCategory.ROADS, FeatureCategory.BUILDINGS);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir
  Path dir;

  private final OverpassClient client = mock(OverpassClient.class);
  private final Stats stats = Stats.inMemory();
  private final TerrainpackConfig config = TerrainpackConfig.from(Arguments.of(
    "chunk_delay", "0s",
    "http_retry_wait", "0s",
    "http_retries", "2",
    "threads", "2"
  ));
  private final TerrainExport export =
    new TerrainExport(config, new FeatureFetcher(config, client, duration -> {
    }, stats), stats);

  private TerrainExport.Request request(Map<String, byte[]> masks, Path output) {
    return new TerrainExport.Request("test-export", BBOX, FILTERS, HeightRaster.flat(4, 3, 12f),
      new byte[]{1, 2, 3}, masks, Map.of("source", "unit-test"), output);
  }

  private void respondWithFeatures() throws Exception {
    when(client.send(any())).thenReturn(overpassStream(
      wayJson(1, Map.of("building", "yes", "building:levels", "2"),
        37.702, -122.498, 37.702, -122.497, 37.703, -122.497, 37.703, -122.498, 37.702, -122.498),
      wayJson(2, Map.of("highway", "residential"), 37.704, -122.499, 37.706, -122.495),
      nodeJson(3, 37.705, -122.495, Map.of("amenity", "bench")),
      wayJson(4, Map.of("highway", "service"), 37.705, -122.495)
    ));
  }

  @Test
  void testExportWritesCompletePackage() throws Exception {
    respondWithFeatures();
    Path output = dir.resolve("out").resolve("sf.rter");
    var result = export.run(request(Map.of("Grass", new byte[12]), output));

    verify(client, times(1)).send(any());
    assertEquals(output, result.output());
    assertFalse(result.fetch().isPartial());
    assertEquals(1, result.build().built().get("buildings"));
    assertEquals(1, result.build().built().get("paths"));

    var pkg = TerrainPackage.read(output);
    assertEquals(List.of(
      BlockNames.ELEVATION_RASTER,
      BlockNames.BASE_IMAGERY,
      BlockNames.materialMask("grass"),
      BlockNames.VECTOR_FEATURE_GEOMETRY,
      BlockNames.EXPORT_SUMMARY
    ), new ArrayList<>(pkg.blocks().keySet()));
    assertEquals(List.of(3, 4), pkg.elevation().shape());
    assertEquals(12f, pkg.elevation().asFloats()[5]);
    assertArrayEquals(new byte[]{1, 2, 3}, pkg.block(BlockNames.BASE_IMAGERY).payload());

    var metadata = pkg.metadata();
    assertEquals("test-export", metadata.projectName());
    assertEquals(BBOX, metadata.bbox());
    assertEquals(4, metadata.heightmapWidth());
    assertEquals(3, metadata.heightmapHeight());
    assertEquals(12.0, metadata.minElevation());
    assertEquals(4L, metadata.contentCounts().get("source_elements"));
    assertEquals(1L, metadata.contentCounts().get("buildings"));
    assertEquals("unit-test", metadata.properties().get("source"));

    JsonNode features = MAPPER.readTree(pkg.block(BlockNames.VECTOR_FEATURE_GEOMETRY).payload());
    assertEquals(1, features.path("counts").path("buildings").asInt());

    JsonNode summary = MAPPER.readTree(pkg.block(BlockNames.EXPORT_SUMMARY).payload());
    assertEquals(1, summary.path("fetch").path("chunks").asInt());
    assertEquals(1, summary.path("fetch").path("succeededChunks").asInt());
    assertEquals(1, summary.path("build").path("dropped").path("path_degenerate").asInt());
    assertEquals(1, summary.path("dataErrors").path("geometry_path_degenerate").asInt());
  }

  @Test
  void testMaskSizeMustMatchRaster() {
    Path output = dir.resolve("bad.rter");
    var e = assertThrows(ValidationException.class, () -> export.run(request(Map.of("rock", new byte[5]), output)));
    assertTrue(e.getMessage().contains("rock"), e.getMessage());
    verifyNoInteractions(client);
    assertFalse(Files.exists(output));
  }

  @Test
  void testEmptyFiltersRejected() {
    var bad = new TerrainExport.Request("x", BBOX, Set.of(), HeightRaster.flat(2, 2, 0), null, null, null,
      dir.resolve("x.rter"));
    assertThrows(ValidationException.class, () -> export.run(bad));
    verifyNoInteractions(client);
  }

  @Test
  void testOutputDirectoryRejected() {
    assertThrows(ValidationException.class, () -> export.run(request(Map.of(), dir)));
    verifyNoInteractions(client);
  }

  @Test
  void testFailedFetchWritesNothing() throws Exception {
    when(client.send(any())).thenThrow(new IOException("connection refused"));
    Path output = dir.resolve("failed.rter");
    assertThrows(QueryException.class, () -> export.run(request(Map.of(), output)));
    verify(client, times(2)).send(any());
    assertFalse(Files.exists(output));
  }

  @Test
  void testCancelledBeforeFetch() {
    Path output = dir.resolve("cancelled.rter");
    assertThrows(CancellationException.class, () -> export.run(request(Map.of(), output), () -> true));
    verifyNoInteractions(client);
    assertFalse(Files.exists(output));
  }

  @Test
  void testVerifyCommand() throws Exception {
    respondWithFeatures();
    Path output = dir.resolve("verify.rter");
    export.run(request(Map.of(), output));

    assertEquals(0, TerrainPack.run(Arguments.of("verify", "true", "input", output.toString())));
    byte[] bytes = Files.readAllBytes(output);
    bytes[bytes.length / 2] ^= 1;
    Files.write(output, bytes);
    assertEquals(1, TerrainPack.run(Arguments.of("verify", "true", "input", output.toString())));
  }

  @Test
  void testCommandRequiresBbox() {
    assertThrows(ValidationException.class, () -> TerrainPack.run(Arguments.of()));
  }
}
