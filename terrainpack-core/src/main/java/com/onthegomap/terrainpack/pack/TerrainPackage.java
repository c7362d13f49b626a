package com.onthegomap.terrainpack.pack;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An in-memory terrain package: metadata and named blocks in the order they are stored.
 */
public record TerrainPackage(PackageMetadata metadata, Map<String, DataBlock> blocks) {

  public TerrainPackage {
    blocks = Collections.unmodifiableMap(new LinkedHashMap<>(blocks));
    for (var entry : blocks.entrySet()) {
      if (!entry.getKey().equals(entry.getValue().name())) {
        throw new IllegalArgumentException("Block " + entry.getValue().name() + " stored as " + entry.getKey());
      }
    }
  }

  /** Reads and verifies every block from {@code path}. */
  public static TerrainPackage read(Path path) throws IOException {
    try (var reader = PackageReader.open(path)) {
      return reader.readAll();
    }
  }

  /**
   * Writes {@code metadata} and {@code blocks} to {@code path}, leaving any existing file untouched when writing
   * fails.
   */
  public static void write(Path path, PackageMetadata metadata, Collection<DataBlock> blocks) throws IOException {
    var writer = PackageWriter.newWriteToFile(path, metadata);
    try {
      for (var block : blocks) {
        writer.addBlock(block);
      }
      writer.close();
    } catch (IOException | RuntimeException e) {
      writer.abort();
      throw e;
    }
  }

  public void write(Path path) throws IOException {
    write(path, metadata, blocks.values());
  }

  public DataBlock block(String name) {
    return blocks.get(name);
  }

  public DataBlock elevation() {
    return blocks.get(BlockNames.ELEVATION_RASTER);
  }
}
