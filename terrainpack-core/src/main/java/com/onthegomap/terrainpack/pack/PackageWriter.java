package com.onthegomap.terrainpack.pack;

import com.google.common.hash.HashingOutputStream;
import com.google.common.hash.Hashing;
import com.onthegomap.terrainpack.config.ValidationException;
import com.onthegomap.terrainpack.util.Format;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a terrain package to a file.
 * <p>
 * Blocks are compressed as they are added and the file is written on {@link #close()}, first to a temporary file next
 * to the destination which then replaces it, so readers never see a partially written package. Call {@link #abort()}
 * instead of {@code close()} to discard everything added so far.
 */
@NotThreadSafe
public final class PackageWriter implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PackageWriter.class);

  private enum State {
    EMPTY,
    WRITING,
    CLOSED,
    ABORTED
  }

  private record StoredBlock(PackageFormat.BlockHeader header, byte[] stored) {}

  private final Path destination;
  private final Map<String, StoredBlock> blocks = new LinkedHashMap<>();
  private PackageMetadata metadata;
  private State state = State.EMPTY;
  private long uncompressedBytes = 0;

  private PackageWriter(Path destination, PackageMetadata metadata) {
    this.destination = destination;
    this.metadata = Objects.requireNonNull(metadata, "metadata");
  }

  /** Returns a writer that will create or replace {@code path} when closed. */
  public static PackageWriter newWriteToFile(Path path, PackageMetadata metadata) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return new PackageWriter(path, metadata);
  }

  public Path destination() {
    return destination;
  }

  /** Replaces the metadata that will be written on {@link #close()}. */
  public PackageWriter setMetadata(PackageMetadata metadata) {
    requireOpen();
    this.metadata = Objects.requireNonNull(metadata, "metadata");
    return this;
  }

  /** Returns true if a block named {@code name} was already added. */
  public boolean hasBlock(String name) {
    return blocks.containsKey(name);
  }

  /**
   * Compresses and stages {@code block} for writing.
   *
   * @throws IllegalArgumentException if a block with the same name was already added
   * @throws IllegalStateException    if the writer was closed or aborted
   */
  public PackageWriter addBlock(DataBlock block) {
    requireOpen();
    if (blocks.containsKey(block.name())) {
      throw new IllegalArgumentException("Duplicate block name: " + block.name());
    }
    Compression compression = block.type().compression();
    byte[] stored = compression.compress(block.payload());
    var header = new PackageFormat.BlockHeader(
      block.name(),
      block.type(),
      compression,
      stored.length,
      block.payload().length,
      PackageFormat.sha256Hex(stored),
      block.dtype(),
      block.shape()
    );
    blocks.put(block.name(), new StoredBlock(header, stored));
    uncompressedBytes += block.payload().length;
    state = State.WRITING;
    LOGGER.debug("Added block {} ({} -> {})", block.name(), Format.storage(block.payload().length),
      Format.storage(stored.length));
    return this;
  }

  /**
   * Writes the package and moves it to its destination.
   *
   * @throws ValidationException if no elevation raster block was added
   * @throws IOException         if the file could not be written, in which case the destination is left untouched
   */
  @Override
  public void close() throws IOException {
    if (state == State.CLOSED || state == State.ABORTED) {
      return;
    }
    if (!blocks.containsKey(BlockNames.ELEVATION_RASTER)) {
      throw new ValidationException("A package requires an " + BlockNames.ELEVATION_RASTER + " block");
    }
    Path dir = destination.toAbsolutePath().getParent();
    Path temp = Files.createTempFile(dir, destination.getFileName().toString(), ".tmp");
    try {
      long size = writeTo(temp);
      moveIntoPlace(temp);
      state = State.CLOSED;
      LOGGER.info("Wrote {} with {} blocks, {} ({} uncompressed)", destination, blocks.size(),
        Format.storage(size), Format.storage(uncompressedBytes));
      blocks.clear();
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  /** Discards every block added so far without touching the destination. */
  public void abort() {
    if (state != State.CLOSED) {
      state = State.ABORTED;
      blocks.clear();
      LOGGER.debug("Aborted writing {}", destination);
    }
  }

  private void requireOpen() {
    if (state == State.CLOSED || state == State.ABORTED) {
      throw new IllegalStateException("Package writer for " + destination + " is " + state);
    }
  }

  private long writeTo(Path temp) throws IOException {
    try (
      var fileOut = new BufferedOutputStream(Files.newOutputStream(temp), 1 << 16);
      var hashing = new HashingOutputStream(Hashing.sha256(), fileOut)
    ) {
      var out = new CountingOut(hashing);
      List<String> names = new ArrayList<>(blocks.keySet());
      byte[] metadataJson = PackageFormat.toJson(new PackageFormat.MetadataDocument(metadata, names));
      out.write(PackageFormat.MAGIC);
      out.write(PackageFormat.uint32(PackageFormat.VERSION));
      out.write(PackageFormat.uint32(metadataJson.length));
      out.write(metadataJson);

      var index = new PackageFormat.Index();
      for (var block : blocks.values()) {
        byte[] headerJson = PackageFormat.toJson(block.header());
        long headerOffset = out.count;
        out.write(PackageFormat.uint32(headerJson.length));
        out.write(headerJson);
        var header = block.header();
        index.put(header.name(), new PackageFormat.IndexEntry(headerOffset, out.count, block.stored().length,
          header.type(), header.compressedSize(), header.uncompressedSize()));
        out.write(block.stored());
      }
      byte[] indexJson = PackageFormat.toJson(index);
      out.write(indexJson);
      out.write(PackageFormat.uint32(indexJson.length));
      // the checksum covers everything before it so it goes straight to the file
      fileOut.write(hashing.hash().asBytes());
      return out.count + PackageFormat.CHECKSUM_LENGTH;
    }
  }

  private void moveIntoPlace(Path temp) throws IOException {
    try {
      Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      LOGGER.debug("Atomic move not supported for {}, replacing instead", destination);
      Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static final class CountingOut {
    private final OutputStream out;
    private long count = 0;

    CountingOut(OutputStream out) {
      this.out = out;
    }

    void write(byte[] bytes) throws IOException {
      out.write(bytes);
      count += bytes.length;
    }
  }
}
