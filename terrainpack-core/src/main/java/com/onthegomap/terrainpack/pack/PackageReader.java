package com.onthegomap.terrainpack.pack;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.DataFormatException;
import javax.annotation.concurrent.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads blocks from a terrain package file.
 * <p>
 * {@link #open(Path)} verifies the checksum over the whole file before parsing anything, then the format version,
 * metadata and block index. Each {@link #readBlock(String)} checks the block's own checksum and size again.
 */
@ThreadSafe
public final class PackageReader implements Closeable {

  private static final Logger LOGGER = LoggerFactory.getLogger(PackageReader.class);

  private final Path path;
  private final FileChannel channel;
  private final PackageMetadata metadata;
  private final List<String> blockNames;
  private final Map<String, PackageFormat.IndexEntry> index;

  private PackageReader(Path path, FileChannel channel) throws IOException {
    this.path = path;
    this.channel = channel;
    long size = channel.size();
    if (size < PackageFormat.MIN_LENGTH) {
      throw new FormatException(path + " is too small to be a terrain package: " + size + " bytes");
    }
    verifyFileChecksum(size);

    byte[] preamble = getBytes(0, PackageFormat.PREAMBLE_LENGTH);
    if (!Arrays.equals(Arrays.copyOf(preamble, PackageFormat.MAGIC.length), PackageFormat.MAGIC)) {
      throw new FormatException(path + " is not a terrain package");
    }
    long version = PackageFormat.readUint32(preamble, PackageFormat.MAGIC.length);
    if (version != PackageFormat.VERSION) {
      throw new FormatException(
        "Unsupported package version " + version + " in " + path + ", expected " + PackageFormat.VERSION);
    }
    long metadataLength = PackageFormat.readUint32(preamble, PackageFormat.MAGIC.length + Integer.BYTES);
    long contentEnd = size - PackageFormat.TRAILER_LENGTH;
    requireRange(PackageFormat.PREAMBLE_LENGTH, metadataLength, contentEnd, "metadata");
    var document = PackageFormat.fromJson(getBytes(PackageFormat.PREAMBLE_LENGTH, (int) metadataLength),
      PackageFormat.MetadataDocument.class, "metadata");
    if (document.metadata() == null) {
      throw new FormatException("Missing metadata in " + path);
    }
    this.metadata = document.metadata();

    long indexLength = PackageFormat.readUint32(getBytes(contentEnd, Integer.BYTES), 0);
    long indexStart = contentEnd - indexLength;
    requireRange(indexStart, indexLength, contentEnd, "index");
    var parsedIndex = PackageFormat.fromJson(getBytes(indexStart, (int) indexLength), PackageFormat.Index.class,
      "index");
    for (var entry : parsedIndex.entrySet()) {
      var value = entry.getValue();
      if (value == null || value.type() == null) {
        throw new FormatException("Invalid index entry for " + entry.getKey());
      }
      requireRange(value.headerOffset(), value.offset() + value.length() - value.headerOffset(), indexStart,
        "block " + entry.getKey());
    }
    this.index = Map.copyOf(parsedIndex);
    this.blockNames = List.copyOf(parsedIndex.keySet());
    if (document.blocks() != null && !document.blocks().equals(blockNames)) {
      throw new FormatException("Metadata lists blocks " + document.blocks() + " but index has " + blockNames);
    }
  }

  /**
   * Opens and verifies the package at {@code path}.
   *
   * @throws IntegrityException if the file does not match its checksum
   * @throws FormatException    if the file is not a package or has an unsupported version
   */
  public static PackageReader open(Path path) throws IOException {
    FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
    try {
      return new PackageReader(path, channel);
    } catch (IOException | RuntimeException e) {
      channel.close();
      throw e;
    }
  }

  /**
   * Checks every checksum in the package at {@code path} without throwing.
   */
  public static VerificationReport verify(Path path) {
    try (var reader = open(path)) {
      List<String> blocks = new ArrayList<>();
      for (String name : reader.blockNames()) {
        reader.readBlock(name);
        blocks.add(name);
      }
      return VerificationReport.valid(path, reader.metadata(), blocks);
    } catch (PackageException e) {
      LOGGER.debug("Verification of {} failed", path, e);
      return VerificationReport.invalid(path, e);
    } catch (IOException e) {
      return VerificationReport.invalid(path, new FormatException("Unable to read " + path + ": " + e, e));
    }
  }

  public Path path() {
    return path;
  }

  public PackageMetadata metadata() {
    return metadata;
  }

  /** Names of the blocks in the order they were written. */
  public List<String> blockNames() {
    return blockNames;
  }

  public boolean hasBlock(String name) {
    return index.containsKey(name);
  }

  /**
   * Reads, verifies and decompresses one block.
   *
   * @throws IllegalArgumentException if there is no block named {@code name}
   * @throws IntegrityException       if the stored payload does not match its checksum or size
   */
  public DataBlock readBlock(String name) throws IOException {
    var entry = index.get(name);
    if (entry == null) {
      throw new IllegalArgumentException("No block named " + name + " in " + path);
    }
    long headerLength = PackageFormat.readUint32(getBytes(entry.headerOffset(), Integer.BYTES), 0);
    if (entry.headerOffset() + Integer.BYTES + headerLength != entry.offset()) {
      throw new FormatException("Block header for " + name + " does not end where its payload starts");
    }
    var header = PackageFormat.fromJson(getBytes(entry.headerOffset() + Integer.BYTES, (int) headerLength),
      PackageFormat.BlockHeader.class, "block header");
    if (!name.equals(header.name()) || header.compression() == null || header.type() != entry.type()) {
      throw new FormatException("Block header does not match index for " + name);
    }
    byte[] stored = getBytes(entry.offset(), (int) entry.length());
    if (stored.length != header.compressedSize() || !PackageFormat.sha256Hex(stored).equals(header.checksum())) {
      throw new IntegrityException("Checksum mismatch for block " + name + " in " + path);
    }
    byte[] payload;
    try {
      payload = header.compression().decompress(stored, Math.toIntExact(header.uncompressedSize()));
    } catch (DataFormatException | ArithmeticException e) {
      throw new IntegrityException("Unable to decompress block " + name + " in " + path + ": " + e.getMessage());
    }
    try {
      return new DataBlock(name, header.type(), payload, header.dtype(), header.shape());
    } catch (IllegalArgumentException e) {
      throw new FormatException("Invalid block " + name + ": " + e.getMessage(), e);
    }
  }

  /** Reads every block into memory. */
  public TerrainPackage readAll() throws IOException {
    Map<String, DataBlock> blocks = new LinkedHashMap<>();
    for (String name : blockNames) {
      blocks.put(name, readBlock(name));
    }
    return new TerrainPackage(metadata, blocks);
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  private void verifyFileChecksum(long size) throws IOException {
    long contentLength = size - PackageFormat.CHECKSUM_LENGTH;
    Hasher hasher = Hashing.sha256().newHasher();
    ByteBuffer buffer = ByteBuffer.allocate(1 << 16);
    long position = 0;
    while (position < contentLength) {
      buffer.clear();
      buffer.limit((int) Math.min(buffer.capacity(), contentLength - position));
      int read = channel.read(buffer, position);
      if (read < 0) {
        throw new EOFException("Unexpected end of " + path);
      }
      buffer.flip();
      hasher.putBytes(buffer);
      position += read;
    }
    byte[] expected = getBytes(contentLength, PackageFormat.CHECKSUM_LENGTH);
    if (!MessageDigest.isEqual(hasher.hash().asBytes(), expected)) {
      if (!Arrays.equals(getBytes(0, PackageFormat.MAGIC.length), PackageFormat.MAGIC)) {
        throw new IntegrityException("Checksum mismatch, " + path + " is not a terrain package");
      }
      throw new IntegrityException("Checksum mismatch, " + path + " is corrupt or truncated");
    }
  }

  private void requireRange(long start, long length, long limit, String what) {
    if (start < PackageFormat.PREAMBLE_LENGTH || length < 0 || start + length > limit || length > Integer.MAX_VALUE) {
      throw new FormatException("Invalid " + what + " range " + start + "+" + length + " in " + path);
    }
  }

  private byte[] getBytes(long start, int length) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(length);
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, start + buffer.position());
      if (read < 0) {
        throw new EOFException("Unexpected end of " + path + " reading " + length + " bytes at " + start);
      }
    }
    return buffer.array();
  }
}
