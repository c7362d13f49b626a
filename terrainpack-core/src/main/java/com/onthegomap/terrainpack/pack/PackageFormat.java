package com.onthegomap.terrainpack.pack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Byte layout of a terrain package file.
 * <p>
 * All integers are little-endian:
 *
 * <pre>
 * magic          4 bytes  "RTER"
 * version        uint32
 * metadataLength uint32
 * metadata       JSON {@link MetadataDocument}
 * blocks         repeated: uint32 header length, JSON {@link BlockHeader}, stored payload
 * index          JSON map of block name to {@link IndexEntry}
 * indexLength    uint32
 * checksum       SHA-256 of every preceding byte
 * </pre>
 * <p>
 * Readers find the index from the end of the file so blocks can be written as they are added.
 */
public final class PackageFormat {

  public static final byte[] MAGIC = "RTER".getBytes(StandardCharsets.US_ASCII);
  public static final int VERSION = 1;
  public static final int CHECKSUM_LENGTH = 32;
  static final int PREAMBLE_LENGTH = MAGIC.length + Integer.BYTES * 2;
  static final int TRAILER_LENGTH = Integer.BYTES + CHECKSUM_LENGTH;
  /** Smallest possible package: preamble, trailer and empty JSON documents. */
  static final int MIN_LENGTH = PREAMBLE_LENGTH + TRAILER_LENGTH + 4;

  static final ObjectMapper MAPPER = new ObjectMapper()
    .setSerializationInclusion(JsonInclude.Include.NON_NULL)
    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private PackageFormat() {}

  /** The document stored in the metadata section. */
  public record MetadataDocument(PackageMetadata metadata, List<String> blocks) {}

  /** Describes the stored payload that follows it. */
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record BlockHeader(
    String name,
    BlockType type,
    Compression compression,
    long compressedSize,
    long uncompressedSize,
    String checksum,
    ElementType dtype,
    List<Integer> shape
  ) {}

  /** Where a block's stored payload lives in the file. */
  public record IndexEntry(
    long headerOffset,
    long offset,
    long length,
    BlockType type,
    long compressedSize,
    long uncompressedSize
  ) {}

  /** Block index keyed by name in the order blocks were written. */
  static final class Index extends LinkedHashMap<String, IndexEntry> {
    Index() {}

    Index(Map<String, IndexEntry> entries) {
      super(entries);
    }
  }

  static String sha256Hex(byte[] bytes) {
    return Hashing.sha256().hashBytes(bytes).toString();
  }

  static byte[] toJson(Object value) {
    try {
      return MAPPER.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Unable to encode as json: " + value, e);
    }
  }

  static <T> T fromJson(byte[] bytes, Class<T> clazz, String what) {
    try {
      return MAPPER.readValue(bytes, clazz);
    } catch (IOException | RuntimeException e) {
      throw new FormatException("Invalid " + what + " json", e);
    }
  }

  static byte[] uint32(long value) {
    if (value < 0 || value > 0xFFFFFFFFL) {
      throw new IllegalArgumentException("value does not fit in uint32: " + value);
    }
    return ByteBuffer.allocate(Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array();
  }

  static long readUint32(byte[] bytes, int offset) {
    return Integer.toUnsignedLong(
      ByteBuffer.wrap(bytes, offset, Integer.BYTES).order(ByteOrder.LITTLE_ENDIAN).getInt());
  }
}
