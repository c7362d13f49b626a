package com.onthegomap.terrainpack.pack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.onthegomap.terrainpack.util.Zlib;
import java.util.zip.DataFormatException;

/** Compression applied to a stored block payload. */
public enum Compression {
  NONE("none"),
  ZLIB("zlib");

  private final String id;

  Compression(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  @JsonCreator
  public static Compression fromId(String id) {
    for (var compression : values()) {
      if (compression.id.equals(id)) {
        return compression;
      }
    }
    throw new FormatException("Unknown compression: " + id);
  }

  byte[] compress(byte[] data) {
    return this == ZLIB ? Zlib.deflate(data) : data;
  }

  byte[] decompress(byte[] stored, int uncompressedSize) throws DataFormatException {
    if (this == ZLIB) {
      return Zlib.inflate(stored, uncompressedSize);
    } else if (stored.length != uncompressedSize) {
      throw new DataFormatException("expected " + uncompressedSize + " bytes, got " + stored.length);
    }
    return stored;
  }
}
