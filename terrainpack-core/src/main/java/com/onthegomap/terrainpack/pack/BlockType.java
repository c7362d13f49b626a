package com.onthegomap.terrainpack.pack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** How the payload of a block should be interpreted, which also decides how it is compressed. */
public enum BlockType {
  NUMERIC_ARRAY("numeric-array", Compression.ZLIB),
  OPAQUE_BINARY("opaque-binary", Compression.NONE),
  STRUCTURED_TEXT("structured-text", Compression.ZLIB);

  private final String id;
  private final Compression compression;

  BlockType(String id, Compression compression) {
    this.id = id;
    this.compression = compression;
  }

  @JsonValue
  public String id() {
    return id;
  }

  /** Compression applied to payloads of this type. Opaque payloads are usually already compressed. */
  public Compression compression() {
    return compression;
  }

  @JsonCreator
  public static BlockType fromId(String id) {
    for (var type : values()) {
      if (type.id.equals(id)) {
        return type;
      }
    }
    throw new FormatException("Unknown block type: " + id);
  }
}
