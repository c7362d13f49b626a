package com.onthegomap.terrainpack.pack;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Type of each element in a numeric array block, stored little-endian. */
public enum ElementType {
  UINT8("uint8", 1),
  INT16("int16", 2),
  UINT16("uint16", 2),
  INT32("int32", 4),
  FLOAT32("float32", 4),
  FLOAT64("float64", 8);

  private final String id;
  private final int bytes;

  ElementType(String id, int bytes) {
    this.id = id;
    this.bytes = bytes;
  }

  @JsonValue
  public String id() {
    return id;
  }

  /** Bytes per element. */
  public int bytes() {
    return bytes;
  }

  @JsonCreator
  public static ElementType fromId(String id) {
    for (var type : values()) {
      if (type.id.equals(id)) {
        return type;
      }
    }
    throw new FormatException("Unknown element type: " + id);
  }
}
