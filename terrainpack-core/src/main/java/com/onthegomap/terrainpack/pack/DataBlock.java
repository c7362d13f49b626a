package com.onthegomap.terrainpack.pack;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A named payload stored in a terrain package.
 * <p>
 * Numeric array blocks carry an element type and a shape whose product times the element size equals the payload
 * length. Other block types have neither.
 */
public record DataBlock(String name, BlockType type, byte[] payload, ElementType dtype, List<Integer> shape) {

  public DataBlock {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(payload, "payload");
    if (name.isBlank()) {
      throw new IllegalArgumentException("block name must not be blank");
    }
    if (type == BlockType.NUMERIC_ARRAY) {
      if (dtype == null || shape == null || shape.isEmpty()) {
        throw new IllegalArgumentException("numeric block " + name + " needs an element type and a shape");
      }
      shape = List.copyOf(shape);
      long elements = 1;
      for (int dim : shape) {
        if (dim <= 0) {
          throw new IllegalArgumentException("block " + name + " has non-positive dimension in " + shape);
        }
        elements *= dim;
      }
      if (elements * dtype.bytes() != payload.length) {
        throw new IllegalArgumentException("block " + name + " shape " + shape + " of " + dtype.id() +
          " needs " + (elements * dtype.bytes()) + " bytes, got " + payload.length);
      }
    } else if (dtype != null || shape != null) {
      throw new IllegalArgumentException("only numeric blocks have an element type and shape, " + name + " is " +
        type.id());
    }
  }

  /** Returns a numeric block of little-endian float32 values. */
  public static DataBlock numericFloats(String name, float[] values, int... shape) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    buffer.asFloatBuffer().put(values);
    return new DataBlock(name, BlockType.NUMERIC_ARRAY, buffer.array(), ElementType.FLOAT32, shapeOf(shape));
  }

  /** Returns a numeric block of unsigned bytes, like a material weight mask. */
  public static DataBlock numericBytes(String name, byte[] values, int... shape) {
    return new DataBlock(name, BlockType.NUMERIC_ARRAY, values, ElementType.UINT8, shapeOf(shape));
  }

  public static DataBlock opaque(String name, byte[] payload) {
    return new DataBlock(name, BlockType.OPAQUE_BINARY, payload, null, null);
  }

  public static DataBlock structuredText(String name, byte[] payload) {
    return new DataBlock(name, BlockType.STRUCTURED_TEXT, payload, null, null);
  }

  private static List<Integer> shapeOf(int[] shape) {
    return Arrays.stream(shape).boxed().toList();
  }

  /**
   * Returns the payload of a float32 block as floats.
   *
   * @throws IllegalStateException if this is not a float32 block
   */
  public float[] asFloats() {
    if (dtype != ElementType.FLOAT32) {
      throw new IllegalStateException("block " + name + " is not float32: " + dtype);
    }
    float[] result = new float[payload.length / Float.BYTES];
    ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(result);
    return result;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof DataBlock other &&
      name.equals(other.name) &&
      type == other.type &&
      Arrays.equals(payload, other.payload) &&
      dtype == other.dtype &&
      Objects.equals(shape, other.shape));
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, Arrays.hashCode(payload), dtype, shape);
  }

  @Override
  public String toString() {
    return "DataBlock[" + name + ", " + type.id() + ", " + payload.length + " bytes" +
      (shape == null ? "" : ", " + dtype.id() + shape) + "]";
  }
}
