package com.onthegomap.terrainpack.geo;

/** A point or direction in the local frame: x northward, y eastward, z up, in engine units. */
public record Vec3(double x, double y, double z) {

  public static final Vec3 ZERO = new Vec3(0, 0, 0);

  public Vec3 plus(Vec3 other) {
    return new Vec3(x + other.x, y + other.y, z + other.z);
  }

  public Vec3 minus(Vec3 other) {
    return new Vec3(x - other.x, y - other.y, z - other.z);
  }

  public Vec3 times(double factor) {
    return new Vec3(x * factor, y * factor, z * factor);
  }

  public double length() {
    return Math.sqrt(x * x + y * y + z * z);
  }

  /** Distance ignoring the vertical axis. */
  public double horizontalDistance(Vec3 other) {
    return Math.hypot(other.x - x, other.y - y);
  }

  /** Returns this vector scaled to length 1, or {@link #ZERO} if it has no length. */
  public Vec3 normalize() {
    double length = length();
    return length == 0 ? ZERO : times(1 / length);
  }

  /** Linear interpolation where {@code t=0} is this point and {@code t=1} is {@code other}. */
  public Vec3 lerp(Vec3 other, double t) {
    return new Vec3(x + (other.x - x) * t, y + (other.y - y) * t, z + (other.z - z) * t);
  }
}
