package com.onthegomap.terrainpack.geo;

import javax.annotation.concurrent.ThreadSafe;

/**
 * Converts geodetic coordinates inside an export's bounding box to the renderer's local frame.
 * <p>
 * x grows northward and y eastward from the box's south-west corner using a flat-earth approximation scaled at the
 * box's central latitude, and z is the ground elevation sampled from a {@link HeightRaster}. All three axes are
 * multiplied by {@code unitScale} (meters to engine units) and then shifted by {@code origin}.
 * <p>
 * Instances are immutable and safe to share between threads.
 */
@ThreadSafe
public class LocalFrameTransformer {

  /** Centimeters, the linear unit most game engines use. */
  public static final double DEFAULT_UNIT_SCALE = 100d;

  private final BoundingBox bbox;
  private final HeightRaster raster;
  private final double unitScale;
  private final Vec3 origin;
  private final double clampTolerance;
  private final double metersPerDegreeLon;

  /**
   * @param bbox           area covered by {@code raster}
   * @param raster         ground elevation in meters
   * @param unitScale      engine units per meter
   * @param origin         offset added to every output point, in engine units
   * @param clampTolerance how far in degrees a point may lie outside {@code bbox} before
   *                       {@link #toLocalChecked(double, double)} rejects it
   */
  public LocalFrameTransformer(BoundingBox bbox, HeightRaster raster, double unitScale, Vec3 origin,
    double clampTolerance) {
    if (!(unitScale > 0)) {
      throw new IllegalArgumentException("unit scale must be positive: " + unitScale);
    }
    this.bbox = bbox;
    this.raster = raster;
    this.unitScale = unitScale;
    this.origin = origin;
    this.clampTolerance = clampTolerance;
    this.metersPerDegreeLon = GeoUtils.metersPerDegreeLon(bbox.centerLat());
  }

  public LocalFrameTransformer(BoundingBox bbox, HeightRaster raster) {
    this(bbox, raster, DEFAULT_UNIT_SCALE, Vec3.ZERO, 1e-6);
  }

  public BoundingBox bbox() {
    return bbox;
  }

  public double unitScale() {
    return unitScale;
  }

  /**
   * Returns the local-frame position of {@code (lat, lon)}.
   * <p>
   * Horizontal position is extrapolated linearly for points outside the box but elevation is sampled at the nearest
   * point on the box edge, so this never throws.
   */
  public Vec3 toLocal(double lat, double lon) {
    double x = (lat - bbox.minLat()) * GeoUtils.METERS_PER_DEGREE_LAT * unitScale;
    double y = (lon - bbox.minLon()) * metersPerDegreeLon * unitScale;
    return new Vec3(x + origin.x(), y + origin.y(), groundElevation(lat, lon) + origin.z());
  }

  /**
   * Same as {@link #toLocal(double, double)} but rejects points further outside the bounding box than the configured
   * tolerance.
   *
   * @throws GeometryException if the point lies too far outside the box
   */
  public Vec3 toLocalChecked(double lat, double lon) throws GeometryException {
    double delta = clampDelta(lat, lon);
    if (delta > clampTolerance) {
      throw new GeometryException("outside_bbox",
        "point %s,%s lies %s degrees outside %s".formatted(lat, lon, delta, bbox));
    }
    return toLocal(lat, lon);
  }

  /** Returns how many degrees {@code (lat, lon)} must move along either axis to reach the bounding box. */
  public double clampDelta(double lat, double lon) {
    double dLat = Math.max(0, Math.max(bbox.minLat() - lat, lat - bbox.maxLat()));
    double dLon = Math.max(0, Math.max(bbox.minLon() - lon, lon - bbox.maxLon()));
    return Math.max(dLat, dLon);
  }

  /** Ground elevation under {@code (lat, lon)} in engine units, not including the origin offset. */
  public double groundElevation(double lat, double lon) {
    double u = (lon - bbox.minLon()) / bbox.width();
    double v = (lat - bbox.minLat()) / bbox.height();
    double meters = raster.sampleBilinear(u, v);
    return Double.isNaN(meters) ? 0 : meters * unitScale;
  }
}
