package com.onthegomap.terrainpack.geo;

import com.onthegomap.terrainpack.config.ValidationException;
import java.math.BigDecimal;
import java.util.stream.Stream;
import org.locationtech.jts.geom.Envelope;

/**
 * A geodetic rectangle in degrees.
 * <p>
 * Construction enforces {@code min < max} on both axes, longitudes in [-180, 180] and latitudes in [-90, 90].
 */
public record BoundingBox(double minLon, double minLat, double maxLon, double maxLat) {

  public BoundingBox {
    if (Double.isNaN(minLon) || Double.isNaN(minLat) || Double.isNaN(maxLon) || Double.isNaN(maxLat)) {
      throw new ValidationException("bounding box has NaN coordinates");
    }
    if (minLon < -180 || maxLon > 180) {
      throw new ValidationException("longitude out of range [-180, 180]: " + minLon + ", " + maxLon);
    }
    if (minLat < -90 || maxLat > 90) {
      throw new ValidationException("latitude out of range [-90, 90]: " + minLat + ", " + maxLat);
    }
    if (minLon >= maxLon) {
      throw new ValidationException("minLon " + minLon + " must be less than maxLon " + maxLon);
    }
    if (minLat >= maxLat) {
      throw new ValidationException("minLat " + minLat + " must be less than maxLat " + maxLat);
    }
  }

  /**
   * Parses a box from {@code minLon,minLat,maxLon,maxLat}.
   *
   * @throws ValidationException if the string does not have 4 numbers or they do not form a valid box
   */
  public static BoundingBox parse(String input) {
    double[] bounds;
    try {
      bounds = Stream.of(input.strip().split("[\\s,]+")).mapToDouble(Double::parseDouble).toArray();
    } catch (NumberFormatException e) {
      throw new ValidationException("invalid bounding box: " + input);
    }
    if (bounds.length != 4) {
      throw new ValidationException("bounding box must have 4 coordinates, got: " + input);
    }
    return new BoundingBox(bounds[0], bounds[1], bounds[2], bounds[3]);
  }

  /**
   * Ensures each side of this box spans between {@code minDegrees} and {@code maxDegrees}.
   *
   * @throws ValidationException if the box is too small or too large to export
   */
  public BoundingBox requireSideBetween(double minDegrees, double maxDegrees) {
    double width = width();
    double height = height();
    if (width < minDegrees || height < minDegrees) {
      throw new ValidationException(
        "bounding box too small: %sx%s degrees, minimum %s".formatted(width, height, minDegrees));
    }
    if (width > maxDegrees || height > maxDegrees) {
      throw new ValidationException(
        "bounding box too large: %sx%s degrees, maximum %s".formatted(width, height, maxDegrees));
    }
    return this;
  }

  public double width() {
    return maxLon - minLon;
  }

  public double height() {
    return maxLat - minLat;
  }

  public double centerLat() {
    return (minLat + maxLat) / 2;
  }

  public double centerLon() {
    return (minLon + maxLon) / 2;
  }

  /** Approximate area in square kilometers using the same flat-earth scale factors as the local frame. */
  public double areaKm2() {
    double widthKm = width() * GeoUtils.metersPerDegreeLon(centerLat()) / 1000d;
    double heightKm = height() * GeoUtils.METERS_PER_DEGREE_LAT / 1000d;
    return widthKm * heightKm;
  }

  public boolean contains(double lat, double lon) {
    return lat >= minLat && lat <= maxLat && lon >= minLon && lon <= maxLon;
  }

  public Envelope toEnvelope() {
    return new Envelope(minLon, maxLon, minLat, maxLat);
  }

  /** Returns {@code minLat,minLon,maxLat,maxLon}, the order Overpass QL expects, without exponent notation. */
  public String toOverpassBbox() {
    return plain(minLat) + "," + plain(minLon) + "," + plain(maxLat) + "," + plain(maxLon);
  }

  private static String plain(double degrees) {
    return BigDecimal.valueOf(degrees).toPlainString();
  }

  @Override
  public String toString() {
    return "BoundingBox[" + minLon + "," + minLat + "," + maxLon + "," + maxLat + "]";
  }
}
