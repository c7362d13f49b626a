package com.onthegomap.terrainpack.geo;

/**
 * Constants and helpers for converting between degrees and meters.
 */
public class GeoUtils {

  /** Meters per degree of latitude, treated as a constant across the export area. */
  public static final double METERS_PER_DEGREE_LAT = 110_540d;
  /** Meters per degree of longitude at the equator. */
  public static final double METERS_PER_DEGREE_LON_EQUATOR = 111_320d;
  /** Mean earth radius in meters. */
  public static final double EARTH_RADIUS_METERS = 6_371_008.8;

  private GeoUtils() {}

  /** Returns meters per degree of longitude at {@code lat} degrees latitude. */
  public static double metersPerDegreeLon(double lat) {
    return METERS_PER_DEGREE_LON_EQUATOR * Math.cos(Math.toRadians(lat));
  }

  /** Returns the great-circle distance in meters between two points using the haversine formula. */
  public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
    double dLat = Math.toRadians(lat2 - lat1);
    double dLon = Math.toRadians(lon2 - lon1);
    double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
      Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2)) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
    return 2 * EARTH_RADIUS_METERS * Math.asin(Math.min(1, Math.sqrt(a)));
  }
}
