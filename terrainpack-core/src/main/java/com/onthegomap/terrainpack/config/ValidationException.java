package com.onthegomap.terrainpack.config;

/**
 * Malformed export input (bounding box, feature filter set) rejected before any network or file I/O.
 */
public class ValidationException extends IllegalArgumentException {
  public ValidationException(String message) {
    super(message);
  }
}
