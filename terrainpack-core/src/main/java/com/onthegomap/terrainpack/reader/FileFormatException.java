package com.onthegomap.terrainpack.reader;

/**
 * Error encountered while parsing a response from the map-feature query service.
 */
public class FileFormatException extends RuntimeException {
  public FileFormatException(String message) {
    super(message);
  }

  public FileFormatException(String message, Throwable throwable) {
    super(message, throwable);
  }
}
