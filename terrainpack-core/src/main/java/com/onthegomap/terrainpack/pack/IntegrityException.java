package com.onthegomap.terrainpack.pack;

/**
 * A package whose contents do not match a checksum recorded when it was written.
 */
public class IntegrityException extends PackageException {
  public IntegrityException(String message) {
    super(message);
  }
}
