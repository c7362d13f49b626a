package com.onthegomap.terrainpack.pack;

/**
 * A package file that cannot be used. Callers should re-export it rather than attempt partial recovery.
 */
public abstract class PackageException extends RuntimeException {
  protected PackageException(String message) {
    super(message);
  }

  protected PackageException(String message, Throwable cause) {
    super(message, cause);
  }
}
