package com.onthegomap.terrainpack.pack;

/**
 * A file that is not a package this reader understands: wrong magic token, unsupported version or an unreadable
 * structure.
 */
public class FormatException extends PackageException {
  public FormatException(String message) {
    super(message);
  }

  public FormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
