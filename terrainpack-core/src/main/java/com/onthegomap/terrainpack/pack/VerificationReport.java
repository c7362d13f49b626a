package com.onthegomap.terrainpack.pack;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of checking a package file.
 *
 * @param path     the checked file
 * @param valid    true if every checksum matched and every block decoded
 * @param metadata the package metadata, null when invalid
 * @param blocks   names of the verified blocks
 * @param error    why the package is invalid, null when valid
 */
public record VerificationReport(
  Path path,
  boolean valid,
  PackageMetadata metadata,
  List<String> blocks,
  PackageException error
) {

  static VerificationReport valid(Path path, PackageMetadata metadata, List<String> blocks) {
    return new VerificationReport(path, true, metadata, List.copyOf(blocks), null);
  }

  static VerificationReport invalid(Path path, PackageException error) {
    return new VerificationReport(path, false, null, List.of(), error);
  }

  @Override
  public String toString() {
    return valid ?
      path + ": OK, " + blocks.size() + " blocks " + blocks :
      path + ": INVALID, " + error.getMessage();
  }
}
