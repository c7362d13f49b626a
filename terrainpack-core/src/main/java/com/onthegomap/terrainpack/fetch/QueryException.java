package com.onthegomap.terrainpack.fetch;

import java.util.List;

/**
 * Thrown when no chunk of a fetch could be retrieved.
 */
public class QueryException extends RuntimeException {

  private final transient List<ChunkWarning> failures;

  public QueryException(String message, List<ChunkWarning> failures) {
    super(message);
    this.failures = List.copyOf(failures);
  }

  /** Why each chunk failed. */
  public List<ChunkWarning> failures() {
    return failures;
  }
}
