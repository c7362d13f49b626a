package com.onthegomap.terrainpack.geometry;

import java.util.Map;
import java.util.TreeMap;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Diagnostics from one geometry build: how many features of each kind were produced, and how many source elements
 * were dropped (unusable geometry) or skipped (nothing to render) and why.
 *
 * @param built   output features by {@link ConvertedFeature.Kind#group()}
 * @param dropped source elements with degenerate geometry by reason
 * @param skipped source elements that do not map to any output kind by reason
 */
public record BuildSummary(Map<String, Long> built, Map<String, Long> dropped, Map<String, Long> skipped) {

  public BuildSummary {
    built = Map.copyOf(built);
    dropped = Map.copyOf(dropped);
    skipped = Map.copyOf(skipped);
  }

  public long totalBuilt() {
    return sum(built);
  }

  public long totalDropped() {
    return sum(dropped);
  }

  public long totalSkipped() {
    return sum(skipped);
  }

  public long built(ConvertedFeature.Kind kind) {
    return built.getOrDefault(kind.group(), 0L);
  }

  private static long sum(Map<String, Long> map) {
    return map.values().stream().mapToLong(Long::longValue).sum();
  }

  static Builder builder() {
    return new Builder();
  }

  @NotThreadSafe
  static final class Builder {

    private final Map<String, Long> built = new TreeMap<>();
    private final Map<String, Long> dropped = new TreeMap<>();
    private final Map<String, Long> skipped = new TreeMap<>();

    void built(ConvertedFeature.Kind kind) {
      built.merge(kind.group(), 1L, Long::sum);
    }

    void dropped(String reason) {
      dropped.merge(reason, 1L, Long::sum);
    }

    void skipped(String reason) {
      skipped.merge(reason, 1L, Long::sum);
    }

    Builder merge(Builder other) {
      other.built.forEach((k, v) -> built.merge(k, v, Long::sum));
      other.dropped.forEach((k, v) -> dropped.merge(k, v, Long::sum));
      other.skipped.forEach((k, v) -> skipped.merge(k, v, Long::sum));
      return this;
    }

    BuildSummary build() {
      return new BuildSummary(built, dropped, skipped);
    }
  }
}
